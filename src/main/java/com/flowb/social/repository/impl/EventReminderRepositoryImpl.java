package com.flowb.social.repository.impl;

import com.flowb.social.model.EventReminder;
import com.flowb.social.repository.EventReminderRepository;
import com.flowb.social.store.DataStore;
import com.flowb.social.store.StoreQuery;
import com.flowb.social.util.QueryPerformanceTracker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

@Repository
public class EventReminderRepositoryImpl extends AbstractStoreRepository implements EventReminderRepository {

    private static final List<String> REMINDER_KEY = List.of("user_id", "event_source_id", "remind_minutes_before");

    @Autowired
    public EventReminderRepositoryImpl(DataStore dataStore, QueryPerformanceTracker queryTracker) {
        super(dataStore, queryTracker);
    }

    @Override
    public List<EventReminder> findByUserAndEvent(String userId, String eventId) {
        return execute("Query", EventReminder.TABLE, "Failed to load reminders", () ->
            dataStore.query(StoreQuery.from(EventReminder.TABLE)
                    .eq("user_id", userId)
                    .eq("event_source_id", eventId)
                    .orderAsc("remind_minutes_before"), EventReminder.class));
    }

    @Override
    public List<EventReminder> findDue(Instant cutoff, int limit) {
        return execute("Query", EventReminder.TABLE, "Failed to load due reminders", () ->
            dataStore.query(StoreQuery.from(EventReminder.TABLE)
                    .eq("sent", false)
                    .lte("fire_at", cutoff)
                    .orderAsc("fire_at")
                    .limit(limit), EventReminder.class));
    }

    @Override
    public List<EventReminder> findUnscheduled(int limit) {
        return execute("Query", EventReminder.TABLE, "Failed to load unscheduled reminders", () ->
            dataStore.query(StoreQuery.from(EventReminder.TABLE)
                    .eq("sent", false)
                    .isNull("fire_at")
                    .orderAsc("created_at")
                    .limit(limit), EventReminder.class));
    }

    @Override
    public EventReminder upsert(EventReminder reminder) {
        return execute("Upsert", EventReminder.TABLE, "Failed to save reminder", () ->
            dataStore.upsert(EventReminder.TABLE, reminder, REMINDER_KEY, EventReminder.class));
    }

    @Override
    public void deleteOthers(String userId, String eventId, Collection<Integer> keepMinutes) {
        run("Delete", EventReminder.TABLE, "Failed to replace reminders", () ->
            dataStore.delete(StoreQuery.from(EventReminder.TABLE)
                    .eq("user_id", userId)
                    .eq("event_source_id", eventId)
                    .notIn("remind_minutes_before", keepMinutes)));
    }

    @Override
    public void deleteByUserAndEvent(String userId, String eventId) {
        run("Delete", EventReminder.TABLE, "Failed to clear reminders", () ->
            dataStore.delete(StoreQuery.from(EventReminder.TABLE)
                    .eq("user_id", userId)
                    .eq("event_source_id", eventId)));
    }

    @Override
    public void deleteUnsentByUserAndEvent(String userId, String eventId) {
        run("Delete", EventReminder.TABLE, "Failed to clear reminders", () ->
            dataStore.delete(StoreQuery.from(EventReminder.TABLE)
                    .eq("user_id", userId)
                    .eq("event_source_id", eventId)
                    .eq("sent", false)));
    }

    @Override
    public void markSent(String reminderId) {
        run("Patch", EventReminder.TABLE, "Failed to mark reminder sent", () ->
            dataStore.patch(StoreQuery.from(EventReminder.TABLE).eq("id", reminderId), Map.of("sent", true)));
    }

    @Override
    public void updateFireAt(String reminderId, Instant fireAt) {
        run("Patch", EventReminder.TABLE, "Failed to reschedule reminder", () ->
            dataStore.patch(StoreQuery.from(EventReminder.TABLE).eq("id", reminderId), Map.of("fire_at", fireAt)));
    }
}

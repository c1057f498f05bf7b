package com.flowb.social.repository.impl;

import com.flowb.social.model.Attendance;
import com.flowb.social.model.AttendanceStatus;
import com.flowb.social.repository.AttendanceRepository;
import com.flowb.social.store.DataStore;
import com.flowb.social.store.StoreQuery;
import com.flowb.social.util.QueryPerformanceTracker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class AttendanceRepositoryImpl extends AbstractStoreRepository implements AttendanceRepository {

    private static final List<String> RSVP_KEY = List.of("user_id", "event_id");
    private static final List<AttendanceStatus> ATTENDING = List.of(AttendanceStatus.GOING, AttendanceStatus.MAYBE);

    @Autowired
    public AttendanceRepositoryImpl(DataStore dataStore, QueryPerformanceTracker queryTracker) {
        super(dataStore, queryTracker);
    }

    @Override
    public Attendance upsert(Attendance attendance) {
        return execute("Upsert", Attendance.TABLE, "Failed to save RSVP", () ->
            dataStore.upsert(Attendance.TABLE, attendance, RSVP_KEY, Attendance.class));
    }

    @Override
    public void delete(String userId, String eventId) {
        run("Delete", Attendance.TABLE, "Failed to cancel RSVP", () ->
            dataStore.delete(StoreQuery.from(Attendance.TABLE)
                    .eq("user_id", userId)
                    .eq("event_id", eventId)));
    }

    @Override
    public Optional<Attendance> findByUserAndEvent(String userId, String eventId) {
        return execute("Query", Attendance.TABLE, "Failed to load RSVP", () ->
            dataStore.query(StoreQuery.from(Attendance.TABLE)
                    .eq("user_id", userId)
                    .eq("event_id", eventId)
                    .limit(1), Attendance.class)
                .stream().findFirst());
    }

    @Override
    public List<Attendance> findForEvent(String eventId, Collection<String> userIds) {
        if (userIds.isEmpty()) {
            return List.of();
        }
        return execute("Query", Attendance.TABLE, "Failed to load event attendance", () ->
            dataStore.query(StoreQuery.from(Attendance.TABLE)
                    .eq("event_id", eventId)
                    .in("user_id", userIds)
                    .in("status", ATTENDING), Attendance.class));
    }

    @Override
    public List<Attendance> findUpcoming(Collection<String> userIds, Instant from, int limit) {
        if (userIds.isEmpty()) {
            return List.of();
        }
        return execute("Query", Attendance.TABLE, "Failed to load upcoming attendance", () ->
            dataStore.query(StoreQuery.from(Attendance.TABLE)
                    .in("user_id", userIds)
                    .in("status", ATTENDING)
                    .gte("event_date", from)
                    .orderAsc("event_date")
                    .limit(limit), Attendance.class));
    }

    @Override
    public List<Attendance> findForUser(String userId, int limit) {
        return execute("Query", Attendance.TABLE, "Failed to load schedule", () ->
            dataStore.query(StoreQuery.from(Attendance.TABLE)
                    .eq("user_id", userId)
                    .in("status", ATTENDING)
                    .orderAsc("event_date")
                    .limit(limit), Attendance.class));
    }
}

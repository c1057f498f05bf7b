package com.flowb.social.repository;

import com.flowb.social.model.EventReminder;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface EventReminderRepository {

    List<EventReminder> findByUserAndEvent(String userId, String eventId);

    /**
     * Unsent reminders whose fire time is at or before {@code cutoff}, earliest fire time first.
     */
    List<EventReminder> findDue(Instant cutoff, int limit);

    /**
     * Unsent reminders with no fire time recorded yet.
     */
    List<EventReminder> findUnscheduled(int limit);

    /**
     * Insert or reset to unsent, keyed on (user, event, minutes before).
     */
    EventReminder upsert(EventReminder reminder);

    /**
     * Remove the user's reminders for the event whose offset is not in {@code keepMinutes}.
     */
    void deleteOthers(String userId, String eventId, Collection<Integer> keepMinutes);

    void deleteByUserAndEvent(String userId, String eventId);

    void deleteUnsentByUserAndEvent(String userId, String eventId);

    void markSent(String reminderId);

    void updateFireAt(String reminderId, Instant fireAt);
}

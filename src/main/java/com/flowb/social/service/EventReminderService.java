package com.flowb.social.service;

import com.flowb.social.dto.ReminderSweepResult;
import com.flowb.social.model.EventReminder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Per-user event reminders and the periodic sweep that sends them.
 */
public interface EventReminderService {

    int MIN_LEAD_MINUTES = 1;
    /** One week. */
    int MAX_LEAD_MINUTES = 10080;

    static boolean isValidLeadTime(int minutes) {
        return minutes >= MIN_LEAD_MINUTES && minutes <= MAX_LEAD_MINUTES;
    }

    static Instant fireTime(Instant eventStart, int minutesBefore) {
        return eventStart == null ? null : eventStart.minus(Duration.ofMinutes(minutesBefore));
    }

    /**
     * Replace the user's reminders for an event. Out-of-range values are dropped.
     */
    List<EventReminder> setReminders(String userId, String eventId, List<Integer> minutesBefore);

    List<EventReminder> getReminders(String userId, String eventId);

    void clearReminders(String userId, String eventId);

    /**
     * Send every unsent reminder whose fire time is within the processing window around {@code now}.
     */
    ReminderSweepResult sendEventReminders(Instant now);
}

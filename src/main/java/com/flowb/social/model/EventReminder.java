package com.flowb.social.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class EventReminder {

    public static final String TABLE = "flowb_event_reminders";

    private String id;
    private String userId;
    private String eventSourceId;
    private int remindMinutesBefore;
    private boolean sent;
    /** Event start minus lead time. Null until the event's start time is known. */
    private Instant fireAt;
    private Instant createdAt;

    public EventReminder(String userId, String eventSourceId, int remindMinutesBefore) {
        this.userId = userId;
        this.eventSourceId = eventSourceId;
        this.remindMinutesBefore = remindMinutesBefore;
    }
}

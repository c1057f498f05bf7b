package com.flowb.social.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A user's RSVP to an event, unique on (userId, eventId).
 */
@Data
@NoArgsConstructor
public class Attendance {

    public static final String TABLE = "flowb_event_attendance";
    public static final String DEFAULT_VISIBILITY = "friends";

    private String id;
    private String userId;
    private String eventId;
    private String eventName;
    private Instant eventDate;
    private String eventVenue;
    private AttendanceStatus status;
    private String visibility;
    private Instant updatedAt;
}

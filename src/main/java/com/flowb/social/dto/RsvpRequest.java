package com.flowb.social.dto;

import com.flowb.social.model.AttendanceStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An RSVP with optional event metadata. Status defaults to going.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RsvpRequest {
    private String eventId;
    private AttendanceStatus status;
    private String eventName;
    private Instant eventDate;
    private String eventVenue;

    public static RsvpRequest going(String eventId) {
        return new RsvpRequest(eventId, AttendanceStatus.GOING, null, null, null);
    }
}

package com.flowb.social.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Members of a user's flow attending one event, split into going and maybe.
 */
@Data
@NoArgsConstructor
public class EventAttendees {

    private String eventId;
    private String eventName;
    private Instant eventDate;
    private String eventVenue;
    private List<FlowMember> going = new ArrayList<>();
    private List<FlowMember> maybe = new ArrayList<>();

    public EventAttendees(String eventId) {
        this.eventId = eventId;
    }

    public boolean isEmpty() {
        return going.isEmpty() && maybe.isEmpty();
    }
}

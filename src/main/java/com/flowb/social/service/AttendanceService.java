package com.flowb.social.service;

import com.flowb.social.dto.EventAttendees;
import com.flowb.social.dto.FlowAttendance;
import com.flowb.social.dto.RsvpRequest;
import com.flowb.social.model.Attendance;

import java.util.List;

/**
 * Per-user, per-event RSVPs and the "who from my flow is going" views built on them.
 */
public interface AttendanceService {

    /**
     * Record or replace the caller's RSVP. Going and maybe RSVPs both register the caller's
     * default reminders and tell their flow.
     */
    Attendance rsvp(String userId, RsvpRequest request);

    void cancelRsvp(String userId, String eventId);

    EventAttendees whoIsGoing(String userId, String eventId);

    List<EventAttendees> upcomingForFlow(String userId);

    List<Attendance> mySchedule(String userId);

    FlowAttendance flowAttendance(String userId, String eventId);
}

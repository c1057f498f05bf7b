package com.flowb.social.repository;

import com.flowb.social.model.Attendance;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AttendanceRepository {

    /**
     * Insert or replace the RSVP keyed on (userId, eventId).
     */
    Attendance upsert(Attendance attendance);

    void delete(String userId, String eventId);

    Optional<Attendance> findByUserAndEvent(String userId, String eventId);

    /**
     * Going and maybe RSVPs for one event from the given users.
     */
    List<Attendance> findForEvent(String eventId, Collection<String> userIds);

    /**
     * Going and maybe RSVPs from the given users for events on or after {@code from},
     * earliest first.
     */
    List<Attendance> findUpcoming(Collection<String> userIds, Instant from, int limit);

    /**
     * A user's own going and maybe RSVPs, earliest event first.
     */
    List<Attendance> findForUser(String userId, int limit);
}

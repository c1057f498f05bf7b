package com.flowb.social.repository;

import com.flowb.social.model.Checkin;

import java.time.Instant;
import java.util.List;

public interface CheckinRepository {

    Checkin save(Checkin checkin);

    /**
     * Check-ins for the crew that have not expired at {@code now}.
     */
    List<Checkin> findActiveForCrew(String crewId, Instant now);
}

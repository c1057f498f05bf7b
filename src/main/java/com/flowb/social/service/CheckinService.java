package com.flowb.social.service;

import com.flowb.social.dto.CheckinResult;

public interface CheckinService {

    /**
     * Record a crew check-in at a venue and tell the rest of the crew.
     */
    CheckinResult checkIn(String userId, String crewId, String venueName, String message);

    /**
     * Ping every other crew member without an active check-in.
     * @return how many members were pinged
     */
    int locateCrew(String userId, String crewId);
}

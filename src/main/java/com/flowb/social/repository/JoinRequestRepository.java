package com.flowb.social.repository;

import com.flowb.social.model.JoinRequest;
import com.flowb.social.model.JoinRequestStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JoinRequestRepository {

    Optional<JoinRequest> findById(String requestId);

    Optional<JoinRequest> findPending(String crewId, String userId);

    /**
     * Pending requests for a crew, oldest first.
     */
    List<JoinRequest> findPendingForCrew(String crewId);

    JoinRequest save(JoinRequest request);

    void markReviewed(String requestId, JoinRequestStatus status, String reviewerId, Instant reviewedAt);
}

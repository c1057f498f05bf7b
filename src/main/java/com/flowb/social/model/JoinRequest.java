package com.flowb.social.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A request to join an approval-mode crew. At most one pending request exists per
 * (group, user); approved and denied are terminal.
 */
@Data
@NoArgsConstructor
public class JoinRequest {

    public static final String TABLE = "flowb_crew_join_requests";

    private String id;
    private String groupId;
    private String userId;
    private JoinRequestStatus status;
    private Instant requestedAt;
    private String reviewedBy;
    private Instant reviewedAt;

    public JoinRequest(String groupId, String userId, Instant requestedAt) {
        this.groupId = groupId;
        this.userId = userId;
        this.status = JoinRequestStatus.PENDING;
        this.requestedAt = requestedAt;
    }
}

package com.flowb.social.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A user's personal flow invite code, shared as {@code /f/<code>}.
 */
@Data
@NoArgsConstructor
public class FlowInvite {

    public static final String TABLE = "flowb_flow_invites";

    private String userId;
    private String code;
    private Instant createdAt;

    public FlowInvite(String userId, String code, Instant createdAt) {
        this.userId = userId;
        this.code = code;
        this.createdAt = createdAt;
    }
}

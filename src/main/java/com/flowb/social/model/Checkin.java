package com.flowb.social.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A member's presence at a venue, visible to the crew until it expires.
 */
@Data
@NoArgsConstructor
public class Checkin {

    public static final String TABLE = "flowb_checkins";

    private String id;
    private String userId;
    private Platform platform;
    private String crewId;
    private String venueName;
    private String message;
    private Instant createdAt;
    private Instant expiresAt;
}

package com.flowb.social.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One platform handle and the canonical person it belongs to.
 * Several rows share a canonical id once their handles have been federated.
 */
@Data
@NoArgsConstructor
public class Identity {

    public static final String TABLE = "flowb_identities";

    private String id;
    private String canonicalId;
    private Platform platform;
    private String platformUserId;
    private String federationId;
    private String displayName;
    private String avatarUrl;
    private Instant linkedAt;

    public Identity(String canonicalId, String platformUserId, String federationId) {
        this.canonicalId = canonicalId;
        this.platformUserId = platformUserId;
        this.platform = Platform.fromUserId(platformUserId);
        this.federationId = federationId;
    }
}

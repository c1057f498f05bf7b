package com.flowb.social.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum JoinRequestStatus {
    @JsonProperty("pending") PENDING,
    @JsonProperty("approved") APPROVED,
    @JsonProperty("denied") DENIED;

    public String label() {
        return name().toLowerCase();
    }
}

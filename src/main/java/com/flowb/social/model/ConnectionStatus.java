package com.flowb.social.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ConnectionStatus {
    @JsonProperty("pending") PENDING,
    @JsonProperty("active") ACTIVE,
    @JsonProperty("muted") MUTED,
    @JsonProperty("blocked") BLOCKED
}

package com.flowb.social.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum JoinMode {
    @JsonProperty("open") OPEN,
    @JsonProperty("approval") APPROVAL,
    @JsonProperty("closed") CLOSED
}

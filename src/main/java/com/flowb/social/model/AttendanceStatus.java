package com.flowb.social.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AttendanceStatus {
    @JsonProperty("going") GOING,
    @JsonProperty("maybe") MAYBE
}

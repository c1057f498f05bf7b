package com.flowb.social.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Role hierarchy inside a crew: creator > admin > member. A user who is not a
 * member ranks 0.
 */
public enum CrewRole {
    @JsonProperty("member") MEMBER(1),
    @JsonProperty("admin") ADMIN(2),
    @JsonProperty("creator") CREATOR(3);

    public static final int NO_MEMBERSHIP_RANK = 0;

    private final int rank;

    CrewRole(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean isAtLeast(CrewRole required) {
        return rank >= required.rank;
    }

    public String label() {
        return name().toLowerCase();
    }
}

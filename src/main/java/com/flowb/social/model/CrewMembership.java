package com.flowb.social.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * A user's membership in a crew.
 *
 * Only crew creation assigns {@link CrewRole#CREATOR}, so each crew has exactly one.
 */
public class CrewMembership {

    public static final String TABLE = "flowb_group_members";

    private String groupId;
    private String userId;
    private CrewRole role;
    private Instant joinedAt;
    private boolean muted;

    public CrewMembership() {
    }

    public CrewMembership(String groupId, String userId, CrewRole role, Instant joinedAt) {
        this.groupId = groupId;
        this.userId = userId;
        this.role = role;
        this.joinedAt = joinedAt;
    }

    @JsonIgnore
    public boolean isCreator() {
        return role == CrewRole.CREATOR;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public CrewRole getRole() {
        return role;
    }

    public void setRole(CrewRole role) {
        this.role = role;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public void setJoinedAt(Instant joinedAt) {
        this.joinedAt = joinedAt;
    }

    public boolean isMuted() {
        return muted;
    }

    public void setMuted(boolean muted) {
        this.muted = muted;
    }
}

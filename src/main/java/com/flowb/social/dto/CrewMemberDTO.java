package com.flowb.social.dto;

import com.flowb.social.model.CrewMembership;
import com.flowb.social.model.CrewRole;

import java.time.Instant;

/**
 * Data Transfer Object for crew member information.
 */
public class CrewMemberDTO {

    private String userId;
    private String displayName;
    private CrewRole role;
    private Instant joinedAt;

    public CrewMemberDTO(CrewMembership membership, String displayName) {
        this.userId = membership.getUserId();
        this.displayName = displayName;
        this.role = membership.getRole();
        this.joinedAt = membership.getJoinedAt();
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
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
}

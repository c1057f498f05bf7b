package com.flowb.social.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A named group with role-hierarchical membership and a join policy.
 * Crews are never hard-deleted. Expiry only matters at join time.
 */
public class Crew {

    public static final String TABLE = "flowb_groups";

    private String id;
    private String name;
    private String emoji;
    private String description;
    private String createdBy;
    private String joinCode;
    private JoinMode joinMode;
    private int maxMembers;
    private boolean isPublic;
    private boolean isTemporary;
    private Instant expiresAt;
    private Instant createdAt;

    public Crew() {
    }

    public Crew(String name, String emoji, String createdBy, String joinCode, int maxMembers) {
        this.name = name;
        this.emoji = emoji;
        this.createdBy = createdBy;
        this.joinCode = joinCode;
        this.joinMode = JoinMode.OPEN;
        this.maxMembers = maxMembers;
    }

    /**
     * Temporary squads stop accepting members once their expiry has passed.
     */
    @JsonIgnore
    public boolean isExpiredAt(Instant now) {
        return isTemporary && expiresAt != null && expiresAt.isBefore(now);
    }

    @JsonIgnore
    public String getDisplayName() {
        return emoji != null ? emoji + " " + name : name;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public void setEmoji(String emoji) {
        this.emoji = emoji;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public String getJoinCode() {
        return joinCode;
    }

    public void setJoinCode(String joinCode) {
        this.joinCode = joinCode;
    }

    public JoinMode getJoinMode() {
        return joinMode;
    }

    public void setJoinMode(JoinMode joinMode) {
        this.joinMode = joinMode;
    }

    public int getMaxMembers() {
        return maxMembers;
    }

    public void setMaxMembers(int maxMembers) {
        this.maxMembers = maxMembers;
    }

    @JsonProperty("is_public")
    public boolean isPublic() {
        return isPublic;
    }

    @JsonProperty("is_public")
    public void setPublic(boolean isPublic) {
        this.isPublic = isPublic;
    }

    @JsonProperty("is_temporary")
    public boolean isTemporary() {
        return isTemporary;
    }

    @JsonProperty("is_temporary")
    public void setTemporary(boolean isTemporary) {
        this.isTemporary = isTemporary;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}

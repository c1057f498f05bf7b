package com.flowb.social.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A member's personal invite code for one crew. Used for referral attribution;
 * joining through it skips approval mode.
 */
@Data
@NoArgsConstructor
public class CrewInvite {

    public static final String TABLE = "flowb_crew_invites";

    private String id;
    private String groupId;
    private String inviterId;
    private String inviteCode;
    private int uses;
    private Instant createdAt;

    public CrewInvite(String groupId, String inviterId, String inviteCode, Instant createdAt) {
        this.groupId = groupId;
        this.inviterId = inviterId;
        this.inviteCode = inviteCode;
        this.createdAt = createdAt;
    }
}

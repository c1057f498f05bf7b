package com.flowb.social.dto;

import com.flowb.social.model.Crew;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a join attempt. {@code invitedBy} is set when a personal invite code was used,
 * for referral attribution.
 */
@Data
@NoArgsConstructor
public class JoinCrewResult {

    public enum Outcome {
        JOINED,
        ALREADY_MEMBER,
        REQUESTED,
        ALREADY_REQUESTED
    }

    private Outcome outcome;
    private Crew crew;
    private int memberCount;
    private String invitedBy;
    private String requestId;

    public JoinCrewResult(Outcome outcome, Crew crew, int memberCount) {
        this.outcome = outcome;
        this.crew = crew;
        this.memberCount = memberCount;
    }

    public boolean isMember() {
        return outcome == Outcome.JOINED || outcome == Outcome.ALREADY_MEMBER;
    }
}

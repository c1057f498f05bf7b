package com.flowb.social.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AcceptInviteResult {

    public enum Outcome {
        CONNECTED,
        /** A pending or muted row was set back to active. */
        RECONNECTED,
        ALREADY_CONNECTED
    }

    private Outcome outcome;
    private String friendId;
    private String friendName;
}

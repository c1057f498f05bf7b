package com.flowb.social.dto;

import com.flowb.social.model.Crew;
import com.flowb.social.model.CrewRole;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A crew as seen from one member's list.
 */
@Data
@NoArgsConstructor
public class CrewSummary {

    private String crewId;
    private String name;
    private String emoji;
    private String joinCode;
    private CrewRole role;

    public CrewSummary(Crew crew, CrewRole role) {
        this.crewId = crew.getId();
        this.name = crew.getName();
        this.emoji = crew.getEmoji();
        this.joinCode = crew.getJoinCode();
        this.role = role;
    }
}

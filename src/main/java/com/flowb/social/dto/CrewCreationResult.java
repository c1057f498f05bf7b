package com.flowb.social.dto;

import com.flowb.social.model.Crew;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CrewCreationResult {
    private Crew crew;
    private String joinLink;
}

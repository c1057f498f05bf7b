package com.flowb.social.dto;

import com.flowb.social.model.JoinMode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Crew settings change. Null fields are left as they are.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CrewSettingsUpdate {
    private Boolean listedPublicly;
    private JoinMode joinMode;
}

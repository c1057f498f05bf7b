package com.flowb.social.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Raw user ids from a flow attending an event, for event-card counters.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FlowAttendance {
    private List<String> going;
    private List<String> maybe;
}

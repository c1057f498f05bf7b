package com.flowb.social.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Who should hear about an RSVP: friends, plus co-members grouped by crew for message framing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotifyTargets {

    private List<String> friends;
    private List<CrewTargets> crews;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CrewTargets {
        private String crewId;
        private String groupName;
        private String groupEmoji;
        private List<String> userIds;
    }
}

package com.flowb.social.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A user's flow: active friends, most recently connected first, and the crews they belong to.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FlowListing {
    private List<FriendEntry> friends;
    private List<CrewSummary> crews;
}

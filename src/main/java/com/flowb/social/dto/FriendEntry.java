package com.flowb.social.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FriendEntry {
    private String userId;
    private String displayName;
    private Instant acceptedAt;
}

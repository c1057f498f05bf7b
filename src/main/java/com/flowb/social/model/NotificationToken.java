package com.flowb.social.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A Farcaster mini app notification token registered for one fid.
 */
@Data
@NoArgsConstructor
public class NotificationToken {

    public static final String TABLE = "flowb_notification_tokens";

    private String id;
    private long fid;
    private String token;
    private String url;
    private boolean enabled;
    private Instant updatedAt;
}

package com.flowb.social.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One direction of a friendship. An accepted friendship is two rows, one per side,
 * so each side can mute independently.
 */
@Data
@NoArgsConstructor
public class Connection {

    public static final String TABLE = "flowb_connections";

    private String id;
    private String userId;
    private String friendId;
    private ConnectionStatus status;
    private Instant createdAt;
    private Instant acceptedAt;

    public Connection(String userId, String friendId, ConnectionStatus status, Instant acceptedAt) {
        this.userId = userId;
        this.friendId = friendId;
        this.status = status;
        this.createdAt = acceptedAt;
        this.acceptedAt = acceptedAt;
    }
}

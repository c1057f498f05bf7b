package com.flowb.social.repository;

import com.flowb.social.model.Connection;
import com.flowb.social.model.ConnectionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Directional friend connection rows. A friendship is two rows, one per side.
 */
public interface ConnectionRepository {

    Optional<Connection> findBetween(String userId, String friendId);

    /**
     * The user's own rows with the given status, most recently accepted first.
     */
    List<Connection> findByUserAndStatus(String userId, ConnectionStatus status);

    /**
     * Ids of users whose row toward {@code userId} is muted or blocked.
     */
    Set<String> findUserIdsSilencing(String userId);

    Connection save(Connection connection);

    void updateStatus(String connectionId, ConnectionStatus status, Instant acceptedAt);

    void deleteBetween(String userId, String friendId);
}

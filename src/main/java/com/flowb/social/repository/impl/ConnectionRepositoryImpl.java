package com.flowb.social.repository.impl;

import com.flowb.social.model.Connection;
import com.flowb.social.model.ConnectionStatus;
import com.flowb.social.repository.ConnectionRepository;
import com.flowb.social.store.DataStore;
import com.flowb.social.store.StoreQuery;
import com.flowb.social.util.QueryPerformanceTracker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
public class ConnectionRepositoryImpl extends AbstractStoreRepository implements ConnectionRepository {

    @Autowired
    public ConnectionRepositoryImpl(DataStore dataStore, QueryPerformanceTracker queryTracker) {
        super(dataStore, queryTracker);
    }

    @Override
    public Optional<Connection> findBetween(String userId, String friendId) {
        return execute("Query", Connection.TABLE, "Failed to look up connection", () ->
            dataStore.query(StoreQuery.from(Connection.TABLE)
                    .eq("user_id", userId)
                    .eq("friend_id", friendId)
                    .limit(1), Connection.class)
                .stream().findFirst());
    }

    @Override
    public List<Connection> findByUserAndStatus(String userId, ConnectionStatus status) {
        return execute("Query", Connection.TABLE, "Failed to load connections", () ->
            dataStore.query(StoreQuery.from(Connection.TABLE)
                    .eq("user_id", userId)
                    .eq("status", status)
                    .orderDesc("accepted_at"), Connection.class));
    }

    @Override
    public Set<String> findUserIdsSilencing(String userId) {
        return execute("Query", Connection.TABLE, "Failed to load muted connections", () ->
            dataStore.query(StoreQuery.from(Connection.TABLE)
                    .eq("friend_id", userId)
                    .in("status", List.of(ConnectionStatus.MUTED, ConnectionStatus.BLOCKED)), Connection.class)
                .stream()
                .map(Connection::getUserId)
                .collect(Collectors.toSet()));
    }

    @Override
    public Connection save(Connection connection) {
        return execute("Insert", Connection.TABLE, "Failed to save connection", () ->
            dataStore.insert(Connection.TABLE, connection, Connection.class));
    }

    @Override
    public void updateStatus(String connectionId, ConnectionStatus status, Instant acceptedAt) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("status", status);
        if (acceptedAt != null) {
            fields.put("accepted_at", acceptedAt);
        }
        run("Patch", Connection.TABLE, "Failed to update connection", () ->
            dataStore.patch(StoreQuery.from(Connection.TABLE).eq("id", connectionId), fields));
    }

    @Override
    public void deleteBetween(String userId, String friendId) {
        run("Delete", Connection.TABLE, "Failed to remove connection", () ->
            dataStore.delete(StoreQuery.from(Connection.TABLE)
                    .eq("user_id", userId)
                    .eq("friend_id", friendId)));
    }
}

package com.flowb.social.repository.impl;

import com.flowb.social.model.JoinRequest;
import com.flowb.social.model.JoinRequestStatus;
import com.flowb.social.repository.JoinRequestRepository;
import com.flowb.social.store.DataStore;
import com.flowb.social.store.StoreQuery;
import com.flowb.social.util.QueryPerformanceTracker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class JoinRequestRepositoryImpl extends AbstractStoreRepository implements JoinRequestRepository {

    @Autowired
    public JoinRequestRepositoryImpl(DataStore dataStore, QueryPerformanceTracker queryTracker) {
        super(dataStore, queryTracker);
    }

    @Override
    public Optional<JoinRequest> findById(String requestId) {
        return execute("Query", JoinRequest.TABLE, "Failed to load join request", () ->
            dataStore.query(StoreQuery.from(JoinRequest.TABLE).eq("id", requestId).limit(1), JoinRequest.class)
                .stream().findFirst());
    }

    @Override
    public Optional<JoinRequest> findPending(String crewId, String userId) {
        return execute("Query", JoinRequest.TABLE, "Failed to look up join request", () ->
            dataStore.query(StoreQuery.from(JoinRequest.TABLE)
                    .eq("group_id", crewId)
                    .eq("user_id", userId)
                    .eq("status", JoinRequestStatus.PENDING)
                    .limit(1), JoinRequest.class)
                .stream().findFirst());
    }

    @Override
    public List<JoinRequest> findPendingForCrew(String crewId) {
        return execute("Query", JoinRequest.TABLE, "Failed to load join requests", () ->
            dataStore.query(StoreQuery.from(JoinRequest.TABLE)
                    .eq("group_id", crewId)
                    .eq("status", JoinRequestStatus.PENDING)
                    .orderAsc("requested_at"), JoinRequest.class));
    }

    @Override
    public JoinRequest save(JoinRequest request) {
        return execute("Insert", JoinRequest.TABLE, "Failed to create join request", () ->
            dataStore.insert(JoinRequest.TABLE, request, JoinRequest.class));
    }

    @Override
    public void markReviewed(String requestId, JoinRequestStatus status, String reviewerId, Instant reviewedAt) {
        run("Patch", JoinRequest.TABLE, "Failed to update join request", () ->
            dataStore.patch(StoreQuery.from(JoinRequest.TABLE).eq("id", requestId), Map.of(
                    "status", status,
                    "reviewed_by", reviewerId,
                    "reviewed_at", reviewedAt)));
    }
}

package com.flowb.social.repository.impl;

import com.flowb.social.model.FlowInvite;
import com.flowb.social.repository.FlowInviteRepository;
import com.flowb.social.store.DataStore;
import com.flowb.social.store.StoreQuery;
import com.flowb.social.util.QueryPerformanceTracker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class FlowInviteRepositoryImpl extends AbstractStoreRepository implements FlowInviteRepository {

    @Autowired
    public FlowInviteRepositoryImpl(DataStore dataStore, QueryPerformanceTracker queryTracker) {
        super(dataStore, queryTracker);
    }

    @Override
    public Optional<FlowInvite> findByUserId(String userId) {
        return execute("Query", FlowInvite.TABLE, "Failed to look up flow invite", () ->
            dataStore.query(StoreQuery.from(FlowInvite.TABLE)
                    .eq("user_id", userId)
                    .limit(1), FlowInvite.class)
                .stream().findFirst());
    }

    @Override
    public Optional<FlowInvite> findByCode(String code) {
        return execute("Query", FlowInvite.TABLE, "Failed to look up flow invite", () ->
            dataStore.query(StoreQuery.from(FlowInvite.TABLE)
                    .eq("code", code)
                    .limit(1), FlowInvite.class)
                .stream().findFirst());
    }

    @Override
    public FlowInvite save(FlowInvite invite) {
        return execute("Insert", FlowInvite.TABLE, "Failed to create flow invite", () ->
            dataStore.insert(FlowInvite.TABLE, invite, FlowInvite.class));
    }
}

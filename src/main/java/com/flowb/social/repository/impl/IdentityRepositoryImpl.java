package com.flowb.social.repository.impl;

import com.flowb.social.model.Identity;
import com.flowb.social.repository.IdentityRepository;
import com.flowb.social.store.DataStore;
import com.flowb.social.store.StoreQuery;
import com.flowb.social.util.QueryPerformanceTracker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class IdentityRepositoryImpl extends AbstractStoreRepository implements IdentityRepository {

    private static final List<String> HANDLE_KEY = List.of("platform", "platform_user_id");

    @Autowired
    public IdentityRepositoryImpl(DataStore dataStore, QueryPerformanceTracker queryTracker) {
        super(dataStore, queryTracker);
    }

    @Override
    public Optional<Identity> findByPlatformUserId(String platformUserId) {
        return execute("Query", Identity.TABLE, "Failed to look up identity", () ->
            dataStore.query(StoreQuery.from(Identity.TABLE)
                    .eq("platform_user_id", platformUserId)
                    .limit(1), Identity.class)
                .stream().findFirst());
    }

    @Override
    public List<Identity> findByCanonicalId(String canonicalId) {
        return execute("Query", Identity.TABLE, "Failed to load linked identities", () ->
            dataStore.query(StoreQuery.from(Identity.TABLE)
                    .eq("canonical_id", canonicalId)
                    .orderAsc("linked_at"), Identity.class));
    }

    @Override
    public List<Identity> findByPlatformUserIds(Collection<String> platformUserIds) {
        if (platformUserIds.isEmpty()) {
            return List.of();
        }
        return execute("Query", Identity.TABLE, "Failed to load identities", () ->
            dataStore.query(StoreQuery.from(Identity.TABLE)
                    .in("platform_user_id", platformUserIds), Identity.class));
    }

    @Override
    public void saveIfAbsent(Identity identity) {
        run("Insert", Identity.TABLE, "Failed to save identity", () ->
            dataStore.insertIgnoringConflicts(Identity.TABLE, identity, HANDLE_KEY));
    }
}

package com.flowb.social.repository.impl;

import com.flowb.social.model.NotificationPreference;
import com.flowb.social.repository.NotificationPreferenceRepository;
import com.flowb.social.store.DataStore;
import com.flowb.social.store.StoreQuery;
import com.flowb.social.util.QueryPerformanceTracker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Preferences live as columns of the user's session row.
 */
@Repository
public class NotificationPreferenceRepositoryImpl extends AbstractStoreRepository
        implements NotificationPreferenceRepository {

    @Autowired
    public NotificationPreferenceRepositoryImpl(DataStore dataStore, QueryPerformanceTracker queryTracker) {
        super(dataStore, queryTracker);
    }

    @Override
    public Optional<NotificationPreference> findByUserId(String userId) {
        return execute("Query", NotificationPreference.TABLE, "Failed to load preferences", () ->
            dataStore.query(StoreQuery.from(NotificationPreference.TABLE)
                    .eq("user_id", userId)
                    .limit(1), NotificationPreference.class)
                .stream().findFirst());
    }

    @Override
    public NotificationPreference save(NotificationPreference preference) {
        return execute("Upsert", NotificationPreference.TABLE, "Failed to save preferences", () ->
            dataStore.upsert(NotificationPreference.TABLE, preference, List.of("user_id"), NotificationPreference.class));
    }
}

package com.flowb.social.repository.impl;

import com.flowb.social.model.NotificationToken;
import com.flowb.social.repository.NotificationTokenRepository;
import com.flowb.social.store.DataStore;
import com.flowb.social.store.StoreQuery;
import com.flowb.social.util.QueryPerformanceTracker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;

@Repository
public class NotificationTokenRepositoryImpl extends AbstractStoreRepository implements NotificationTokenRepository {

    @Autowired
    public NotificationTokenRepositoryImpl(DataStore dataStore, QueryPerformanceTracker queryTracker) {
        super(dataStore, queryTracker);
    }

    @Override
    public Optional<NotificationToken> findEnabledByFid(long fid) {
        return execute("Query", NotificationToken.TABLE, "Failed to load notification token", () ->
            dataStore.query(StoreQuery.from(NotificationToken.TABLE)
                    .eq("fid", fid)
                    .eq("enabled", true)
                    .limit(1), NotificationToken.class)
                .stream().findFirst());
    }

    @Override
    public void disable(long fid) {
        run("Patch", NotificationToken.TABLE, "Failed to disable notification token", () ->
            dataStore.patch(StoreQuery.from(NotificationToken.TABLE).eq("fid", fid), Map.of("enabled", false)));
    }
}

package com.flowb.social.repository.impl;

import com.flowb.social.exception.DataStoreException;
import com.flowb.social.exception.RepositoryException;
import com.flowb.social.store.DataStore;
import com.flowb.social.util.QueryPerformanceTracker;

import java.util.function.Supplier;

/**
 * Shared plumbing for repositories over the {@link DataStore}: every call is timed and
 * store failures surface as {@link RepositoryException}.
 */
abstract class AbstractStoreRepository {

    protected final DataStore dataStore;
    protected final QueryPerformanceTracker queryTracker;

    protected AbstractStoreRepository(DataStore dataStore, QueryPerformanceTracker queryTracker) {
        this.dataStore = dataStore;
        this.queryTracker = queryTracker;
    }

    protected <T> T execute(String operation, String table, String failureMessage, Supplier<T> call) {
        return queryTracker.trackQuery(operation, table, () -> {
            try {
                return call.get();
            } catch (DataStoreException e) {
                throw new RepositoryException(failureMessage, e);
            }
        });
    }

    protected void run(String operation, String table, String failureMessage, Runnable call) {
        execute(operation, table, failureMessage, () -> {
            call.run();
            return null;
        });
    }
}

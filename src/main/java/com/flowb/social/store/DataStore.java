package com.flowb.social.store;

import java.util.List;
import java.util.Map;

/**
 * Minimal contract over the hosted relational store.
 *
 * Rows are mapped to and from plain model classes whose properties follow the
 * table's snake_case columns. Implementations throw
 * {@link com.flowb.social.exception.DataStoreException} when the store fails.
 */
public interface DataStore {

    <T> List<T> query(StoreQuery query, Class<T> rowType);

    <T> T insert(String table, Object row, Class<T> rowType);

    /**
     * Insert, or merge into the existing row that matches on {@code conflictKeys}.
     */
    <T> T upsert(String table, Object row, List<String> conflictKeys, Class<T> rowType);

    /**
     * Insert unless a row matching on {@code conflictKeys} exists. An existing row is never overwritten.
     */
    void insertIgnoringConflicts(String table, Object row, List<String> conflictKeys);

    void patch(StoreQuery filter, Map<String, Object> fields);

    void delete(StoreQuery filter);
}

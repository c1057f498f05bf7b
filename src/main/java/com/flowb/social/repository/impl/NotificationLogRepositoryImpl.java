package com.flowb.social.repository.impl;

import com.flowb.social.model.NotificationLogEntry;
import com.flowb.social.model.NotificationType;
import com.flowb.social.repository.NotificationLogRepository;
import com.flowb.social.store.DataStore;
import com.flowb.social.store.StoreQuery;
import com.flowb.social.util.QueryPerformanceTracker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
public class NotificationLogRepositoryImpl extends AbstractStoreRepository implements NotificationLogRepository {

    private static final List<String> DEDUP_KEY =
            List.of("recipient_id", "notification_type", "reference_id", "triggered_by");

    @Autowired
    public NotificationLogRepositoryImpl(DataStore dataStore, QueryPerformanceTracker queryTracker) {
        super(dataStore, queryTracker);
    }

    @Override
    public boolean exists(String recipientId, Collection<NotificationType> types, String referenceId, String triggeredBy) {
        return execute("Query", NotificationLogEntry.TABLE, "Failed to check notification log", () ->
            !dataStore.query(StoreQuery.from(NotificationLogEntry.TABLE)
                    .eq("recipient_id", recipientId)
                    .in("notification_type", types)
                    .eq("reference_id", referenceId)
                    .eq("triggered_by", triggeredBy)
                    .limit(1), NotificationLogEntry.class).isEmpty());
    }

    @Override
    public Set<String> findNotifiedRecipients(Collection<NotificationType> types, String referenceId, String triggeredBy) {
        return execute("Query", NotificationLogEntry.TABLE, "Failed to load notification log", () ->
            dataStore.query(StoreQuery.from(NotificationLogEntry.TABLE)
                    .in("notification_type", types)
                    .eq("reference_id", referenceId)
                    .eq("triggered_by", triggeredBy), NotificationLogEntry.class)
                .stream()
                .map(NotificationLogEntry::getRecipientId)
                .collect(Collectors.toSet()));
    }

    @Override
    public int countSince(String recipientId, Instant since, int cap) {
        return execute("Query", NotificationLogEntry.TABLE, "Failed to count notifications", () ->
            dataStore.query(StoreQuery.from(NotificationLogEntry.TABLE)
                    .eq("recipient_id", recipientId)
                    .gte("sent_at", since)
                    .limit(cap), NotificationLogEntry.class).size());
    }

    @Override
    public void record(NotificationLogEntry entry) {
        run("Insert", NotificationLogEntry.TABLE, "Failed to record notification", () ->
            dataStore.insertIgnoringConflicts(NotificationLogEntry.TABLE, entry, DEDUP_KEY));
    }
}

package com.flowb.social.repository;

import com.flowb.social.model.NotificationLogEntry;
import com.flowb.social.model.NotificationType;

import java.time.Instant;
import java.util.Collection;
import java.util.Set;

/**
 * The dedup ledger. Append-only; one entry per (recipient, type, reference, trigger).
 */
public interface NotificationLogRepository {

    boolean exists(String recipientId, Collection<NotificationType> types, String referenceId, String triggeredBy);

    /**
     * Recipients that already have an entry of one of {@code types} for the reference and trigger.
     */
    Set<String> findNotifiedRecipients(Collection<NotificationType> types, String referenceId, String triggeredBy);

    /**
     * Entries for the recipient since {@code since}, counting no further than {@code cap}.
     */
    int countSince(String recipientId, Instant since, int cap);

    /**
     * Append an entry. A duplicate of an existing tuple is a no-op.
     */
    void record(NotificationLogEntry entry);
}

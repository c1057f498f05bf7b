package com.flowb.social.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Dedup ledger row. Unique on (recipientId, notificationType, referenceId, triggeredBy).
 */
@Data
@NoArgsConstructor
public class NotificationLogEntry {

    public static final String TABLE = "flowb_notification_log";

    private Long id;
    private String recipientId;
    private NotificationType notificationType;
    private String referenceId;
    private String triggeredBy;
    private Instant sentAt;

    public NotificationLogEntry(String recipientId, NotificationType notificationType,
                                String referenceId, String triggeredBy, Instant sentAt) {
        this.recipientId = recipientId;
        this.notificationType = notificationType;
        this.referenceId = referenceId;
        this.triggeredBy = triggeredBy;
        this.sentAt = sentAt;
    }
}

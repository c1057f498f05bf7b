package com.flowb.social.service;

import com.flowb.social.channel.ChannelDispatcher;
import com.flowb.social.exception.RepositoryException;
import com.flowb.social.model.NotificationLogEntry;
import com.flowb.social.model.NotificationType;
import com.flowb.social.repository.ConnectionRepository;
import com.flowb.social.repository.NotificationLogRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * The shared send path for social notifications.
 *
 * Each candidate goes through the eligibility checks, then the channel dispatcher. Only a
 * successful send writes a ledger entry, so a failed send can be retried by the next trigger
 * of the same event. Failures never abort the rest of a batch.
 */
@Component
public class NotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    public static final String SYSTEM_TRIGGER = "system";

    private final NotificationEligibility eligibility;
    private final ChannelDispatcher channelDispatcher;
    private final NotificationLogRepository notificationLogRepository;
    private final ConnectionRepository connectionRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public NotificationDispatcher(NotificationEligibility eligibility,
                                  ChannelDispatcher channelDispatcher,
                                  NotificationLogRepository notificationLogRepository,
                                  ConnectionRepository connectionRepository,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.eligibility = eligibility;
        this.channelDispatcher = channelDispatcher;
        this.notificationLogRepository = notificationLogRepository;
        this.connectionRepository = connectionRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Start a fan-out for one actor. Recipients who muted or blocked the actor are looked up
     * once, and a recipient messaged in one pass is not messaged again in a later pass.
     */
    public FanOut fanOut(String actorId) {
        return new FanOut(actorId, silencing(actorId));
    }

    /**
     * Deliver one message, subject to the eligibility checks and the ledger.
     */
    public DeliveryOutcome deliver(NotificationType type, String recipientId, String referenceId,
                                   String triggeredBy, String text, Collection<NotificationType> ledgerTypes) {
        Optional<SkipReason> skip;
        try {
            skip = eligibility.check(type, recipientId, referenceId, triggeredBy, ledgerTypes);
        } catch (RepositoryException e) {
            logger.warn("Eligibility check failed for {} ({} {})", recipientId, type.getValue(), referenceId, e);
            recordFailure(type, "check_error");
            return DeliveryOutcome.FAILED;
        }
        if (skip.isPresent()) {
            recordSkip(type, recipientId, skip.get());
            return DeliveryOutcome.SKIPPED;
        }

        if (!channelDispatcher.send(recipientId, text)) {
            logger.warn("Could not deliver {} notification to {}", type.getValue(), recipientId);
            recordFailure(type, "channel");
            return DeliveryOutcome.FAILED;
        }

        try {
            notificationLogRepository.record(new NotificationLogEntry(recipientId, type, referenceId,
                triggeredBy, Instant.now(clock)));
        } catch (RepositoryException e) {
            logger.warn("Sent {} to {} but could not record it in the ledger", type.getValue(), recipientId, e);
        }
        meterRegistry.counter("notification_dispatch_total", "type", type.getValue(), "status", "sent").increment();
        return DeliveryOutcome.SENT;
    }

    private Set<String> silencing(String actorId) {
        try {
            return connectionRepository.findUserIdsSilencing(actorId);
        } catch (RepositoryException e) {
            logger.warn("Could not load users who muted {}", actorId, e);
            return Set.of();
        }
    }

    private void recordSkip(NotificationType type, String recipientId, SkipReason reason) {
        logger.debug("Skipping {} notification to {}: {}", type.getValue(), recipientId, reason.getValue());
        meterRegistry.counter("notification_dispatch_total",
            "type", type.getValue(), "status", "skipped", "reason", reason.getValue()).increment();
    }

    private void recordFailure(NotificationType type, String reason) {
        meterRegistry.counter("notification_dispatch_total",
            "type", type.getValue(), "status", "failed", "reason", reason).increment();
    }

    /**
     * One actor's fan-out across one or more recipient lists.
     */
    public final class FanOut {

        private final String actorId;
        private final Set<String> silencing;
        private final Set<String> visited = new HashSet<>();
        private int sent;

        private FanOut(String actorId, Set<String> silencing) {
            this.actorId = actorId;
            this.silencing = silencing;
        }

        /**
         * @return how many messages this pass sent
         */
        public int send(NotificationType type, String referenceId, Collection<String> recipients,
                        String text, Collection<NotificationType> ledgerTypes) {
            int sentInPass = 0;
            for (String recipientId : recipients) {
                if (recipientId.equals(actorId)) {
                    recordSkip(type, recipientId, SkipReason.SELF);
                    continue;
                }
                if (silencing.contains(recipientId)) {
                    recordSkip(type, recipientId, SkipReason.MUTED);
                    continue;
                }
                if (visited.contains(recipientId)) {
                    recordSkip(type, recipientId, SkipReason.BATCH_DUPLICATE);
                    continue;
                }
                if (deliver(type, recipientId, referenceId, actorId, text, ledgerTypes) == DeliveryOutcome.SENT) {
                    visited.add(recipientId);
                    sentInPass++;
                }
            }
            sent += sentInPass;
            return sentInPass;
        }

        public int getSent() {
            return sent;
        }
    }
}

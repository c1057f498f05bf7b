package com.flowb.social.listener;

import com.flowb.social.dto.ReminderSweepResult;
import com.flowb.social.service.EventReminderService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Runs the event reminder sweep on a fixed delay.
 *
 * Idempotency: each reminder row is marked sent once it has been handled, and deliveries
 * are recorded in the notification ledger, so an overlapping or repeated sweep does not
 * send the same reminder twice.
 */
@Component
@ConditionalOnProperty(name = "flowb.notifications.reminders.enabled", havingValue = "true")
public class EventReminderScheduler {

    private static final Logger logger = LoggerFactory.getLogger(EventReminderScheduler.class);

    private final EventReminderService eventReminderService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public EventReminderScheduler(EventReminderService eventReminderService, MeterRegistry meterRegistry, Clock clock) {
        this.eventReminderService = eventReminderService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${flowb.notifications.reminders.fixed-delay-ms:300000}",
               initialDelayString = "${flowb.notifications.reminders.initial-delay-ms:60000}")
    public void sweep() {
        try {
            ReminderSweepResult result = eventReminderService.sendEventReminders(Instant.now(clock));
            logger.debug("Reminder sweep finished: {}", result);
        } catch (Exception e) {
            logger.error("Event reminder sweep failed", e);
            meterRegistry.counter("event_reminder_sweep_total", "status", "error").increment();
            // Don't rethrow - the next scheduled run will pick up the same unsent rows
        }
    }
}

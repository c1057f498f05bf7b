package com.flowb.social.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on Spring scheduling for the event reminder sweep.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "flowb.notifications.reminders.enabled", havingValue = "true")
public class SchedulerConfig {
}

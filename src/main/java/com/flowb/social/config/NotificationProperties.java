package com.flowb.social.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Component
@ConfigurationProperties(prefix = "flowb.notifications")
public class NotificationProperties {

    private String defaultTimezone = "America/Denver";

    @DurationUnit(ChronoUnit.MINUTES)
    private Duration checkinLifetime = Duration.ofHours(2);

    /**
     * Target URL carried by Farcaster mini app notifications.
     */
    private String farcasterAppUrl = "https://flowb-farcaster.netlify.app";

    private final Reminders reminders = new Reminders();

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    public Duration getCheckinLifetime() {
        return checkinLifetime;
    }

    public void setCheckinLifetime(Duration checkinLifetime) {
        this.checkinLifetime = checkinLifetime;
    }

    public String getFarcasterAppUrl() {
        return farcasterAppUrl;
    }

    public void setFarcasterAppUrl(String farcasterAppUrl) {
        this.farcasterAppUrl = farcasterAppUrl;
    }

    public Reminders getReminders() {
        return reminders;
    }

    public static class Reminders {

        private boolean enabled = false;

        /**
         * Half-width of the window around {@code start - minutesBefore} in which a reminder fires.
         */
        private int windowMinutes = 10;

        private int batchSize = 200;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWindowMinutes() {
            return windowMinutes;
        }

        public void setWindowMinutes(int windowMinutes) {
            this.windowMinutes = windowMinutes;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }
}

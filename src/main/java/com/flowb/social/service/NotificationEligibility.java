package com.flowb.social.service;

import com.flowb.social.config.NotificationProperties;
import com.flowb.social.model.NotificationPreference;
import com.flowb.social.model.NotificationType;
import com.flowb.social.repository.NotificationLogRepository;
import com.flowb.social.util.QuietHours;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Collection;
import java.util.Optional;

/**
 * Per-recipient checks applied before a message goes out, in order:
 * type toggle, daily cap, quiet hours, then the dedup ledger.
 * Preferences are re-read on every call.
 */
@Component
public class NotificationEligibility {

    private final NotificationPreferenceService preferenceService;
    private final NotificationLogRepository notificationLogRepository;
    private final NotificationProperties notificationProperties;
    private final Clock clock;

    @Autowired
    public NotificationEligibility(NotificationPreferenceService preferenceService,
                                   NotificationLogRepository notificationLogRepository,
                                   NotificationProperties notificationProperties,
                                   Clock clock) {
        this.preferenceService = preferenceService;
        this.notificationLogRepository = notificationLogRepository;
        this.notificationProperties = notificationProperties;
        this.clock = clock;
    }

    /**
     * @param ledgerTypes notification types whose ledger entries count as "already told"
     * @return the reason to skip, or empty when the recipient may be messaged
     */
    public Optional<SkipReason> check(NotificationType type, String recipientId, String referenceId,
                                      String triggeredBy, Collection<NotificationType> ledgerTypes) {
        NotificationPreference preference = preferenceService.getPreferences(recipientId);
        if (!preference.allows(type)) {
            return Optional.of(SkipReason.PREFERENCE);
        }

        Instant now = Instant.now(clock);
        ZoneId zone = zoneOf(preference);

        int limit = preference.getDailyNotificationLimit();
        if (notificationLogRepository.countSince(recipientId, QuietHours.startOfDay(now, zone), limit) >= limit) {
            return Optional.of(SkipReason.RATE_LIMIT);
        }

        if (preference.isQuietHoursEnabled()
                && QuietHours.isQuietAt(now, zone, preference.getQuietHoursStart(), preference.getQuietHoursEnd())) {
            return Optional.of(SkipReason.QUIET_HOURS);
        }

        if (notificationLogRepository.exists(recipientId, ledgerTypes, referenceId, triggeredBy)) {
            return Optional.of(SkipReason.DUPLICATE);
        }
        return Optional.empty();
    }

    public ZoneId zoneOf(NotificationPreference preference) {
        return QuietHours.zoneOrDefault(preference.getTimezone(),
            ZoneId.of(notificationProperties.getDefaultTimezone()));
    }
}

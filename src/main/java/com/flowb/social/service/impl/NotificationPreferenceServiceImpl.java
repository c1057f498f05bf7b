package com.flowb.social.service.impl;

import com.flowb.social.config.NotificationProperties;
import com.flowb.social.dto.PreferenceUpdate;
import com.flowb.social.exception.ValidationException;
import com.flowb.social.model.NotificationPreference;
import com.flowb.social.repository.NotificationPreferenceRepository;
import com.flowb.social.service.EventReminderService;
import com.flowb.social.service.NotificationPreferenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Service
public class NotificationPreferenceServiceImpl implements NotificationPreferenceService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationPreferenceServiceImpl.class);

    private final NotificationPreferenceRepository preferenceRepository;
    private final NotificationProperties notificationProperties;

    @Autowired
    public NotificationPreferenceServiceImpl(NotificationPreferenceRepository preferenceRepository,
                                             NotificationProperties notificationProperties) {
        this.preferenceRepository = preferenceRepository;
        this.notificationProperties = notificationProperties;
    }

    @Override
    public NotificationPreference getPreferences(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User id is required");
        }
        NotificationPreference preference = preferenceRepository.findByUserId(userId)
            .orElseGet(() -> NotificationPreference.defaultsFor(userId));
        if (preference.getTimezone() == null || preference.getTimezone().isBlank()) {
            preference.setTimezone(notificationProperties.getDefaultTimezone());
        }
        return preference;
    }

    @Override
    public NotificationPreference updatePreferences(String userId, PreferenceUpdate update) {
        NotificationPreference preference = getPreferences(userId);
        if (update == null) {
            return preference;
        }

        if (update.getNotifyCrewCheckins() != null) {
            preference.setNotifyCrewCheckins(update.getNotifyCrewCheckins());
        }
        if (update.getNotifyFriendRsvps() != null) {
            preference.setNotifyFriendRsvps(update.getNotifyFriendRsvps());
        }
        if (update.getNotifyCrewRsvps() != null) {
            preference.setNotifyCrewRsvps(update.getNotifyCrewRsvps());
        }
        if (update.getNotifyEventReminders() != null) {
            preference.setNotifyEventReminders(update.getNotifyEventReminders());
        }
        if (update.getNotifyDailyDigest() != null) {
            preference.setNotifyDailyDigest(update.getNotifyDailyDigest());
        }
        if (update.getDailyNotificationLimit() != null) {
            preference.setDailyNotificationLimit(clamp(update.getDailyNotificationLimit(),
                NotificationPreference.MIN_DAILY_LIMIT, NotificationPreference.MAX_DAILY_LIMIT));
        }
        if (update.getQuietHoursEnabled() != null) {
            preference.setQuietHoursEnabled(update.getQuietHoursEnabled());
        }
        if (update.getQuietHoursStart() != null) {
            preference.setQuietHoursStart(clamp(update.getQuietHoursStart(), 0, 23));
        }
        if (update.getQuietHoursEnd() != null) {
            preference.setQuietHoursEnd(clamp(update.getQuietHoursEnd(), 0, 23));
        }
        if (update.getTimezone() != null) {
            preference.setTimezone(validTimezone(update.getTimezone()));
        }
        if (update.getReminderDefaults() != null) {
            preference.setReminderDefaults(validLeadTimes(update.getReminderDefaults()));
        }

        NotificationPreference saved = preferenceRepository.save(preference);
        logger.info("Updated notification preferences for {}", userId);
        return saved != null ? saved : preference;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static String validTimezone(String timezone) {
        try {
            return ZoneId.of(timezone.trim()).getId();
        } catch (DateTimeException e) {
            throw new ValidationException("Unknown timezone: " + timezone, e);
        }
    }

    private static List<Integer> validLeadTimes(List<Integer> minutes) {
        List<Integer> valid = new ArrayList<>();
        minutes.stream()
            .filter(Objects::nonNull)
            .filter(EventReminderService::isValidLeadTime)
            .distinct()
            .forEach(valid::add);
        return valid;
    }
}

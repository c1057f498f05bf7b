package com.flowb.social.service.impl;

import com.flowb.social.config.NotificationProperties;
import com.flowb.social.dto.ReminderSweepResult;
import com.flowb.social.exception.RepositoryException;
import com.flowb.social.exception.ValidationException;
import com.flowb.social.model.Attendance;
import com.flowb.social.model.EventReminder;
import com.flowb.social.model.NotificationPreference;
import com.flowb.social.model.NotificationType;
import com.flowb.social.repository.AttendanceRepository;
import com.flowb.social.repository.EventReminderRepository;
import com.flowb.social.service.DeliveryOutcome;
import com.flowb.social.service.EventReminderService;
import com.flowb.social.service.NotificationDispatcher;
import com.flowb.social.service.NotificationEligibility;
import com.flowb.social.service.NotificationPreferenceService;
import com.flowb.social.service.NotificationTextGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Event reminders.
 *
 * The sweep only sends a reminder whose fire time (event start minus lead time) lies within
 * the window around now. Rows are read earliest fire time first, so reminders far in the
 * future never crowd a due one out of the batch. Rows still ahead of the window stay unsent.
 * Rows inside it are marked sent whether or not a message went out, so a reminder the user
 * turned off is consumed once instead of being re-evaluated every sweep.
 */
@Service
public class EventReminderServiceImpl implements EventReminderService {

    private static final Logger logger = LoggerFactory.getLogger(EventReminderServiceImpl.class);

    private static final DateTimeFormatter START_TIME = DateTimeFormatter.ofPattern("h:mm a", Locale.US);

    private final EventReminderRepository reminderRepository;
    private final AttendanceRepository attendanceRepository;
    private final NotificationDispatcher dispatcher;
    private final NotificationEligibility eligibility;
    private final NotificationPreferenceService preferenceService;
    private final NotificationTextGenerator textGenerator;
    private final NotificationProperties notificationProperties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public EventReminderServiceImpl(EventReminderRepository reminderRepository,
                                    AttendanceRepository attendanceRepository,
                                    NotificationDispatcher dispatcher,
                                    NotificationEligibility eligibility,
                                    NotificationPreferenceService preferenceService,
                                    NotificationTextGenerator textGenerator,
                                    NotificationProperties notificationProperties,
                                    MeterRegistry meterRegistry,
                                    Clock clock) {
        this.reminderRepository = reminderRepository;
        this.attendanceRepository = attendanceRepository;
        this.dispatcher = dispatcher;
        this.eligibility = eligibility;
        this.preferenceService = preferenceService;
        this.textGenerator = textGenerator;
        this.notificationProperties = notificationProperties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public List<EventReminder> setReminders(String userId, String eventId, List<Integer> minutesBefore) {
        requireIds(userId, eventId);
        List<Integer> valid = minutesBefore == null ? List.of() : minutesBefore.stream()
            .filter(Objects::nonNull)
            .filter(EventReminderService::isValidLeadTime)
            .distinct()
            .collect(Collectors.toList());
        if (valid.isEmpty()) {
            throw new ValidationException("Reminder times must be between " + MIN_LEAD_MINUTES
                + " and " + MAX_LEAD_MINUTES + " minutes");
        }

        Instant startsAt = attendanceRepository.findByUserAndEvent(userId, eventId)
            .map(Attendance::getEventDate)
            .orElse(null);
        reminderRepository.deleteOthers(userId, eventId, valid);
        List<EventReminder> saved = new ArrayList<>();
        for (Integer minutes : valid) {
            EventReminder reminder = new EventReminder(userId, eventId, minutes);
            reminder.setFireAt(EventReminderService.fireTime(startsAt, minutes));
            reminder.setCreatedAt(Instant.now(clock));
            EventReminder stored = reminderRepository.upsert(reminder);
            saved.add(stored != null ? stored : reminder);
        }
        logger.info("Set {} reminders for {} on {}", valid.size(), userId, eventId);
        return saved;
    }

    @Override
    public List<EventReminder> getReminders(String userId, String eventId) {
        requireIds(userId, eventId);
        return reminderRepository.findByUserAndEvent(userId, eventId);
    }

    @Override
    public void clearReminders(String userId, String eventId) {
        requireIds(userId, eventId);
        reminderRepository.deleteByUserAndEvent(userId, eventId);
        logger.info("Cleared reminders for {} on {}", userId, eventId);
    }

    @Override
    public ReminderSweepResult sendEventReminders(Instant now) {
        ReminderSweepResult result = new ReminderSweepResult();
        Duration window = Duration.ofMinutes(notificationProperties.getReminders().getWindowMinutes());

        int batchSize = notificationProperties.getReminders().getBatchSize();
        List<EventReminder> pending = new ArrayList<>(reminderRepository.findDue(now.plus(window), batchSize));
        pending.addAll(reminderRepository.findUnscheduled(batchSize));
        for (EventReminder reminder : pending) {
            result.setScanned(result.getScanned() + 1);
            try {
                String status = processReminder(reminder, now, window);
                switch (status) {
                    case "sent":
                        result.setSent(result.getSent() + 1);
                        break;
                    case "waiting":
                        result.setWaiting(result.getWaiting() + 1);
                        break;
                    default:
                        result.setConsumed(result.getConsumed() + 1);
                }
                meterRegistry.counter("event_reminder_total", "status", status).increment();
            } catch (RepositoryException e) {
                logger.error("Error processing reminder {} for {}", reminder.getId(), reminder.getUserId(), e);
                meterRegistry.counter("event_reminder_total", "status", "error").increment();
            }
        }

        if (result.getScanned() > 0) {
            logger.info("Reminder sweep: scanned={}, sent={}, consumed={}, waiting={}",
                result.getScanned(), result.getSent(), result.getConsumed(), result.getWaiting());
        }
        return result;
    }

    private String processReminder(EventReminder reminder, Instant now, Duration window) {
        Optional<Attendance> attendance = attendanceRepository.findByUserAndEvent(
            reminder.getUserId(), reminder.getEventSourceId());
        if (attendance.isEmpty()) {
            logger.debug("No RSVP behind reminder {}, consuming it", reminder.getId());
            reminderRepository.markSent(reminder.getId());
            return "no_rsvp";
        }

        Instant startsAt = attendance.get().getEventDate();
        if (startsAt == null) {
            logger.debug("Event {} has no start time, consuming reminder {}", reminder.getEventSourceId(),
                reminder.getId());
            reminderRepository.markSent(reminder.getId());
            return "no_start_time";
        }

        Instant fireAt = EventReminderService.fireTime(startsAt, reminder.getRemindMinutesBefore());
        if (fireAt.isAfter(now.plus(window))) {
            if (!fireAt.equals(reminder.getFireAt())) {
                reminderRepository.updateFireAt(reminder.getId(), fireAt);
            }
            return "waiting";
        }
        if (fireAt.isBefore(now.minus(window))) {
            logger.debug("Reminder {} missed its window ({}), consuming it", reminder.getId(), fireAt);
            reminderRepository.markSent(reminder.getId());
            return "missed";
        }

        DeliveryOutcome outcome = dispatcher.deliver(NotificationType.EVENT_REMINDER, reminder.getUserId(),
            reminder.getEventSourceId() + ":" + reminder.getRemindMinutesBefore(),
            NotificationDispatcher.SYSTEM_TRIGGER, reminderText(attendance.get(), reminder.getUserId()),
            Set.of(NotificationType.EVENT_REMINDER));
        reminderRepository.markSent(reminder.getId());
        return outcome == DeliveryOutcome.SENT ? "sent" : outcome.name().toLowerCase();
    }

    private String reminderText(Attendance attendance, String userId) {
        NotificationPreference preference = preferenceService.getPreferences(userId);
        ZoneId zone = eligibility.zoneOf(preference);
        String eventName = attendance.getEventName() != null ? attendance.getEventName() : attendance.getEventId();
        return textGenerator.getEventReminderBody(eventName,
            START_TIME.format(attendance.getEventDate().atZone(zone)), attendance.getEventVenue());
    }

    private static void requireIds(String userId, String eventId) {
        if (userId == null || userId.isBlank() || eventId == null || eventId.isBlank()) {
            throw new ValidationException("User id and event id are required");
        }
    }
}

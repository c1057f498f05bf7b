package com.flowb.social.service.impl;

import com.flowb.social.dto.EventAttendees;
import com.flowb.social.dto.FlowAttendance;
import com.flowb.social.dto.FlowMember;
import com.flowb.social.dto.RsvpRequest;
import com.flowb.social.exception.RepositoryException;
import com.flowb.social.exception.ValidationException;
import com.flowb.social.model.Attendance;
import com.flowb.social.model.AttendanceStatus;
import com.flowb.social.model.EventReminder;
import com.flowb.social.model.NotificationPreference;
import com.flowb.social.repository.AttendanceRepository;
import com.flowb.social.repository.EventReminderRepository;
import com.flowb.social.service.AttendanceService;
import com.flowb.social.service.DisplayNameService;
import com.flowb.social.service.EventReminderService;
import com.flowb.social.service.FlowAudience;
import com.flowb.social.service.NotificationPreferenceService;
import com.flowb.social.service.NotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class AttendanceServiceImpl implements AttendanceService {

    private static final Logger logger = LoggerFactory.getLogger(AttendanceServiceImpl.class);

    static final int LIST_LIMIT = 20;
    private static final int EVENT_NAME_FALLBACK_LENGTH = 8;

    private final AttendanceRepository attendanceRepository;
    private final EventReminderRepository eventReminderRepository;
    private final FlowAudience flowAudience;
    private final DisplayNameService displayNameService;
    private final NotificationPreferenceService preferenceService;
    private final NotificationService notificationService;
    private final Clock clock;

    @Autowired
    public AttendanceServiceImpl(AttendanceRepository attendanceRepository,
                                 EventReminderRepository eventReminderRepository,
                                 FlowAudience flowAudience,
                                 DisplayNameService displayNameService,
                                 NotificationPreferenceService preferenceService,
                                 NotificationService notificationService,
                                 Clock clock) {
        this.attendanceRepository = attendanceRepository;
        this.eventReminderRepository = eventReminderRepository;
        this.flowAudience = flowAudience;
        this.displayNameService = displayNameService;
        this.preferenceService = preferenceService;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    @Override
    public Attendance rsvp(String userId, RsvpRequest request) {
        requireId(userId, "User id");
        if (request == null) {
            throw new ValidationException("RSVP details are required");
        }
        requireId(request.getEventId(), "Event id");

        Attendance attendance = new Attendance();
        attendance.setUserId(userId);
        attendance.setEventId(request.getEventId());
        attendance.setEventName(request.getEventName());
        attendance.setEventDate(request.getEventDate());
        attendance.setEventVenue(request.getEventVenue());
        attendance.setStatus(request.getStatus() != null ? request.getStatus() : AttendanceStatus.GOING);
        attendance.setVisibility(Attendance.DEFAULT_VISIBILITY);
        attendance.setUpdatedAt(Instant.now(clock));

        Attendance saved = attendanceRepository.upsert(attendance);
        logger.info("User {} RSVP'd {} to {}", userId, attendance.getStatus(), request.getEventId());

        registerDefaultReminders(userId, request.getEventId(), request.getEventDate());
        String eventName = request.getEventName() != null ? request.getEventName() : request.getEventId();
        try {
            notificationService.notifyRsvp(userId, request.getEventId(), eventName, attendance.getStatus());
        } catch (RuntimeException e) {
            logger.warn("RSVP notification failed for {} on {}", userId, request.getEventId(), e);
        }
        return saved != null ? saved : attendance;
    }

    @Override
    public void cancelRsvp(String userId, String eventId) {
        requireId(userId, "User id");
        requireId(eventId, "Event id");
        attendanceRepository.delete(userId, eventId);
        eventReminderRepository.deleteUnsentByUserAndEvent(userId, eventId);
        logger.info("User {} cancelled RSVP to {}", userId, eventId);
    }

    @Override
    public EventAttendees whoIsGoing(String userId, String eventId) {
        requireId(userId, "User id");
        requireId(eventId, "Event id");
        Set<String> flow = flowAudience.flowOf(userId);

        EventAttendees attendees = new EventAttendees(eventId);
        if (flow.isEmpty()) {
            return attendees;
        }
        List<Attendance> rows = attendanceRepository.findForEvent(eventId, flow);
        Map<String, String> names = displayNameService.displayNames(
            rows.stream().map(Attendance::getUserId).collect(Collectors.toList()));
        for (Attendance row : rows) {
            addAttendee(attendees, row, names.get(row.getUserId()));
        }
        return attendees;
    }

    @Override
    public List<EventAttendees> upcomingForFlow(String userId) {
        requireId(userId, "User id");
        Set<String> flow = flowAudience.flowOf(userId);
        if (flow.isEmpty()) {
            return List.of();
        }

        List<Attendance> rows = attendanceRepository.findUpcoming(flow, Instant.now(clock), LIST_LIMIT);
        Map<String, String> names = displayNameService.displayNames(
            rows.stream().map(Attendance::getUserId).distinct().collect(Collectors.toList()));

        Map<String, EventAttendees> byEvent = new LinkedHashMap<>();
        for (Attendance row : rows) {
            EventAttendees event = byEvent.computeIfAbsent(row.getEventId(), EventAttendees::new);
            addAttendee(event, row, names.get(row.getUserId()));
        }
        return new ArrayList<>(byEvent.values());
    }

    @Override
    public List<Attendance> mySchedule(String userId) {
        requireId(userId, "User id");
        return attendanceRepository.findForUser(userId, LIST_LIMIT);
    }

    @Override
    public FlowAttendance flowAttendance(String userId, String eventId) {
        requireId(userId, "User id");
        requireId(eventId, "Event id");
        Set<String> flow = flowAudience.flowOf(userId);
        List<String> going = new ArrayList<>();
        List<String> maybe = new ArrayList<>();
        if (!flow.isEmpty()) {
            for (Attendance row : attendanceRepository.findForEvent(eventId, flow)) {
                (row.getStatus() == AttendanceStatus.GOING ? going : maybe).add(row.getUserId());
            }
        }
        return new FlowAttendance(going, maybe);
    }

    private void addAttendee(EventAttendees event, Attendance row, String displayName) {
        if (event.getEventName() == null) {
            event.setEventName(row.getEventName() != null
                ? row.getEventName()
                : row.getEventId().substring(0, Math.min(EVENT_NAME_FALLBACK_LENGTH, row.getEventId().length())));
        }
        if (event.getEventDate() == null) {
            event.setEventDate(row.getEventDate());
        }
        if (event.getEventVenue() == null) {
            event.setEventVenue(row.getEventVenue());
        }
        FlowMember member = new FlowMember(row.getUserId(), displayName);
        if (row.getStatus() == AttendanceStatus.GOING) {
            event.getGoing().add(member);
        } else {
            event.getMaybe().add(member);
        }
    }

    private void registerDefaultReminders(String userId, String eventId, Instant startsAt) {
        List<Integer> defaults;
        try {
            defaults = preferenceService.getPreferences(userId).getReminderDefaults();
        } catch (RepositoryException e) {
            logger.warn("Could not load reminder defaults for {}, using {} minutes", userId,
                NotificationPreference.DEFAULT_REMINDER_MINUTES, e);
            defaults = List.of(NotificationPreference.DEFAULT_REMINDER_MINUTES);
        }
        for (Integer minutes : defaults) {
            if (minutes == null || !EventReminderService.isValidLeadTime(minutes)) {
                continue;
            }
            try {
                EventReminder reminder = new EventReminder(userId, eventId, minutes);
                reminder.setFireAt(EventReminderService.fireTime(startsAt, minutes));
                reminder.setCreatedAt(Instant.now(clock));
                eventReminderRepository.upsert(reminder);
            } catch (RepositoryException e) {
                logger.warn("Could not register {} minute reminder for {} on {}", minutes, userId, eventId, e);
            }
        }
        if (startsAt != null) {
            rescheduleReminders(userId, eventId, startsAt);
        }
    }

    /**
     * Move custom reminders along with the event when an RSVP carries a new start time.
     */
    private void rescheduleReminders(String userId, String eventId, Instant startsAt) {
        try {
            for (EventReminder reminder : eventReminderRepository.findByUserAndEvent(userId, eventId)) {
                Instant fireAt = EventReminderService.fireTime(startsAt, reminder.getRemindMinutesBefore());
                if (!reminder.isSent() && !fireAt.equals(reminder.getFireAt())) {
                    eventReminderRepository.updateFireAt(reminder.getId(), fireAt);
                }
            }
        } catch (RepositoryException e) {
            logger.warn("Could not reschedule reminders for {} on {}", userId, eventId, e);
        }
    }

    private static void requireId(String value, String label) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(label + " is required");
        }
    }
}

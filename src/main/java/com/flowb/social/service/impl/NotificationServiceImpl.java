package com.flowb.social.service.impl;

import com.flowb.social.model.AttendanceStatus;
import com.flowb.social.model.Crew;
import com.flowb.social.model.CrewMembership;
import com.flowb.social.model.NotificationType;
import com.flowb.social.repository.CrewRepository;
import com.flowb.social.service.DisplayNameService;
import com.flowb.social.service.FlowAudience;
import com.flowb.social.service.NotificationDispatcher;
import com.flowb.social.service.NotificationService;
import com.flowb.social.service.NotificationTextGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class NotificationServiceImpl implements NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationServiceImpl.class);

    private static final DateTimeFormatter LOCATE_HOUR =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH").withZone(ZoneOffset.UTC);

    private final CrewRepository crewRepository;
    private final FlowAudience flowAudience;
    private final DisplayNameService displayNameService;
    private final NotificationDispatcher dispatcher;
    private final NotificationTextGenerator textGenerator;
    private final Clock clock;

    @Autowired
    public NotificationServiceImpl(CrewRepository crewRepository,
                                   FlowAudience flowAudience,
                                   DisplayNameService displayNameService,
                                   NotificationDispatcher dispatcher,
                                   NotificationTextGenerator textGenerator,
                                   Clock clock) {
        this.crewRepository = crewRepository;
        this.flowAudience = flowAudience;
        this.displayNameService = displayNameService;
        this.dispatcher = dispatcher;
        this.textGenerator = textGenerator;
        this.clock = clock;
    }

    @Override
    public int notifyCheckin(String actorId, String crewId, String venueName) {
        Optional<Crew> crew = crewRepository.findById(crewId);
        if (crew.isEmpty()) {
            logger.warn("Check-in notification for unknown crew {}", crewId);
            return 0;
        }
        String text = textGenerator.getCheckinBody(crew.get().getEmoji(), displayNameService.displayName(actorId),
            venueName);
        int sent = dispatcher.fanOut(actorId).send(NotificationType.CHECKIN, crewId + ":" + venueName,
            unmutedMembers(crewId), text, Set.of(NotificationType.CHECKIN));
        logger.info("Check-in by {} in crew {} notified {} members", actorId, crewId, sent);
        return sent;
    }

    @Override
    public int notifyCrewJoin(String actorId, String crewId) {
        Optional<Crew> crew = crewRepository.findById(crewId);
        if (crew.isEmpty()) {
            logger.warn("Join notification for unknown crew {}", crewId);
            return 0;
        }
        String text = textGenerator.getCrewJoinBody(crew.get().getEmoji(), displayNameService.displayName(actorId),
            crew.get().getName());
        int sent = dispatcher.fanOut(actorId).send(NotificationType.CREW_JOIN, crewId + ":" + actorId,
            unmutedMembers(crewId), text, Set.of(NotificationType.CREW_JOIN));
        logger.info("Join of {} to crew {} notified {} members", actorId, crewId, sent);
        return sent;
    }

    @Override
    public int notifyFriendRsvp(String actorId, String eventId, String eventName, AttendanceStatus status) {
        NotificationDispatcher.FanOut fanOut = dispatcher.fanOut(actorId);
        sendToFriends(fanOut, actorId, eventId, eventName, displayNameService.displayName(actorId), status);
        logger.info("RSVP by {} to {} notified {} friends", actorId, eventId, fanOut.getSent());
        return fanOut.getSent();
    }

    @Override
    public int notifyCrewMemberRsvp(String actorId, String eventId, String eventName, AttendanceStatus status) {
        NotificationDispatcher.FanOut fanOut = dispatcher.fanOut(actorId);
        sendToCrews(fanOut, actorId, eventId, eventName, displayNameService.displayName(actorId), status);
        logger.info("RSVP by {} to {} notified {} crew members", actorId, eventId, fanOut.getSent());
        return fanOut.getSent();
    }

    @Override
    public int notifyRsvp(String actorId, String eventId, String eventName, AttendanceStatus status) {
        NotificationDispatcher.FanOut fanOut = dispatcher.fanOut(actorId);
        String actorName = displayNameService.displayName(actorId);
        sendToFriends(fanOut, actorId, eventId, eventName, actorName, status);
        sendToCrews(fanOut, actorId, eventId, eventName, actorName, status);
        logger.info("RSVP ({}) by {} to {} notified {} people", status, actorId, eventId, fanOut.getSent());
        return fanOut.getSent();
    }

    @Override
    public int notifyCrewLocate(String actorId, String crewId, Collection<String> recipientIds) {
        if (recipientIds.isEmpty()) {
            return 0;
        }
        Optional<Crew> crew = crewRepository.findById(crewId);
        if (crew.isEmpty()) {
            logger.warn("Locate ping for unknown crew {}", crewId);
            return 0;
        }
        String text = textGenerator.getCrewLocateBody(crew.get().getEmoji(), displayNameService.displayName(actorId),
            crew.get().getName());
        String reference = crewId + ":" + LOCATE_HOUR.format(clock.instant());
        int sent = dispatcher.fanOut(actorId).send(NotificationType.CREW_LOCATE, reference,
            recipientIds, text, Set.of(NotificationType.CREW_LOCATE));
        logger.info("Locate ping by {} in crew {} reached {} of {} members", actorId, crewId, sent,
            recipientIds.size());
        return sent;
    }

    private void sendToFriends(NotificationDispatcher.FanOut fanOut, String actorId, String eventId,
                               String eventName, String actorName, AttendanceStatus status) {
        List<String> friends = flowAudience.activeFriendIds(actorId);
        if (friends.isEmpty()) {
            return;
        }
        fanOut.send(NotificationType.FRIEND_RSVP, eventId, friends,
            textGenerator.getFriendRsvpBody(actorName, eventName, status), NotificationType.RSVP_TYPES);
    }

    private void sendToCrews(NotificationDispatcher.FanOut fanOut, String actorId, String eventId,
                             String eventName, String actorName, AttendanceStatus status) {
        List<String> crewIds = crewRepository.findUnmutedMembershipsForUser(actorId).stream()
            .map(CrewMembership::getGroupId)
            .collect(Collectors.toList());
        if (crewIds.isEmpty()) {
            return;
        }

        Map<String, List<String>> membersByCrew = new LinkedHashMap<>();
        crewIds.forEach(id -> membersByCrew.put(id, new ArrayList<>()));
        for (CrewMembership member : crewRepository.findUnmutedMembers(crewIds)) {
            List<String> members = membersByCrew.get(member.getGroupId());
            if (members != null) {
                members.add(member.getUserId());
            }
        }

        Map<String, Crew> crews = crewRepository.findByIds(crewIds).stream()
            .collect(Collectors.toMap(Crew::getId, crew -> crew, (a, b) -> a));
        membersByCrew.forEach((crewId, members) -> {
            Crew crew = crews.get(crewId);
            if (crew == null || members.isEmpty()) {
                return;
            }
            fanOut.send(NotificationType.CREW_RSVP, eventId, members,
                textGenerator.getCrewRsvpBody(crew.getEmoji(), actorName, eventName, status), NotificationType.RSVP_TYPES);
        });
    }

    private List<String> unmutedMembers(String crewId) {
        return crewRepository.findUnmutedMembers(List.of(crewId)).stream()
            .map(CrewMembership::getUserId)
            .collect(Collectors.toList());
    }
}

package com.flowb.social.service.impl;

import com.flowb.social.dto.NotifyTargets;
import com.flowb.social.exception.ValidationException;
import com.flowb.social.model.Crew;
import com.flowb.social.model.CrewMembership;
import com.flowb.social.model.NotificationLogEntry;
import com.flowb.social.model.NotificationType;
import com.flowb.social.repository.ConnectionRepository;
import com.flowb.social.repository.CrewRepository;
import com.flowb.social.repository.NotificationLogRepository;
import com.flowb.social.service.FlowAudience;
import com.flowb.social.service.NotificationTargetingService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class NotificationTargetingServiceImpl implements NotificationTargetingService {

    private final FlowAudience flowAudience;
    private final CrewRepository crewRepository;
    private final ConnectionRepository connectionRepository;
    private final NotificationLogRepository notificationLogRepository;
    private final Clock clock;

    @Autowired
    public NotificationTargetingServiceImpl(FlowAudience flowAudience,
                                            CrewRepository crewRepository,
                                            ConnectionRepository connectionRepository,
                                            NotificationLogRepository notificationLogRepository,
                                            Clock clock) {
        this.flowAudience = flowAudience;
        this.crewRepository = crewRepository;
        this.connectionRepository = connectionRepository;
        this.notificationLogRepository = notificationLogRepository;
        this.clock = clock;
    }

    @Override
    public NotifyTargets computeTargets(String actorId, String eventId) {
        if (actorId == null || actorId.isBlank() || eventId == null || eventId.isBlank()) {
            throw new ValidationException("Actor id and event id are required");
        }
        Set<String> excluded = new HashSet<>(notificationLogRepository.findNotifiedRecipients(
            NotificationType.RSVP_TYPES, eventId, actorId));
        excluded.addAll(connectionRepository.findUserIdsSilencing(actorId));
        excluded.add(actorId);

        List<String> friends = flowAudience.activeFriendIds(actorId).stream()
            .filter(id -> !excluded.contains(id))
            .distinct()
            .collect(Collectors.toList());
        // Each recipient appears once: friends take the friend list, then the first crew listing them.
        Set<String> assigned = new HashSet<>(excluded);
        assigned.addAll(friends);

        List<String> crewIds = crewRepository.findUnmutedMembershipsForUser(actorId).stream()
            .map(CrewMembership::getGroupId)
            .collect(Collectors.toList());
        Map<String, List<String>> membersByCrew = new LinkedHashMap<>();
        crewIds.forEach(id -> membersByCrew.put(id, new ArrayList<>()));
        for (CrewMembership member : crewRepository.findUnmutedMembers(crewIds)) {
            List<String> members = membersByCrew.get(member.getGroupId());
            if (members != null && assigned.add(member.getUserId())) {
                members.add(member.getUserId());
            }
        }

        Map<String, Crew> crews = crewRepository.findByIds(crewIds).stream()
            .collect(Collectors.toMap(Crew::getId, crew -> crew, (a, b) -> a));
        List<NotifyTargets.CrewTargets> crewTargets = new ArrayList<>();
        membersByCrew.forEach((crewId, members) -> {
            Crew crew = crews.get(crewId);
            if (crew != null && !members.isEmpty()) {
                crewTargets.add(new NotifyTargets.CrewTargets(crewId, crew.getName(), crew.getEmoji(), members));
            }
        });
        return new NotifyTargets(friends, crewTargets);
    }

    @Override
    public void logNotification(String recipientId, NotificationType type, String referenceId, String triggeredBy) {
        notificationLogRepository.record(new NotificationLogEntry(recipientId, type, referenceId,
            triggeredBy, Instant.now(clock)));
    }
}

package com.flowb.social.service;

import com.flowb.social.model.Connection;
import com.flowb.social.model.ConnectionStatus;
import com.flowb.social.model.CrewMembership;
import com.flowb.social.repository.ConnectionRepository;
import com.flowb.social.repository.CrewRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A user's flow: active friends plus everyone in the crews they have not muted, minus themselves.
 */
@Component
public class FlowAudience {

    private final ConnectionRepository connectionRepository;
    private final CrewRepository crewRepository;

    @Autowired
    public FlowAudience(ConnectionRepository connectionRepository, CrewRepository crewRepository) {
        this.connectionRepository = connectionRepository;
        this.crewRepository = crewRepository;
    }

    public Set<String> flowOf(String userId) {
        Set<String> flow = new LinkedHashSet<>(activeFriendIds(userId));

        List<String> crewIds = crewRepository.findUnmutedMembershipsForUser(userId).stream()
            .map(CrewMembership::getGroupId)
            .collect(Collectors.toList());
        for (CrewMembership member : crewRepository.findMembersOfCrews(crewIds)) {
            flow.add(member.getUserId());
        }

        flow.remove(userId);
        return flow;
    }

    public List<String> activeFriendIds(String userId) {
        return connectionRepository.findByUserAndStatus(userId, ConnectionStatus.ACTIVE).stream()
            .map(Connection::getFriendId)
            .collect(Collectors.toList());
    }
}

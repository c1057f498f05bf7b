package com.flowb.social.service.impl;

import com.flowb.social.dto.AcceptInviteResult;
import com.flowb.social.dto.CrewSummary;
import com.flowb.social.dto.FlowListing;
import com.flowb.social.dto.FriendEntry;
import com.flowb.social.dto.InviteLinkResponse;
import com.flowb.social.exception.IllegalOperationException;
import com.flowb.social.exception.ResourceNotFoundException;
import com.flowb.social.exception.ValidationException;
import com.flowb.social.model.Connection;
import com.flowb.social.model.ConnectionStatus;
import com.flowb.social.model.Crew;
import com.flowb.social.model.CrewMembership;
import com.flowb.social.model.FlowInvite;
import com.flowb.social.repository.ConnectionRepository;
import com.flowb.social.repository.CrewRepository;
import com.flowb.social.repository.FlowInviteRepository;
import com.flowb.social.service.ConnectionService;
import com.flowb.social.service.DisplayNameService;
import com.flowb.social.util.InviteCodeGenerator;
import com.flowb.social.util.ShareLinkBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class ConnectionServiceImpl implements ConnectionService {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionServiceImpl.class);
    private static final int INVITE_CODE_LENGTH = 8;

    private final ConnectionRepository connectionRepository;
    private final FlowInviteRepository flowInviteRepository;
    private final CrewRepository crewRepository;
    private final DisplayNameService displayNameService;
    private final ShareLinkBuilder shareLinkBuilder;
    private final Clock clock;

    @Autowired
    public ConnectionServiceImpl(ConnectionRepository connectionRepository,
                                 FlowInviteRepository flowInviteRepository,
                                 CrewRepository crewRepository,
                                 DisplayNameService displayNameService,
                                 ShareLinkBuilder shareLinkBuilder,
                                 Clock clock) {
        this.connectionRepository = connectionRepository;
        this.flowInviteRepository = flowInviteRepository;
        this.crewRepository = crewRepository;
        this.displayNameService = displayNameService;
        this.shareLinkBuilder = shareLinkBuilder;
        this.clock = clock;
    }

    @Override
    public InviteLinkResponse getInviteLink(String userId) {
        requireId(userId, "User id");
        FlowInvite invite = flowInviteRepository.findByUserId(userId).orElseGet(() -> {
            String code = InviteCodeGenerator.generateUnique(INVITE_CODE_LENGTH,
                    candidate -> flowInviteRepository.findByCode(candidate).isPresent());
            logger.info("Created flow invite code for {}", userId);
            return flowInviteRepository.save(new FlowInvite(userId, code, Instant.now(clock)));
        });
        return new InviteLinkResponse(invite.getCode(), shareLinkBuilder.flowInvite(invite.getCode()));
    }

    @Override
    public AcceptInviteResult acceptInvite(String userId, String inviteCode) {
        requireId(userId, "User id");
        requireId(inviteCode, "Invite code");

        FlowInvite invite = flowInviteRepository.findByCode(inviteCode.trim())
            .orElseThrow(() -> new ResourceNotFoundException("Invite code not found: " + inviteCode));
        String inviterId = invite.getUserId();
        if (inviterId.equals(userId)) {
            throw new IllegalOperationException("You can't add yourself to your own flow");
        }

        Optional<Connection> outgoing = connectionRepository.findBetween(userId, inviterId);
        Optional<Connection> incoming = connectionRepository.findBetween(inviterId, userId);
        if (isBlocked(outgoing) || isBlocked(incoming)) {
            throw new IllegalOperationException("This connection is blocked");
        }

        String friendName = displayNameService.displayName(inviterId);
        if (isActive(outgoing) && isActive(incoming)) {
            return new AcceptInviteResult(AcceptInviteResult.Outcome.ALREADY_CONNECTED, inviterId, friendName);
        }

        Instant acceptedAt = Instant.now(clock);
        boolean existed = outgoing.isPresent() || incoming.isPresent();
        activate(outgoing, userId, inviterId, acceptedAt);
        activate(incoming, inviterId, userId, acceptedAt);

        AcceptInviteResult.Outcome outcome = existed
            ? AcceptInviteResult.Outcome.RECONNECTED
            : AcceptInviteResult.Outcome.CONNECTED;
        logger.info("Connection {} between {} and {}", outcome.name().toLowerCase(), userId, inviterId);
        return new AcceptInviteResult(outcome, inviterId, friendName);
    }

    @Override
    public void removeConnection(String userId, String friendId) {
        requireId(userId, "User id");
        requireId(friendId, "Friend id");
        connectionRepository.deleteBetween(userId, friendId);
        connectionRepository.deleteBetween(friendId, userId);
        logger.info("Removed connection between {} and {}", userId, friendId);
    }

    @Override
    public ConnectionStatus toggleMute(String userId, String friendId) {
        requireId(userId, "User id");
        requireId(friendId, "Friend id");
        Connection connection = connectionRepository.findBetween(userId, friendId)
            .orElseThrow(() -> new ResourceNotFoundException("Not connected to " + friendId));

        ConnectionStatus next;
        switch (connection.getStatus()) {
            case ACTIVE:
                next = ConnectionStatus.MUTED;
                break;
            case MUTED:
                next = ConnectionStatus.ACTIVE;
                break;
            default:
                throw new IllegalOperationException("Connection is " + connection.getStatus().name().toLowerCase());
        }
        connectionRepository.updateStatus(connection.getId(), next, null);
        logger.info("User {} set connection to {} as {}", userId, friendId, next);
        return next;
    }

    @Override
    public FlowListing listFlow(String userId) {
        requireId(userId, "User id");
        List<Connection> connections = connectionRepository.findByUserAndStatus(userId, ConnectionStatus.ACTIVE);
        Map<String, String> names = displayNameService.displayNames(
            connections.stream().map(Connection::getFriendId).collect(Collectors.toList()));

        List<FriendEntry> friends = new ArrayList<>();
        for (Connection connection : connections) {
            friends.add(new FriendEntry(connection.getFriendId(), names.get(connection.getFriendId()),
                connection.getAcceptedAt()));
        }

        List<CrewMembership> memberships = crewRepository.findMembershipsForUser(userId);
        Map<String, Crew> crewsById = crewRepository.findByIds(
                memberships.stream().map(CrewMembership::getGroupId).collect(Collectors.toList()))
            .stream()
            .collect(Collectors.toMap(Crew::getId, Function.identity(), (a, b) -> a));

        List<CrewSummary> crews = new ArrayList<>();
        for (CrewMembership membership : memberships) {
            Crew crew = crewsById.get(membership.getGroupId());
            if (crew != null) {
                crews.add(new CrewSummary(crew, membership.getRole()));
            }
        }
        return new FlowListing(friends, crews);
    }

    private void activate(Optional<Connection> existing, String userId, String friendId, Instant acceptedAt) {
        if (existing.isPresent()) {
            connectionRepository.updateStatus(existing.get().getId(), ConnectionStatus.ACTIVE, acceptedAt);
        } else {
            connectionRepository.save(new Connection(userId, friendId, ConnectionStatus.ACTIVE, acceptedAt));
        }
    }

    private static boolean isBlocked(Optional<Connection> connection) {
        return connection.map(c -> c.getStatus() == ConnectionStatus.BLOCKED).orElse(false);
    }

    private static boolean isActive(Optional<Connection> connection) {
        return connection.map(c -> c.getStatus() == ConnectionStatus.ACTIVE).orElse(false);
    }

    private static void requireId(String value, String label) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(label + " is required");
        }
    }
}

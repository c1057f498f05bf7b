package com.flowb.social.service.impl;

import com.flowb.social.config.CrewProperties;
import com.flowb.social.dto.CrewCreationResult;
import com.flowb.social.dto.CrewMemberDTO;
import com.flowb.social.dto.CrewSettingsUpdate;
import com.flowb.social.dto.CrewSummary;
import com.flowb.social.dto.InviteLinkResponse;
import com.flowb.social.dto.JoinCrewResult;
import com.flowb.social.exception.IllegalOperationException;
import com.flowb.social.exception.ResourceNotFoundException;
import com.flowb.social.exception.UnauthorizedException;
import com.flowb.social.exception.ValidationException;
import com.flowb.social.model.Crew;
import com.flowb.social.model.CrewInvite;
import com.flowb.social.model.CrewMembership;
import com.flowb.social.model.CrewRole;
import com.flowb.social.model.JoinMode;
import com.flowb.social.model.JoinRequest;
import com.flowb.social.model.JoinRequestStatus;
import com.flowb.social.repository.CrewInviteRepository;
import com.flowb.social.repository.CrewRepository;
import com.flowb.social.repository.JoinRequestRepository;
import com.flowb.social.service.CrewService;
import com.flowb.social.service.DisplayNameService;
import com.flowb.social.service.NotificationService;
import com.flowb.social.util.CrewNameParser;
import com.flowb.social.util.InviteCodeGenerator;
import com.flowb.social.util.ShareLinkBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Crew lifecycle, join policies and role management.
 *
 * Only {@link #createCrew} assigns the creator role; promotion, demotion and removal
 * refuse to touch the creator, so every crew keeps exactly one.
 */
@Service
public class CrewServiceImpl implements CrewService {

    private static final Logger logger = LoggerFactory.getLogger(CrewServiceImpl.class);

    private final CrewRepository crewRepository;
    private final CrewInviteRepository crewInviteRepository;
    private final JoinRequestRepository joinRequestRepository;
    private final DisplayNameService displayNameService;
    private final NotificationService notificationService;
    private final ShareLinkBuilder shareLinkBuilder;
    private final CrewProperties crewProperties;
    private final Clock clock;

    @Autowired
    public CrewServiceImpl(CrewRepository crewRepository,
                           CrewInviteRepository crewInviteRepository,
                           JoinRequestRepository joinRequestRepository,
                           DisplayNameService displayNameService,
                           NotificationService notificationService,
                           ShareLinkBuilder shareLinkBuilder,
                           CrewProperties crewProperties,
                           Clock clock) {
        this.crewRepository = crewRepository;
        this.crewInviteRepository = crewInviteRepository;
        this.joinRequestRepository = joinRequestRepository;
        this.displayNameService = displayNameService;
        this.notificationService = notificationService;
        this.shareLinkBuilder = shareLinkBuilder;
        this.crewProperties = crewProperties;
        this.clock = clock;
    }

    @Override
    public CrewCreationResult createCrew(String userId, String rawName) {
        requireId(userId, "User id");
        if (rawName == null || rawName.isBlank()) {
            throw new ValidationException("Crew name required.");
        }
        CrewNameParser.ParsedName parsed = CrewNameParser.parse(rawName);
        if (parsed.getName().isEmpty()) {
            throw new ValidationException("Crew name required (not just an emoji).");
        }
        String emoji = parsed.getEmoji() != null ? parsed.getEmoji() : crewProperties.getDefaultEmoji();

        String joinCode = InviteCodeGenerator.generateUnique(crewProperties.getJoinCodeLength(),
            crewRepository::joinCodeExists);
        Instant now = Instant.now(clock);

        Crew crew = new Crew(parsed.getName(), emoji, userId, joinCode, crewProperties.getDefaultMaxMembers());
        crew.setCreatedAt(now);
        CrewMembership creator = new CrewMembership(null, userId, CrewRole.CREATOR, now);

        Crew saved = crewRepository.createCrewWithCreator(crew, creator);
        return new CrewCreationResult(saved, shareLinkBuilder.crewJoin(saved.getJoinCode()));
    }

    @Override
    public JoinCrewResult joinCrew(String userId, String code) {
        requireId(userId, "User id");
        requireId(code, "Join code");
        String trimmed = code.trim();

        Optional<CrewInvite> personalInvite = crewInviteRepository.findByCode(trimmed);
        Crew crew;
        if (personalInvite.isPresent()) {
            crew = crewRepository.findById(personalInvite.get().getGroupId())
                .orElseThrow(() -> new ResourceNotFoundException("Crew not found for invite " + trimmed));
        } else {
            crew = crewRepository.findByJoinCode(trimmed)
                .orElseThrow(() -> new ResourceNotFoundException("No crew found for code " + trimmed));
        }

        requireJoinable(crew);

        if (crewRepository.findMembership(crew.getId(), userId).isPresent()) {
            return new JoinCrewResult(JoinCrewResult.Outcome.ALREADY_MEMBER, crew,
                crewRepository.countMembers(crew.getId()));
        }

        int memberCount = crewRepository.countMembers(crew.getId());
        if (memberCount >= crew.getMaxMembers()) {
            throw new IllegalOperationException("Crew is full (" + crew.getMaxMembers() + " members)");
        }

        if (crew.getJoinMode() == JoinMode.APPROVAL && personalInvite.isEmpty()) {
            return submitRequest(crew, userId);
        }

        JoinCrewResult result = admit(crew, userId, memberCount);
        personalInvite.ifPresent(invite -> {
            crewInviteRepository.updateUses(invite.getId(), invite.getUses() + 1);
            result.setInvitedBy(invite.getInviterId());
        });
        return result;
    }

    @Override
    public JoinCrewResult requestJoin(String userId, String crewId) {
        requireId(userId, "User id");
        Crew crew = findCrew(crewId);
        requireJoinable(crew);

        if (crewRepository.findMembership(crewId, userId).isPresent()) {
            return new JoinCrewResult(JoinCrewResult.Outcome.ALREADY_MEMBER, crew,
                crewRepository.countMembers(crewId));
        }

        if (crew.getJoinMode() == JoinMode.OPEN) {
            int memberCount = crewRepository.countMembers(crewId);
            if (memberCount >= crew.getMaxMembers()) {
                throw new IllegalOperationException("Crew is full (" + crew.getMaxMembers() + " members)");
            }
            return admit(crew, userId, memberCount);
        }
        return submitRequest(crew, userId);
    }

    @Override
    public JoinRequest approveRequest(String reviewerId, String requestId) {
        JoinRequest request = findPendingRequestForReview(reviewerId, requestId);
        Crew crew = findCrew(request.getGroupId());

        boolean alreadyMember = crewRepository.findMembership(crew.getId(), request.getUserId()).isPresent();
        int memberCount = crewRepository.countMembers(crew.getId());
        if (!alreadyMember && memberCount >= crew.getMaxMembers()) {
            throw new IllegalOperationException("Crew is full (" + crew.getMaxMembers() + " members)");
        }

        Instant now = Instant.now(clock);
        joinRequestRepository.markReviewed(request.getId(), JoinRequestStatus.APPROVED, reviewerId, now);
        request.setStatus(JoinRequestStatus.APPROVED);
        request.setReviewedBy(reviewerId);
        request.setReviewedAt(now);

        if (!alreadyMember) {
            admit(crew, request.getUserId(), memberCount);
        }
        logger.info("Join request {} approved by {}", requestId, reviewerId);
        return request;
    }

    @Override
    public JoinRequest denyRequest(String reviewerId, String requestId) {
        JoinRequest request = findPendingRequestForReview(reviewerId, requestId);

        Instant now = Instant.now(clock);
        joinRequestRepository.markReviewed(request.getId(), JoinRequestStatus.DENIED, reviewerId, now);
        request.setStatus(JoinRequestStatus.DENIED);
        request.setReviewedBy(reviewerId);
        request.setReviewedAt(now);

        logger.info("Join request {} denied by {}", requestId, reviewerId);
        return request;
    }

    @Override
    public CrewRole promote(String actorId, String crewId, String targetId) {
        return changeRole(actorId, crewId, targetId, CrewRole.ADMIN);
    }

    @Override
    public CrewRole demote(String actorId, String crewId, String targetId) {
        return changeRole(actorId, crewId, targetId, CrewRole.MEMBER);
    }

    @Override
    public Crew updateSettings(String actorId, String crewId, CrewSettingsUpdate update) {
        Crew crew = findCrew(crewId);
        requireRole(actorId, crewId, CrewRole.ADMIN, "Only crew creators and admins can change settings");

        Map<String, Object> fields = new LinkedHashMap<>();
        if (update != null && update.getListedPublicly() != null
                && update.getListedPublicly() != crew.isPublic()) {
            fields.put("is_public", update.getListedPublicly());
            crew.setPublic(update.getListedPublicly());
        }
        if (update != null && update.getJoinMode() != null && update.getJoinMode() != crew.getJoinMode()) {
            fields.put("join_mode", update.getJoinMode());
            crew.setJoinMode(update.getJoinMode());
        }

        if (!fields.isEmpty()) {
            crewRepository.updateSettings(crewId, fields);
            logger.info("Crew {} settings updated by {}: {}", crewId, actorId, fields.keySet());
        }
        return crew;
    }

    @Override
    public InviteLinkResponse createPersonalInvite(String userId, String crewId) {
        requireId(userId, "User id");
        findCrew(crewId);
        if (crewRepository.findMembership(crewId, userId).isEmpty()) {
            throw new UnauthorizedException("Only crew members can create invites");
        }

        CrewInvite invite = crewInviteRepository.findByCrewAndInviter(crewId, userId).orElseGet(() -> {
            String code = InviteCodeGenerator.generateUnique(crewProperties.getInviteCodeLength(),
                crewInviteRepository::codeExists);
            logger.info("Created personal invite for {} in crew {}", userId, crewId);
            return crewInviteRepository.save(new CrewInvite(crewId, userId, code, Instant.now(clock)));
        });
        return new InviteLinkResponse(invite.getInviteCode(),
            shareLinkBuilder.crewInvite(invite.getInviteCode()), invite.getUses());
    }

    @Override
    public List<CrewSummary> listCrews(String userId) {
        requireId(userId, "User id");
        List<CrewMembership> memberships = crewRepository.findMembershipsForUser(userId);
        Map<String, Crew> crews = crewRepository.findByIds(
                memberships.stream().map(CrewMembership::getGroupId).collect(Collectors.toList()))
            .stream()
            .collect(Collectors.toMap(Crew::getId, Function.identity(), (a, b) -> a));

        return memberships.stream()
            .filter(membership -> crews.containsKey(membership.getGroupId()))
            .map(membership -> new CrewSummary(crews.get(membership.getGroupId()), membership.getRole()))
            .collect(Collectors.toList());
    }

    @Override
    public List<CrewMemberDTO> getMembers(String crewId) {
        findCrew(crewId);
        List<CrewMembership> members = crewRepository.findMembers(crewId);
        Map<String, String> names = displayNameService.displayNames(
            members.stream().map(CrewMembership::getUserId).collect(Collectors.toList()));
        return members.stream()
            .map(member -> new CrewMemberDTO(member, names.get(member.getUserId())))
            .collect(Collectors.toList());
    }

    @Override
    public void leaveCrew(String userId, String crewId) {
        requireId(userId, "User id");
        requireId(crewId, "Crew id");
        Optional<CrewMembership> membership = crewRepository.findMembership(crewId, userId);
        if (membership.isEmpty()) {
            return;
        }
        if (membership.get().isCreator()) {
            throw new IllegalOperationException("The crew creator can't leave their own crew");
        }
        crewRepository.removeMember(crewId, userId);
        logger.info("User {} left crew {}", userId, crewId);
    }

    @Override
    public void removeMember(String actorId, String crewId, String targetId) {
        requireId(targetId, "Member id");
        if (targetId.equals(actorId)) {
            leaveCrew(actorId, crewId);
            return;
        }
        findCrew(crewId);
        CrewRole actorRole = requireRole(actorId, crewId, CrewRole.ADMIN, "Only crew admins can remove members");

        Optional<CrewMembership> target = crewRepository.findMembership(crewId, targetId);
        if (target.isEmpty()) {
            return;
        }
        if (target.get().isCreator()) {
            throw new IllegalOperationException("The crew creator can't be removed");
        }
        if (actorRole.getRank() <= target.get().getRole().getRank()) {
            throw new UnauthorizedException("Only the crew creator can remove an admin");
        }
        crewRepository.removeMember(crewId, targetId);
        logger.info("User {} removed {} from crew {}", actorId, targetId, crewId);
    }

    @Override
    public List<Crew> browsePublicCrews(int limit) {
        int effectiveLimit = limit > 0 ? limit : crewProperties.getBrowseLimit();
        return crewRepository.findPublic(effectiveLimit);
    }

    @Override
    public List<JoinRequest> getPendingRequests(String actorId, String crewId) {
        findCrew(crewId);
        requireRole(actorId, crewId, CrewRole.ADMIN, "Only crew creators and admins can review requests");
        return joinRequestRepository.findPendingForCrew(crewId);
    }

    @Override
    public List<String> getCrewAdmins(String crewId) {
        requireId(crewId, "Crew id");
        List<String> admins = new ArrayList<>();
        for (CrewMembership membership : crewRepository.findMembersWithRoles(crewId,
                EnumSet.of(CrewRole.CREATOR, CrewRole.ADMIN))) {
            admins.add(membership.getUserId());
        }
        return admins;
    }

    @Override
    public Optional<CrewRole> getRole(String userId, String crewId) {
        requireId(userId, "User id");
        requireId(crewId, "Crew id");
        return crewRepository.findMembership(crewId, userId).map(CrewMembership::getRole);
    }

    @Override
    public boolean hasPermission(String userId, String crewId, CrewRole minimumRole) {
        int rank = getRole(userId, crewId).map(CrewRole::getRank).orElse(CrewRole.NO_MEMBERSHIP_RANK);
        return rank >= minimumRole.getRank();
    }

    private JoinCrewResult admit(Crew crew, String userId, int memberCountBefore) {
        crewRepository.addMember(new CrewMembership(crew.getId(), userId, CrewRole.MEMBER, Instant.now(clock)));
        logger.info("User {} joined crew {}", userId, crew.getId());

        try {
            notificationService.notifyCrewJoin(userId, crew.getId());
        } catch (RuntimeException e) {
            logger.warn("Crew join notification failed for {} in {}", userId, crew.getId(), e);
        }
        return new JoinCrewResult(JoinCrewResult.Outcome.JOINED, crew, memberCountBefore + 1);
    }

    private JoinCrewResult submitRequest(Crew crew, String userId) {
        Optional<JoinRequest> pending = joinRequestRepository.findPending(crew.getId(), userId);
        int memberCount = crewRepository.countMembers(crew.getId());
        if (pending.isPresent()) {
            JoinCrewResult result = new JoinCrewResult(JoinCrewResult.Outcome.ALREADY_REQUESTED, crew, memberCount);
            result.setRequestId(pending.get().getId());
            return result;
        }

        JoinRequest saved = joinRequestRepository.save(new JoinRequest(crew.getId(), userId, Instant.now(clock)));
        logger.info("User {} requested to join crew {}", userId, crew.getId());
        JoinCrewResult result = new JoinCrewResult(JoinCrewResult.Outcome.REQUESTED, crew, memberCount);
        result.setRequestId(saved.getId());
        return result;
    }

    private JoinRequest findPendingRequestForReview(String reviewerId, String requestId) {
        requireId(reviewerId, "Reviewer id");
        requireId(requestId, "Request id");
        JoinRequest request = joinRequestRepository.findById(requestId)
            .orElseThrow(() -> new ResourceNotFoundException("Join request not found: " + requestId));
        requireRole(reviewerId, request.getGroupId(), CrewRole.ADMIN,
            "Only crew creators and admins can review requests");
        if (request.getStatus() != JoinRequestStatus.PENDING) {
            throw new IllegalOperationException("Request already " + request.getStatus().label());
        }
        return request;
    }

    private CrewRole changeRole(String actorId, String crewId, String targetId, CrewRole newRole) {
        requireId(targetId, "Member id");
        findCrew(crewId);
        requireRole(actorId, crewId, CrewRole.CREATOR, "Only the crew creator can change roles");

        CrewMembership target = crewRepository.findMembership(crewId, targetId)
            .orElseThrow(() -> new ResourceNotFoundException("User " + targetId + " is not in this crew"));
        if (target.isCreator()) {
            throw new IllegalOperationException("The crew creator's role can't be changed");
        }
        if (target.getRole() == newRole) {
            return newRole;
        }
        crewRepository.updateRole(crewId, targetId, newRole);
        logger.info("User {} set {} to {} in crew {}", actorId, targetId, newRole.label(), crewId);
        return newRole;
    }

    private CrewRole requireRole(String userId, String crewId, CrewRole minimumRole, String message) {
        requireId(userId, "User id");
        Optional<CrewRole> role = crewRepository.findMembership(crewId, userId).map(CrewMembership::getRole);
        if (role.isEmpty() || !role.get().isAtLeast(minimumRole)) {
            throw new UnauthorizedException(message);
        }
        return role.get();
    }

    private void requireJoinable(Crew crew) {
        if (crew.isExpiredAt(Instant.now(clock))) {
            throw new IllegalOperationException("This crew has expired");
        }
        if (crew.getJoinMode() == JoinMode.CLOSED) {
            throw new IllegalOperationException("This crew is closed to new members");
        }
    }

    private Crew findCrew(String crewId) {
        requireId(crewId, "Crew id");
        return crewRepository.findById(crewId)
            .orElseThrow(() -> new ResourceNotFoundException("Crew not found: " + crewId));
    }

    private static void requireId(String value, String label) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(label + " is required");
        }
    }
}

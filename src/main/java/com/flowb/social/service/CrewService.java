package com.flowb.social.service;

import com.flowb.social.dto.CrewCreationResult;
import com.flowb.social.dto.CrewMemberDTO;
import com.flowb.social.dto.CrewSettingsUpdate;
import com.flowb.social.dto.CrewSummary;
import com.flowb.social.dto.InviteLinkResponse;
import com.flowb.social.dto.JoinCrewResult;
import com.flowb.social.model.Crew;
import com.flowb.social.model.CrewRole;
import com.flowb.social.model.JoinRequest;

import java.util.List;
import java.util.Optional;

/**
 * Crews: role-hierarchical groups with open, approval or closed join policies.
 * Role checks rank creator above admin above member; a non-member ranks below all three.
 */
public interface CrewService {

    CrewCreationResult createCrew(String userId, String rawName);

    /**
     * Join with either a member's personal invite code or the crew's public join code,
     * tried in that order. Personal invites skip approval mode and are credited to the inviter.
     */
    JoinCrewResult joinCrew(String userId, String code);

    JoinCrewResult requestJoin(String userId, String crewId);

    JoinRequest approveRequest(String reviewerId, String requestId);

    JoinRequest denyRequest(String reviewerId, String requestId);

    CrewRole promote(String actorId, String crewId, String targetId);

    CrewRole demote(String actorId, String crewId, String targetId);

    Crew updateSettings(String actorId, String crewId, CrewSettingsUpdate update);

    InviteLinkResponse createPersonalInvite(String userId, String crewId);

    List<CrewSummary> listCrews(String userId);

    List<CrewMemberDTO> getMembers(String crewId);

    void leaveCrew(String userId, String crewId);

    void removeMember(String actorId, String crewId, String targetId);

    List<Crew> browsePublicCrews(int limit);

    List<JoinRequest> getPendingRequests(String actorId, String crewId);

    /**
     * Creator and admins of a crew, the audience for join-request reviews.
     */
    List<String> getCrewAdmins(String crewId);

    Optional<CrewRole> getRole(String userId, String crewId);

    boolean hasPermission(String userId, String crewId, CrewRole minimumRole);
}

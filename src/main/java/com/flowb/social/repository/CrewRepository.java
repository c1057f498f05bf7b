package com.flowb.social.repository;

import com.flowb.social.model.Crew;
import com.flowb.social.model.CrewMembership;
import com.flowb.social.model.CrewRole;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for crews and their memberships.
 */
public interface CrewRepository {

    // Crew operations

    /**
     * Insert a crew together with its creator's membership. If the membership cannot be
     * written the crew row is removed again.
     */
    Crew createCrewWithCreator(Crew crew, CrewMembership creatorMembership);

    Optional<Crew> findById(String crewId);

    Optional<Crew> findByJoinCode(String joinCode);

    boolean joinCodeExists(String joinCode);

    List<Crew> findByIds(Collection<String> crewIds);

    /**
     * Public crews, newest first.
     */
    List<Crew> findPublic(int limit);

    void updateSettings(String crewId, Map<String, Object> fields);

    // Membership operations

    Optional<CrewMembership> findMembership(String crewId, String userId);

    /**
     * All members of a crew, oldest first.
     */
    List<CrewMembership> findMembers(String crewId);

    List<CrewMembership> findMembersOfCrews(Collection<String> crewIds);

    List<CrewMembership> findUnmutedMembers(Collection<String> crewIds);

    List<CrewMembership> findMembersWithRoles(String crewId, Collection<CrewRole> roles);

    List<CrewMembership> findMembershipsForUser(String userId);

    List<CrewMembership> findUnmutedMembershipsForUser(String userId);

    int countMembers(String crewId);

    /**
     * Add a member unless the user already belongs to the crew; an existing role is kept.
     */
    void addMember(CrewMembership membership);

    void updateRole(String crewId, String userId, CrewRole role);

    void removeMember(String crewId, String userId);
}

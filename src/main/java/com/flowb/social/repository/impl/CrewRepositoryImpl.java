package com.flowb.social.repository.impl;

import com.flowb.social.exception.RepositoryException;
import com.flowb.social.model.Crew;
import com.flowb.social.model.CrewMembership;
import com.flowb.social.model.CrewRole;
import com.flowb.social.repository.CrewRepository;
import com.flowb.social.store.DataStore;
import com.flowb.social.store.StoreQuery;
import com.flowb.social.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Crew and membership persistence over the {@code flowb_groups} and
 * {@code flowb_group_members} tables.
 */
@Repository
public class CrewRepositoryImpl extends AbstractStoreRepository implements CrewRepository {

    private static final Logger logger = LoggerFactory.getLogger(CrewRepositoryImpl.class);
    private static final List<String> MEMBERSHIP_KEY = List.of("group_id", "user_id");

    @Autowired
    public CrewRepositoryImpl(DataStore dataStore, QueryPerformanceTracker queryTracker) {
        super(dataStore, queryTracker);
    }

    @Override
    public Crew createCrewWithCreator(Crew crew, CrewMembership creatorMembership) {
        Crew saved = execute("Insert", Crew.TABLE, "Failed to create crew", () ->
            dataStore.insert(Crew.TABLE, crew, Crew.class));
        if (saved == null || saved.getId() == null) {
            throw new RepositoryException("Failed to create crew: store returned no row");
        }

        creatorMembership.setGroupId(saved.getId());
        try {
            run("Insert", CrewMembership.TABLE, "Failed to add crew creator", () ->
                dataStore.insert(CrewMembership.TABLE, creatorMembership, CrewMembership.class));
        } catch (RepositoryException e) {
            logger.error("Creator membership failed for crew {}, removing crew row", saved.getId());
            run("Delete", Crew.TABLE, "Failed to roll back crew", () ->
                dataStore.delete(StoreQuery.from(Crew.TABLE).eq("id", saved.getId())));
            throw e;
        }

        logger.info("Created crew {} with creator {}", saved.getId(), creatorMembership.getUserId());
        return saved;
    }

    @Override
    public Optional<Crew> findById(String crewId) {
        return execute("Query", Crew.TABLE, "Failed to load crew", () ->
            dataStore.query(StoreQuery.from(Crew.TABLE).eq("id", crewId).limit(1), Crew.class)
                .stream().findFirst());
    }

    @Override
    public Optional<Crew> findByJoinCode(String joinCode) {
        return execute("Query", Crew.TABLE, "Failed to look up crew code", () ->
            dataStore.query(StoreQuery.from(Crew.TABLE).eq("join_code", joinCode).limit(1), Crew.class)
                .stream().findFirst());
    }

    @Override
    public boolean joinCodeExists(String joinCode) {
        return findByJoinCode(joinCode).isPresent();
    }

    @Override
    public List<Crew> findByIds(Collection<String> crewIds) {
        if (crewIds.isEmpty()) {
            return List.of();
        }
        return execute("Query", Crew.TABLE, "Failed to load crews", () ->
            dataStore.query(StoreQuery.from(Crew.TABLE).in("id", crewIds), Crew.class));
    }

    @Override
    public List<Crew> findPublic(int limit) {
        return execute("Query", Crew.TABLE, "Failed to browse crews", () ->
            dataStore.query(StoreQuery.from(Crew.TABLE)
                    .eq("is_public", true)
                    .orderDesc("created_at")
                    .limit(limit), Crew.class));
    }

    @Override
    public void updateSettings(String crewId, Map<String, Object> fields) {
        run("Patch", Crew.TABLE, "Failed to update crew settings", () ->
            dataStore.patch(StoreQuery.from(Crew.TABLE).eq("id", crewId), fields));
    }

    @Override
    public Optional<CrewMembership> findMembership(String crewId, String userId) {
        return execute("Query", CrewMembership.TABLE, "Failed to load membership", () ->
            dataStore.query(StoreQuery.from(CrewMembership.TABLE)
                    .eq("group_id", crewId)
                    .eq("user_id", userId)
                    .limit(1), CrewMembership.class)
                .stream().findFirst());
    }

    @Override
    public List<CrewMembership> findMembers(String crewId) {
        return execute("Query", CrewMembership.TABLE, "Failed to load crew members", () ->
            dataStore.query(StoreQuery.from(CrewMembership.TABLE)
                    .eq("group_id", crewId)
                    .orderAsc("joined_at"), CrewMembership.class));
    }

    @Override
    public List<CrewMembership> findMembersOfCrews(Collection<String> crewIds) {
        if (crewIds.isEmpty()) {
            return List.of();
        }
        return execute("Query", CrewMembership.TABLE, "Failed to load crew members", () ->
            dataStore.query(StoreQuery.from(CrewMembership.TABLE)
                    .in("group_id", crewIds), CrewMembership.class));
    }

    @Override
    public List<CrewMembership> findUnmutedMembers(Collection<String> crewIds) {
        if (crewIds.isEmpty()) {
            return List.of();
        }
        return execute("Query", CrewMembership.TABLE, "Failed to load crew members", () ->
            dataStore.query(StoreQuery.from(CrewMembership.TABLE)
                    .in("group_id", crewIds)
                    .eq("muted", false)
                    .orderAsc("joined_at"), CrewMembership.class));
    }

    @Override
    public List<CrewMembership> findMembersWithRoles(String crewId, Collection<CrewRole> roles) {
        return execute("Query", CrewMembership.TABLE, "Failed to load crew admins", () ->
            dataStore.query(StoreQuery.from(CrewMembership.TABLE)
                    .eq("group_id", crewId)
                    .in("role", roles)
                    .orderAsc("joined_at"), CrewMembership.class));
    }

    @Override
    public List<CrewMembership> findMembershipsForUser(String userId) {
        return execute("Query", CrewMembership.TABLE, "Failed to load memberships", () ->
            dataStore.query(StoreQuery.from(CrewMembership.TABLE)
                    .eq("user_id", userId)
                    .orderAsc("joined_at"), CrewMembership.class));
    }

    @Override
    public List<CrewMembership> findUnmutedMembershipsForUser(String userId) {
        return execute("Query", CrewMembership.TABLE, "Failed to load memberships", () ->
            dataStore.query(StoreQuery.from(CrewMembership.TABLE)
                    .eq("user_id", userId)
                    .eq("muted", false), CrewMembership.class));
    }

    @Override
    public int countMembers(String crewId) {
        return findMembers(crewId).size();
    }

    @Override
    public void addMember(CrewMembership membership) {
        run("Insert", CrewMembership.TABLE, "Failed to add crew member", () ->
            dataStore.insertIgnoringConflicts(CrewMembership.TABLE, membership, MEMBERSHIP_KEY));
    }

    @Override
    public void updateRole(String crewId, String userId, CrewRole role) {
        run("Patch", CrewMembership.TABLE, "Failed to update member role", () ->
            dataStore.patch(StoreQuery.from(CrewMembership.TABLE)
                    .eq("group_id", crewId)
                    .eq("user_id", userId), Map.of("role", role)));
    }

    @Override
    public void removeMember(String crewId, String userId) {
        run("Delete", CrewMembership.TABLE, "Failed to remove crew member", () ->
            dataStore.delete(StoreQuery.from(CrewMembership.TABLE)
                    .eq("group_id", crewId)
                    .eq("user_id", userId)));
    }
}

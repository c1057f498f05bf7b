package com.flowb.social.repository.impl;

import com.flowb.social.model.CrewInvite;
import com.flowb.social.repository.CrewInviteRepository;
import com.flowb.social.store.DataStore;
import com.flowb.social.store.StoreQuery;
import com.flowb.social.util.QueryPerformanceTracker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;

@Repository
public class CrewInviteRepositoryImpl extends AbstractStoreRepository implements CrewInviteRepository {

    @Autowired
    public CrewInviteRepositoryImpl(DataStore dataStore, QueryPerformanceTracker queryTracker) {
        super(dataStore, queryTracker);
    }

    @Override
    public Optional<CrewInvite> findByCode(String inviteCode) {
        return execute("Query", CrewInvite.TABLE, "Failed to look up crew invite", () ->
            dataStore.query(StoreQuery.from(CrewInvite.TABLE)
                    .eq("invite_code", inviteCode)
                    .limit(1), CrewInvite.class)
                .stream().findFirst());
    }

    @Override
    public Optional<CrewInvite> findByCrewAndInviter(String crewId, String inviterId) {
        return execute("Query", CrewInvite.TABLE, "Failed to look up crew invite", () ->
            dataStore.query(StoreQuery.from(CrewInvite.TABLE)
                    .eq("group_id", crewId)
                    .eq("inviter_id", inviterId)
                    .limit(1), CrewInvite.class)
                .stream().findFirst());
    }

    @Override
    public boolean codeExists(String inviteCode) {
        return findByCode(inviteCode).isPresent();
    }

    @Override
    public CrewInvite save(CrewInvite invite) {
        return execute("Insert", CrewInvite.TABLE, "Failed to create crew invite", () ->
            dataStore.insert(CrewInvite.TABLE, invite, CrewInvite.class));
    }

    @Override
    public void updateUses(String inviteId, int uses) {
        run("Patch", CrewInvite.TABLE, "Failed to update crew invite", () ->
            dataStore.patch(StoreQuery.from(CrewInvite.TABLE).eq("id", inviteId), Map.of("uses", uses)));
    }
}

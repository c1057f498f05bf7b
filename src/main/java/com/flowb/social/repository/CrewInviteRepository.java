package com.flowb.social.repository;

import com.flowb.social.model.CrewInvite;

import java.util.Optional;

public interface CrewInviteRepository {

    Optional<CrewInvite> findByCode(String inviteCode);

    Optional<CrewInvite> findByCrewAndInviter(String crewId, String inviterId);

    boolean codeExists(String inviteCode);

    CrewInvite save(CrewInvite invite);

    void updateUses(String inviteId, int uses);
}

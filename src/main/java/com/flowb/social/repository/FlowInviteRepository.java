package com.flowb.social.repository;

import com.flowb.social.model.FlowInvite;

import java.util.Optional;

public interface FlowInviteRepository {

    Optional<FlowInvite> findByUserId(String userId);

    Optional<FlowInvite> findByCode(String code);

    FlowInvite save(FlowInvite invite);
}

package com.flowb.social.client;

import com.flowb.social.dto.LinkedHandles;

import java.util.Optional;

/**
 * External account federation lookup used by identity resolution.
 */
public interface FederationClient {

    /**
     * Handles linked to {@code platformUserId}. Empty when the service knows no links or
     * the lookup fails; implementations should not throw.
     */
    Optional<LinkedHandles> lookupLinkedHandles(String platformUserId);
}

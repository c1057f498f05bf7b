package com.flowb.social.repository;

import com.flowb.social.model.Identity;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface IdentityRepository {

    Optional<Identity> findByPlatformUserId(String platformUserId);

    List<Identity> findByCanonicalId(String canonicalId);

    List<Identity> findByPlatformUserIds(Collection<String> platformUserIds);

    /**
     * Write a row unless one exists for the handle. Existing rows keep their canonical id.
     */
    void saveIfAbsent(Identity identity);
}

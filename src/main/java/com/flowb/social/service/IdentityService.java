package com.flowb.social.service;

import com.flowb.social.dto.IdentityHints;

import java.util.List;

/**
 * Maps platform-scoped user handles to one canonical identity per person.
 */
public interface IdentityService {

    /**
     * Resolve the canonical id for a platform handle, creating identity rows lazily.
     * Never fails because of a federation or identity-write problem; the worst case is
     * a standalone canonical id equal to the handle itself.
     */
    String resolveCanonicalId(String platformUserId, IdentityHints hints);

    default String resolveCanonicalId(String platformUserId) {
        return resolveCanonicalId(platformUserId, IdentityHints.none());
    }

    /**
     * All platform handles recorded for a canonical identity, the canonical id itself included.
     */
    List<String> getLinkedIds(String canonicalId);
}

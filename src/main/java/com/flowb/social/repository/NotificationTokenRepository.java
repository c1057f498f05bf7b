package com.flowb.social.repository;

import com.flowb.social.model.NotificationToken;

import java.util.Optional;

/**
 * Farcaster mini app notification tokens, one per fid.
 */
public interface NotificationTokenRepository {

    Optional<NotificationToken> findEnabledByFid(long fid);

    void disable(long fid);
}

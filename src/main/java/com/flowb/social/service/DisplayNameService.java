package com.flowb.social.service;

import com.flowb.social.config.CacheConfig;
import com.flowb.social.exception.RepositoryException;
import com.flowb.social.model.Identity;
import com.flowb.social.model.Platform;
import com.flowb.social.repository.IdentityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Batch display-name lookup over identity rows, cached in the {@code displayNames} cache.
 * Users without a recorded name get a handle-style fallback ({@code @12345}) which is not cached.
 */
@Service
public class DisplayNameService {

    private static final Logger logger = LoggerFactory.getLogger(DisplayNameService.class);

    private final IdentityRepository identityRepository;
    private final CacheManager cacheManager;

    @Autowired
    public DisplayNameService(IdentityRepository identityRepository, CacheManager cacheManager) {
        this.identityRepository = identityRepository;
        this.cacheManager = cacheManager;
    }

    public String displayName(String userId) {
        return displayNames(Set.of(userId)).get(userId);
    }

    /**
     * Display names keyed by user id, in the iteration order of {@code userIds}.
     * A failed lookup degrades to fallback names.
     */
    public Map<String, String> displayNames(Collection<String> userIds) {
        Cache cache = cacheManager.getCache(CacheConfig.DISPLAY_NAMES);
        Map<String, String> names = new LinkedHashMap<>();
        Set<String> misses = new LinkedHashSet<>();

        for (String userId : userIds) {
            String cached = cache != null ? cache.get(userId, String.class) : null;
            if (cached != null) {
                names.put(userId, cached);
            } else {
                names.put(userId, null);
                misses.add(userId);
            }
        }

        if (!misses.isEmpty()) {
            try {
                for (Identity identity : identityRepository.findByPlatformUserIds(misses)) {
                    String name = identity.getDisplayName();
                    if (name != null && !name.isBlank() && misses.contains(identity.getPlatformUserId())) {
                        names.put(identity.getPlatformUserId(), name);
                        if (cache != null) {
                            cache.put(identity.getPlatformUserId(), name);
                        }
                    }
                }
            } catch (RepositoryException e) {
                logger.warn("Display name lookup failed for {} users", misses.size(), e);
            }
        }

        names.replaceAll((userId, name) -> name != null ? name : fallbackName(userId));
        return names;
    }

    /**
     * {@code telegram_123} and {@code farcaster_456} become {@code @123} and {@code @456};
     * other ids are shown as-is.
     */
    public static String fallbackName(String userId) {
        Platform platform = Platform.fromUserId(userId);
        if ((platform == Platform.TELEGRAM || platform == Platform.FARCASTER)
                && userId.startsWith(platform.getPrefix())) {
            return "@" + platform.stripPrefix(userId);
        }
        return userId;
    }
}

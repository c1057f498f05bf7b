package com.flowb.social.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Spring Cache configuration using Caffeine as the cache provider.
 *
 * Only display names are cached. Identity rows and notification preferences are
 * re-read on every call so a changed preference takes effect on the next fan-out.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String DISPLAY_NAMES = "displayNames";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(DISPLAY_NAMES);
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.MINUTES)
                .maximumSize(10000)
                .recordStats());
        return cacheManager;
    }
}

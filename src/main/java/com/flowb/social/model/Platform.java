package com.flowb.social.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Messaging platform a user id belongs to, detected from the id's prefix
 * (for example {@code telegram_12345}).
 */
public enum Platform {
    @JsonProperty("telegram") TELEGRAM("telegram_"),
    @JsonProperty("farcaster") FARCASTER("farcaster_"),
    @JsonProperty("web") WEB("web_"),
    @JsonProperty("discord") DISCORD("discord_"),
    @JsonProperty("twitter") TWITTER("twitter_"),
    @JsonProperty("github") GITHUB("github_"),
    @JsonProperty("apple") APPLE("apple_"),
    @JsonProperty("email") EMAIL("email_"),
    @JsonProperty("phone") PHONE("phone_");

    private final String prefix;

    Platform(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Platform of a prefixed user id. Ids without a known prefix are web users.
     */
    public static Platform fromUserId(String userId) {
        if (userId != null) {
            for (Platform platform : values()) {
                if (userId.startsWith(platform.prefix)) {
                    return platform;
                }
            }
        }
        return WEB;
    }

    /**
     * The platform-native id, e.g. {@code 12345} for {@code telegram_12345}.
     */
    public String stripPrefix(String userId) {
        return userId.startsWith(prefix) ? userId.substring(prefix.length()) : userId;
    }

    public String toUserId(String nativeId) {
        return prefix + nativeId;
    }
}

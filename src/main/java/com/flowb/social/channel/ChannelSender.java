package com.flowb.social.channel;

/**
 * Delivers a text message to users of one platform.
 */
public interface ChannelSender {

    /**
     * The user-id prefix this sender handles, e.g. {@code telegram_}.
     */
    String prefix();

    /**
     * @return true when the platform accepted the message. Never throws.
     */
    boolean send(String userId, String text);

    default boolean handles(String userId) {
        return userId != null && userId.startsWith(prefix());
    }
}

package com.flowb.social.service;

/**
 * Why a candidate recipient was not messaged. The value is the {@code reason} metric tag.
 */
public enum SkipReason {
    SELF("self"),
    /** The recipient muted or blocked the actor. */
    MUTED("muted"),
    PREFERENCE("preference"),
    RATE_LIMIT("rate_limit"),
    QUIET_HOURS("quiet_hours"),
    DUPLICATE("duplicate"),
    /** Already messaged earlier in the same fan-out. */
    BATCH_DUPLICATE("batch_duplicate");

    private final String value;

    SkipReason(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}

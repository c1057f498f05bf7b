package com.flowb.social.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Kinds of social notification, stored in the dedup ledger's {@code notification_type} column.
 */
public enum NotificationType {
    @JsonProperty("checkin") CHECKIN("checkin"),
    @JsonProperty("friend_rsvp") FRIEND_RSVP("friend_rsvp"),
    @JsonProperty("crew_rsvp") CREW_RSVP("crew_rsvp"),
    @JsonProperty("crew_join") CREW_JOIN("crew_join"),
    @JsonProperty("crew_locate") CREW_LOCATE("crew_locate"),
    @JsonProperty("event_reminder") EVENT_REMINDER("event_reminder");

    /**
     * Either RSVP type counts as "already told" for an RSVP, so one person hears about it once.
     */
    public static final Set<NotificationType> RSVP_TYPES =
        Collections.unmodifiableSet(EnumSet.of(FRIEND_RSVP, CREW_RSVP));

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}

package com.flowb.social.service;

import com.flowb.social.model.AttendanceStatus;

import java.util.Collection;

/**
 * Social notification triggers. Each returns how many messages were sent.
 */
public interface NotificationService {

    int notifyCheckin(String actorId, String crewId, String venueName);

    int notifyCrewJoin(String actorId, String crewId);

    int notifyFriendRsvp(String actorId, String eventId, String eventName, AttendanceStatus status);

    /**
     * Tell co-members across all of the actor's crews. Someone in two shared crews hears once.
     */
    int notifyCrewMemberRsvp(String actorId, String eventId, String eventName, AttendanceStatus status);

    /**
     * Friends first, then crew co-members, in one fan-out: a friend who is also a crew-mate
     * gets the friend message only. A maybe RSVP goes to the same people with softer wording.
     */
    int notifyRsvp(String actorId, String eventId, String eventName, AttendanceStatus status);

    /**
     * Ping crew members to share where they are. At most one ping per member per hour.
     */
    int notifyCrewLocate(String actorId, String crewId, Collection<String> recipientIds);
}

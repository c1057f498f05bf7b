package com.flowb.social.service;

import com.flowb.social.model.AttendanceStatus;
import org.springframework.stereotype.Component;

/**
 * Shared notification text for every channel.
 * Centralizes message wording so Telegram and Farcaster recipients read the same thing.
 */
@Component
public class NotificationTextGenerator {

    public static final String PUSH_TITLE = "FlowB";

    /**
     * Generate body text for a crew check-in.
     * @param crewEmoji Emoji of the crew (can be null)
     * @param actorName Display name of the member who checked in
     * @param venueName Where they checked in
     * @return Notification body text
     */
    public String getCheckinBody(String crewEmoji, String actorName, String venueName) {
        return withEmoji(crewEmoji, String.format("%s checked in at %s", actorName, venueName));
    }

    public String getCrewJoinBody(String crewEmoji, String actorName, String crewName) {
        return withEmoji(crewEmoji, String.format("%s just joined %s!", actorName, crewName));
    }

    public String getFriendRsvpBody(String actorName, String eventName, AttendanceStatus status) {
        return String.format("%s %s %s!", actorName, rsvpVerb(status), eventName);
    }

    public String getCrewRsvpBody(String crewEmoji, String actorName, String eventName, AttendanceStatus status) {
        return withEmoji(crewEmoji, getFriendRsvpBody(actorName, eventName, status));
    }

    public String getCrewLocateBody(String crewEmoji, String actorName, String crewName) {
        return withEmoji(crewEmoji, String.format("%s is looking for you in %s. Where are you?", actorName, crewName));
    }

    /**
     * Generate body text for an event reminder.
     * @param eventName Event title
     * @param startTime Start time already formatted for the recipient's timezone
     * @param venueName Venue (can be null)
     * @return Notification body text
     */
    public String getEventReminderBody(String eventName, String startTime, String venueName) {
        if (venueName != null && !venueName.trim().isEmpty()) {
            return String.format("%s starts at %s at %s", eventName, startTime, venueName);
        }
        return String.format("%s starts at %s", eventName, startTime);
    }

    private static String rsvpVerb(AttendanceStatus status) {
        return status == AttendanceStatus.MAYBE ? "might go to" : "is going to";
    }

    private static String withEmoji(String emoji, String text) {
        if (emoji == null || emoji.isBlank()) {
            return text;
        }
        return emoji + " " + text;
    }
}

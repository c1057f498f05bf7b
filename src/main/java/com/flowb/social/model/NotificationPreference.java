package com.flowb.social.model;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-user notification settings, stored as columns of the user's session row.
 *
 * Every field carries its default, and null columns keep it, so a user without a
 * session row or with a partially filled one still gets a complete preference set.
 */
public class NotificationPreference {

    public static final String TABLE = "flowb_sessions";

    public static final int DEFAULT_DAILY_LIMIT = 10;
    public static final int MIN_DAILY_LIMIT = 1;
    public static final int MAX_DAILY_LIMIT = 50;
    public static final int DEFAULT_QUIET_START = 22;
    public static final int DEFAULT_QUIET_END = 8;
    public static final int DEFAULT_REMINDER_MINUTES = 30;

    private String userId;

    @JsonSetter(nulls = Nulls.SKIP)
    private boolean notifyCrewCheckins = true;

    @JsonSetter(nulls = Nulls.SKIP)
    private boolean notifyFriendRsvps = true;

    @JsonSetter(nulls = Nulls.SKIP)
    private boolean notifyCrewRsvps = true;

    @JsonSetter(nulls = Nulls.SKIP)
    private boolean notifyEventReminders = true;

    @JsonSetter(nulls = Nulls.SKIP)
    private boolean notifyDailyDigest = true;

    @JsonSetter(nulls = Nulls.SKIP)
    private int dailyNotificationLimit = DEFAULT_DAILY_LIMIT;

    @JsonSetter(nulls = Nulls.SKIP)
    private boolean quietHoursEnabled = false;

    @JsonSetter(nulls = Nulls.SKIP)
    private int quietHoursStart = DEFAULT_QUIET_START;

    @JsonSetter(nulls = Nulls.SKIP)
    private int quietHoursEnd = DEFAULT_QUIET_END;

    private String timezone;

    @JsonSetter(nulls = Nulls.SKIP)
    private List<Integer> reminderDefaults = new ArrayList<>(List.of(DEFAULT_REMINDER_MINUTES));

    public NotificationPreference() {
    }

    public static NotificationPreference defaultsFor(String userId) {
        NotificationPreference preference = new NotificationPreference();
        preference.setUserId(userId);
        return preference;
    }

    /**
     * Whether this user wants notifications of the given type. Locate pings are direct
     * requests from a crew-mate and cannot be turned off.
     */
    public boolean allows(NotificationType type) {
        switch (type) {
            case CHECKIN:
            case CREW_JOIN:
                return notifyCrewCheckins;
            case FRIEND_RSVP:
                return notifyFriendRsvps;
            case CREW_RSVP:
                return notifyCrewRsvps;
            case EVENT_REMINDER:
                return notifyEventReminders;
            case CREW_LOCATE:
            default:
                return true;
        }
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public boolean isNotifyCrewCheckins() {
        return notifyCrewCheckins;
    }

    public void setNotifyCrewCheckins(boolean notifyCrewCheckins) {
        this.notifyCrewCheckins = notifyCrewCheckins;
    }

    public boolean isNotifyFriendRsvps() {
        return notifyFriendRsvps;
    }

    public void setNotifyFriendRsvps(boolean notifyFriendRsvps) {
        this.notifyFriendRsvps = notifyFriendRsvps;
    }

    public boolean isNotifyCrewRsvps() {
        return notifyCrewRsvps;
    }

    public void setNotifyCrewRsvps(boolean notifyCrewRsvps) {
        this.notifyCrewRsvps = notifyCrewRsvps;
    }

    public boolean isNotifyEventReminders() {
        return notifyEventReminders;
    }

    public void setNotifyEventReminders(boolean notifyEventReminders) {
        this.notifyEventReminders = notifyEventReminders;
    }

    public boolean isNotifyDailyDigest() {
        return notifyDailyDigest;
    }

    public void setNotifyDailyDigest(boolean notifyDailyDigest) {
        this.notifyDailyDigest = notifyDailyDigest;
    }

    public int getDailyNotificationLimit() {
        return dailyNotificationLimit;
    }

    public void setDailyNotificationLimit(int dailyNotificationLimit) {
        this.dailyNotificationLimit = dailyNotificationLimit;
    }

    public boolean isQuietHoursEnabled() {
        return quietHoursEnabled;
    }

    public void setQuietHoursEnabled(boolean quietHoursEnabled) {
        this.quietHoursEnabled = quietHoursEnabled;
    }

    public int getQuietHoursStart() {
        return quietHoursStart;
    }

    public void setQuietHoursStart(int quietHoursStart) {
        this.quietHoursStart = quietHoursStart;
    }

    public int getQuietHoursEnd() {
        return quietHoursEnd;
    }

    public void setQuietHoursEnd(int quietHoursEnd) {
        this.quietHoursEnd = quietHoursEnd;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public List<Integer> getReminderDefaults() {
        return reminderDefaults;
    }

    public void setReminderDefaults(List<Integer> reminderDefaults) {
        this.reminderDefaults = reminderDefaults;
    }
}

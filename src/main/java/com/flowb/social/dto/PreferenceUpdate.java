package com.flowb.social.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial preference change; only non-null fields are applied.
 */
@Data
@NoArgsConstructor
public class PreferenceUpdate {
    private Boolean notifyCrewCheckins;
    private Boolean notifyFriendRsvps;
    private Boolean notifyCrewRsvps;
    private Boolean notifyEventReminders;
    private Boolean notifyDailyDigest;
    private Integer dailyNotificationLimit;
    private Boolean quietHoursEnabled;
    private Integer quietHoursStart;
    private Integer quietHoursEnd;
    private String timezone;
    private List<Integer> reminderDefaults;
}

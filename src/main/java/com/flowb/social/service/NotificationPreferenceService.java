package com.flowb.social.service;

import com.flowb.social.dto.PreferenceUpdate;
import com.flowb.social.model.NotificationPreference;

public interface NotificationPreferenceService {

    /**
     * The user's preferences, or the defaults when none are stored. Timezone is always set.
     */
    NotificationPreference getPreferences(String userId);

    NotificationPreference updatePreferences(String userId, PreferenceUpdate update);
}

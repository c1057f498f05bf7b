package com.flowb.social.repository;

import com.flowb.social.model.NotificationPreference;

import java.util.Optional;

public interface NotificationPreferenceRepository {

    Optional<NotificationPreference> findByUserId(String userId);

    NotificationPreference save(NotificationPreference preference);
}

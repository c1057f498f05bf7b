package com.flowb.social.service.impl;

import com.flowb.social.config.NotificationProperties;
import com.flowb.social.dto.PreferenceUpdate;
import com.flowb.social.exception.ValidationException;
import com.flowb.social.model.NotificationPreference;
import com.flowb.social.repository.NotificationPreferenceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationPreferenceServiceImplTest {

    private static final String USER = "telegram_1";

    @Mock
    private NotificationPreferenceRepository preferenceRepository;

    private NotificationPreferenceServiceImpl preferenceService;

    @BeforeEach
    void setUp() {
        preferenceService = new NotificationPreferenceServiceImpl(preferenceRepository, new NotificationProperties());
    }

    @Test
    void getPreferences_NoRow_ReturnsDefaultsWithDefaultTimezone() {
        // Given
        when(preferenceRepository.findByUserId(USER)).thenReturn(Optional.empty());

        // When
        NotificationPreference preference = preferenceService.getPreferences(USER);

        // Then
        assertThat(preference.getUserId()).isEqualTo(USER);
        assertThat(preference.isNotifyCrewCheckins()).isTrue();
        assertThat(preference.getDailyNotificationLimit()).isEqualTo(10);
        assertThat(preference.isQuietHoursEnabled()).isFalse();
        assertThat(preference.getQuietHoursStart()).isEqualTo(22);
        assertThat(preference.getQuietHoursEnd()).isEqualTo(8);
        assertThat(preference.getReminderDefaults()).containsExactly(30);
        assertThat(preference.getTimezone()).isEqualTo("America/Denver");
    }

    @Test
    void updatePreferences_OutOfRangeValues_AreClamped() {
        // Given
        when(preferenceRepository.findByUserId(USER)).thenReturn(Optional.empty());
        when(preferenceRepository.save(any(NotificationPreference.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        PreferenceUpdate update = new PreferenceUpdate();
        update.setDailyNotificationLimit(500);
        update.setQuietHoursStart(-3);
        update.setQuietHoursEnd(99);

        // When
        NotificationPreference saved = preferenceService.updatePreferences(USER, update);

        // Then
        assertThat(saved.getDailyNotificationLimit()).isEqualTo(50);
        assertThat(saved.getQuietHoursStart()).isZero();
        assertThat(saved.getQuietHoursEnd()).isEqualTo(23);
    }

    @Test
    void updatePreferences_ZeroLimit_ClampedToOne() {
        // Given
        when(preferenceRepository.findByUserId(USER)).thenReturn(Optional.empty());
        when(preferenceRepository.save(any(NotificationPreference.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        PreferenceUpdate update = new PreferenceUpdate();
        update.setDailyNotificationLimit(0);

        // When / Then
        assertThat(preferenceService.updatePreferences(USER, update).getDailyNotificationLimit()).isEqualTo(1);
    }

    @Test
    void updatePreferences_OnlyGivenFieldsChange() {
        // Given
        NotificationPreference stored = NotificationPreference.defaultsFor(USER);
        stored.setNotifyCrewRsvps(false);
        stored.setTimezone("Europe/Berlin");
        when(preferenceRepository.findByUserId(USER)).thenReturn(Optional.of(stored));
        when(preferenceRepository.save(any(NotificationPreference.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        PreferenceUpdate update = new PreferenceUpdate();
        update.setQuietHoursEnabled(true);

        // When
        NotificationPreference saved = preferenceService.updatePreferences(USER, update);

        // Then
        assertThat(saved.isQuietHoursEnabled()).isTrue();
        assertThat(saved.isNotifyCrewRsvps()).isFalse();
        assertThat(saved.getTimezone()).isEqualTo("Europe/Berlin");
    }

    @Test
    void updatePreferences_ReminderDefaults_DropsInvalidAndDuplicateLeadTimes() {
        // Given
        when(preferenceRepository.findByUserId(USER)).thenReturn(Optional.empty());
        when(preferenceRepository.save(any(NotificationPreference.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        PreferenceUpdate update = new PreferenceUpdate();
        update.setReminderDefaults(Arrays.asList(60, 0, 60, null, 20000, 1440));

        // When
        NotificationPreference saved = preferenceService.updatePreferences(USER, update);

        // Then
        assertThat(saved.getReminderDefaults()).containsExactly(60, 1440);
    }

    @Test
    void updatePreferences_UnknownTimezone_ThrowsValidation() {
        // Given
        when(preferenceRepository.findByUserId(USER)).thenReturn(Optional.empty());
        PreferenceUpdate update = new PreferenceUpdate();
        update.setTimezone("Mars/Olympus_Mons");

        // When / Then
        assertThatThrownBy(() -> preferenceService.updatePreferences(USER, update))
                .isInstanceOf(ValidationException.class);
        verify(preferenceRepository, never()).save(any());
    }
}

package com.flowb.social.scenario;

import com.flowb.social.dto.PreferenceUpdate;
import com.flowb.social.dto.ReminderSweepResult;
import com.flowb.social.dto.RsvpRequest;
import com.flowb.social.model.AttendanceStatus;
import com.flowb.social.model.EventReminder;
import com.flowb.social.testutil.SocialFixture;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReminderScenarioTest {

    private static final String ALICE = "telegram_1";
    private static final Instant NOW = SocialFixture.NOW;

    private final SocialFixture fixture = new SocialFixture();

    private void goingTo(String eventId, Instant startsAt) {
        goingTo(ALICE, eventId, startsAt);
    }

    private void goingTo(String userId, String eventId, Instant startsAt) {
        fixture.attendanceService.rsvp(userId,
                new RsvpRequest(eventId, AttendanceStatus.GOING, "Opening Party", startsAt, "Main Stage"));
    }

    @Test
    void rsvp_RegistersDefaultReminderAndSweepSendsItOnce() {
        // Given: starts in 30 minutes, default lead time is 30
        goingTo("evt-42", NOW.plus(Duration.ofMinutes(30)));
        assertThat(fixture.reminderService.getReminders(ALICE, "evt-42"))
                .extracting(EventReminder::getRemindMinutesBefore).containsExactly(30);

        // When
        ReminderSweepResult first = fixture.reminderService.sendEventReminders(NOW);
        ReminderSweepResult second = fixture.reminderService.sendEventReminders(NOW.plusSeconds(300));

        // Then
        assertThat(first.getSent()).isEqualTo(1);
        assertThat(second.getScanned()).isZero();
        assertThat(fixture.deliveredTo(ALICE)).containsExactly("Opening Party starts at 11:30 AM at Main Stage");
    }

    @Test
    void sweep_ReminderAheadOfWindow_WaitsUntilDue() {
        // Given
        goingTo("evt-42", NOW.plus(Duration.ofHours(3)));

        // When
        ReminderSweepResult early = fixture.reminderService.sendEventReminders(NOW);
        ReminderSweepResult due = fixture.reminderService.sendEventReminders(NOW.plus(Duration.ofMinutes(150)));

        // Then
        assertThat(early.getScanned()).isZero();
        assertThat(due.getSent()).isEqualTo(1);
    }

    @Test
    void sweep_MoreFutureRowsThanBatch_DueReminderStillSent() {
        // Given: three reminders a week out registered before one due now
        fixture.notificationProperties.getReminders().setBatchSize(3);
        goingTo("telegram_11", "evt-later", NOW.plus(Duration.ofDays(7)));
        goingTo("telegram_12", "evt-later", NOW.plus(Duration.ofDays(7)));
        goingTo("telegram_13", "evt-later", NOW.plus(Duration.ofDays(7)));
        goingTo("telegram_9", "evt-now", NOW.plus(Duration.ofMinutes(30)));

        // When
        ReminderSweepResult result = fixture.reminderService.sendEventReminders(NOW);

        // Then
        assertThat(result.getSent()).isEqualTo(1);
        assertThat(fixture.deliveredTo("telegram_9")).containsExactly("Opening Party starts at 11:30 AM at Main Stage");
        assertThat(fixture.reminderService.getReminders("telegram_11", "evt-later"))
                .extracting(EventReminder::isSent).containsExactly(false);
    }

    @Test
    void rsvp_EventMovedEarlier_CustomReminderFollows() {
        // Given
        goingTo("evt-42", NOW.plus(Duration.ofDays(2)));
        fixture.reminderService.setReminders(ALICE, "evt-42", List.of(1440, 120));

        // When: the event now starts in two hours
        goingTo("evt-42", NOW.plus(Duration.ofHours(2)));
        ReminderSweepResult result = fixture.reminderService.sendEventReminders(NOW);

        // Then
        assertThat(result.getSent()).isEqualTo(1);
        assertThat(result.getConsumed()).isEqualTo(1);
        assertThat(fixture.deliveredTo(ALICE)).containsExactly("Opening Party starts at 1:00 PM at Main Stage");
        assertThat(fixture.reminderService.getReminders(ALICE, "evt-42"))
                .filteredOn(r -> r.getRemindMinutesBefore() == 30)
                .extracting(EventReminder::getFireAt).containsExactly(NOW.plus(Duration.ofMinutes(90)));
    }

    @Test
    void cancelRsvp_RemovesUnsentReminders() {
        // Given
        goingTo("evt-42", NOW.plus(Duration.ofHours(3)));

        // When
        fixture.attendanceService.cancelRsvp(ALICE, "evt-42");

        // Then
        assertThat(fixture.reminderService.getReminders(ALICE, "evt-42")).isEmpty();
        assertThat(fixture.reminderService.sendEventReminders(NOW).getScanned()).isZero();
    }

    @Test
    void reminderDefaults_FromPreferencesAndRemindersDisabled_ConsumedSilently() {
        // Given
        PreferenceUpdate update = new PreferenceUpdate();
        update.setReminderDefaults(List.of(60, 15));
        update.setNotifyEventReminders(false);
        fixture.preferenceService.updatePreferences(ALICE, update);
        goingTo("evt-42", NOW.plus(Duration.ofMinutes(60)));

        // When
        ReminderSweepResult result = fixture.reminderService.sendEventReminders(NOW);

        // Then
        assertThat(fixture.reminderService.getReminders(ALICE, "evt-42"))
                .extracting(EventReminder::getRemindMinutesBefore).containsExactlyInAnyOrder(60, 15);
        assertThat(result.getConsumed()).isEqualTo(1);
        assertThat(fixture.reminderService.getReminders(ALICE, "evt-42"))
                .filteredOn(r -> r.getRemindMinutesBefore() == 15)
                .extracting(EventReminder::isSent).containsExactly(false);
        assertThat(fixture.delivered()).isEmpty();
    }

    @Test
    void setReminders_ReplacesPreviousLeadTimes() {
        // Given
        goingTo("evt-42", NOW.plus(Duration.ofDays(2)));

        // When
        fixture.reminderService.setReminders(ALICE, "evt-42", List.of(1440, 120));

        // Then
        assertThat(fixture.reminderService.getReminders(ALICE, "evt-42"))
                .extracting(EventReminder::getRemindMinutesBefore).containsExactlyInAnyOrder(1440, 120);
    }
}

package com.flowb.social.scenario;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowb.social.dto.NotifyTargets;
import com.flowb.social.dto.PreferenceUpdate;
import com.flowb.social.dto.RsvpRequest;
import com.flowb.social.model.AttendanceStatus;
import com.flowb.social.model.Crew;
import com.flowb.social.model.CrewMembership;
import com.flowb.social.model.EventReminder;
import com.flowb.social.model.NotificationLogEntry;
import com.flowb.social.model.NotificationType;
import com.flowb.social.testutil.SocialFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * The RSVP, check-in and locate fan-outs end to end: one flow of Alice, friend Bob and the
 * Wolves crew with Bob, Cara and Dan, where Dan has muted the crew.
 */
class NotificationScenarioTest {

    private static final String ALICE = "telegram_1";
    private static final String BOB = "telegram_2";
    private static final String CARA = "telegram_3";
    private static final String DAN = "farcaster_4";

    private SocialFixture fixture;
    private Crew wolves;

    @BeforeEach
    void setUp() {
        fixture = new SocialFixture();
        fixture.connect(ALICE, BOB);
        wolves = fixture.crewService.createCrew(ALICE, "🐺 Wolves").getCrew();
        fixture.crewService.joinCrew(BOB, wolves.getJoinCode());
        fixture.crewService.joinCrew(CARA, wolves.getJoinCode());
        fixture.crewService.joinCrew(DAN, wolves.getJoinCode());
        for (ObjectNode row : fixture.store.rows(CrewMembership.TABLE)) {
            if (DAN.equals(row.path("user_id").asText())) {
                row.put("muted", true);
            }
        }
        fixture.clearDelivered();
    }

    private RsvpRequest openingParty() {
        return new RsvpRequest("evt-42", AttendanceStatus.GOING, "Opening Party", null, null);
    }

    @Test
    void rsvp_FriendHearsOnceAndCrewMatesGetCrewText() {
        // When
        fixture.attendanceService.rsvp(ALICE, openingParty());

        // Then
        assertThat(fixture.deliveredTo(BOB)).containsExactly("@1 is going to Opening Party!");
        assertThat(fixture.deliveredTo(CARA)).containsExactly("🐺 @1 is going to Opening Party!");
        assertThat(fixture.deliveredTo(DAN)).isEmpty();
        assertThat(fixture.deliveredTo(ALICE)).isEmpty();
    }

    @Test
    void rsvp_Repeated_NoSecondMessages() {
        // Given
        fixture.attendanceService.rsvp(ALICE, openingParty());
        int ledgerSize = fixture.store.rows(NotificationLogEntry.TABLE).size();
        fixture.clearDelivered();

        // When
        fixture.attendanceService.rsvp(ALICE, openingParty());

        // Then
        assertThat(fixture.delivered()).isEmpty();
        assertThat(fixture.store.rows(NotificationLogEntry.TABLE)).hasSize(ledgerSize);
        NotifyTargets remaining = fixture.targetingService.computeTargets(ALICE, "evt-42");
        assertThat(remaining.getFriends()).isEmpty();
        assertThat(remaining.getCrews()).isEmpty();
    }

    @Test
    void computeTargets_FriendWhoIsCrewMate_OnlyInFriendList() {
        // When
        NotifyTargets targets = fixture.targetingService.computeTargets(ALICE, "evt-42");

        // Then
        assertThat(targets.getFriends()).containsExactly(BOB);
        assertThat(targets.getCrews()).hasSize(1);
        assertThat(targets.getCrews().get(0).getUserIds()).containsExactly(CARA);
    }

    @Test
    void rsvp_MutedFriendIsSkipped() {
        // Given
        fixture.connectionService.toggleMute(BOB, ALICE);

        // When
        fixture.attendanceService.rsvp(ALICE, openingParty());

        // Then
        assertThat(fixture.deliveredTo(BOB)).isEmpty();
        assertThat(fixture.deliveredTo(CARA)).hasSize(1);
    }

    @Test
    void rsvp_Maybe_FlowHearsTentativeWording() {
        // When
        fixture.attendanceService.rsvp(ALICE,
                new RsvpRequest("evt-42", AttendanceStatus.MAYBE, "Opening Party", null, null));

        // Then
        assertThat(fixture.deliveredTo(BOB)).containsExactly("@1 might go to Opening Party!");
        assertThat(fixture.deliveredTo(CARA)).containsExactly("🐺 @1 might go to Opening Party!");
        assertThat(fixture.deliveredTo(DAN)).isEmpty();
        assertThat(fixture.reminderRepository.findByUserAndEvent(ALICE, "evt-42"))
                .extracting(EventReminder::getRemindMinutesBefore).containsExactly(30);
    }

    @Test
    void dailyCap_StopsFurtherMessages() {
        // Given: Cara already heard about Dan joining today
        PreferenceUpdate update = new PreferenceUpdate();
        update.setDailyNotificationLimit(3);
        fixture.preferenceService.updatePreferences(CARA, update);

        // When
        fixture.checkinService.checkIn(ALICE, wolves.getId(), "Main Stage", null);
        fixture.checkinService.checkIn(ALICE, wolves.getId(), "Side Stage", null);
        fixture.checkinService.checkIn(ALICE, wolves.getId(), "Food Court", null);

        // Then
        assertThat(fixture.deliveredTo(CARA)).containsExactly(
                "🐺 @1 checked in at Main Stage", "🐺 @1 checked in at Side Stage");
        assertThat(fixture.deliveredTo(BOB)).hasSize(3);
        assertThat(fixture.meterRegistry.counter("notification_dispatch_total",
                "type", "checkin", "status", "skipped", "reason", "rate_limit").count()).isEqualTo(1.0);
    }

    @Test
    void checkin_ByMutedFriend_SkipsMuterButReachesOtherMembers() {
        // Given
        fixture.connectionService.toggleMute(ALICE, BOB);

        // When
        fixture.checkinService.checkIn(BOB, wolves.getId(), "Main Stage", null);

        // Then
        assertThat(fixture.deliveredTo(ALICE)).isEmpty();
        assertThat(fixture.deliveredTo(CARA)).containsExactly("🐺 @2 checked in at Main Stage");
        assertThat(fixture.store.all(NotificationLogEntry.TABLE, NotificationLogEntry.class))
                .filteredOn(entry -> entry.getNotificationType() == NotificationType.CHECKIN)
                .extracting(NotificationLogEntry::getRecipientId)
                .containsExactly(CARA);
    }

    @Test
    void checkin_SameVenueTwice_SecondIsDuplicate() {
        // When
        fixture.checkinService.checkIn(ALICE, wolves.getId(), "Main Stage", null);
        fixture.checkinService.checkIn(ALICE, wolves.getId(), "Main Stage", null);

        // Then
        assertThat(fixture.deliveredTo(BOB)).hasSize(1);
        assertThat(fixture.deliveredTo(CARA)).hasSize(1);
    }

    @Test
    void locateCrew_PingsOnlyMembersNotCheckedInAndOncePerHour() {
        // Given
        fixture.checkinService.checkIn(BOB, wolves.getId(), "Main Stage", null);
        fixture.clearDelivered();

        // When
        int first = fixture.checkinService.locateCrew(ALICE, wolves.getId());
        int second = fixture.checkinService.locateCrew(ALICE, wolves.getId());

        // Then
        assertThat(first).isEqualTo(2);
        assertThat(second).isEqualTo(2);
        assertThat(fixture.deliveredTo(CARA))
                .containsExactly("🐺 @1 is looking for you in Wolves. Where are you?");
        assertThat(fixture.deliveredTo(DAN)).hasSize(1);
        assertThat(fixture.deliveredTo(BOB)).isEmpty();
    }

    @Test
    void channelDown_NoLedgerEntrySoLaterAttemptDelivers() {
        // Given
        fixture.telegram.setAvailable(false);
        fixture.checkinService.checkIn(ALICE, wolves.getId(), "Main Stage", null);
        assertThat(fixture.deliveredTo(CARA)).isEmpty();

        // When
        fixture.telegram.setAvailable(true);
        fixture.checkinService.checkIn(ALICE, wolves.getId(), "Main Stage", null);

        // Then
        assertThat(fixture.deliveredTo(CARA)).containsExactly("🐺 @1 checked in at Main Stage");
    }
}

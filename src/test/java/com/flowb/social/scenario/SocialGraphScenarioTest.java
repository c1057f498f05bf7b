package com.flowb.social.scenario;

import com.flowb.social.dto.AcceptInviteResult;
import com.flowb.social.dto.CrewSettingsUpdate;
import com.flowb.social.dto.EventAttendees;
import com.flowb.social.dto.FlowMember;
import com.flowb.social.dto.JoinCrewResult;
import com.flowb.social.dto.RsvpRequest;
import com.flowb.social.exception.IllegalOperationException;
import com.flowb.social.exception.UnauthorizedException;
import com.flowb.social.model.AttendanceStatus;
import com.flowb.social.model.Connection;
import com.flowb.social.model.ConnectionStatus;
import com.flowb.social.model.Crew;
import com.flowb.social.model.CrewMembership;
import com.flowb.social.model.CrewRole;
import com.flowb.social.model.JoinMode;
import com.flowb.social.model.JoinRequest;
import com.flowb.social.model.JoinRequestStatus;
import com.flowb.social.testutil.SocialFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Connections and crews over real repositories and an in-memory store.
 */
class SocialGraphScenarioTest {

    private static final String ALICE = "telegram_1";
    private static final String BOB = "telegram_2";
    private static final String CARA = "farcaster_3";

    private SocialFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new SocialFixture();
    }

    @Nested
    @DisplayName("Connections")
    class Connections {

        @Test
        void acceptInvite_CreatesBothDirectionsActive() {
            // When
            fixture.connect(ALICE, BOB);

            // Then
            assertThat(fixture.store.all(Connection.TABLE, Connection.class))
                    .extracting(Connection::getUserId, Connection::getFriendId, Connection::getStatus)
                    .containsExactlyInAnyOrder(
                            tuple(BOB, ALICE, ConnectionStatus.ACTIVE),
                            tuple(ALICE, BOB, ConnectionStatus.ACTIVE));
            assertThat(fixture.connectionService.listFlow(ALICE).getFriends())
                    .extracting("userId").containsExactly(BOB);
            assertThat(fixture.connectionService.listFlow(BOB).getFriends())
                    .extracting("userId").containsExactly(ALICE);
        }

        @Test
        void acceptInvite_Twice_ReportsAlreadyConnectedWithoutNewRows() {
            // Given
            fixture.connect(ALICE, BOB);
            String code = fixture.connectionService.getInviteLink(ALICE).getInviteCode();

            // When
            AcceptInviteResult again = fixture.connectionService.acceptInvite(BOB, code);

            // Then
            assertThat(again.getOutcome()).isEqualTo(AcceptInviteResult.Outcome.ALREADY_CONNECTED);
            assertThat(again.getFriendName()).isEqualTo("@1");
            assertThat(fixture.store.rows(Connection.TABLE)).hasSize(2);
        }

        @Test
        void toggleMute_OnlyChangesOwnDirection() {
            // Given
            fixture.connect(ALICE, BOB);

            // When
            ConnectionStatus status = fixture.connectionService.toggleMute(BOB, ALICE);

            // Then
            assertThat(status).isEqualTo(ConnectionStatus.MUTED);
            assertThat(fixture.connectionRepository.findBetween(BOB, ALICE).get().getStatus())
                    .isEqualTo(ConnectionStatus.MUTED);
            assertThat(fixture.connectionRepository.findBetween(ALICE, BOB).get().getStatus())
                    .isEqualTo(ConnectionStatus.ACTIVE);
            assertThat(fixture.connectionService.toggleMute(BOB, ALICE)).isEqualTo(ConnectionStatus.ACTIVE);
        }

        @Test
        void removeConnection_DeletesBothDirections() {
            // Given
            fixture.connect(ALICE, BOB);

            // When
            fixture.connectionService.removeConnection(BOB, ALICE);

            // Then
            assertThat(fixture.store.rows(Connection.TABLE)).isEmpty();
            assertThat(fixture.connectionService.listFlow(ALICE).getFriends()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Crews")
    class Crews {

        private Crew wolves;

        @BeforeEach
        void createCrew() {
            wolves = fixture.crewService.createCrew(ALICE, "🐺 Wolves").getCrew();
        }

        @Test
        void createCrew_CreatorIsOnlyMember() {
            assertThat(wolves.getName()).isEqualTo("Wolves");
            assertThat(wolves.getEmoji()).isEqualTo("🐺");
            assertThat(fixture.crewRepository.findMembers(wolves.getId()))
                    .extracting(CrewMembership::getUserId, CrewMembership::getRole)
                    .containsExactly(tuple(ALICE, CrewRole.CREATOR));
        }

        @Test
        void joinCrew_Twice_OneMembershipAndOneJoinNotification() {
            // When
            JoinCrewResult first = fixture.crewService.joinCrew(BOB, wolves.getJoinCode());
            JoinCrewResult second = fixture.crewService.joinCrew(BOB, wolves.getJoinCode());

            // Then
            assertThat(first.getOutcome()).isEqualTo(JoinCrewResult.Outcome.JOINED);
            assertThat(second.getOutcome()).isEqualTo(JoinCrewResult.Outcome.ALREADY_MEMBER);
            assertThat(fixture.crewRepository.countMembers(wolves.getId())).isEqualTo(2);
            assertThat(fixture.deliveredTo(ALICE)).containsExactly("🐺 @2 just joined Wolves!");
        }

        @Test
        void joinThenRsvp_CreatorSeesMemberGoing() {
            // Given
            fixture.crewService.joinCrew(BOB, wolves.getJoinCode());

            // When
            fixture.attendanceService.rsvp(BOB,
                    new RsvpRequest("evt-42", AttendanceStatus.GOING, "Opening Party", null, "Main Stage"));
            EventAttendees attendees = fixture.attendanceService.whoIsGoing(ALICE, "evt-42");

            // Then
            assertThat(attendees.getEventName()).isEqualTo("Opening Party");
            assertThat(attendees.getGoing()).extracting(FlowMember::getUserId).containsExactly(BOB);
            assertThat(attendees.getMaybe()).isEmpty();
            assertThat(fixture.deliveredTo(ALICE)).containsExactly(
                    "🐺 @2 just joined Wolves!", "🐺 @2 is going to Opening Party!");
        }

        @Test
        void roles_OnlyCreatorChangesRolesAndCreatorStaysCreator() {
            // Given
            fixture.crewService.joinCrew(BOB, wolves.getJoinCode());
            fixture.crewService.joinCrew(CARA, wolves.getJoinCode());

            // When
            fixture.crewService.promote(ALICE, wolves.getId(), BOB);

            // Then
            assertThat(fixture.crewService.getRole(BOB, wolves.getId())).contains(CrewRole.ADMIN);
            assertThatThrownBy(() -> fixture.crewService.promote(BOB, wolves.getId(), CARA))
                    .isInstanceOf(UnauthorizedException.class);
            assertThatThrownBy(() -> fixture.crewService.removeMember(BOB, wolves.getId(), ALICE))
                    .isInstanceOf(IllegalOperationException.class);
            assertThatThrownBy(() -> fixture.crewService.demote(ALICE, wolves.getId(), ALICE))
                    .isInstanceOf(IllegalOperationException.class);

            fixture.crewService.removeMember(BOB, wolves.getId(), CARA);
            fixture.crewService.demote(ALICE, wolves.getId(), BOB);

            assertThat(fixture.crewRepository.findMembers(wolves.getId()))
                    .extracting(CrewMembership::getUserId, CrewMembership::getRole)
                    .containsExactly(tuple(ALICE, CrewRole.CREATOR), tuple(BOB, CrewRole.MEMBER));
            assertThat(fixture.crewService.getCrewAdmins(wolves.getId())).containsExactly(ALICE);
        }

        @Test
        void approvalCrew_RequestThenApprove_AdmitsOnce() {
            // Given
            fixture.crewService.updateSettings(ALICE, wolves.getId(), new CrewSettingsUpdate(null, JoinMode.APPROVAL));

            // When
            JoinCrewResult requested = fixture.crewService.joinCrew(BOB, wolves.getJoinCode());
            JoinCrewResult repeated = fixture.crewService.joinCrew(BOB, wolves.getJoinCode());

            // Then
            assertThat(requested.getOutcome()).isEqualTo(JoinCrewResult.Outcome.REQUESTED);
            assertThat(repeated.getOutcome()).isEqualTo(JoinCrewResult.Outcome.ALREADY_REQUESTED);
            assertThat(repeated.getRequestId()).isEqualTo(requested.getRequestId());
            assertThat(fixture.crewService.getRole(BOB, wolves.getId())).isEmpty();

            // When
            JoinRequest approved = fixture.crewService.approveRequest(ALICE, requested.getRequestId());

            // Then
            assertThat(approved.getStatus()).isEqualTo(JoinRequestStatus.APPROVED);
            assertThat(fixture.crewService.getRole(BOB, wolves.getId())).contains(CrewRole.MEMBER);
            assertThat(fixture.crewService.getPendingRequests(ALICE, wolves.getId())).isEmpty();
            assertThatThrownBy(() -> fixture.crewService.approveRequest(ALICE, requested.getRequestId()))
                    .isInstanceOf(IllegalOperationException.class);
        }

        @Test
        void personalInvite_BypassesApprovalAndCountsUse() {
            // Given
            fixture.crewService.updateSettings(ALICE, wolves.getId(), new CrewSettingsUpdate(null, JoinMode.APPROVAL));
            String code = fixture.crewService.createPersonalInvite(ALICE, wolves.getId()).getInviteCode();

            // When
            JoinCrewResult result = fixture.crewService.joinCrew(BOB, code);

            // Then
            assertThat(result.getOutcome()).isEqualTo(JoinCrewResult.Outcome.JOINED);
            assertThat(result.getInvitedBy()).isEqualTo(ALICE);
            assertThat(fixture.crewService.createPersonalInvite(ALICE, wolves.getId()).getUses()).isEqualTo(1);
        }
    }
}

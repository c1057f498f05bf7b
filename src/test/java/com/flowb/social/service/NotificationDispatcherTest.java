package com.flowb.social.service;

import com.flowb.social.channel.ChannelDispatcher;
import com.flowb.social.exception.RepositoryException;
import com.flowb.social.model.NotificationLogEntry;
import com.flowb.social.model.NotificationType;
import com.flowb.social.repository.ConnectionRepository;
import com.flowb.social.repository.NotificationLogRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T18:00:00Z");
    private static final String ACTOR = "telegram_1";
    private static final Set<NotificationType> CHECKIN_LEDGER = Set.of(NotificationType.CHECKIN);

    @Mock
    private NotificationEligibility eligibility;

    @Mock
    private ChannelDispatcher channelDispatcher;

    @Mock
    private NotificationLogRepository notificationLogRepository;

    @Mock
    private ConnectionRepository connectionRepository;

    private SimpleMeterRegistry meterRegistry;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = new NotificationDispatcher(eligibility, channelDispatcher, notificationLogRepository,
                connectionRepository, meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private double count(String type, String status) {
        return meterRegistry.counter("notification_dispatch_total", "type", type, "status", status).count();
    }

    private double skipped(String type, String reason) {
        return meterRegistry.counter("notification_dispatch_total",
                "type", type, "status", "skipped", "reason", reason).count();
    }

    @Nested
    @DisplayName("deliver")
    class Deliver {

        @Test
        void deliver_Eligible_SendsAndRecordsLedgerEntry() {
            // Given
            when(eligibility.check(NotificationType.CHECKIN, "telegram_2", "crew-1:Bar", ACTOR, CHECKIN_LEDGER))
                    .thenReturn(Optional.empty());
            when(channelDispatcher.send("telegram_2", "hello")).thenReturn(true);

            // When
            DeliveryOutcome outcome = dispatcher.deliver(NotificationType.CHECKIN, "telegram_2", "crew-1:Bar",
                    ACTOR, "hello", CHECKIN_LEDGER);

            // Then
            assertThat(outcome).isEqualTo(DeliveryOutcome.SENT);
            ArgumentCaptor<NotificationLogEntry> captor = ArgumentCaptor.forClass(NotificationLogEntry.class);
            verify(notificationLogRepository).record(captor.capture());
            NotificationLogEntry entry = captor.getValue();
            assertThat(entry.getRecipientId()).isEqualTo("telegram_2");
            assertThat(entry.getNotificationType()).isEqualTo(NotificationType.CHECKIN);
            assertThat(entry.getReferenceId()).isEqualTo("crew-1:Bar");
            assertThat(entry.getTriggeredBy()).isEqualTo(ACTOR);
            assertThat(entry.getSentAt()).isEqualTo(NOW);
            assertThat(count("checkin", "sent")).isEqualTo(1.0);
        }

        @Test
        void deliver_ChannelFails_NoLedgerEntrySoRetryIsPossible() {
            // Given
            when(eligibility.check(any(), anyString(), anyString(), anyString(), any())).thenReturn(Optional.empty());
            when(channelDispatcher.send("telegram_2", "hello")).thenReturn(false);

            // When
            DeliveryOutcome outcome = dispatcher.deliver(NotificationType.CHECKIN, "telegram_2", "crew-1:Bar",
                    ACTOR, "hello", CHECKIN_LEDGER);

            // Then
            assertThat(outcome).isEqualTo(DeliveryOutcome.FAILED);
            verify(notificationLogRepository, never()).record(any());
            assertThat(meterRegistry.counter("notification_dispatch_total",
                    "type", "checkin", "status", "failed", "reason", "channel").count()).isEqualTo(1.0);
        }

        @Test
        void deliver_Ineligible_SkipsWithoutSending() {
            // Given
            when(eligibility.check(any(), anyString(), anyString(), anyString(), any()))
                    .thenReturn(Optional.of(SkipReason.QUIET_HOURS));

            // When
            DeliveryOutcome outcome = dispatcher.deliver(NotificationType.CHECKIN, "telegram_2", "crew-1:Bar",
                    ACTOR, "hello", CHECKIN_LEDGER);

            // Then
            assertThat(outcome).isEqualTo(DeliveryOutcome.SKIPPED);
            verifyNoInteractions(channelDispatcher);
            assertThat(skipped("checkin", "quiet_hours")).isEqualTo(1.0);
        }

        @Test
        void deliver_EligibilityReadFails_CountsFailure() {
            // Given
            when(eligibility.check(any(), anyString(), anyString(), anyString(), any()))
                    .thenThrow(new RepositoryException("store down"));

            // When
            DeliveryOutcome outcome = dispatcher.deliver(NotificationType.CHECKIN, "telegram_2", "crew-1:Bar",
                    ACTOR, "hello", CHECKIN_LEDGER);

            // Then
            assertThat(outcome).isEqualTo(DeliveryOutcome.FAILED);
            verifyNoInteractions(channelDispatcher);
        }

        @Test
        void deliver_LedgerWriteFails_StillCountsAsSent() {
            // Given
            when(eligibility.check(any(), anyString(), anyString(), anyString(), any())).thenReturn(Optional.empty());
            when(channelDispatcher.send(anyString(), anyString())).thenReturn(true);
            doThrow(new RepositoryException("insert failed")).when(notificationLogRepository).record(any());

            // When / Then
            assertThat(dispatcher.deliver(NotificationType.CHECKIN, "telegram_2", "crew-1:Bar",
                    ACTOR, "hello", CHECKIN_LEDGER)).isEqualTo(DeliveryOutcome.SENT);
        }
    }

    @Nested
    @DisplayName("fanOut")
    class FanOutTests {

        @Test
        void send_SkipsActorAndUsersWhoMutedActor() {
            // Given
            when(connectionRepository.findUserIdsSilencing(ACTOR)).thenReturn(Set.of("telegram_3"));
            when(eligibility.check(any(), anyString(), anyString(), anyString(), any())).thenReturn(Optional.empty());
            when(channelDispatcher.send(anyString(), anyString())).thenReturn(true);

            // When
            int sent = dispatcher.fanOut(ACTOR).send(NotificationType.CHECKIN, "crew-1:Bar",
                    List.of(ACTOR, "telegram_2", "telegram_3"), "hello", CHECKIN_LEDGER);

            // Then
            assertThat(sent).isEqualTo(1);
            verify(channelDispatcher).send("telegram_2", "hello");
            verify(channelDispatcher, never()).send(eq(ACTOR), anyString());
            verify(channelDispatcher, never()).send(eq("telegram_3"), anyString());
            assertThat(skipped("checkin", "self")).isEqualTo(1.0);
            assertThat(skipped("checkin", "muted")).isEqualTo(1.0);
        }

        @Test
        void send_RecipientInTwoPasses_MessagedOnce() {
            // Given
            when(connectionRepository.findUserIdsSilencing(ACTOR)).thenReturn(Set.of());
            when(eligibility.check(any(), anyString(), anyString(), anyString(), any())).thenReturn(Optional.empty());
            when(channelDispatcher.send(anyString(), anyString())).thenReturn(true);
            NotificationDispatcher.FanOut fanOut = dispatcher.fanOut(ACTOR);

            // When
            fanOut.send(NotificationType.FRIEND_RSVP, "evt-42", List.of("telegram_2"), "friend text",
                    NotificationType.RSVP_TYPES);
            fanOut.send(NotificationType.CREW_RSVP, "evt-42", List.of("telegram_2", "telegram_4"), "crew text",
                    NotificationType.RSVP_TYPES);

            // Then
            assertThat(fanOut.getSent()).isEqualTo(2);
            verify(channelDispatcher).send("telegram_2", "friend text");
            verify(channelDispatcher, never()).send("telegram_2", "crew text");
            verify(channelDispatcher).send("telegram_4", "crew text");
            assertThat(skipped("crew_rsvp", "batch_duplicate")).isEqualTo(1.0);
        }

        @Test
        void send_FailedRecipientIsRetriedInLaterPass() {
            // Given
            when(connectionRepository.findUserIdsSilencing(ACTOR)).thenReturn(Set.of());
            when(eligibility.check(any(), anyString(), anyString(), anyString(), any())).thenReturn(Optional.empty());
            when(channelDispatcher.send("telegram_2", "friend text")).thenReturn(false);
            when(channelDispatcher.send("telegram_2", "crew text")).thenReturn(true);
            NotificationDispatcher.FanOut fanOut = dispatcher.fanOut(ACTOR);

            // When
            fanOut.send(NotificationType.FRIEND_RSVP, "evt-42", List.of("telegram_2"), "friend text",
                    NotificationType.RSVP_TYPES);
            fanOut.send(NotificationType.CREW_RSVP, "evt-42", List.of("telegram_2"), "crew text",
                    NotificationType.RSVP_TYPES);

            // Then
            assertThat(fanOut.getSent()).isEqualTo(1);
        }

        @Test
        void fanOut_SilencingLookupFails_ContinuesWithoutMuteFilter() {
            // Given
            when(connectionRepository.findUserIdsSilencing(ACTOR)).thenThrow(new RepositoryException("down"));
            when(eligibility.check(any(), anyString(), anyString(), anyString(), any())).thenReturn(Optional.empty());
            when(channelDispatcher.send(anyString(), anyString())).thenReturn(true);

            // When
            int sent = dispatcher.fanOut(ACTOR).send(NotificationType.CHECKIN, "crew-1:Bar",
                    List.of("telegram_2"), "hello", CHECKIN_LEDGER);

            // Then
            assertThat(sent).isEqualTo(1);
        }
    }
}

package uk.gegc.accounting.features.streaming.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;
import uk.gegc.accounting.features.account.domain.exception.UserNotFoundException;
import uk.gegc.accounting.features.account.domain.model.UserAccount;
import uk.gegc.accounting.features.credit.application.CreditLedgerService;
import uk.gegc.accounting.features.credit.application.CreditMetricsService;
import uk.gegc.accounting.features.credit.application.UserLedgerLock;
import uk.gegc.accounting.features.credit.domain.model.AllocationDraw;
import uk.gegc.accounting.features.pricing.application.PricingFunction;
import uk.gegc.accounting.features.streaming.api.dto.AbortResultDto;
import uk.gegc.accounting.features.streaming.api.dto.FinalizeResultDto;
import uk.gegc.accounting.features.streaming.application.StreamingProperties;
import uk.gegc.accounting.features.streaming.domain.exception.InsufficientCreditsForSessionException;
import uk.gegc.accounting.features.streaming.domain.exception.SessionAlreadyExistsException;
import uk.gegc.accounting.features.streaming.domain.exception.SessionAlreadySettledException;
import uk.gegc.accounting.features.streaming.domain.exception.SessionNotFoundException;
import uk.gegc.accounting.features.streaming.domain.model.SessionHold;
import uk.gegc.accounting.features.streaming.domain.model.SessionStatus;
import uk.gegc.accounting.features.streaming.domain.model.StreamingSession;
import uk.gegc.accounting.features.streaming.infra.mapping.StreamingSessionMapper;
import uk.gegc.accounting.features.streaming.infra.repository.SessionHoldRepository;
import uk.gegc.accounting.features.streaming.infra.repository.StreamingSessionRepository;
import uk.gegc.accounting.features.usage.api.dto.UsageRecordDto;
import uk.gegc.accounting.features.usage.application.UsageRecorderService;
import uk.gegc.accounting.shared.exception.InvalidAmountException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StreamingSessionServiceImpl")
class StreamingSessionServiceImplTest {

    private static final String USER_ID = "user-1";
    private static final String MODEL = "test-model";
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 1, 12, 0);

    @Mock
    private StreamingSessionRepository sessionRepository;
    @Mock
    private SessionHoldRepository holdRepository;
    @Mock
    private StreamingSessionMapper sessionMapper;
    @Mock
    private CreditLedgerService creditLedgerService;
    @Mock
    private UserLedgerLock ledgerLock;
    @Mock
    private UsageRecorderService usageRecorderService;
    @Mock
    private PricingFunction pricingFunction;
    @Mock
    private CreditMetricsService metricsService;

    @Captor
    private ArgumentCaptor<Map<String, Object>> metadataCaptor;

    private StreamingProperties streamingProperties;
    private StreamingSessionServiceImpl sessionService;
    private final UUID usageId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        streamingProperties = new StreamingProperties();
        streamingProperties.setSafetyFactor(1.0d);
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
        sessionService = new StreamingSessionServiceImpl(
                sessionRepository,
                holdRepository,
                sessionMapper,
                creditLedgerService,
                ledgerLock,
                usageRecorderService,
                pricingFunction,
                streamingProperties,
                metricsService,
                clock
        );

        // one credit per started thousand tokens
        lenient().when(pricingFunction.creditsFor(eq(MODEL), anyLong()))
                .thenAnswer(invocation -> (invocation.<Long>getArgument(1) + 999) / 1000);
        UserAccount account = new UserAccount();
        account.setUserId(USER_ID);
        lenient().when(ledgerLock.lock(USER_ID)).thenReturn(Optional.of(account));
        lenient().when(ledgerLock.lockExisting(USER_ID)).thenReturn(account);
        lenient().when(usageRecorderService.record(anyString(), anyString(), anyString(), anyLong(), anyMap()))
                .thenAnswer(invocation -> new UsageRecordDto(usageId, invocation.getArgument(0), NOW,
                        invocation.getArgument(1), invocation.getArgument(2), invocation.getArgument(3),
                        invocation.getArgument(4)));
    }

    private StreamingSession activeSession(String sessionId, long allocatedCredits) {
        StreamingSession session = new StreamingSession();
        session.setSessionId(sessionId);
        session.setUserId(USER_ID);
        session.setModelId(MODEL);
        session.setEstimatedTokens(allocatedCredits * 1000);
        session.setEstimatedCredits(allocatedCredits);
        session.setAllocatedCredits(allocatedCredits);
        session.setStatus(SessionStatus.ACTIVE);
        session.setCreatedAt(NOW.minusSeconds(42));
        when(sessionRepository.findBySessionIdForUpdate(sessionId)).thenReturn(Optional.of(session));
        return session;
    }

    private SessionHold hold(String sessionId, UUID allocationId, long credits, int order) {
        SessionHold hold = new SessionHold();
        hold.setSessionId(sessionId);
        hold.setAllocationId(allocationId);
        hold.setCredits(credits);
        hold.setDrawOrder(order);
        return hold;
    }

    @Nested
    @DisplayName("initialize")
    class Initialize {

        @Test
        @DisplayName("holds the estimate scaled by the safety factor and remembers each draw")
        void holdsScaledEstimate() {
            // Given
            streamingProperties.setSafetyFactor(1.2d);
            UUID first = UUID.randomUUID();
            UUID second = UUID.randomUUID();
            when(sessionRepository.existsBySessionId("s1")).thenReturn(false);
            when(creditLedgerService.reserve(USER_ID, 120))
                    .thenReturn(Optional.of(List.of(new AllocationDraw(first, 80), new AllocationDraw(second, 40))));
            when(sessionRepository.saveAndFlush(any(StreamingSession.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            sessionService.initialize("s1", USER_ID, MODEL, 100_000);

            // Then
            ArgumentCaptor<StreamingSession> sessionCaptor = ArgumentCaptor.forClass(StreamingSession.class);
            verify(sessionRepository).saveAndFlush(sessionCaptor.capture());
            StreamingSession saved = sessionCaptor.getValue();
            assertThat(saved.getEstimatedCredits()).isEqualTo(100);
            assertThat(saved.getAllocatedCredits()).isEqualTo(120);
            assertThat(saved.getStatus()).isEqualTo(SessionStatus.ACTIVE);
            assertThat(saved.getCreatedAt()).isEqualTo(NOW);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<SessionHold>> holdsCaptor = ArgumentCaptor.forClass(List.class);
            verify(holdRepository).saveAll(holdsCaptor.capture());
            assertThat(holdsCaptor.getValue())
                    .extracting(SessionHold::getAllocationId, SessionHold::getCredits, SessionHold::getDrawOrder)
                    .containsExactly(
                            tuple(first, 80L, 0),
                            tuple(second, 40L, 1)
                    );
            verify(metricsService).incrementSessionInitialized(120);
        }

        @Test
        @DisplayName("rounds the scaled estimate up")
        void roundsUp() {
            streamingProperties.setSafetyFactor(1.2d);
            when(creditLedgerService.reserve(USER_ID, 2)).thenReturn(Optional.of(List.of()));
            when(sessionRepository.saveAndFlush(any(StreamingSession.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // 1 credit * 1.2 -> 2
            sessionService.initialize("s1", USER_ID, MODEL, 10);

            verify(creditLedgerService).reserve(USER_ID, 2);
        }

        @Test
        @DisplayName("rejects the session without creating it when the balance is short")
        void insufficientBalance() {
            when(creditLedgerService.reserve(USER_ID, 200)).thenReturn(Optional.empty());
            when(creditLedgerService.currentBalance(USER_ID)).thenReturn(50L);

            assertThatThrownBy(() -> sessionService.initialize("s3", USER_ID, MODEL, 200_000))
                    .isInstanceOfSatisfying(InsufficientCreditsForSessionException.class, ex -> {
                        assertThat(ex.getBalance()).isEqualTo(50);
                        assertThat(ex.getRequired()).isEqualTo(200);
                    });
            verify(sessionRepository, never()).saveAndFlush(any());
            verify(metricsService).incrementSessionRejected();
        }

        @Test
        @DisplayName("refuses a reused session id before reserving")
        void duplicateSessionId() {
            when(sessionRepository.existsBySessionId("s1")).thenReturn(true);

            assertThatThrownBy(() -> sessionService.initialize("s1", USER_ID, MODEL, 1000))
                    .isInstanceOf(SessionAlreadyExistsException.class);
            verify(creditLedgerService, never()).reserve(anyString(), anyLong());
        }

        @Test
        @DisplayName("a session id claimed concurrently by another user is reported as a duplicate")
        void duplicateSessionIdOnInsert() {
            when(sessionRepository.existsBySessionId("s1")).thenReturn(false);
            when(creditLedgerService.reserve(USER_ID, 1)).thenReturn(Optional.of(List.of()));
            when(sessionRepository.saveAndFlush(any(StreamingSession.class)))
                    .thenThrow(new DataIntegrityViolationException("Duplicate entry 's1' for key 'uk_streaming_session_id'"));

            assertThatThrownBy(() -> sessionService.initialize("s1", USER_ID, MODEL, 1000))
                    .isInstanceOf(SessionAlreadyExistsException.class)
                    .hasMessageContaining("s1");
            verify(holdRepository, never()).saveAll(anyList());
            verify(metricsService, never()).incrementSessionInitialized(anyLong());
        }

        @Test
        @DisplayName("unknown users cannot open sessions")
        void unknownUser() {
            when(ledgerLock.lockExisting("ghost")).thenThrow(new UserNotFoundException("ghost"));

            assertThatThrownBy(() -> sessionService.initialize("s1", "ghost", MODEL, 1000))
                    .isInstanceOf(UserNotFoundException.class);
        }

        @Test
        @DisplayName("rejects a non-positive estimate")
        void rejectsNonPositiveEstimate() {
            assertThatThrownBy(() -> sessionService.initialize("s1", USER_ID, MODEL, 0))
                    .isInstanceOf(InvalidAmountException.class);
        }
    }

    @Nested
    @DisplayName("finalize")
    class Finalize {

        @Test
        @DisplayName("charges actual usage and refunds the rest of the hold into the drawn allocations")
        void refundsUnusedHold() {
            // Given: 200 held, 150 used
            StreamingSession session = activeSession("s1", 200);
            UUID allocationId = UUID.randomUUID();
            when(holdRepository.findBySessionIdOrderByDrawOrderAsc("s1"))
                    .thenReturn(List.of(hold("s1", allocationId, 200, 0)));

            // When
            FinalizeResultDto result = sessionService.finalizeSession("s1", USER_ID, 150_000, true);

            // Then
            assertThat(result.status()).isEqualTo(SessionStatus.FINALIZED);
            assertThat(result.actualCredits()).isEqualTo(150);
            assertThat(result.chargedCredits()).isEqualTo(150);
            assertThat(result.refund()).isEqualTo(50);
            assertThat(result.reconciliationRequired()).isFalse();
            assertThat(result.usageRecordId()).isEqualTo(usageId);
            assertThat(result.allocatedCredits()).isEqualTo(result.chargedCredits() + result.refund());

            verify(creditLedgerService).refund(USER_ID, List.of(new AllocationDraw(allocationId, 200)), 50,
                    "Refund from streaming session s1");
            assertThat(session.getStatus()).isEqualTo(SessionStatus.FINALIZED);
            assertThat(session.getSettledAt()).isEqualTo(NOW);
            assertThat(session.getRefundedCredits()).isEqualTo(50);
            assertThat(session.getSucceeded()).isTrue();

            verify(usageRecorderService).record(eq(USER_ID), eq("chat-streaming"), eq(MODEL), eq(150L), metadataCaptor.capture());
            Map<String, Object> metadata = metadataCaptor.getValue();
            assertThat(metadata)
                    .containsEntry("sessionId", "s1")
                    .containsEntry("actualTokens", 150_000L)
                    .containsEntry("allocatedCredits", 200L)
                    .containsEntry("refund", 50L)
                    .containsEntry("durationSeconds", 42L)
                    .containsEntry("success", true)
                    .doesNotContainKey("uncollectedCredits");
            verify(metricsService).incrementSessionFinalized(150);
        }

        @Test
        @DisplayName("collects a shortfall from the balance when it can")
        void collectsShortfall() {
            activeSession("s1", 200);
            when(creditLedgerService.deduct(USER_ID, 50)).thenReturn(true);

            FinalizeResultDto result = sessionService.finalizeSession("s1", USER_ID, 250_000, true);

            assertThat(result.chargedCredits()).isEqualTo(250);
            assertThat(result.refund()).isZero();
            assertThat(result.uncollectedCredits()).isZero();
            assertThat(result.reconciliationRequired()).isFalse();
            verify(creditLedgerService, never()).refund(anyString(), anyList(), anyLong(), anyString());
        }

        @Test
        @DisplayName("caps the charge at the hold and flags reconciliation when the shortfall cannot be collected")
        void flagsUncollectableShortfall() {
            StreamingSession session = activeSession("s1", 200);
            when(creditLedgerService.deduct(USER_ID, 50)).thenReturn(false);

            FinalizeResultDto result = sessionService.finalizeSession("s1", USER_ID, 250_000, true);

            assertThat(result.actualCredits()).isEqualTo(250);
            assertThat(result.chargedCredits()).isEqualTo(200);
            assertThat(result.uncollectedCredits()).isEqualTo(50);
            assertThat(result.reconciliationRequired()).isTrue();
            assertThat(session.isReconciliationRequired()).isTrue();
            assertThat(session.getUncollectedCredits()).isEqualTo(50);

            verify(usageRecorderService).record(eq(USER_ID), eq("chat-streaming"), eq(MODEL), eq(200L), metadataCaptor.capture());
            assertThat(metadataCaptor.getValue()).containsEntry("uncollectedCredits", 50L);
            verify(metricsService).incrementReconciliationRequired(50);
        }

        @Test
        @DisplayName("a settled session cannot be finalized again")
        void alreadySettled() {
            StreamingSession session = activeSession("s1", 200);
            session.setStatus(SessionStatus.FINALIZED);

            assertThatThrownBy(() -> sessionService.finalizeSession("s1", USER_ID, 1000, true))
                    .isInstanceOfSatisfying(SessionAlreadySettledException.class,
                            ex -> assertThat(ex.getStatus()).isEqualTo(SessionStatus.FINALIZED));
            verify(creditLedgerService, never()).refund(anyString(), anyList(), anyLong(), anyString());
            verify(usageRecorderService, never()).record(anyString(), anyString(), anyString(), anyLong(), anyMap());
        }

        @Test
        @DisplayName("another user's session is reported as missing")
        void foreignSession() {
            StreamingSession session = activeSession("s1", 200);
            session.setUserId("someone-else");

            assertThatThrownBy(() -> sessionService.finalizeSession("s1", USER_ID, 1000, true))
                    .isInstanceOf(SessionNotFoundException.class);
        }

        @Test
        @DisplayName("unknown session")
        void unknownSession() {
            when(sessionRepository.findBySessionIdForUpdate("nope")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> sessionService.finalizeSession("nope", USER_ID, 1000, true))
                    .isInstanceOf(SessionNotFoundException.class);
        }

        @Test
        @DisplayName("negative token counts are rejected before locking")
        void negativeTokens() {
            assertThatThrownBy(() -> sessionService.finalizeSession("s1", USER_ID, -1, true))
                    .isInstanceOf(InvalidAmountException.class);
            verify(ledgerLock, never()).lock(anyString());
        }
    }

    @Nested
    @DisplayName("abort")
    class Abort {

        @Test
        @DisplayName("charges the partial usage and refunds the remainder")
        void chargesPartialUsage() {
            StreamingSession session = activeSession("s2", 200);
            UUID allocationId = UUID.randomUUID();
            when(holdRepository.findBySessionIdOrderByDrawOrderAsc("s2"))
                    .thenReturn(List.of(hold("s2", allocationId, 200, 0)));

            AbortResultDto result = sessionService.abortSession("s2", USER_ID, 50_000);

            assertThat(result.status()).isEqualTo(SessionStatus.ABORTED);
            assertThat(result.partialCredits()).isEqualTo(50);
            assertThat(result.chargedCredits()).isEqualTo(50);
            assertThat(result.refund()).isEqualTo(150);
            assertThat(session.getStatus()).isEqualTo(SessionStatus.ABORTED);
            assertThat(session.getSucceeded()).isFalse();

            verify(usageRecorderService).record(eq(USER_ID), eq("chat-streaming-aborted"), eq(MODEL), eq(50L), metadataCaptor.capture());
            assertThat(metadataCaptor.getValue())
                    .containsEntry("tokensGenerated", 50_000L)
                    .containsEntry("success", false);
            verify(metricsService).incrementSessionAborted(50);
        }

        @Test
        @DisplayName("an abort with no output refunds the whole hold and still records usage")
        void zeroTokens() {
            activeSession("s2", 200);
            when(holdRepository.findBySessionIdOrderByDrawOrderAsc("s2")).thenReturn(List.of());

            AbortResultDto result = sessionService.abortSession("s2", USER_ID, 0);

            assertThat(result.chargedCredits()).isZero();
            assertThat(result.refund()).isEqualTo(200);
            verify(creditLedgerService).refund(USER_ID, List.of(), 200, "Refund from streaming session s2");
            verify(usageRecorderService).record(eq(USER_ID), eq("chat-streaming-aborted"), eq(MODEL), eq(0L), anyMap());
        }

        @Test
        @DisplayName("an aborted session cannot be finalized")
        void finalizeAfterAbort() {
            StreamingSession session = activeSession("s2", 200);
            session.setStatus(SessionStatus.ABORTED);

            assertThatThrownBy(() -> sessionService.finalizeSession("s2", USER_ID, 1000, true))
                    .isInstanceOf(SessionAlreadySettledException.class);
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("recent sessions default to the configured window and system-wide limit")
        void recentDefaults() {
            when(sessionRepository.findRecent(eq(SessionStatus.ACTIVE), any(LocalDateTime.class), any(Pageable.class)))
                    .thenReturn(List.of());

            sessionService.getRecentSessions(null);

            ArgumentCaptor<LocalDateTime> since = ArgumentCaptor.forClass(LocalDateTime.class);
            ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
            verify(sessionRepository).findRecent(eq(SessionStatus.ACTIVE), since.capture(), page.capture());
            assertThat(since.getValue()).isEqualTo(NOW.minusMinutes(5));
            assertThat(page.getValue().getPageSize()).isEqualTo(50);
        }

        @Test
        @DisplayName("per-user recent sessions are limited to twenty")
        void recentPerUserLimit() {
            when(sessionRepository.findRecentByUserId(eq(USER_ID), eq(SessionStatus.ACTIVE), any(LocalDateTime.class), any(Pageable.class)))
                    .thenReturn(List.of());

            sessionService.getRecentSessions(USER_ID, 15);

            ArgumentCaptor<LocalDateTime> since = ArgumentCaptor.forClass(LocalDateTime.class);
            ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
            verify(sessionRepository).findRecentByUserId(eq(USER_ID), eq(SessionStatus.ACTIVE), since.capture(), page.capture());
            assertThat(since.getValue()).isEqualTo(NOW.minusMinutes(15));
            assertThat(page.getValue().getPageSize()).isEqualTo(20);
        }

        @Test
        @DisplayName("a non-positive window is rejected")
        void invalidWindow() {
            assertThatThrownBy(() -> sessionService.getRecentSessions(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}

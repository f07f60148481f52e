package uk.gegc.accounting.features.streaming.application.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.accounting.features.streaming.api.dto.StreamingSessionDto;
import uk.gegc.accounting.features.streaming.application.StreamingProperties;
import uk.gegc.accounting.features.streaming.application.StreamingSessionService;
import uk.gegc.accounting.features.streaming.domain.exception.SessionAlreadySettledException;
import uk.gegc.accounting.features.streaming.domain.model.SessionStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StaleSessionSweeper")
class StaleSessionSweeperTest {

    @Mock
    private StreamingSessionService sessionService;

    private StaleSessionSweeper sweeper;

    @BeforeEach
    void setUp() {
        StreamingProperties properties = new StreamingProperties();
        properties.getSweeper().setStaleAfterMinutes(30);
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
        sweeper = new StaleSessionSweeper(sessionService, properties, clock);
    }

    private static StreamingSessionDto active(String sessionId, String userId) {
        return new StreamingSessionDto(sessionId, userId, "test-model", 10_000, 10, 12, SessionStatus.ACTIVE,
                null, null, null, null, 0, false, null, LocalDateTime.of(2025, 3, 1, 10, 0), null);
    }

    @Test
    @DisplayName("aborts sessions older than the cutoff with zero tokens")
    void abortsStaleSessions() {
        // Given
        when(sessionService.findStaleSessions(LocalDateTime.of(2025, 3, 1, 11, 30)))
                .thenReturn(List.of(active("s1", "u1"), active("s2", "u2")));

        // When
        sweeper.abortStaleSessions();

        // Then
        verify(sessionService).abortSession("s1", "u1", 0L);
        verify(sessionService).abortSession("s2", "u2", 0L);
    }

    @Test
    @DisplayName("one failing session does not stop the sweep")
    void continuesAfterFailure() {
        when(sessionService.findStaleSessions(LocalDateTime.of(2025, 3, 1, 11, 30)))
                .thenReturn(List.of(active("s1", "u1"), active("s2", "u2")));
        when(sessionService.abortSession("s1", "u1", 0L))
                .thenThrow(new SessionAlreadySettledException("s1", SessionStatus.FINALIZED));

        sweeper.abortStaleSessions();

        verify(sessionService).abortSession("s2", "u2", 0L);
    }

    @Test
    @DisplayName("does nothing when no session is stale")
    void nothingStale() {
        when(sessionService.findStaleSessions(LocalDateTime.of(2025, 3, 1, 11, 30))).thenReturn(List.of());

        sweeper.abortStaleSessions();

        verify(sessionService, never()).abortSession(anyString(), anyString(), anyLong());
    }
}

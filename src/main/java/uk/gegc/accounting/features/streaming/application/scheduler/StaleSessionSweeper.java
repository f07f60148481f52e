package uk.gegc.accounting.features.streaming.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.accounting.features.streaming.api.dto.StreamingSessionDto;
import uk.gegc.accounting.features.streaming.application.StreamingProperties;
import uk.gegc.accounting.features.streaming.application.StreamingSessionService;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Aborts sessions whose client never came back to settle them, returning the whole hold.
 * Disabled unless accounting.streaming.sweeper.enabled=true.
 */
@Component
@ConditionalOnProperty(prefix = "accounting.streaming.sweeper", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class StaleSessionSweeper {

    private final StreamingSessionService sessionService;
    private final StreamingProperties streamingProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${accounting.streaming.sweeper.interval-ms:60000}")
    public void abortStaleSessions() {
        LocalDateTime cutoff = LocalDateTime.now(clock)
                .minusMinutes(streamingProperties.getSweeper().getStaleAfterMinutes());
        List<StreamingSessionDto> stale = sessionService.findStaleSessions(cutoff);
        if (stale.isEmpty()) {
            return;
        }

        log.info("Aborting {} streaming sessions opened before {}", stale.size(), cutoff);
        int aborted = 0;
        for (StreamingSessionDto session : stale) {
            try {
                sessionService.abortSession(session.sessionId(), session.userId(), 0L);
                aborted++;
            } catch (Exception e) {
                // settled concurrently or lock timeout; picked up on the next run if still active
                log.error("Failed to abort stale streaming session {}", session.sessionId(), e);
            }
        }
        log.info("Stale session sweep finished: {}/{} aborted", aborted, stale.size());
    }
}

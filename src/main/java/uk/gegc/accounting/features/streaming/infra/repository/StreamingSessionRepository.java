package uk.gegc.accounting.features.streaming.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.accounting.features.streaming.domain.model.SessionStatus;
import uk.gegc.accounting.features.streaming.domain.model.StreamingSession;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface StreamingSessionRepository extends JpaRepository<StreamingSession, UUID> {

    boolean existsBySessionId(String sessionId);

    /**
     * Settlement takes this lock after the owner's ledger lock, never before.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM StreamingSession s WHERE s.sessionId = :sessionId")
    Optional<StreamingSession> findBySessionIdForUpdate(@Param("sessionId") String sessionId);

    List<StreamingSession> findByUserIdAndStatusOrderByCreatedAtDesc(String userId, SessionStatus status);

    List<StreamingSession> findByStatusOrderByCreatedAtDesc(SessionStatus status);

    List<StreamingSession> findByStatusAndCreatedAtBefore(SessionStatus status, LocalDateTime cutoff);

    /**
     * Active sessions first, however old, then the most recently settled.
     */
    @Query("""
            SELECT s FROM StreamingSession s
            WHERE s.status = :active OR s.settledAt >= :since
            ORDER BY CASE WHEN s.status = uk.gegc.accounting.features.streaming.domain.model.SessionStatus.ACTIVE THEN 0 ELSE 1 END, s.settledAt DESC, s.createdAt DESC
            """)
    List<StreamingSession> findRecent(@Param("active") SessionStatus active,
                                      @Param("since") LocalDateTime since,
                                      Pageable pageable);

    @Query("""
            SELECT s FROM StreamingSession s
            WHERE s.userId = :userId
              AND (s.status = :active OR s.settledAt >= :since)
            ORDER BY CASE WHEN s.status = uk.gegc.accounting.features.streaming.domain.model.SessionStatus.ACTIVE THEN 0 ELSE 1 END, s.settledAt DESC, s.createdAt DESC
            """)
    List<StreamingSession> findRecentByUserId(@Param("userId") String userId,
                                              @Param("active") SessionStatus active,
                                              @Param("since") LocalDateTime since,
                                              Pageable pageable);
}

package uk.gegc.accounting.features.streaming.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A provisional hold against a user's balance for a streaming call whose final cost is unknown at start.
 * Settled exactly once, by finalize or abort. Rows are kept for audit and replay detection.
 */
@Entity
@Table(name = "streaming_sessions", indexes = {
        @Index(name = "idx_streaming_sessions_user_status", columnList = "user_id, status"),
        @Index(name = "idx_streaming_sessions_status_created", columnList = "status, created_at")
})
@Getter
@Setter
public class StreamingSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false, unique = true, length = 128)
    private String sessionId;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(name = "model_id", nullable = false, updatable = false, length = 200)
    private String modelId;

    @Column(name = "estimated_tokens", nullable = false, updatable = false)
    private long estimatedTokens;

    @Column(name = "estimated_credits", nullable = false, updatable = false)
    private long estimatedCredits;

    @Column(name = "allocated_credits", nullable = false, updatable = false)
    private long allocatedCredits;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SessionStatus status;

    @Column(name = "actual_tokens")
    private Long actualTokens;

    @Column(name = "actual_credits")
    private Long actualCredits;

    @Column(name = "charged_credits")
    private Long chargedCredits;

    @Column(name = "refunded_credits")
    private Long refundedCredits;

    @Column(name = "uncollected_credits", nullable = false)
    private long uncollectedCredits;

    @Column(name = "reconciliation_required", nullable = false)
    private boolean reconciliationRequired;

    @Column(name = "succeeded")
    private Boolean succeeded;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "settled_at")
    private LocalDateTime settledAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;
}

package uk.gegc.accounting.features.streaming.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

/**
 * Credits a session's hold took from one allocation.
 */
@Entity
@Table(name = "streaming_session_holds", indexes = {
        @Index(name = "idx_session_holds_session", columnList = "session_id")
})
@Getter
@Setter
public class SessionHold {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false, length = 128)
    private String sessionId;

    @Column(name = "allocation_id", nullable = false, updatable = false)
    private UUID allocationId;

    @Column(name = "credits", nullable = false, updatable = false)
    private long credits;

    @Column(name = "draw_order", nullable = false, updatable = false)
    private int drawOrder;
}

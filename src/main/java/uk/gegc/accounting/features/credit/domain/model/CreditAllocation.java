package uk.gegc.accounting.features.credit.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One grant of credits with its own expiry. {@code totalCredits} never changes after creation and
 * {@code 0 <= remainingCredits <= totalCredits} always holds. Rows are never deleted.
 */
@Entity
@Table(name = "credit_allocations", indexes = {
        @Index(name = "idx_credit_allocations_user_expiry", columnList = "user_id, expires_at")
})
@Getter
@Setter
public class CreditAllocation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(name = "total_credits", nullable = false, updatable = false)
    private long totalCredits;

    @Column(name = "remaining_credits", nullable = false)
    private long remainingCredits;

    @Column(name = "allocated_by", nullable = false, length = 100)
    private String allocatedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}

package uk.gegc.accounting.features.usage.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Immutable fact about one completed metered operation. Reporting only; never used for balances.
 */
@Entity
@Table(name = "usage_records", indexes = {
        @Index(name = "idx_usage_records_user_time", columnList = "user_id, recorded_at"),
        @Index(name = "idx_usage_records_time", columnList = "recorded_at")
})
@Getter
@Setter
public class UsageRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private LocalDateTime timestamp;

    @Column(name = "service", nullable = false, updatable = false, length = 100)
    private String service;

    @Column(name = "operation", nullable = false, updatable = false, length = 200)
    private String operation;

    @Column(name = "credits", nullable = false, updatable = false)
    private long credits;

    @Column(name = "metadata", length = 4000, updatable = false)
    private String metadataJson;
}

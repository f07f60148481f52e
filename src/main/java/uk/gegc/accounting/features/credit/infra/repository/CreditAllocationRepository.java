package uk.gegc.accounting.features.credit.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.accounting.features.credit.domain.model.CreditAllocation;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public interface CreditAllocationRepository extends JpaRepository<CreditAllocation, UUID> {

    /**
     * Allocations that still count towards the balance at {@code now}.
     */
    @Query("""
            SELECT a FROM CreditAllocation a
            WHERE a.userId = :userId
              AND a.remainingCredits > 0
              AND (a.expiresAt IS NULL OR a.expiresAt > :now)
            """)
    List<CreditAllocation> findActiveByUserId(@Param("userId") String userId, @Param("now") LocalDateTime now);

    @Query("""
            SELECT COALESCE(SUM(a.remainingCredits), 0) FROM CreditAllocation a
            WHERE a.userId = :userId
              AND a.remainingCredits > 0
              AND (a.expiresAt IS NULL OR a.expiresAt > :now)
            """)
    long sumActiveRemainingCredits(@Param("userId") String userId, @Param("now") LocalDateTime now);

    List<CreditAllocation> findByUserIdOrderByCreatedAtDesc(String userId);
}

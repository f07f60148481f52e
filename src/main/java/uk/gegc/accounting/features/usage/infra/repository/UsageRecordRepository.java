package uk.gegc.accounting.features.usage.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.accounting.features.usage.domain.model.UsageRecord;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public interface UsageRecordRepository extends JpaRepository<UsageRecord, UUID> {

    @Query("""
            SELECT r FROM UsageRecord r
            WHERE r.userId = :userId
              AND r.timestamp BETWEEN :from AND :to
            ORDER BY r.timestamp DESC
            """)
    List<UsageRecord> findByUserIdInRange(@Param("userId") String userId,
                                          @Param("from") LocalDateTime from,
                                          @Param("to") LocalDateTime to);

    @Query("""
            SELECT r FROM UsageRecord r
            WHERE r.timestamp BETWEEN :from AND :to
            ORDER BY r.timestamp DESC
            """)
    List<UsageRecord> findInRange(@Param("from") LocalDateTime from,
                                  @Param("to") LocalDateTime to);
}

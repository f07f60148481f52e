package uk.gegc.accounting.features.streaming.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.accounting.features.streaming.domain.model.SessionHold;

import java.util.List;
import java.util.UUID;

public interface SessionHoldRepository extends JpaRepository<SessionHold, UUID> {

    List<SessionHold> findBySessionIdOrderByDrawOrderAsc(String sessionId);
}

package org.nowstart.folio.repository;

import org.nowstart.folio.data.entity.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

    List<AuditEvent> findByEntityAndEntityIdOrderByCreatedAtAsc(String entity, String entityId);
}

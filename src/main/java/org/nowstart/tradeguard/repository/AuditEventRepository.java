package org.nowstart.tradeguard.repository;

import java.util.UUID;
import org.nowstart.tradeguard.data.entity.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {
}

package org.nowstart.tradeguard.service.audit;

import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.nowstart.tradeguard.data.entity.AuditEvent;
import org.nowstart.tradeguard.data.type.AuditEventType;
import org.nowstart.tradeguard.repository.AuditEventRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AuditTrailService {

    private final AuditEventRepository auditEventRepository;

    @Transactional
    public AuditEvent record(AuditEventType type, String subject, String payload) {
        AuditEvent event = AuditEvent.builder()
                .eventId(UUID.randomUUID())
                .type(type)
                .subject(subject)
                .payload(payload)
                .build();
        return auditEventRepository.save(event);
    }
}

package org.nowstart.tradeguard.data.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.tradeguard.data.type.AuditEventType;

@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditEvent extends AuditableEntity {

    @Id
    private UUID eventId;

    @Enumerated(EnumType.STRING)
    private AuditEventType type;

    private String subject;

    private String payload;
}

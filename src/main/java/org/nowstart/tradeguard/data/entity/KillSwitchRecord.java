package org.nowstart.tradeguard.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "kill_switch")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class KillSwitchRecord extends AuditableEntity {

    @Id
    private String id;

    private boolean triggered;

    private String reason;

    private Instant triggeredAt;

    private int consecutiveLosses;

    // JSON array of epoch millis.
    @Column(nullable = false, length = 4000)
    private String spreadViolations;
}

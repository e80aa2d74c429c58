package org.nowstart.tradeguard.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import java.math.BigDecimal;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EquityWatermark extends AuditableEntity {

    @Id
    private String accountId;

    @Column(precision = 38, scale = 12)
    private BigDecimal peakEquity;

    @Column(precision = 38, scale = 12)
    private BigDecimal lastEquity;
}

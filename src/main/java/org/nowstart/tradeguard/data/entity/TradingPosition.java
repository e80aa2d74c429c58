package org.nowstart.tradeguard.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "trading_positions")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TradingPosition extends AuditableEntity {

    @Id
    private String symbol;

    @Column(precision = 38, scale = 12)
    private BigDecimal qty;

    @Column(precision = 38, scale = 12)
    private BigDecimal avgPrice;

    @Column(precision = 38, scale = 12)
    private BigDecimal lastPrice;

    @Column(precision = 38, scale = 12)
    private BigDecimal realizedPnlTotal;

    // Realized PnL booked on realizedPnlDay (UTC); rolled over on the first fill of a new day.
    @Column(precision = 38, scale = 12)
    private BigDecimal realizedPnlToday;

    private LocalDate realizedPnlDay;

    private Instant lastStopOutAt;
}

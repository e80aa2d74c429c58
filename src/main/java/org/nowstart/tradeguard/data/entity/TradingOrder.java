package org.nowstart.tradeguard.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.tradeguard.data.type.ExecutionMode;
import org.nowstart.tradeguard.data.type.OrderSide;
import org.nowstart.tradeguard.data.type.OrderStatus;
import org.nowstart.tradeguard.data.type.TradeOrderType;

/**
 * Durable order row. The client order id doubles as primary key, which is what makes a
 * second submission of the same trading intent resolve to the same row.
 */
@Entity
@Table(name = "trading_orders")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TradingOrder extends AuditableEntity {

    @Id
    private String clientOrderId;

    private String orderId;

    private String symbol;

    @Enumerated(EnumType.STRING)
    private OrderSide side;

    @Enumerated(EnumType.STRING)
    private TradeOrderType orderType;

    @Enumerated(EnumType.STRING)
    private ExecutionMode mode;

    @Column(precision = 38, scale = 12)
    private BigDecimal quantity;

    @Column(precision = 38, scale = 12)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    private OrderStatus status;

    @Column(precision = 38, scale = 12)
    private BigDecimal filledQuantity;

    @Column(precision = 38, scale = 12)
    private BigDecimal avgFillPrice;

    private String reason;

    private boolean positionApplied;
}

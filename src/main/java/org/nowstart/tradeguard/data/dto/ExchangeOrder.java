package org.nowstart.tradeguard.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.tradeguard.data.type.OrderSide;
import org.nowstart.tradeguard.data.type.OrderStatus;
import org.nowstart.tradeguard.data.type.TradeOrderType;

public record ExchangeOrder(
        String orderId,
        String clientOrderId,
        String symbol,
        OrderSide side,
        TradeOrderType type,
        BigDecimal quantity,
        BigDecimal price,
        OrderStatus status,
        BigDecimal filledQuantity,
        BigDecimal avgFillPrice,
        String reason,
        Instant createdAt,
        Instant updatedAt
) {
}

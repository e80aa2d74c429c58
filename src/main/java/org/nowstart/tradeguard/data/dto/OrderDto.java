package org.nowstart.tradeguard.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.tradeguard.data.entity.TradingOrder;
import org.nowstart.tradeguard.data.type.ExecutionMode;
import org.nowstart.tradeguard.data.type.OrderSide;
import org.nowstart.tradeguard.data.type.OrderStatus;
import org.nowstart.tradeguard.data.type.TradeOrderType;

public record OrderDto(
        String clientOrderId,
        String orderId,
        String symbol,
        OrderSide side,
        TradeOrderType type,
        ExecutionMode mode,
        BigDecimal quantity,
        BigDecimal price,
        OrderStatus status,
        BigDecimal filledQuantity,
        BigDecimal avgFillPrice,
        String reason,
        Instant createdAt,
        Instant updatedAt
) {

    public static OrderDto from(TradingOrder order) {
        return new OrderDto(
                order.getClientOrderId(),
                order.getOrderId(),
                order.getSymbol(),
                order.getSide(),
                order.getOrderType(),
                order.getMode(),
                order.getQuantity(),
                order.getPrice(),
                order.getStatus(),
                order.getFilledQuantity(),
                order.getAvgFillPrice(),
                order.getReason(),
                order.getCreatedAt(),
                order.getUpdatedAt()
        );
    }
}

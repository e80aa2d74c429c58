package org.nowstart.tradeguard.data.dto;

import java.math.BigDecimal;
import org.nowstart.tradeguard.data.type.OrderSide;
import org.nowstart.tradeguard.data.type.TradeOrderType;

public record OrderRequest(
        String symbol,
        OrderSide side,
        TradeOrderType type,
        BigDecimal quantity,
        BigDecimal price,
        String clientOrderId
) {
}

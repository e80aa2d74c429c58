package org.nowstart.tradeguard.data.dto;

import java.math.BigDecimal;

public record TradeOutcome(
        String symbol,
        String clientOrderId,
        BigDecimal closedQuantity,
        BigDecimal realizedPnl,
        boolean positionClosed
) {

    public boolean won() {
        return realizedPnl.signum() > 0;
    }
}

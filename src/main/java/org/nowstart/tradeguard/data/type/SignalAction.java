package org.nowstart.tradeguard.data.type;

import java.util.Optional;

public enum SignalAction {
    BUY,
    SELL,
    HOLD;

    public Optional<OrderSide> toSide() {
        return switch (this) {
            case BUY -> Optional.of(OrderSide.BUY);
            case SELL -> Optional.of(OrderSide.SELL);
            case HOLD -> Optional.empty();
        };
    }
}

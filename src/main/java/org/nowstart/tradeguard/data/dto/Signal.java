package org.nowstart.tradeguard.data.dto;

import org.nowstart.tradeguard.data.type.SignalAction;

public record Signal(
        SignalAction action,
        double confidence,
        String reason
) {

    public static Signal hold(String reason) {
        return new Signal(SignalAction.HOLD, 0.0, reason);
    }
}

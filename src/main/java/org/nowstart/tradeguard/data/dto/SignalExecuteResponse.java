package org.nowstart.tradeguard.data.dto;

public record SignalExecuteResponse(
        RiskDecision decision,
        OrderDto order
) {
}

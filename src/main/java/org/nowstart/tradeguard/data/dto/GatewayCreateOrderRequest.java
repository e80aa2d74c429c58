package org.nowstart.tradeguard.data.dto;

public record GatewayCreateOrderRequest(
        String symbol,
        String side,
        String type,
        String quantity,
        String price,
        String clientOrderId
) {
}

package org.nowstart.tradeguard.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayOrderResponse(
        String orderId,
        String clientOrderId,
        String symbol,
        String side,
        String type,
        String quantity,
        String price,
        String status,
        String filledQuantity,
        String avgFillPrice,
        String reason,
        Long createdAt,
        Long updatedAt
) {
}

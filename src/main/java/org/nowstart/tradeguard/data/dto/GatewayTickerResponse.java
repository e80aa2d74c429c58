package org.nowstart.tradeguard.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayTickerResponse(
        String symbol,
        Double bid,
        Double ask,
        Double last,
        Double volume24h,
        Long time
) {
}

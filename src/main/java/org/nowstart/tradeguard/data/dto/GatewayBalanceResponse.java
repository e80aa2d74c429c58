package org.nowstart.tradeguard.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayBalanceResponse(
        String asset,
        String free,
        String locked
) {
}

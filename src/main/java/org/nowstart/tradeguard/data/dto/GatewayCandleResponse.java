package org.nowstart.tradeguard.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayCandleResponse(
        Long time,
        Double open,
        Double high,
        Double low,
        Double close,
        Double volume
) {
}

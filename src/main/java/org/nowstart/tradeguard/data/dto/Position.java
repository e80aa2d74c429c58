package org.nowstart.tradeguard.data.dto;

public record Position(
        String symbol,
        double quantity,
        double avgEntryPrice,
        double marketPrice
) {
}

package org.nowstart.tradeguard.data.dto;

import java.time.Instant;

public record Ticker(
        String symbol,
        double bid,
        double ask,
        double last,
        Double volume24h,
        Instant time
) {

    public double mid() {
        return (ask + bid) / 2.0;
    }
}

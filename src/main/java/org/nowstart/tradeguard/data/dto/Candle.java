package org.nowstart.tradeguard.data.dto;

import java.time.Instant;

public record Candle(
        String symbol,
        String interval,
        Instant time,
        double open,
        double high,
        double low,
        double close,
        double volume
) {
}

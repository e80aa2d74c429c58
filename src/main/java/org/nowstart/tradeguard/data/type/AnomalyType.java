package org.nowstart.tradeguard.data.type;

import java.util.Locale;

public enum AnomalyType {
    VOLUME_SPIKE,
    SPREAD_BLOWOUT,
    PRICE_GAP,
    WICK_ANOMALY,
    STALE_DATA;

    public String metricName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

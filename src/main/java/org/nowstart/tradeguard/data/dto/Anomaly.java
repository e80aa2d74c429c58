package org.nowstart.tradeguard.data.dto;

import java.time.Instant;
import org.nowstart.tradeguard.data.type.AnomalySeverity;
import org.nowstart.tradeguard.data.type.AnomalyType;

public record Anomaly(
        AnomalyType type,
        AnomalySeverity severity,
        String message,
        double value,
        double threshold,
        Instant timestamp
) {
}

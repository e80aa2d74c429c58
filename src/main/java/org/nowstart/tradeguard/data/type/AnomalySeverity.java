package org.nowstart.tradeguard.data.type;

public enum AnomalySeverity {
    LOW,
    MEDIUM,
    HIGH
}

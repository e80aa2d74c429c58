package org.nowstart.tradeguard.data.type;

public enum OrderStatus {
    PENDING,
    OPEN,
    FILLED,
    CANCELED,
    REJECTED;

    public boolean isActive() {
        return this == PENDING || this == OPEN;
    }
}

package org.nowstart.tradeguard.data.type;

public enum AuditEventType {
    PAPER_ORDER_FILLED,
    LIVE_ORDER_SUBMITTED,
    ORDER_CANCELED,
    KILL_SWITCH_TRIGGERED,
    KILL_SWITCH_RESET,
    EQUITY_PEAK_REBASED,
    ORDER_RECONCILED
}

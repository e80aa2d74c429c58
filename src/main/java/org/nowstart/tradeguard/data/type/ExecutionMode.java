package org.nowstart.tradeguard.data.type;

public enum ExecutionMode {
    LIVE,
    PAPER
}

package org.nowstart.tradeguard.data.type;

public enum TradeOrderType {
    MARKET,
    LIMIT
}

package org.nowstart.tradeguard.service.metrics;

public interface TradingMetrics {

    default void increment(String name) {
        increment(name, 1.0);
    }

    void increment(String name, double value);

    void gauge(String name, double value);

    void observe(String name, double value);
}

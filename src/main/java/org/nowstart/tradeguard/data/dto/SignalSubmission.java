package org.nowstart.tradeguard.data.dto;

/**
 * Input of {@code OrderManager#submitSignal}. A null idempotency key makes the manager
 * generate a fresh client order id.
 */
public record SignalSubmission(
        String symbol,
        Signal signal,
        Ticker ticker,
        String idempotencyKey
) {

    public SignalSubmission(String symbol, Signal signal, Ticker ticker) {
        this(symbol, signal, ticker, null);
    }
}

package org.nowstart.tradeguard.data.exception;

import lombok.Getter;

/**
 * Raised instead of calling the exchange while the circuit breaker is open.
 */
@Getter
public class ExchangeUnavailableException extends RuntimeException {

    private final int failureCount;

    public ExchangeUnavailableException(String operation, int failureCount) {
        super("Exchange circuit open, skipped " + operation + " after " + failureCount + " consecutive failures");
        this.failureCount = failureCount;
    }
}

package org.nowstart.tradeguard.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Non-retryable failure with a stable machine-readable code: malformed input, unknown
 * order, or an order state that forbids the requested operation.
 */
@Getter
public class TradingApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public TradingApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static TradingApiException invalidOrder(String message) {
        return new TradingApiException(HttpStatus.UNPROCESSABLE_ENTITY, "invalid_order", message);
    }

    public static TradingApiException orderNotFound(String clientOrderId) {
        return new TradingApiException(HttpStatus.NOT_FOUND, "order_not_found", "Order not found: " + clientOrderId);
    }
}

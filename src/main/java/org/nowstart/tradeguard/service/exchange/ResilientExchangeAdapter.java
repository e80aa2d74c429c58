package org.nowstart.tradeguard.service.exchange;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradeguard.data.dto.Balance;
import org.nowstart.tradeguard.data.dto.Candle;
import org.nowstart.tradeguard.data.dto.ExchangeOrder;
import org.nowstart.tradeguard.data.dto.OrderRequest;
import org.nowstart.tradeguard.data.dto.Ticker;
import org.nowstart.tradeguard.data.exception.ExchangeUnavailableException;
import org.nowstart.tradeguard.service.killswitch.KillSwitch;
import org.nowstart.tradeguard.service.metrics.TradingMetrics;
import org.nowstart.tradeguard.service.risk.CircuitBreaker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Circuit breaker in front of the exchange. Every failed call, after the Feign retries
 * are exhausted, counts once against the breaker and the kill switch API error threshold.
 */
@Slf4j
@Primary
@Component
public class ResilientExchangeAdapter implements ExchangeAdapter {

    private final ExchangeAdapter delegate;
    private final CircuitBreaker circuitBreaker;
    private final KillSwitch killSwitch;
    private final TradingMetrics tradingMetrics;
    private final Clock clock;

    public ResilientExchangeAdapter(
            @Qualifier(GatewayExchangeAdapter.BEAN_NAME) ExchangeAdapter delegate,
            CircuitBreaker circuitBreaker,
            KillSwitch killSwitch,
            TradingMetrics tradingMetrics,
            Clock clock
    ) {
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;
        this.killSwitch = killSwitch;
        this.tradingMetrics = tradingMetrics;
        this.clock = clock;
    }

    @Override
    public Ticker getTicker(String symbol) {
        return call("get_ticker", () -> delegate.getTicker(symbol));
    }

    @Override
    public List<Candle> getCandles(String symbol, String interval, int limit) {
        return call("get_candles", () -> delegate.getCandles(symbol, interval, limit));
    }

    @Override
    public ExchangeOrder placeOrder(OrderRequest request) {
        return call("place_order", () -> delegate.placeOrder(request));
    }

    @Override
    public ExchangeOrder cancelOrder(String orderId, String symbol) {
        return call("cancel_order", () -> delegate.cancelOrder(orderId, symbol));
    }

    @Override
    public ExchangeOrder getOrder(String orderId, String symbol) {
        return call("get_order", () -> delegate.getOrder(orderId, symbol));
    }

    @Override
    public List<ExchangeOrder> listOpenOrders(String symbol) {
        return call("list_open_orders", () -> delegate.listOpenOrders(symbol));
    }

    @Override
    public List<Balance> getBalances() {
        return call("get_balances", delegate::getBalances);
    }

    private <T> T call(String operation, Supplier<T> action) {
        Instant startedAt = clock.instant();
        if (circuitBreaker.isOpen(startedAt)) {
            tradingMetrics.increment("exchange.circuit_open");
            throw new ExchangeUnavailableException(operation, circuitBreaker.getFailureCount());
        }

        try {
            T result = action.get();
            circuitBreaker.recordSuccess();
            tradingMetrics.observe("exchange.latency_ms", Duration.between(startedAt, clock.instant()).toMillis());
            return result;
        } catch (RuntimeException e) {
            circuitBreaker.recordFailure(clock.instant());
            int failureCount = circuitBreaker.getFailureCount();
            tradingMetrics.increment("exchange.errors");
            log.warn("event=exchange_call_failed operation={} failure_count={} error=\"{}\"", operation, failureCount, e.getMessage());
            killSwitch.checkApiErrors(failureCount);
            throw e;
        }
    }
}

package org.nowstart.tradeguard.service.exchange;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradeguard.data.dto.Balance;
import org.nowstart.tradeguard.data.dto.Candle;
import org.nowstart.tradeguard.data.dto.ExchangeOrder;
import org.nowstart.tradeguard.data.dto.GatewayBalanceResponse;
import org.nowstart.tradeguard.data.dto.GatewayCandleResponse;
import org.nowstart.tradeguard.data.dto.GatewayCreateOrderRequest;
import org.nowstart.tradeguard.data.dto.GatewayOrderResponse;
import org.nowstart.tradeguard.data.dto.GatewayTickerResponse;
import org.nowstart.tradeguard.data.dto.OrderRequest;
import org.nowstart.tradeguard.data.dto.Ticker;
import org.nowstart.tradeguard.data.type.OrderSide;
import org.nowstart.tradeguard.data.type.OrderStatus;
import org.nowstart.tradeguard.data.type.TradeOrderType;
import org.nowstart.tradeguard.repository.ExchangeGatewayFeignClient;
import org.springframework.stereotype.Component;

/**
 * Maps the REST exchange gateway wire format onto domain types. No retry or breaker logic here;
 * retries happen in the Feign client, the breaker in {@link ResilientExchangeAdapter}.
 */
@Slf4j
@Component(GatewayExchangeAdapter.BEAN_NAME)
@RequiredArgsConstructor
public class GatewayExchangeAdapter implements ExchangeAdapter {

    public static final String BEAN_NAME = "gatewayExchangeAdapter";

    private final ExchangeGatewayFeignClient exchangeGatewayFeignClient;
    private final Clock clock;

    @Override
    public Ticker getTicker(String symbol) {
        GatewayTickerResponse response = exchangeGatewayFeignClient.getTicker(symbol);
        if (response == null) {
            throw new IllegalStateException("Empty ticker response for " + symbol);
        }

        return new Ticker(
                response.symbol() == null ? symbol : response.symbol(),
                orZero(response.bid()),
                orZero(response.ask()),
                orZero(response.last()),
                response.volume24h(),
                toInstant(response.time())
        );
    }

    @Override
    public List<Candle> getCandles(String symbol, String interval, int limit) {
        List<GatewayCandleResponse> responses = exchangeGatewayFeignClient.getCandles(symbol, interval, limit);
        if (responses == null) {
            return List.of();
        }

        return responses.stream()
                .filter(candle -> candle.time() != null)
                .map(candle -> new Candle(
                        symbol,
                        interval,
                        Instant.ofEpochMilli(candle.time()),
                        orZero(candle.open()),
                        orZero(candle.high()),
                        orZero(candle.low()),
                        orZero(candle.close()),
                        orZero(candle.volume())
                ))
                .sorted(Comparator.comparing(Candle::time))
                .toList();
    }

    @Override
    public ExchangeOrder placeOrder(OrderRequest request) {
        GatewayCreateOrderRequest body = new GatewayCreateOrderRequest(
                request.symbol(),
                request.side().wireValue(),
                request.type().name().toLowerCase(Locale.ROOT),
                stringify(request.quantity()),
                request.type() == TradeOrderType.LIMIT ? stringify(request.price()) : null,
                request.clientOrderId()
        );
        return toExchangeOrder(exchangeGatewayFeignClient.createOrder(body));
    }

    @Override
    public ExchangeOrder cancelOrder(String orderId, String symbol) {
        return toExchangeOrder(exchangeGatewayFeignClient.cancelOrder(orderId, symbol));
    }

    @Override
    public ExchangeOrder getOrder(String orderId, String symbol) {
        return toExchangeOrder(exchangeGatewayFeignClient.getOrder(orderId, symbol));
    }

    @Override
    public List<ExchangeOrder> listOpenOrders(String symbol) {
        List<GatewayOrderResponse> responses = exchangeGatewayFeignClient.getOpenOrders(symbol);
        if (responses == null) {
            return List.of();
        }
        return responses.stream().map(this::toExchangeOrder).toList();
    }

    @Override
    public List<Balance> getBalances() {
        List<GatewayBalanceResponse> responses = exchangeGatewayFeignClient.getBalances();
        if (responses == null) {
            return List.of();
        }
        return responses.stream()
                .map(balance -> new Balance(balance.asset(), parseDecimal(balance.free()), parseDecimal(balance.locked())))
                .toList();
    }

    ExchangeOrder toExchangeOrder(GatewayOrderResponse response) {
        if (response == null) {
            throw new IllegalStateException("Empty order response from exchange gateway");
        }

        return new ExchangeOrder(
                response.orderId(),
                response.clientOrderId(),
                response.symbol(),
                toOrderSide(response.side()),
                toOrderType(response.type()),
                parseDecimal(response.quantity()),
                response.price() == null ? null : parseDecimal(response.price()),
                toOrderStatus(response.status()),
                parseDecimal(response.filledQuantity()),
                response.avgFillPrice() == null ? null : parseDecimal(response.avgFillPrice()),
                response.reason(),
                response.createdAt() == null ? null : Instant.ofEpochMilli(response.createdAt()),
                response.updatedAt() == null ? null : Instant.ofEpochMilli(response.updatedAt())
        );
    }

    OrderStatus toOrderStatus(String status) {
        if (status == null || status.isBlank()) {
            return OrderStatus.PENDING;
        }

        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "new", "open", "partially_filled" -> OrderStatus.OPEN;
            case "filled", "done" -> OrderStatus.FILLED;
            case "canceled", "cancelled", "expired" -> OrderStatus.CANCELED;
            case "rejected" -> OrderStatus.REJECTED;
            case "pending" -> OrderStatus.PENDING;
            default -> {
                log.warn("event=unknown_order_status status={}", status);
                yield OrderStatus.PENDING;
            }
        };
    }

    OrderSide toOrderSide(String side) {
        if (side == null || side.isBlank()) {
            return null;
        }

        return switch (side.trim().toLowerCase(Locale.ROOT)) {
            case "buy", "bid" -> OrderSide.BUY;
            case "sell", "ask" -> OrderSide.SELL;
            default -> {
                log.warn("event=unknown_order_side side={}", side);
                yield null;
            }
        };
    }

    TradeOrderType toOrderType(String type) {
        if (type == null || type.isBlank()) {
            return null;
        }

        return switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "market" -> TradeOrderType.MARKET;
            case "limit" -> TradeOrderType.LIMIT;
            default -> {
                log.warn("event=unknown_order_type type={}", type);
                yield null;
            }
        };
    }

    private Instant toInstant(Long epochMillis) {
        return epochMillis == null ? clock.instant() : Instant.ofEpochMilli(epochMillis);
    }

    private double orZero(Double value) {
        return value == null ? 0.0 : value;
    }

    private BigDecimal parseDecimal(String value) {
        if (value == null || value.isBlank()) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(value);
    }

    private String stringify(BigDecimal value) {
        return value == null ? null : value.stripTrailingZeros().toPlainString();
    }
}

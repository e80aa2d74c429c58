package org.nowstart.tradeguard.service.execution;

import java.math.BigDecimal;
import lombok.RequiredArgsConstructor;
import org.nowstart.tradeguard.data.dto.ExchangeOrder;
import org.nowstart.tradeguard.data.dto.OrderRequest;
import org.nowstart.tradeguard.data.dto.Ticker;
import org.nowstart.tradeguard.data.entity.TradingOrder;
import org.nowstart.tradeguard.data.exception.TradingApiException;
import org.nowstart.tradeguard.data.type.ExecutionMode;
import org.nowstart.tradeguard.data.type.OrderStatus;
import org.nowstart.tradeguard.service.exchange.ExchangeAdapter;
import org.springframework.http.HttpStatus;

@RequiredArgsConstructor
public final class LiveBroker implements Broker {

    private final ExchangeAdapter exchangeAdapter;

    @Override
    public ExecutionMode mode() {
        return ExecutionMode.LIVE;
    }

    @Override
    public TradingOrder place(OrderRequest request, Ticker ticker) {
        ExchangeOrder placed = exchangeAdapter.placeOrder(request);
        return TradingOrder.builder()
                .clientOrderId(request.clientOrderId())
                .orderId(placed.orderId())
                .symbol(request.symbol())
                .side(request.side())
                .orderType(request.type())
                .mode(ExecutionMode.LIVE)
                .quantity(request.quantity())
                .price(request.price())
                .status(placed.status())
                .filledQuantity(placed.filledQuantity() == null ? BigDecimal.ZERO : placed.filledQuantity())
                .avgFillPrice(placed.avgFillPrice())
                .reason(placed.reason())
                .build();
    }

    @Override
    public TradingOrder cancel(TradingOrder order) {
        if (order.getOrderId() == null || order.getOrderId().isBlank()) {
            throw new TradingApiException(HttpStatus.CONFLICT, "missing_exchange_id", "Order exchange id is missing");
        }
        if (order.getStatus() == OrderStatus.FILLED) {
            throw new TradingApiException(HttpStatus.CONFLICT, "cannot_cancel", "Filled LIVE order cannot be canceled");
        }

        ExchangeOrder canceled = exchangeAdapter.cancelOrder(order.getOrderId(), order.getSymbol());
        if (canceled.filledQuantity() != null) {
            order.setFilledQuantity(canceled.filledQuantity());
        }
        if (canceled.avgFillPrice() != null) {
            order.setAvgFillPrice(canceled.avgFillPrice());
        }
        order.setStatus(OrderStatus.CANCELED);
        return order;
    }
}

package org.nowstart.tradeguard.service.execution;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradeguard.data.dto.OrderRequest;
import org.nowstart.tradeguard.data.dto.Ticker;
import org.nowstart.tradeguard.data.entity.TradingOrder;
import org.nowstart.tradeguard.data.exception.TradingApiException;
import org.nowstart.tradeguard.data.type.ExecutionMode;
import org.nowstart.tradeguard.data.type.OrderSide;
import org.nowstart.tradeguard.data.type.OrderStatus;
import org.nowstart.tradeguard.data.type.TradeOrderType;
import org.springframework.http.HttpStatus;

/**
 * Local fill simulation. Market orders fill at once at mid plus or minus the configured
 * slippage (capped at 2%); limit orders fill at their limit only when the book already crosses it.
 */
@Slf4j
public final class PaperBroker implements Broker {

    static final double MAX_SLIPPAGE_FRACTION = 0.02;
    private static final int PRICE_SCALE = 12;

    private final double maxSlippageBps;

    public PaperBroker(double maxSlippageBps) {
        this.maxSlippageBps = maxSlippageBps;
    }

    @Override
    public ExecutionMode mode() {
        return ExecutionMode.PAPER;
    }

    @Override
    public TradingOrder place(OrderRequest request, Ticker ticker) {
        if (request.type() == TradeOrderType.LIMIT && request.price() != null) {
            double limit = request.price().doubleValue();
            boolean crossed = request.side() == OrderSide.BUY ? ticker.ask() <= limit : ticker.bid() >= limit;
            return crossed ? filled(request, request.price()) : pending(request);
        }

        double mid = ticker.mid();
        double slip = mid * Math.min(maxSlippageBps / 10_000.0, MAX_SLIPPAGE_FRACTION);
        double fillPrice = request.side() == OrderSide.BUY ? mid + slip : mid - slip;
        return filled(request, BigDecimal.valueOf(fillPrice).setScale(PRICE_SCALE, RoundingMode.HALF_UP));
    }

    @Override
    public TradingOrder cancel(TradingOrder order) {
        if (order.getStatus() == OrderStatus.FILLED) {
            throw new TradingApiException(HttpStatus.CONFLICT, "cannot_cancel", "Filled PAPER order cannot be canceled");
        }

        order.setStatus(OrderStatus.CANCELED);
        return order;
    }

    private TradingOrder filled(OrderRequest request, BigDecimal fillPrice) {
        TradingOrder order = baseOrder(request)
                .status(OrderStatus.FILLED)
                .filledQuantity(request.quantity())
                .avgFillPrice(fillPrice)
                .build();
        log.info("event=paper_fill client_order_id={} symbol={} side={} qty={} price={}",
                request.clientOrderId(), request.symbol(), request.side(), request.quantity(), fillPrice);
        return order;
    }

    private TradingOrder pending(OrderRequest request) {
        return baseOrder(request)
                .status(OrderStatus.PENDING)
                .filledQuantity(BigDecimal.ZERO)
                .build();
    }

    private TradingOrder.TradingOrderBuilder baseOrder(OrderRequest request) {
        return TradingOrder.builder()
                .clientOrderId(request.clientOrderId())
                .orderId("paper-" + UUID.randomUUID())
                .symbol(request.symbol())
                .side(request.side())
                .orderType(request.type())
                .mode(ExecutionMode.PAPER)
                .quantity(request.quantity())
                .price(request.price());
    }
}

package org.nowstart.tradeguard.service.execution;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradeguard.data.dto.OrderRequest;
import org.nowstart.tradeguard.data.dto.Signal;
import org.nowstart.tradeguard.data.dto.SignalSubmission;
import org.nowstart.tradeguard.data.dto.Ticker;
import org.nowstart.tradeguard.data.entity.TradingOrder;
import org.nowstart.tradeguard.data.exception.TradingApiException;
import org.nowstart.tradeguard.data.property.RiskProperties;
import org.nowstart.tradeguard.data.type.AuditEventType;
import org.nowstart.tradeguard.data.type.ExecutionMode;
import org.nowstart.tradeguard.data.type.OrderSide;
import org.nowstart.tradeguard.data.type.TradeOrderType;
import org.nowstart.tradeguard.repository.OrderStore;
import org.nowstart.tradeguard.service.alert.AlertService;
import org.nowstart.tradeguard.service.audit.AuditTrailService;
import org.nowstart.tradeguard.service.metrics.TradingMetrics;
import org.nowstart.tradeguard.service.risk.RiskGuards;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Turns an approved signal into exactly one broker order per idempotency key.
 *
 * <p>The store is consulted before the broker: a key that already has an order returns that
 * order untouched, so a retried submission never reaches the exchange twice. Risk evaluation
 * happens before this class is called; it does not re-check guards.
 */
@Slf4j
@Service
public class OrderManager {

    private static final int QUANTITY_SCALE = 12;

    private final Broker broker;
    private final OrderStore orderStore;
    private final RiskProperties riskProperties;
    private final TradingMetrics tradingMetrics;
    private final AuditTrailService auditTrailService;
    private final AlertService alertService;
    private final Clock clock;

    public OrderManager(
            Broker broker,
            OrderStore orderStore,
            RiskProperties riskProperties,
            TradingMetrics tradingMetrics,
            AuditTrailService auditTrailService,
            AlertService alertService,
            Clock clock
    ) {
        this.broker = broker;
        this.orderStore = orderStore;
        this.riskProperties = riskProperties;
        this.tradingMetrics = tradingMetrics;
        this.auditTrailService = auditTrailService;
        this.alertService = alertService;
        this.clock = clock;
        log.info("event=order_manager_ready mode={}", broker.mode());
    }

    public ExecutionMode mode() {
        return broker.mode();
    }

    /**
     * @return empty for HOLD; otherwise the stored order for the idempotency key
     */
    public Optional<TradingOrder> submitSignal(SignalSubmission submission) {
        Signal signal = submission.signal();
        Optional<OrderSide> side = signal.action().toSide();
        if (side.isEmpty()) {
            return Optional.empty();
        }

        String clientOrderId = submission.idempotencyKey() == null || submission.idempotencyKey().isBlank()
                ? createClientOrderId(submission.symbol(), side.get())
                : submission.idempotencyKey();

        Optional<TradingOrder> existing = orderStore.getByClientOrderId(clientOrderId);
        if (existing.isPresent()) {
            log.info("event=idempotent_order_hit client_order_id={} order_id={} status={}",
                    clientOrderId, existing.get().getOrderId(), existing.get().getStatus());
            tradingMetrics.increment("orders.idempotent_hit");
            return existing;
        }

        OrderRequest request = new OrderRequest(
                submission.symbol(),
                side.get(),
                TradeOrderType.MARKET,
                computeQuantity(signal, submission.ticker()),
                null,
                clientOrderId
        );

        TradingOrder placed = broker.place(request, submission.ticker());
        if (placed.getReason() == null || placed.getReason().isBlank()) {
            placed.setReason(signal.reason());
        }
        TradingOrder stored = orderStore.upsert(placed);
        tradingMetrics.increment("orders.submitted");

        AuditEventType auditType = stored.getMode() == ExecutionMode.PAPER
                ? AuditEventType.PAPER_ORDER_FILLED
                : AuditEventType.LIVE_ORDER_SUBMITTED;
        auditTrailService.record(auditType, clientOrderId,
                "symbol=" + stored.getSymbol() + " side=" + stored.getSide() + " qty=" + stored.getQuantity()
                        + " status=" + stored.getStatus());
        log.info("event=order_submitted client_order_id={} order_id={} mode={} symbol={} side={} qty={} status={}",
                clientOrderId, stored.getOrderId(), stored.getMode(), stored.getSymbol(), stored.getSide(),
                stored.getQuantity(), stored.getStatus());
        alertService.notify(
                "Order submitted",
                stored.getSide() + " " + stored.getQuantity() + " " + stored.getSymbol(),
                Map.of(
                        "clientOrderId", clientOrderId,
                        "mode", stored.getMode(),
                        "status", stored.getStatus()
                )
        );

        return Optional.of(stored);
    }

    public TradingOrder cancel(String clientOrderId) {
        TradingOrder order = orderStore.getByClientOrderId(clientOrderId)
                .orElseThrow(() -> TradingApiException.orderNotFound(clientOrderId));
        if (order.getMode() != broker.mode()) {
            throw new TradingApiException(
                    HttpStatus.CONFLICT,
                    "mode_mismatch",
                    "Order " + clientOrderId + " was placed in " + order.getMode() + " mode"
            );
        }

        TradingOrder canceled = orderStore.upsert(broker.cancel(order));
        auditTrailService.record(AuditEventType.ORDER_CANCELED, clientOrderId, "status=" + canceled.getStatus());
        log.info("event=order_canceled client_order_id={} order_id={}", clientOrderId, canceled.getOrderId());
        return canceled;
    }

    public Optional<TradingOrder> findByClientOrderId(String clientOrderId) {
        return orderStore.getByClientOrderId(clientOrderId);
    }

    String createClientOrderId(String symbol, OrderSide side) {
        return symbol + "-" + side.wireValue() + "-" + clock.millis() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    BigDecimal computeQuantity(Signal signal, Ticker ticker) {
        double targetUsd = RiskGuards.computePositionUsd(
                signal.confidence(),
                riskProperties.maxPositionUsd(),
                riskProperties.minOrderNotionalUsd()
        );
        double quantity = Math.max(riskProperties.minOrderQuantity(), targetUsd / Math.max(ticker.last(), 1.0));
        if (!Double.isFinite(quantity) || quantity <= 0.0) {
            throw TradingApiException.invalidOrder("Computed order quantity is not positive: " + quantity);
        }
        return BigDecimal.valueOf(quantity).setScale(QUANTITY_SCALE, RoundingMode.DOWN);
    }
}

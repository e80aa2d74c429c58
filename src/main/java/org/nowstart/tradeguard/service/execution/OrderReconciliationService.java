package org.nowstart.tradeguard.service.execution;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradeguard.data.dto.ExchangeOrder;
import org.nowstart.tradeguard.data.dto.TradeOutcome;
import org.nowstart.tradeguard.data.entity.TradingOrder;
import org.nowstart.tradeguard.data.type.AuditEventType;
import org.nowstart.tradeguard.data.type.ExecutionMode;
import org.nowstart.tradeguard.data.type.OrderStatus;
import org.nowstart.tradeguard.repository.OrderStore;
import org.nowstart.tradeguard.service.audit.AuditTrailService;
import org.nowstart.tradeguard.service.exchange.ExchangeAdapter;
import org.nowstart.tradeguard.service.metrics.TradingMetrics;
import org.springframework.stereotype.Service;

/**
 * Brings locally open LIVE orders in line with the exchange. Orders still listed as open take
 * the listed state; the rest are looked up one by one. Newly filled orders are booked into the
 * position ledger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderReconciliationService {

    private final ExchangeAdapter exchangeAdapter;
    private final OrderStore orderStore;
    private final PositionLedgerService positionLedgerService;
    private final AuditTrailService auditTrailService;
    private final TradingMetrics tradingMetrics;

    /**
     * A failed lookup is logged and counted; the order stays open and is retried next pass.
     *
     * @return realized results of fills booked during this pass
     */
    public List<TradeOutcome> reconcile(List<String> symbols) {
        List<TradeOutcome> outcomes = new ArrayList<>();
        for (String symbol : symbols) {
            List<TradingOrder> localOpen = orderStore.findOpenOrders(ExecutionMode.LIVE, symbol);
            if (localOpen.isEmpty()) {
                continue;
            }

            Map<String, ExchangeOrder> remoteOpen;
            try {
                remoteOpen = exchangeAdapter.listOpenOrders(symbol).stream()
                        .filter(order -> order.orderId() != null)
                        .collect(Collectors.toMap(ExchangeOrder::orderId, Function.identity(), (first, second) -> first));
            } catch (RuntimeException e) {
                tradingMetrics.increment("reconciler.errors");
                log.warn("event=reconcile_list_failed symbol={} local_open={}", symbol, localOpen.size(), e);
                continue;
            }

            for (TradingOrder order : localOpen) {
                if (order.getOrderId() == null || order.getOrderId().isBlank()) {
                    log.warn("event=reconcile_skipped client_order_id={} reason=missing_exchange_id", order.getClientOrderId());
                    continue;
                }

                try {
                    ExchangeOrder latest = remoteOpen.containsKey(order.getOrderId())
                            ? remoteOpen.get(order.getOrderId())
                            : exchangeAdapter.getOrder(order.getOrderId(), symbol);
                    reconcileOrder(order, latest).ifPresent(outcomes::add);
                } catch (RuntimeException e) {
                    tradingMetrics.increment("reconciler.errors");
                    log.warn("event=reconcile_lookup_failed symbol={} client_order_id={} order_id={}",
                            symbol, order.getClientOrderId(), order.getOrderId(), e);
                }
            }
        }
        return outcomes;
    }

    private Optional<TradeOutcome> reconcileOrder(TradingOrder order, ExchangeOrder latest) {
        OrderStatus previousStatus = order.getStatus();
        BigDecimal filledQuantity = latest.filledQuantity() == null ? order.getFilledQuantity() : latest.filledQuantity();
        if (latest.status() == previousStatus && sameQuantity(order.getFilledQuantity(), filledQuantity)) {
            return Optional.empty();
        }

        order.setStatus(latest.status());
        order.setFilledQuantity(filledQuantity);
        if (latest.avgFillPrice() != null) {
            order.setAvgFillPrice(latest.avgFillPrice());
        }
        if (latest.reason() != null && !latest.reason().isBlank()) {
            order.setReason(latest.reason());
        }

        TradingOrder stored = orderStore.upsert(order);
        tradingMetrics.increment("reconciler.order_updated");
        auditTrailService.record(AuditEventType.ORDER_RECONCILED, stored.getClientOrderId(),
                "status=" + previousStatus + "->" + stored.getStatus() + " filled_qty=" + stored.getFilledQuantity());
        log.info("event=order_reconciled client_order_id={} order_id={} previous_status={} status={} filled_qty={}",
                stored.getClientOrderId(), stored.getOrderId(), previousStatus, stored.getStatus(), stored.getFilledQuantity());
        return positionLedgerService.apply(stored);
    }

    private boolean sameQuantity(BigDecimal left, BigDecimal right) {
        if (left == null || right == null) {
            return left == right;
        }
        return left.compareTo(right) == 0;
    }
}

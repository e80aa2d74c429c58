package org.nowstart.tradeguard.service.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.tradeguard.data.dto.ExchangeOrder;
import org.nowstart.tradeguard.data.dto.OrderRequest;
import org.nowstart.tradeguard.data.dto.Signal;
import org.nowstart.tradeguard.data.dto.SignalSubmission;
import org.nowstart.tradeguard.data.dto.Ticker;
import org.nowstart.tradeguard.data.entity.TradingOrder;
import org.nowstart.tradeguard.data.exception.TradingApiException;
import org.nowstart.tradeguard.data.type.AuditEventType;
import org.nowstart.tradeguard.data.type.ExecutionMode;
import org.nowstart.tradeguard.data.type.OrderSide;
import org.nowstart.tradeguard.data.type.OrderStatus;
import org.nowstart.tradeguard.data.type.SignalAction;
import org.nowstart.tradeguard.data.type.TradeOrderType;
import org.nowstart.tradeguard.repository.OrderStore;
import org.nowstart.tradeguard.service.alert.AlertService;
import org.nowstart.tradeguard.service.audit.AuditTrailService;
import org.nowstart.tradeguard.service.exchange.ExchangeAdapter;
import org.nowstart.tradeguard.service.metrics.PrometheusTradingMetrics;
import org.nowstart.tradeguard.service.metrics.TradingMetrics;
import org.nowstart.tradeguard.support.InMemoryOrderStore;
import org.nowstart.tradeguard.support.MutableClock;
import org.nowstart.tradeguard.support.TestProperties;

@ExtendWith(MockitoExtension.class)
class OrderManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Ticker TICKER = new Ticker("BTC-USD", 50000, 50010, 50000, 1000.0, NOW);
    private static final Signal BUY = new Signal(SignalAction.BUY, 0.5, "breakout");

    @Mock
    private AuditTrailService auditTrailService;
    @Mock
    private AlertService alertService;
    @Mock
    private ExchangeAdapter exchangeAdapter;

    private final MutableClock clock = new MutableClock(NOW);
    private final PrometheusTradingMetrics metrics = new PrometheusTradingMetrics();
    private final InMemoryOrderStore orderStore = new InMemoryOrderStore();

    @Test
    void submitSignal_holdTouchesNothing(@Mock OrderStore store, @Mock TradingMetrics tradingMetrics) {
        OrderManager manager = new OrderManager(new PaperBroker(20), store, TestProperties.risk(),
                tradingMetrics, auditTrailService, alertService, clock);

        Optional<TradingOrder> result = manager.submitSignal(new SignalSubmission("BTC-USD", Signal.hold("flat"), TICKER, "key-1"));

        assertThat(result).isEmpty();
        verifyNoInteractions(store, tradingMetrics, auditTrailService, alertService);
    }

    @Test
    void submitSignal_sameKeyTwice_placesOneOrder() {
        OrderManager manager = paperManager();
        SignalSubmission submission = new SignalSubmission("BTC-USD", BUY, TICKER, "BTC-USD-buy-1772366400000");

        TradingOrder first = manager.submitSignal(submission).orElseThrow();
        TradingOrder second = manager.submitSignal(submission).orElseThrow();

        assertThat(second).isSameAs(first);
        assertThat(second.getOrderId()).isEqualTo(first.getOrderId());
        assertThat(orderStore.size()).isEqualTo(1);
        assertThat(orderStore.upserts()).isEqualTo(1);
        assertThat(metrics.counter("orders.submitted")).isEqualTo(1.0);
        assertThat(metrics.counter("orders.idempotent_hit")).isEqualTo(1.0);
        verify(auditTrailService, times(1)).record(eq(AuditEventType.PAPER_ORDER_FILLED), eq(submission.idempotencyKey()), anyString());
    }

    @Test
    void submitSignal_paperBuy_fillsAndCarriesSignalReason() {
        OrderManager manager = paperManager();

        TradingOrder order = manager.submitSignal(new SignalSubmission("BTC-USD", BUY, TICKER, "key-1")).orElseThrow();

        assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(order.getMode()).isEqualTo(ExecutionMode.PAPER);
        assertThat(order.getSide()).isEqualTo(OrderSide.BUY);
        assertThat(order.getOrderType()).isEqualTo(TradeOrderType.MARKET);
        assertThat(order.getQuantity()).isEqualByComparingTo("0.0025");
        assertThat(order.getReason()).isEqualTo("breakout");
        assertThat(orderStore.getByClientOrderId("key-1")).containsSame(order);
        verify(alertService).notify(eq("Order submitted"), anyString(), anyMap());
    }

    @Test
    void submitSignal_withoutKey_generatesClientOrderId() {
        OrderManager manager = paperManager();

        TradingOrder order = manager.submitSignal(new SignalSubmission("BTC-USD", BUY, TICKER)).orElseThrow();

        assertThat(order.getClientOrderId()).matches("BTC-USD-buy-" + NOW.toEpochMilli() + "-[0-9a-f]{8}");
    }

    @Test
    void submitSignal_liveRoutesThroughExchange() {
        when(exchangeAdapter.placeOrder(any())).thenAnswer(invocation -> {
            OrderRequest request = invocation.getArgument(0);
            return new ExchangeOrder("ex-1", request.clientOrderId(), request.symbol(), request.side(), request.type(),
                    request.quantity(), null, OrderStatus.OPEN, BigDecimal.ZERO, null, null, NOW, NOW);
        });
        OrderManager manager = new OrderManager(new LiveBroker(exchangeAdapter), orderStore, TestProperties.risk(),
                metrics, auditTrailService, alertService, clock);

        TradingOrder order = manager.submitSignal(new SignalSubmission("BTC-USD", BUY, TICKER, "live-1")).orElseThrow();

        assertThat(order.getOrderId()).isEqualTo("ex-1");
        assertThat(order.getMode()).isEqualTo(ExecutionMode.LIVE);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.OPEN);
        verify(auditTrailService).record(eq(AuditEventType.LIVE_ORDER_SUBMITTED), eq("live-1"), anyString());
    }

    @Test
    void submitSignal_liveRejection_keepsExchangeReason() {
        when(exchangeAdapter.placeOrder(any())).thenAnswer(invocation -> {
            OrderRequest request = invocation.getArgument(0);
            return new ExchangeOrder("ex-3", request.clientOrderId(), request.symbol(), request.side(), request.type(),
                    request.quantity(), null, OrderStatus.REJECTED, BigDecimal.ZERO, null, "insufficient balance", NOW, NOW);
        });
        OrderManager manager = new OrderManager(new LiveBroker(exchangeAdapter), orderStore, TestProperties.risk(),
                metrics, auditTrailService, alertService, clock);

        TradingOrder order = manager.submitSignal(new SignalSubmission("BTC-USD", BUY, TICKER, "live-3")).orElseThrow();

        assertThat(order.getStatus()).isEqualTo(OrderStatus.REJECTED);
        assertThat(order.getReason()).isEqualTo("insufficient balance");
    }

    @Test
    void submitSignal_liveExchangeFailure_storesNothing() {
        when(exchangeAdapter.placeOrder(any())).thenThrow(new IllegalStateException("gateway down"));
        OrderManager manager = new OrderManager(new LiveBroker(exchangeAdapter), orderStore, TestProperties.risk(),
                metrics, auditTrailService, alertService, clock);

        assertThatThrownBy(() -> manager.submitSignal(new SignalSubmission("BTC-USD", BUY, TICKER, "live-2")))
                .isInstanceOf(IllegalStateException.class);
        assertThat(orderStore.size()).isZero();
        verify(auditTrailService, never()).record(any(), anyString(), anyString());
    }

    @Test
    void computeQuantity_scalesNotionalByLastPrice() {
        OrderManager manager = paperManager();

        assertThat(manager.computeQuantity(new Signal(SignalAction.BUY, 1.0, "x"), TICKER)).isEqualByComparingTo("0.005");
        assertThat(manager.computeQuantity(new Signal(SignalAction.BUY, 0.01, "x"), TICKER)).isEqualByComparingTo("0.0005");
        assertThat(manager.computeQuantity(BUY, TICKER).scale()).isEqualTo(12);
    }

    @Test
    void computeQuantity_nonFinite_isInvalidOrder() {
        OrderManager manager = paperManager();

        assertThatThrownBy(() -> manager.computeQuantity(new Signal(SignalAction.BUY, Double.NaN, "x"), TICKER))
                .isInstanceOfSatisfying(TradingApiException.class, e -> assertThat(e.getCode()).isEqualTo("invalid_order"));
    }

    @Test
    void cancel_unknownOrder_isNotFound() {
        OrderManager manager = paperManager();

        assertThatThrownBy(() -> manager.cancel("missing"))
                .isInstanceOfSatisfying(TradingApiException.class, e -> assertThat(e.getCode()).isEqualTo("order_not_found"));
    }

    @Test
    void cancel_orderFromOtherMode_isConflict() {
        orderStore.upsert(order("live-1", ExecutionMode.LIVE, OrderStatus.OPEN));
        OrderManager manager = paperManager();

        assertThatThrownBy(() -> manager.cancel("live-1"))
                .isInstanceOfSatisfying(TradingApiException.class, e -> assertThat(e.getCode()).isEqualTo("mode_mismatch"));
    }

    @Test
    void cancel_pendingPaperOrder_isCanceledAndAudited() {
        orderStore.upsert(order("paper-1", ExecutionMode.PAPER, OrderStatus.PENDING));
        OrderManager manager = paperManager();

        TradingOrder canceled = manager.cancel("paper-1");

        assertThat(canceled.getStatus()).isEqualTo(OrderStatus.CANCELED);
        assertThat(orderStore.getByClientOrderId("paper-1")).get()
                .extracting(TradingOrder::getStatus).isEqualTo(OrderStatus.CANCELED);
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(auditTrailService).record(eq(AuditEventType.ORDER_CANCELED), eq("paper-1"), payload.capture());
        assertThat(payload.getValue()).isEqualTo("status=CANCELED");
    }

    private OrderManager paperManager() {
        return new OrderManager(new PaperBroker(20), orderStore, TestProperties.risk(), metrics,
                auditTrailService, alertService, clock);
    }

    private static TradingOrder order(String clientOrderId, ExecutionMode mode, OrderStatus status) {
        return TradingOrder.builder()
                .clientOrderId(clientOrderId)
                .orderId("id-" + clientOrderId)
                .symbol("BTC-USD")
                .side(OrderSide.BUY)
                .orderType(TradeOrderType.MARKET)
                .mode(mode)
                .quantity(new BigDecimal("0.001"))
                .status(status)
                .filledQuantity(BigDecimal.ZERO)
                .build();
    }
}

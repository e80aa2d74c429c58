package org.nowstart.tradeguard.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradeguard.data.dto.AccountSnapshot;
import org.nowstart.tradeguard.data.dto.Anomaly;
import org.nowstart.tradeguard.data.dto.Candle;
import org.nowstart.tradeguard.data.dto.RiskDecision;
import org.nowstart.tradeguard.data.dto.Signal;
import org.nowstart.tradeguard.data.dto.SignalSubmission;
import org.nowstart.tradeguard.data.dto.Ticker;
import org.nowstart.tradeguard.data.dto.TradeOutcome;
import org.nowstart.tradeguard.data.entity.TradingOrder;
import org.nowstart.tradeguard.data.property.RiskProperties;
import org.nowstart.tradeguard.data.property.TradingProperties;
import org.nowstart.tradeguard.data.type.AnomalySeverity;
import org.nowstart.tradeguard.data.type.ExecutionMode;
import org.nowstart.tradeguard.data.type.OrderSide;
import org.nowstart.tradeguard.service.alert.AlertService;
import org.nowstart.tradeguard.service.anomaly.AnomalyDetector;
import org.nowstart.tradeguard.service.exchange.ExchangeAdapter;
import org.nowstart.tradeguard.service.execution.AccountSnapshotService;
import org.nowstart.tradeguard.service.execution.EquityWatermarkService;
import org.nowstart.tradeguard.service.execution.OrderManager;
import org.nowstart.tradeguard.service.execution.OrderReconciliationService;
import org.nowstart.tradeguard.service.execution.PositionLedgerService;
import org.nowstart.tradeguard.service.killswitch.KillSwitch;
import org.nowstart.tradeguard.service.metrics.TradingMetrics;
import org.nowstart.tradeguard.service.risk.RiskEvaluationService;
import org.nowstart.tradeguard.service.risk.RiskGuards;
import org.nowstart.tradeguard.service.signal.SignalProducer;
import org.springframework.stereotype.Service;

/**
 * One pass over the configured symbols: market data, anomaly and guard checks, kill switch
 * feeds, live order reconciliation, strategy signal, risk evaluation, idempotent submission and position booking.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingCycleService {

    private final TradingProperties tradingProperties;
    private final RiskProperties riskProperties;
    private final ExchangeAdapter exchangeAdapter;
    private final AnomalyDetector anomalyDetector;
    private final KillSwitch killSwitch;
    private final AccountSnapshotService accountSnapshotService;
    private final EquityWatermarkService equityWatermarkService;
    private final SignalProducer signalProducer;
    private final RiskEvaluationService riskEvaluationService;
    private final OrderManager orderManager;
    private final PositionLedgerService positionLedgerService;
    private final OrderReconciliationService orderReconciliationService;
    private final TradingMetrics tradingMetrics;
    private final AlertService alertService;
    private final Clock clock;

    public void runOnce() {
        Instant startedAt = clock.instant();
        List<String> symbols = tradingProperties.symbols().stream()
                .map(String::trim)
                .filter(symbol -> !symbol.isBlank())
                .distinct()
                .toList();

        if (orderManager.mode() == ExecutionMode.LIVE) {
            try {
                orderReconciliationService.reconcile(symbols).forEach(this::recordOutcome);
            } catch (Exception e) {
                tradingMetrics.increment("reconciler.errors");
                log.error("event=reconcile_failed", e);
            }
        }

        for (String symbol : symbols) {
            try {
                evaluateSymbol(symbol);
            } catch (Exception e) {
                tradingMetrics.increment("cycle.symbol_failed");
                log.error("event=cycle_symbol_failed symbol={}", symbol, e);
            }
        }

        tradingMetrics.increment("cycle.runs");
        tradingMetrics.observe("cycle.duration_ms", Duration.between(startedAt, clock.instant()).toMillis());
    }

    /**
     * Manual entry point: the same evaluation and submission path as the scheduled cycle.
     */
    public SignalResult executeSignal(String symbol, Signal signal, String idempotencyKey) {
        Ticker ticker = exchangeAdapter.getTicker(symbol);
        AccountSnapshot snapshot = accountSnapshotService.snapshot(Map.of(symbol, ticker.last()));
        return execute(symbol, signal, ticker, snapshot, idempotencyKey);
    }

    private void evaluateSymbol(String symbol) {
        Ticker ticker = exchangeAdapter.getTicker(symbol);
        List<Candle> candles = exchangeAdapter.getCandles(symbol, tradingProperties.candleInterval(), tradingProperties.candleCount());

        reportAnomalies(symbol, anomalyDetector.checkCandles(candles));
        reportAnomalies(symbol, anomalyDetector.checkTicker(ticker));

        double spreadBps = RiskGuards.computeSpreadBps(ticker);
        double slippageBps = RiskGuards.estimateSlippageBps(ticker);
        if (spreadBps > riskProperties.maxSpreadBps() || slippageBps > riskProperties.maxSlippageBps()) {
            log.warn("event=execution_quality_breach symbol={} spread_bps={} slippage_bps={}", symbol, spreadBps, slippageBps);
            killSwitch.recordSpreadViolation();
        }

        AccountSnapshot snapshot = accountSnapshotService.snapshot(Map.of(symbol, ticker.last()));
        double equity = snapshot.equityUsd();
        double peak = equityWatermarkService.update(equity);
        tradingMetrics.gauge("account.equity_usd", equity);
        killSwitch.checkDrawdown(equity, peak);

        Signal signal = signalProducer.produce(symbol, candles, ticker, snapshot);
        Instant signalTime = candles.isEmpty() ? ticker.time() : candles.get(candles.size() - 1).time();
        String idempotencyKey = signal.action().toSide()
                .map(side -> cycleKey(symbol, side, signalTime))
                .orElse(null);

        SignalResult result = execute(symbol, signal, ticker, snapshot, idempotencyKey);
        log.info("event=cycle_symbol symbol={} action={} confidence={} allowed={} blocked_by={} order={}",
                symbol,
                signal.action(),
                signal.confidence(),
                result.decision().allowed(),
                result.decision().blockedBy() == null ? "none" : result.decision().blockedBy().code(),
                result.order().map(TradingOrder::getClientOrderId).orElse("none"));
    }

    private SignalResult execute(String symbol, Signal signal, Ticker ticker, AccountSnapshot snapshot, String idempotencyKey) {
        RiskDecision decision = riskEvaluationService.evaluate(symbol, signal, snapshot, ticker, clock.instant());
        if (!decision.allowed()) {
            return new SignalResult(decision, Optional.empty());
        }

        Optional<TradingOrder> order = orderManager.submitSignal(new SignalSubmission(symbol, signal, ticker, idempotencyKey));
        order.flatMap(positionLedgerService::apply).ifPresent(this::recordOutcome);
        return new SignalResult(decision, order);
    }

    private void recordOutcome(TradeOutcome outcome) {
        tradingMetrics.increment(outcome.won() ? "trades.won" : "trades.lost");
        log.info("event=trade_closed symbol={} client_order_id={} closed_qty={} realized_pnl={} position_closed={}",
                outcome.symbol(), outcome.clientOrderId(), outcome.closedQuantity(), outcome.realizedPnl(), outcome.positionClosed());
        killSwitch.recordTradeResult(outcome.won());
    }

    private void reportAnomalies(String symbol, List<Anomaly> anomalies) {
        for (Anomaly anomaly : anomalies) {
            tradingMetrics.increment("anomalies." + anomaly.type().metricName());
            log.warn("event=anomaly symbol={} type={} severity={} value={} threshold={} message=\"{}\"",
                    symbol, anomaly.type(), anomaly.severity(), anomaly.value(), anomaly.threshold(), anomaly.message());
            if (anomaly.severity() == AnomalySeverity.HIGH) {
                alertService.notify(
                        "Market anomaly on " + symbol,
                        anomaly.message(),
                        Map.of("type", anomaly.type(), "value", anomaly.value(), "threshold", anomaly.threshold())
                );
            }
        }
    }

    static String cycleKey(String symbol, OrderSide side, Instant signalTime) {
        return symbol + "-" + side.wireValue() + "-" + signalTime.toEpochMilli();
    }

    public record SignalResult(
            RiskDecision decision,
            Optional<TradingOrder> order
    ) {
    }
}

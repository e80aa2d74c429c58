package org.nowstart.tradeguard.service.risk;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradeguard.data.dto.AccountSnapshot;
import org.nowstart.tradeguard.data.dto.Position;
import org.nowstart.tradeguard.data.dto.RiskDecision;
import org.nowstart.tradeguard.data.dto.Signal;
import org.nowstart.tradeguard.data.dto.Ticker;
import org.nowstart.tradeguard.data.property.RiskProperties;
import org.nowstart.tradeguard.data.property.TradingProperties;
import org.nowstart.tradeguard.data.type.ExecutionMode;
import org.nowstart.tradeguard.data.type.RiskBlockCode;
import org.nowstart.tradeguard.data.type.SignalAction;
import org.nowstart.tradeguard.service.killswitch.KillSwitch;
import org.nowstart.tradeguard.service.metrics.TradingMetrics;
import org.springframework.stereotype.Service;

/**
 * Runs the guards in a fixed order and stops at the first one that fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskEvaluationService {

    private final RiskProperties riskProperties;
    private final TradingProperties tradingProperties;
    private final KillSwitch killSwitch;
    private final TradingMetrics tradingMetrics;

    public RiskDecision evaluate(String symbol, Signal signal, AccountSnapshot snapshot, Ticker ticker, Instant now) {
        RiskDecision decision = decide(symbol, signal, snapshot, ticker, now);
        if (!decision.allowed() && decision.blockedBy() != null) {
            tradingMetrics.increment("risk.blocked." + decision.blockedBy().code());
            log.warn("event=risk_blocked symbol={} action={} blocked_by={} reason=\"{}\"",
                    symbol, signal.action(), decision.blockedBy().code(), decision.reason());
        } else if (!decision.allowed()) {
            log.info("event=risk_rejected symbol={} action={} reason=\"{}\"", symbol, signal.action(), decision.reason());
        }
        return decision;
    }

    private RiskDecision decide(String symbol, Signal signal, AccountSnapshot snapshot, Ticker ticker, Instant now) {
        if (killSwitch.isTriggered()) {
            return RiskDecision.block(RiskBlockCode.KILL_SWITCH, "Kill switch triggered: " + killSwitch.getState().reason());
        }

        if (tradingProperties.executionMode() == ExecutionMode.LIVE && !tradingProperties.allowLiveTrading()) {
            return RiskDecision.block(RiskBlockCode.LIVE_DISABLED, "Live trading disabled by config");
        }

        if (signal.action() == SignalAction.HOLD) {
            return RiskDecision.reject("No action signal");
        }

        if (!tradingProperties.allowedPairs().isEmpty() && !tradingProperties.allowedPairs().contains(symbol)) {
            return RiskDecision.block(RiskBlockCode.PAIR_NOT_WHITELISTED, "Pair " + symbol + " not in whitelist");
        }

        if (signal.action() == SignalAction.SELL) {
            Optional<Position> held = snapshot.findPosition(symbol);
            if (held.isEmpty() || held.get().quantity() <= 0.0) {
                return RiskDecision.reject("No position to sell");
            }
        }

        if (RiskGuards.exceedsMaxDailyLoss(snapshot, riskProperties.maxDailyLossUsd())) {
            return RiskDecision.block(RiskBlockCode.MAX_DAILY_LOSS, "Max daily loss reached");
        }

        if (RiskGuards.exceedsMaxOpenPositions(snapshot, riskProperties.maxOpenPositions(), symbol)) {
            return RiskDecision.block(RiskBlockCode.MAX_OPEN_POSITIONS, "Max open positions reached");
        }

        double incomingOrderUsd = signal.action() == SignalAction.BUY
                ? RiskGuards.computePositionUsd(signal.confidence(), riskProperties.maxPositionUsd(), riskProperties.minOrderNotionalUsd())
                : 0.0;
        if (RiskGuards.exceedsMaxPositionUsd(snapshot, symbol, riskProperties.maxPositionUsd(), ticker.last(), incomingOrderUsd)) {
            return RiskDecision.block(RiskBlockCode.MAX_POSITION_USD, "Max position exceeded");
        }

        Instant stopOutAt = snapshot.lastStopOutAtBySymbol().get(symbol);
        if (stopOutAt != null && Duration.between(stopOutAt, now).compareTo(riskProperties.cooldown()) < 0) {
            return RiskDecision.block(RiskBlockCode.COOLDOWN, "Cooldown active after stop-out");
        }

        if (ticker.volume24h() != null && ticker.volume24h() < riskProperties.minVolume()) {
            return RiskDecision.block(RiskBlockCode.MIN_VOLUME, "Volume below minimum guard");
        }

        if (RiskGuards.computeSpreadBps(ticker) > riskProperties.maxSpreadBps()) {
            return RiskDecision.block(RiskBlockCode.SPREAD_GUARD, "Spread guard blocked");
        }

        if (RiskGuards.estimateSlippageBps(ticker) > riskProperties.maxSlippageBps()) {
            return RiskDecision.block(RiskBlockCode.SLIPPAGE_GUARD, "Slippage guard blocked");
        }

        return RiskDecision.allow("All risk checks passed");
    }
}

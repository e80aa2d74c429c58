package org.nowstart.tradeguard.config;

import java.time.Clock;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradeguard.data.property.ExchangeProperties;
import org.nowstart.tradeguard.data.property.KillSwitchProperties;
import org.nowstart.tradeguard.data.property.RiskProperties;
import org.nowstart.tradeguard.data.property.TradingProperties;
import org.nowstart.tradeguard.data.type.AuditEventType;
import org.nowstart.tradeguard.data.type.ExecutionMode;
import org.nowstart.tradeguard.repository.KillSwitchStateStore;
import org.nowstart.tradeguard.service.alert.AlertService;
import org.nowstart.tradeguard.service.audit.AuditTrailService;
import org.nowstart.tradeguard.service.exchange.ExchangeAdapter;
import org.nowstart.tradeguard.service.execution.Broker;
import org.nowstart.tradeguard.service.execution.LiveBroker;
import org.nowstart.tradeguard.service.execution.PaperBroker;
import org.nowstart.tradeguard.service.killswitch.KillSwitch;
import org.nowstart.tradeguard.service.metrics.TradingMetrics;
import org.nowstart.tradeguard.service.risk.CircuitBreaker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Stateful singletons of the trading core. None of these are refresh scoped: a refresh must
 * not drop a triggered kill switch or an open breaker.
 */
@Slf4j
@Configuration
public class TradingCoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CircuitBreaker exchangeCircuitBreaker(ExchangeProperties exchangeProperties) {
        return new CircuitBreaker(exchangeProperties.circuitMaxFailures(), exchangeProperties.circuitResetTimeout());
    }

    @Bean
    public KillSwitch killSwitch(
            KillSwitchProperties killSwitchProperties,
            KillSwitchStateStore killSwitchStateStore,
            TradingMetrics tradingMetrics,
            AlertService alertService,
            AuditTrailService auditTrailService,
            Clock clock
    ) {
        KillSwitch killSwitch = new KillSwitch(killSwitchProperties, tradingMetrics, clock);
        killSwitch.init(killSwitchStateStore);
        killSwitch.setPersistHook(state -> killSwitchStateStore.save(KillSwitch.STATE_ID, state));
        killSwitch.addTriggerListener(state -> auditTrailService.record(
                AuditEventType.KILL_SWITCH_TRIGGERED,
                KillSwitch.STATE_ID,
                "reason=" + state.reason()
        ));
        killSwitch.addTriggerListener(state -> alertService.notify(
                "Kill switch triggered",
                state.reason(),
                Map.of(
                        "triggeredAt", String.valueOf(state.triggeredAt()),
                        "consecutiveLosses", state.consecutiveLosses()
                )
        ));
        return killSwitch;
    }

    @Bean
    public Broker broker(TradingProperties tradingProperties, RiskProperties riskProperties, ExchangeAdapter exchangeAdapter) {
        if (tradingProperties.executionMode() == ExecutionMode.LIVE) {
            log.warn("event=broker_selected mode=LIVE allow_live_trading={}", tradingProperties.allowLiveTrading());
            return new LiveBroker(exchangeAdapter);
        }

        log.info("event=broker_selected mode=PAPER max_slippage_bps={}", riskProperties.maxSlippageBps());
        return new PaperBroker(riskProperties.maxSlippageBps());
    }
}

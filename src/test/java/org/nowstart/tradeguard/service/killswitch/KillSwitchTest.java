package org.nowstart.tradeguard.service.killswitch;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.nowstart.tradeguard.data.dto.KillSwitchSnapshot;
import org.nowstart.tradeguard.service.metrics.PrometheusTradingMetrics;
import org.nowstart.tradeguard.support.InMemoryKillSwitchStateStore;
import org.nowstart.tradeguard.support.MutableClock;
import org.nowstart.tradeguard.support.TestProperties;

class KillSwitchTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private PrometheusTradingMetrics metrics;
    private InMemoryKillSwitchStateStore store;
    private KillSwitch killSwitch;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        metrics = new PrometheusTradingMetrics();
        store = new InMemoryKillSwitchStateStore();
        killSwitch = newKillSwitch();
        killSwitch.init(store);
        killSwitch.setPersistHook(state -> store.save(KillSwitch.STATE_ID, state));
    }

    @Test
    void init_withoutStoredRow_createsArmedRow() {
        assertThat(killSwitch.isTriggered()).isFalse();
        assertThat(store.load(KillSwitch.STATE_ID)).contains(KillSwitchSnapshot.armed());
        assertThat(metrics.gaugeValue("kill_switch.active")).isEqualTo(0.0);
    }

    @Test
    void recordTradeResult_triggersOnlyAtLossStreakThreshold() {
        killSwitch.recordTradeResult(false);
        killSwitch.recordTradeResult(false);

        assertThat(killSwitch.isTriggered()).isFalse();
        assertThat(killSwitch.getState().consecutiveLosses()).isEqualTo(2);

        killSwitch.recordTradeResult(false);

        assertThat(killSwitch.isTriggered()).isTrue();
        assertThat(killSwitch.getState().reason()).isEqualTo("3 consecutive losses");
        assertThat(killSwitch.getState().triggeredAt()).isEqualTo(T0);
        assertThat(metrics.counter("kill_switch.triggered")).isEqualTo(1.0);
        assertThat(metrics.gaugeValue("kill_switch.active")).isEqualTo(1.0);
    }

    @Test
    void recordTradeResult_winResetsStreak() {
        killSwitch.recordTradeResult(false);
        killSwitch.recordTradeResult(false);
        killSwitch.recordTradeResult(true);
        killSwitch.recordTradeResult(false);
        killSwitch.recordTradeResult(false);

        assertThat(killSwitch.isTriggered()).isFalse();
        assertThat(killSwitch.getState().consecutiveLosses()).isEqualTo(2);
    }

    @Test
    void checkDrawdown_justBelowThreshold_staysArmed() {
        killSwitch.checkDrawdown(9501, 10000);

        assertThat(killSwitch.isTriggered()).isFalse();
    }

    @Test
    void checkDrawdown_atThreshold_triggers() {
        killSwitch.checkDrawdown(9500, 10000);

        assertThat(killSwitch.isTriggered()).isTrue();
        assertThat(killSwitch.getState().reason()).isEqualTo("Drawdown 5.00% exceeds 5.0% threshold");
    }

    @Test
    void checkDrawdown_nonPositivePeak_isNoOp() {
        killSwitch.checkDrawdown(-100, 0);
        killSwitch.checkDrawdown(-100, -50);

        assertThat(killSwitch.isTriggered()).isFalse();
    }

    @Test
    void trigger_secondTriggerKeepsFirstReasonAndTime() {
        killSwitch.trigger("first");
        clock.advance(Duration.ofMinutes(1));
        killSwitch.trigger("second");
        killSwitch.checkApiErrors(100);

        assertThat(killSwitch.getState().reason()).isEqualTo("first");
        assertThat(killSwitch.getState().triggeredAt()).isEqualTo(T0);
        assertThat(metrics.counter("kill_switch.triggered")).isEqualTo(1.0);
    }

    @Test
    void recordSpreadViolation_triggersWhenLimitReachedInsideWindow() {
        killSwitch.recordSpreadViolation();
        clock.advance(Duration.ofMinutes(4));
        killSwitch.recordSpreadViolation();

        assertThat(killSwitch.isTriggered()).isFalse();

        clock.advance(Duration.ofMinutes(4));
        killSwitch.recordSpreadViolation();

        assertThat(killSwitch.isTriggered()).isTrue();
        assertThat(killSwitch.getState().reason()).isEqualTo("3 spread/slippage violations in 10 minutes");
    }

    @Test
    void recordSpreadViolation_prunesViolationsOutsideWindow() {
        killSwitch.recordSpreadViolation();
        clock.advance(Duration.ofMinutes(6));
        killSwitch.recordSpreadViolation();
        clock.advance(Duration.ofMinutes(6));
        killSwitch.recordSpreadViolation();

        assertThat(killSwitch.isTriggered()).isFalse();
        assertThat(killSwitch.getState().spreadViolations()).hasSize(2);
    }

    @Test
    void checkApiErrors_triggersAtThreshold() {
        killSwitch.checkApiErrors(4);
        assertThat(killSwitch.isTriggered()).isFalse();

        killSwitch.checkApiErrors(5);
        assertThat(killSwitch.isTriggered()).isTrue();
        assertThat(killSwitch.getState().reason()).isEqualTo("API error count 5 exceeds threshold 5");
    }

    @Test
    void reset_clearsEveryField() {
        killSwitch.recordSpreadViolation();
        killSwitch.recordTradeResult(false);
        killSwitch.trigger("manual");

        killSwitch.reset();

        KillSwitchSnapshot state = killSwitch.getState();
        assertThat(state.triggered()).isFalse();
        assertThat(state.reason()).isNull();
        assertThat(state.triggeredAt()).isNull();
        assertThat(state.consecutiveLosses()).isZero();
        assertThat(state.spreadViolations()).isEmpty();
        assertThat(metrics.counter("kill_switch.reset")).isEqualTo(1.0);
        assertThat(metrics.gaugeValue("kill_switch.active")).isEqualTo(0.0);
    }

    @Test
    void persistThenReload_restoresTriggeredState() {
        killSwitch.recordSpreadViolation();
        killSwitch.recordTradeResult(false);
        clock.advance(Duration.ofSeconds(30));
        killSwitch.trigger("operator halt");
        KillSwitchSnapshot before = killSwitch.getState();
        killSwitch.persist(store);

        KillSwitch restarted = newKillSwitch();
        restarted.init(store);

        assertThat(restarted.isTriggered()).isTrue();
        assertThat(restarted.getState()).isEqualTo(before);
        assertThat(metrics.gaugeValue("kill_switch.active")).isEqualTo(1.0);
    }

    @Test
    void mutations_invokePersistHookWithCurrentState() {
        List<KillSwitchSnapshot> persisted = new ArrayList<>();
        killSwitch.setPersistHook(persisted::add);

        killSwitch.recordTradeResult(false);
        killSwitch.recordSpreadViolation();
        killSwitch.trigger("halt");
        killSwitch.reset();

        assertThat(persisted).hasSize(4);
        assertThat(persisted.get(0).consecutiveLosses()).isEqualTo(1);
        assertThat(persisted.get(1).spreadViolations()).containsExactly(T0);
        assertThat(persisted.get(2).triggered()).isTrue();
        assertThat(persisted.get(3)).isEqualTo(KillSwitchSnapshot.armed());
    }

    @Test
    void triggerListeners_notifiedOnceOnTransition() {
        List<KillSwitchSnapshot> notified = new ArrayList<>();
        killSwitch.addTriggerListener(notified::add);
        killSwitch.addTriggerListener(state -> {
            throw new IllegalStateException("alert channel down");
        });

        killSwitch.recordTradeResult(false);
        killSwitch.recordTradeResult(false);
        killSwitch.recordTradeResult(false);
        killSwitch.recordTradeResult(false);
        killSwitch.trigger("again");

        assertThat(notified).hasSize(1);
        assertThat(notified.get(0).reason()).isEqualTo("3 consecutive losses");
        assertThat(killSwitch.isTriggered()).isTrue();
    }

    private KillSwitch newKillSwitch() {
        return new KillSwitch(TestProperties.killSwitch(), metrics, clock);
    }
}

package org.nowstart.tradeguard.service.killswitch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradeguard.data.dto.KillSwitchSnapshot;
import org.nowstart.tradeguard.data.property.KillSwitchProperties;
import org.nowstart.tradeguard.repository.KillSwitchStateStore;
import org.nowstart.tradeguard.service.metrics.TradingMetrics;

/**
 * Process-wide trading halt. Armed until one of the loss streak, drawdown, spread
 * violation or API error thresholds is crossed; then triggered until {@link #reset()}.
 *
 * <p>The first trigger wins: later triggers keep the original reason and time. Every
 * state change is handed to the persist hook before the method returns, so a restart
 * followed by {@link #init(KillSwitchStateStore)} restores the halt.
 *
 * <p>Not thread-safe. The trading loop is the only writer.
 */
@Slf4j
public class KillSwitch {

    public static final String STATE_ID = "global";

    private final KillSwitchProperties properties;
    private final TradingMetrics metrics;
    private final Clock clock;
    private final List<Consumer<KillSwitchSnapshot>> triggerListeners = new ArrayList<>();

    private Consumer<KillSwitchSnapshot> persistHook = snapshot -> { };

    private boolean triggered;
    private String reason;
    private Instant triggeredAt;
    private int consecutiveLosses;
    private final Deque<Instant> spreadViolations = new ArrayDeque<>();

    public KillSwitch(KillSwitchProperties properties, TradingMetrics metrics, Clock clock) {
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Hydrates from the store, or writes a fresh armed row when none exists yet.
     */
    public void init(KillSwitchStateStore store) {
        Optional<KillSwitchSnapshot> stored = store.load(STATE_ID);
        if (stored.isPresent()) {
            apply(stored.get());
        } else {
            apply(KillSwitchSnapshot.armed());
            store.save(STATE_ID, getState());
        }

        if (triggered) {
            log.warn("event=kill_switch_hydrated triggered=true reason=\"{}\" triggered_at={}", reason, triggeredAt);
        } else {
            log.info("event=kill_switch_hydrated triggered=false consecutive_losses={} spread_violations={}",
                    consecutiveLosses, spreadViolations.size());
        }
        publishGauge();
    }

    public void persist(KillSwitchStateStore store) {
        store.save(STATE_ID, getState());
    }

    public void setPersistHook(Consumer<KillSwitchSnapshot> persistHook) {
        this.persistHook = Objects.requireNonNull(persistHook, "persistHook");
    }

    public void addTriggerListener(Consumer<KillSwitchSnapshot> listener) {
        triggerListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean isTriggered() {
        return triggered;
    }

    public KillSwitchSnapshot getState() {
        return new KillSwitchSnapshot(triggered, reason, triggeredAt, consecutiveLosses, List.copyOf(spreadViolations));
    }

    /**
     * Triggers with the given reason. No-op while already triggered.
     */
    public void trigger(String reason) {
        if (triggerInternal(reason)) {
            afterTrigger();
        }
    }

    public void reset() {
        triggered = false;
        reason = null;
        triggeredAt = null;
        consecutiveLosses = 0;
        spreadViolations.clear();
        log.info("event=kill_switch_reset");
        metrics.increment("kill_switch.reset");
        publishGauge();
        emitPersist();
    }

    /**
     * A win always clears the loss streak; a loss extends it and may trigger.
     */
    public void recordTradeResult(boolean won) {
        boolean newlyTriggered = false;
        if (won) {
            consecutiveLosses = 0;
        } else {
            consecutiveLosses++;
            if (consecutiveLosses >= properties.maxConsecutiveLosses()) {
                newlyTriggered = triggerInternal(consecutiveLosses + " consecutive losses");
            }
        }

        emitPersist();
        if (newlyTriggered) {
            notifyTriggerListeners();
        }
    }

    public void checkDrawdown(double currentEquity, double peakEquity) {
        if (!Double.isFinite(currentEquity) || !Double.isFinite(peakEquity) || peakEquity <= 0.0) {
            return;
        }

        double drawdownPct = (peakEquity - currentEquity) * 100.0 / peakEquity;
        if (drawdownPct >= properties.maxDrawdownPct()) {
            trigger(String.format(
                    Locale.ROOT,
                    "Drawdown %.2f%% exceeds %s%% threshold",
                    drawdownPct,
                    properties.maxDrawdownPct()
            ));
        }
    }

    public void recordSpreadViolation() {
        Instant now = clock.instant();
        spreadViolations.addLast(now);
        int recent = pruneSpreadViolations(now);

        boolean newlyTriggered = false;
        if (recent >= properties.spreadViolationsLimit()) {
            newlyTriggered = triggerInternal(String.format(
                    Locale.ROOT,
                    "%d spread/slippage violations in %d minutes",
                    recent,
                    properties.spreadViolationsWindow().toMinutes()
            ));
        }

        emitPersist();
        if (newlyTriggered) {
            notifyTriggerListeners();
        }
    }

    /**
     * Compares an externally tracked error count, such as the circuit breaker failure count.
     */
    public void checkApiErrors(int errorCount) {
        if (errorCount >= properties.apiErrorThreshold()) {
            trigger("API error count " + errorCount + " exceeds threshold " + properties.apiErrorThreshold());
        }
    }

    /**
     * Violations still inside the trailing window, after pruning older entries.
     */
    public int recentSpreadViolations() {
        return pruneSpreadViolations(clock.instant());
    }

    private int pruneSpreadViolations(Instant now) {
        Duration window = properties.spreadViolationsWindow();
        while (!spreadViolations.isEmpty()
                && Duration.between(spreadViolations.peekFirst(), now).compareTo(window) >= 0) {
            spreadViolations.removeFirst();
        }
        return spreadViolations.size();
    }

    private boolean triggerInternal(String reason) {
        if (triggered) {
            return false;
        }

        triggered = true;
        this.reason = reason;
        triggeredAt = clock.instant();
        log.error("event=kill_switch_triggered reason=\"{}\" triggered_at={}", reason, triggeredAt);
        metrics.increment("kill_switch.triggered");
        publishGauge();
        return true;
    }

    private void afterTrigger() {
        emitPersist();
        notifyTriggerListeners();
    }

    private void notifyTriggerListeners() {
        KillSwitchSnapshot snapshot = getState();
        for (Consumer<KillSwitchSnapshot> listener : triggerListeners) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException e) {
                log.error("event=kill_switch_listener_failed reason=\"{}\"", snapshot.reason(), e);
            }
        }
    }

    private void emitPersist() {
        persistHook.accept(getState());
    }

    private void apply(KillSwitchSnapshot snapshot) {
        triggered = snapshot.triggered();
        reason = snapshot.reason();
        triggeredAt = snapshot.triggeredAt();
        consecutiveLosses = snapshot.consecutiveLosses();
        spreadViolations.clear();
        spreadViolations.addAll(snapshot.spreadViolations());
    }

    private void publishGauge() {
        metrics.gauge("kill_switch.active", triggered ? 1.0 : 0.0);
    }
}

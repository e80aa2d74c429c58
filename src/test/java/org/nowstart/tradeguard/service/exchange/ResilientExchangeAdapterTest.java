package org.nowstart.tradeguard.service.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.tradeguard.data.dto.Ticker;
import org.nowstart.tradeguard.data.exception.ExchangeUnavailableException;
import org.nowstart.tradeguard.service.killswitch.KillSwitch;
import org.nowstart.tradeguard.service.metrics.PrometheusTradingMetrics;
import org.nowstart.tradeguard.service.risk.CircuitBreaker;
import org.nowstart.tradeguard.support.InMemoryKillSwitchStateStore;
import org.nowstart.tradeguard.support.MutableClock;
import org.nowstart.tradeguard.support.TestProperties;

@ExtendWith(MockitoExtension.class)
class ResilientExchangeAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Ticker TICKER = new Ticker("BTC-USD", 50000, 50010, 50005, null, NOW);

    @Mock
    private ExchangeAdapter delegate;

    private final MutableClock clock = new MutableClock(NOW);
    private final PrometheusTradingMetrics metrics = new PrometheusTradingMetrics();
    private KillSwitch killSwitch;

    @BeforeEach
    void setUp() {
        killSwitch = new KillSwitch(TestProperties.killSwitch(), metrics, clock);
        killSwitch.init(new InMemoryKillSwitchStateStore());
    }

    @Test
    void getTicker_success_resetsBreakerAndRecordsLatency() {
        CircuitBreaker breaker = new CircuitBreaker(3, Duration.ofMinutes(5));
        breaker.recordFailure(NOW);
        when(delegate.getTicker("BTC-USD")).thenReturn(TICKER);

        Ticker ticker = adapter(breaker).getTicker("BTC-USD");

        assertThat(ticker).isSameAs(TICKER);
        assertThat(breaker.getFailureCount()).isZero();
        assertThat(metrics.render()).contains("tradeguard_exchange_latency_ms_count 1");
    }

    @Test
    void getTicker_failure_countsAndRethrows() {
        CircuitBreaker breaker = new CircuitBreaker(3, Duration.ofMinutes(5));
        IllegalStateException failure = new IllegalStateException("gateway down");
        when(delegate.getTicker("BTC-USD")).thenThrow(failure);

        assertThatThrownBy(() -> adapter(breaker).getTicker("BTC-USD")).isSameAs(failure);
        assertThat(breaker.getFailureCount()).isEqualTo(1);
        assertThat(metrics.counter("exchange.errors")).isEqualTo(1.0);
    }

    @Test
    void openBreaker_shortCircuitsUntilResetTimeout() {
        CircuitBreaker breaker = new CircuitBreaker(3, Duration.ofMinutes(5));
        ResilientExchangeAdapter adapter = adapter(breaker);
        when(delegate.getTicker("BTC-USD"))
                .thenThrow(new IllegalStateException("1"))
                .thenThrow(new IllegalStateException("2"))
                .thenThrow(new IllegalStateException("3"))
                .thenReturn(TICKER);

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> adapter.getTicker("BTC-USD")).isInstanceOf(IllegalStateException.class);
        }

        assertThatThrownBy(() -> adapter.getTicker("BTC-USD"))
                .isInstanceOfSatisfying(ExchangeUnavailableException.class,
                        e -> assertThat(e.getFailureCount()).isEqualTo(3));
        verify(delegate, times(3)).getTicker("BTC-USD");
        assertThat(metrics.counter("exchange.circuit_open")).isEqualTo(1.0);

        clock.advance(Duration.ofMinutes(5).plusMillis(1));

        assertThat(adapter.getTicker("BTC-USD")).isSameAs(TICKER);
        assertThat(breaker.getFailureCount()).isZero();
    }

    @Test
    void repeatedFailures_triggerKillSwitchAtApiErrorThreshold() {
        CircuitBreaker breaker = new CircuitBreaker(10, Duration.ofMinutes(5));
        ResilientExchangeAdapter adapter = adapter(breaker);
        when(delegate.getBalances()).thenThrow(new IllegalStateException("gateway down"));

        for (int i = 0; i < 4; i++) {
            assertThatThrownBy(adapter::getBalances).isInstanceOf(IllegalStateException.class);
        }
        assertThat(killSwitch.isTriggered()).isFalse();

        assertThatThrownBy(adapter::getBalances).isInstanceOf(IllegalStateException.class);

        assertThat(killSwitch.isTriggered()).isTrue();
        assertThat(killSwitch.getState().reason()).isEqualTo("API error count 5 exceeds threshold 5");
    }

    private ResilientExchangeAdapter adapter(CircuitBreaker breaker) {
        return new ResilientExchangeAdapter(delegate, breaker, killSwitch, metrics, clock);
    }
}

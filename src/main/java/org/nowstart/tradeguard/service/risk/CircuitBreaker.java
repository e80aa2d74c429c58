package org.nowstart.tradeguard.service.risk;

import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;

/**
 * Consecutive-failure breaker in front of the exchange. Opens at {@code maxConsecutiveFailures}
 * and closes by itself once {@code resetTimeout} has passed since the last failure.
 * In-memory only; a restart closes it.
 */
@Slf4j
public class CircuitBreaker {

    private final int maxConsecutiveFailures;
    private final Duration resetTimeout;

    private int failureCount;
    private Instant lastFailureAt;

    public CircuitBreaker(int maxConsecutiveFailures, Duration resetTimeout) {
        if (maxConsecutiveFailures <= 0) {
            throw new IllegalArgumentException("maxConsecutiveFailures must be positive");
        }
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.resetTimeout = resetTimeout;
    }

    public synchronized boolean isOpen(Instant now) {
        if (failureCount > 0 && Duration.between(lastFailureAt, now).compareTo(resetTimeout) > 0) {
            log.info("event=circuit_breaker_auto_reset failure_count={} last_failure_at={}", failureCount, lastFailureAt);
            reset();
        }
        return failureCount >= maxConsecutiveFailures;
    }

    public synchronized void recordFailure(Instant now) {
        failureCount++;
        lastFailureAt = now;
        if (failureCount == maxConsecutiveFailures) {
            log.warn("event=circuit_breaker_opened failure_count={}", failureCount);
        }
    }

    public synchronized void recordSuccess() {
        reset();
    }

    public synchronized void reset() {
        failureCount = 0;
        lastFailureAt = null;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized Instant getLastFailureAt() {
        return lastFailureAt;
    }
}

package org.nowstart.tradeguard.service.exchange;

import feign.RetryableException;
import feign.Retryer;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Feign retryer with a fixed attempt budget and a delay of {@code baseDelay * attempt}.
 * Feign clones it per request, so the attempt counter is never shared between calls.
 */
@Slf4j
public class LinearBackoffRetryer implements Retryer {

    private final int maxAttempts;
    private final Duration baseDelay;
    private int attempt = 1;

    public LinearBackoffRetryer(int maxAttempts, Duration baseDelay) {
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
    }

    @Override
    public void continueOrPropagate(RetryableException e) {
        if (attempt >= maxAttempts) {
            log.warn("event=exchange_retry_exhausted attempts={} status={} method={}", attempt, e.status(), e.method());
            throw e;
        }

        long delayMillis = delayMillis(attempt);
        log.info("event=exchange_retry attempt={} max_attempts={} delay_ms={} status={}", attempt, maxAttempts, delayMillis, e.status());
        attempt++;
        try {
            sleep(delayMillis);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    @Override
    public Retryer clone() {
        return new LinearBackoffRetryer(maxAttempts, baseDelay);
    }

    long delayMillis(int attempt) {
        return baseDelay.toMillis() * attempt;
    }

    int attempt() {
        return attempt;
    }

    protected void sleep(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }
}

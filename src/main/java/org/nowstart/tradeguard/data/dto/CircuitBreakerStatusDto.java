package org.nowstart.tradeguard.data.dto;

import java.time.Instant;

public record CircuitBreakerStatusDto(
        int failureCount,
        Instant lastFailureAt,
        boolean open
) {
}

package org.nowstart.tradeguard.data.dto;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of the kill switch state. This is the unit the state store reads and writes.
 */
public record KillSwitchSnapshot(
        boolean triggered,
        String reason,
        Instant triggeredAt,
        int consecutiveLosses,
        List<Instant> spreadViolations
) {

    public KillSwitchSnapshot {
        spreadViolations = List.copyOf(spreadViolations);
    }

    public static KillSwitchSnapshot armed() {
        return new KillSwitchSnapshot(false, null, null, 0, List.of());
    }
}

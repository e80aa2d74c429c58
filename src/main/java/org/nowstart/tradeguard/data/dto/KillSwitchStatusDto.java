package org.nowstart.tradeguard.data.dto;

import java.time.Instant;

public record KillSwitchStatusDto(
        boolean triggered,
        String reason,
        Instant triggeredAt,
        int consecutiveLosses,
        int spreadViolations
) {

    public static KillSwitchStatusDto from(KillSwitchSnapshot snapshot) {
        return new KillSwitchStatusDto(
                snapshot.triggered(),
                snapshot.reason(),
                snapshot.triggeredAt(),
                snapshot.consecutiveLosses(),
                snapshot.spreadViolations().size()
        );
    }
}

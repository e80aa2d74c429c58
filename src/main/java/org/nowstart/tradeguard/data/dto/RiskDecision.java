package org.nowstart.tradeguard.data.dto;

import org.nowstart.tradeguard.data.type.RiskBlockCode;

public record RiskDecision(
        boolean allowed,
        String reason,
        RiskBlockCode blockedBy
) {

    public static RiskDecision allow(String reason) {
        return new RiskDecision(true, reason, null);
    }

    public static RiskDecision block(RiskBlockCode blockedBy, String reason) {
        return new RiskDecision(false, reason, blockedBy);
    }

    public static RiskDecision reject(String reason) {
        return new RiskDecision(false, reason, null);
    }
}

package org.nowstart.tradeguard.data.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only account view handed to the risk guards. Rebuilt every evaluation cycle.
 */
public record AccountSnapshot(
        double cashUsd,
        double realizedPnlUsd,
        double unrealizedPnlUsd,
        List<Position> openPositions,
        Map<String, Instant> lastStopOutAtBySymbol
) {

    public AccountSnapshot {
        openPositions = List.copyOf(openPositions);
        lastStopOutAtBySymbol = Map.copyOf(lastStopOutAtBySymbol);
    }

    public static AccountSnapshot empty(double cashUsd) {
        return new AccountSnapshot(cashUsd, 0.0, 0.0, List.of(), Map.of());
    }

    public Optional<Position> findPosition(String symbol) {
        return openPositions.stream()
                .filter(position -> position.symbol().equals(symbol))
                .findFirst();
    }

    public double equityUsd() {
        double marketValue = openPositions.stream()
                .mapToDouble(position -> position.quantity() * position.marketPrice())
                .sum();
        return cashUsd + marketValue;
    }
}

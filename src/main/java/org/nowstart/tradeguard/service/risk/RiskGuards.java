package org.nowstart.tradeguard.service.risk;

import java.util.Optional;
import org.nowstart.tradeguard.data.dto.AccountSnapshot;
import org.nowstart.tradeguard.data.dto.Position;
import org.nowstart.tradeguard.data.dto.Ticker;

/**
 * Pure account and market predicates. No I/O, no state.
 */
public final class RiskGuards {

    private static final double BPS = 10_000.0;

    private RiskGuards() {
    }

    public static boolean exceedsMaxDailyLoss(AccountSnapshot snapshot, double maxDailyLossUsd) {
        double pnl = snapshot.realizedPnlUsd() + snapshot.unrealizedPnlUsd();
        return pnl <= -Math.abs(maxDailyLossUsd);
    }

    /**
     * Only opening a symbol that is not held yet counts against the limit.
     */
    public static boolean exceedsMaxOpenPositions(AccountSnapshot snapshot, int maxOpenPositions, String symbol) {
        if (snapshot.findPosition(symbol).isPresent()) {
            return false;
        }
        return snapshot.openPositions().size() >= maxOpenPositions;
    }

    public static boolean exceedsMaxPositionUsd(AccountSnapshot snapshot, String symbol, double maxPositionUsd) {
        return exceedsMaxPositionUsd(snapshot, symbol, maxPositionUsd, null, 0.0);
    }

    /**
     * @param currentPrice mark used for the existing position, the stored market price when null
     * @param incomingOrderUsd notional about to be added, 0 for exits
     */
    public static boolean exceedsMaxPositionUsd(
            AccountSnapshot snapshot,
            String symbol,
            double maxPositionUsd,
            Double currentPrice,
            double incomingOrderUsd
    ) {
        Optional<Position> position = snapshot.findPosition(symbol);
        if (position.isEmpty()) {
            return incomingOrderUsd >= maxPositionUsd;
        }

        double mark = currentPrice != null ? currentPrice : position.get().marketPrice();
        double existing = Math.abs(position.get().quantity() * mark);
        return existing + incomingOrderUsd >= maxPositionUsd;
    }

    /**
     * Bid/ask spread in basis points of mid. Infinite when mid is not positive.
     */
    public static double computeSpreadBps(Ticker ticker) {
        double mid = ticker.mid();
        if (mid <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return (ticker.ask() - ticker.bid()) / mid * BPS;
    }

    /**
     * Distance of the last trade from mid in basis points. Infinite when mid is not positive.
     */
    public static double estimateSlippageBps(Ticker ticker) {
        double mid = ticker.mid();
        if (mid <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.abs(ticker.last() - mid) / mid * BPS;
    }

    /**
     * Confidence-scaled order notional, never below {@code floorUsd}.
     */
    public static double computePositionUsd(double confidence, double maxPositionUsd, double floorUsd) {
        double clamped = Math.max(0.0, Math.min(1.0, confidence));
        return Math.max(floorUsd, maxPositionUsd * clamped);
    }
}

package org.nowstart.tradeguard.service.execution;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.tradeguard.data.dto.AccountSnapshot;
import org.nowstart.tradeguard.data.dto.Balance;
import org.nowstart.tradeguard.data.dto.Position;
import org.nowstart.tradeguard.data.entity.TradingPosition;
import org.nowstart.tradeguard.data.property.TradingProperties;
import org.nowstart.tradeguard.data.type.ExecutionMode;
import org.nowstart.tradeguard.repository.TradingPositionRepository;
import org.nowstart.tradeguard.service.exchange.ExchangeAdapter;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Builds the read-only account view the risk guards evaluate against.
 */
@Service
@RequiredArgsConstructor
public class AccountSnapshotService {

    private final TradingPositionRepository tradingPositionRepository;
    private final ExchangeAdapter exchangeAdapter;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    /**
     * @param marks latest price per symbol; symbols without a mark use the last fill price
     */
    @Transactional(readOnly = true)
    public AccountSnapshot snapshot(Map<String, Double> marks) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        List<Position> openPositions = new ArrayList<>();
        Map<String, Instant> lastStopOutAtBySymbol = new HashMap<>();
        double realizedToday = 0.0;
        double realizedTotal = 0.0;
        double unrealized = 0.0;
        double openCostBasis = 0.0;

        for (TradingPosition row : tradingPositionRepository.findAll()) {
            if (row.getLastStopOutAt() != null) {
                lastStopOutAtBySymbol.put(row.getSymbol(), row.getLastStopOutAt());
            }
            if (today.equals(row.getRealizedPnlDay())) {
                realizedToday += toDouble(row.getRealizedPnlToday());
            }
            realizedTotal += toDouble(row.getRealizedPnlTotal());

            double qty = toDouble(row.getQty());
            if (qty <= 0.0) {
                continue;
            }

            double avgPrice = toDouble(row.getAvgPrice());
            double mark = marks.getOrDefault(row.getSymbol(), toDouble(row.getLastPrice()));
            openPositions.add(new Position(row.getSymbol(), qty, avgPrice, mark));
            unrealized += (mark - avgPrice) * qty;
            openCostBasis += avgPrice * qty;
        }

        double cash = tradingProperties.executionMode() == ExecutionMode.PAPER
                ? tradingProperties.paperStartingCashUsd().doubleValue() + realizedTotal - openCostBasis
                : quoteBalance();

        return new AccountSnapshot(cash, realizedToday, unrealized, openPositions, lastStopOutAtBySymbol);
    }

    private double quoteBalance() {
        return exchangeAdapter.getBalances().stream()
                .filter(balance -> tradingProperties.quoteCurrency().equalsIgnoreCase(balance.asset()))
                .map(Balance::free)
                .mapToDouble(this::toDouble)
                .sum();
    }

    private double toDouble(BigDecimal value) {
        return value == null ? 0.0 : value.doubleValue();
    }
}

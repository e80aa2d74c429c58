package org.nowstart.tradeguard.service.execution;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradeguard.data.dto.TradeOutcome;
import org.nowstart.tradeguard.data.entity.TradingOrder;
import org.nowstart.tradeguard.data.entity.TradingPosition;
import org.nowstart.tradeguard.data.type.OrderSide;
import org.nowstart.tradeguard.data.type.OrderStatus;
import org.nowstart.tradeguard.repository.OrderStore;
import org.nowstart.tradeguard.repository.TradingPositionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Books filled orders into per-symbol positions. Each order is applied at most once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionLedgerService {

    private static final int SCALE = 12;

    private final TradingPositionRepository tradingPositionRepository;
    private final OrderStore orderStore;
    private final Clock clock;

    /**
     * @return the realized result when the fill reduced a position, empty otherwise
     */
    @Transactional
    public Optional<TradeOutcome> apply(TradingOrder order) {
        if (order.getStatus() != OrderStatus.FILLED || order.isPositionApplied()) {
            return Optional.empty();
        }

        BigDecimal qty = safe(order.getFilledQuantity());
        BigDecimal price = safe(order.getAvgFillPrice());
        if (qty.signum() <= 0 || price.signum() <= 0) {
            log.warn("event=position_apply_skipped client_order_id={} qty={} price={}", order.getClientOrderId(), qty, price);
            markApplied(order);
            return Optional.empty();
        }

        TradingPosition position = tradingPositionRepository.findBySymbol(order.getSymbol())
                .orElseGet(() -> TradingPosition.builder()
                        .symbol(order.getSymbol())
                        .qty(BigDecimal.ZERO)
                        .avgPrice(BigDecimal.ZERO)
                        .realizedPnlTotal(BigDecimal.ZERO)
                        .realizedPnlToday(BigDecimal.ZERO)
                        .build());
        position.setLastPrice(price);

        Optional<TradeOutcome> outcome = order.getSide() == OrderSide.BUY
                ? addToPosition(position, qty, price)
                : reducePosition(position, order, qty, price);

        tradingPositionRepository.save(position);
        markApplied(order);
        log.info("event=position_updated symbol={} side={} qty={} avg_price={} realized_today={}",
                position.getSymbol(), order.getSide(), position.getQty(), position.getAvgPrice(), position.getRealizedPnlToday());
        return outcome;
    }

    private Optional<TradeOutcome> addToPosition(TradingPosition position, BigDecimal qty, BigDecimal price) {
        BigDecimal oldQty = safe(position.getQty());
        BigDecimal oldAvg = safe(position.getAvgPrice());
        BigDecimal newQty = oldQty.add(qty);

        BigDecimal weighted = oldAvg.multiply(oldQty).add(price.multiply(qty));
        position.setAvgPrice(weighted.divide(newQty, SCALE, RoundingMode.HALF_UP));
        position.setQty(newQty);
        return Optional.empty();
    }

    private Optional<TradeOutcome> reducePosition(TradingPosition position, TradingOrder order, BigDecimal qty, BigDecimal price) {
        BigDecimal oldQty = safe(position.getQty());
        BigDecimal closedQty = qty.min(oldQty);
        if (closedQty.signum() <= 0) {
            log.warn("event=sell_without_position client_order_id={} symbol={} qty={}", order.getClientOrderId(), order.getSymbol(), qty);
            return Optional.empty();
        }

        BigDecimal pnl = price.subtract(safe(position.getAvgPrice()))
                .multiply(closedQty)
                .setScale(SCALE, RoundingMode.HALF_UP);
        bookRealized(position, pnl);

        BigDecimal newQty = oldQty.subtract(closedQty);
        boolean closed = newQty.signum() <= 0;
        if (closed) {
            position.setQty(BigDecimal.ZERO);
            position.setAvgPrice(BigDecimal.ZERO);
            if (pnl.signum() < 0) {
                position.setLastStopOutAt(clock.instant());
            }
        } else {
            position.setQty(newQty);
        }

        return Optional.of(new TradeOutcome(position.getSymbol(), order.getClientOrderId(), closedQty, pnl, closed));
    }

    private void bookRealized(TradingPosition position, BigDecimal pnl) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        if (!today.equals(position.getRealizedPnlDay())) {
            position.setRealizedPnlDay(today);
            position.setRealizedPnlToday(BigDecimal.ZERO);
        }
        position.setRealizedPnlToday(safe(position.getRealizedPnlToday()).add(pnl));
        position.setRealizedPnlTotal(safe(position.getRealizedPnlTotal()).add(pnl));
    }

    private void markApplied(TradingOrder order) {
        order.setPositionApplied(true);
        orderStore.upsert(order);
    }

    private BigDecimal safe(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}

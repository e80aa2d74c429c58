package org.nowstart.tradeguard.repository;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.nowstart.tradeguard.data.entity.TradingOrder;
import org.nowstart.tradeguard.data.type.ExecutionMode;
import org.nowstart.tradeguard.data.type.OrderStatus;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JpaOrderStore implements OrderStore {

    private static final EnumSet<OrderStatus> OPEN_STATUSES = EnumSet.of(OrderStatus.OPEN, OrderStatus.PENDING);

    private final TradingOrderRepository tradingOrderRepository;

    @Override
    @Transactional
    public TradingOrder upsert(TradingOrder order) {
        return tradingOrderRepository.saveAndFlush(order);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TradingOrder> getByClientOrderId(String clientOrderId) {
        return tradingOrderRepository.findByClientOrderId(clientOrderId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TradingOrder> findOpenOrders(ExecutionMode mode, String symbol) {
        return tradingOrderRepository.findByModeAndSymbolAndStatusInOrderByCreatedAtAsc(mode, symbol, OPEN_STATUSES);
    }
}

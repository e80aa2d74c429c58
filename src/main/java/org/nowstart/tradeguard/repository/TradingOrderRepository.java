package org.nowstart.tradeguard.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.nowstart.tradeguard.data.entity.TradingOrder;
import org.nowstart.tradeguard.data.type.ExecutionMode;
import org.nowstart.tradeguard.data.type.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TradingOrderRepository extends JpaRepository<TradingOrder, String> {

    Optional<TradingOrder> findByClientOrderId(String clientOrderId);

    List<TradingOrder> findByModeAndSymbolAndStatusInOrderByCreatedAtAsc(
            ExecutionMode mode,
            String symbol,
            Collection<OrderStatus> statuses
    );
}

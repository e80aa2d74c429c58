package org.nowstart.tradeguard.repository;

import java.util.List;
import java.util.Optional;
import org.nowstart.tradeguard.data.entity.TradingOrder;
import org.nowstart.tradeguard.data.type.ExecutionMode;

/**
 * Durable order history keyed by client order id. Rows are never deleted.
 */
public interface OrderStore {

    TradingOrder upsert(TradingOrder order);

    Optional<TradingOrder> getByClientOrderId(String clientOrderId);

    /**
     * Orders of the given mode and symbol still waiting on the exchange (OPEN or PENDING).
     */
    List<TradingOrder> findOpenOrders(ExecutionMode mode, String symbol);
}

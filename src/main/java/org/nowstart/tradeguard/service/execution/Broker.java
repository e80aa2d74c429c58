package org.nowstart.tradeguard.service.execution;

import org.nowstart.tradeguard.data.dto.OrderRequest;
import org.nowstart.tradeguard.data.dto.Ticker;
import org.nowstart.tradeguard.data.entity.TradingOrder;
import org.nowstart.tradeguard.data.type.ExecutionMode;

/**
 * Order execution venue. Exactly one implementation is active per process, picked from the
 * configured execution mode at startup.
 */
public sealed interface Broker permits PaperBroker, LiveBroker {

    ExecutionMode mode();

    /**
     * @return a new, not yet persisted order carrying the broker's view of the result
     */
    TradingOrder place(OrderRequest request, Ticker ticker);

    /**
     * Cancels an order previously returned by {@link #place}; mutates and returns it.
     */
    TradingOrder cancel(TradingOrder order);
}

package org.nowstart.tradeguard.service.exchange;

import java.util.List;
import org.nowstart.tradeguard.data.dto.Balance;
import org.nowstart.tradeguard.data.dto.Candle;
import org.nowstart.tradeguard.data.dto.ExchangeOrder;
import org.nowstart.tradeguard.data.dto.OrderRequest;
import org.nowstart.tradeguard.data.dto.Ticker;

/**
 * Exchange capability consumed by the core. Implementations own transport, authentication
 * and wire mapping; the core only sees domain types.
 */
public interface ExchangeAdapter {

    Ticker getTicker(String symbol);

    /**
     * @return candles in ascending time order, at most {@code limit}
     */
    List<Candle> getCandles(String symbol, String interval, int limit);

    ExchangeOrder placeOrder(OrderRequest request);

    ExchangeOrder cancelOrder(String orderId, String symbol);

    ExchangeOrder getOrder(String orderId, String symbol);

    /**
     * @param symbol null lists open orders across all symbols
     */
    List<ExchangeOrder> listOpenOrders(String symbol);

    List<Balance> getBalances();
}

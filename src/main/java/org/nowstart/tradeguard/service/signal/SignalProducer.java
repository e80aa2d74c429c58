package org.nowstart.tradeguard.service.signal;

import java.util.List;
import org.nowstart.tradeguard.data.dto.AccountSnapshot;
import org.nowstart.tradeguard.data.dto.Candle;
import org.nowstart.tradeguard.data.dto.Signal;
import org.nowstart.tradeguard.data.dto.Ticker;

/**
 * Strategy seam. Implementations decide what to trade; the trading cycle decides whether it may.
 */
public interface SignalProducer {

    Signal produce(String symbol, List<Candle> candles, Ticker ticker, AccountSnapshot snapshot);
}

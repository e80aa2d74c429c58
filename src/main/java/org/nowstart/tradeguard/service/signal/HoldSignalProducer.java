package org.nowstart.tradeguard.service.signal;

import java.util.List;
import org.nowstart.tradeguard.data.dto.AccountSnapshot;
import org.nowstart.tradeguard.data.dto.Candle;
import org.nowstart.tradeguard.data.dto.Signal;
import org.nowstart.tradeguard.data.dto.Ticker;
import org.springframework.stereotype.Component;

/**
 * Placeholder strategy: never trades. Replace the bean to plug a real strategy in.
 */
@Component
public class HoldSignalProducer implements SignalProducer {

    @Override
    public Signal produce(String symbol, List<Candle> candles, Ticker ticker, AccountSnapshot snapshot) {
        return Signal.hold("no strategy configured");
    }
}

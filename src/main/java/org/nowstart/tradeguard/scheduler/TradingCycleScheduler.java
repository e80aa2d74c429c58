package org.nowstart.tradeguard.scheduler;

import lombok.RequiredArgsConstructor;
import org.nowstart.tradeguard.service.TradingCycleService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TradingCycleScheduler {

    private final TradingCycleService tradingCycleService;

    @Scheduled(fixedDelayString = "${tradeguard.trading.interval:30s}")
    public void run() {
        tradingCycleService.runOnce();
    }
}

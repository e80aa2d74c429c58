package org.nowstart.tradeguard.service.execution;

import java.math.BigDecimal;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradeguard.data.entity.EquityWatermark;
import org.nowstart.tradeguard.repository.EquityWatermarkRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persisted equity high-water mark, the peak that drawdown is measured from.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EquityWatermarkService {

    static final String ACCOUNT_ID = "default";

    private final EquityWatermarkRepository equityWatermarkRepository;

    /**
     * Records the latest equity and returns the peak including it.
     */
    @Transactional
    public double update(double equity) {
        BigDecimal current = BigDecimal.valueOf(equity);
        EquityWatermark watermark = equityWatermarkRepository.findById(ACCOUNT_ID)
                .orElseGet(() -> EquityWatermark.builder()
                        .accountId(ACCOUNT_ID)
                        .peakEquity(current)
                        .build());

        if (watermark.getPeakEquity() == null || current.compareTo(watermark.getPeakEquity()) > 0) {
            log.info("event=equity_peak previous={} current={}", watermark.getPeakEquity(), current);
            watermark.setPeakEquity(current);
        }
        watermark.setLastEquity(current);
        equityWatermarkRepository.save(watermark);
        return watermark.getPeakEquity().doubleValue();
    }

    /**
     * Moves the peak down to the last observed equity, so drawdown restarts from where the
     * account stands. Used when an operator re-arms trading after a drawdown halt.
     *
     * @return the new peak, empty when no equity has been observed yet
     */
    @Transactional
    public Optional<BigDecimal> rebase() {
        Optional<EquityWatermark> found = equityWatermarkRepository.findById(ACCOUNT_ID)
                .filter(watermark -> watermark.getLastEquity() != null);
        found.ifPresent(watermark -> {
            log.info("event=equity_peak_rebased previous={} current={}", watermark.getPeakEquity(), watermark.getLastEquity());
            watermark.setPeakEquity(watermark.getLastEquity());
            equityWatermarkRepository.save(watermark);
        });
        return found.map(EquityWatermark::getPeakEquity);
    }
}

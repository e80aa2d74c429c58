package org.nowstart.tradeguard.service.anomaly;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import org.nowstart.tradeguard.data.dto.Anomaly;
import org.nowstart.tradeguard.data.dto.Candle;
import org.nowstart.tradeguard.data.dto.Ticker;
import org.nowstart.tradeguard.data.property.AnomalyProperties;
import org.nowstart.tradeguard.data.type.AnomalySeverity;
import org.nowstart.tradeguard.data.type.AnomalyType;
import org.nowstart.tradeguard.service.risk.RiskGuards;
import org.springframework.stereotype.Component;

/**
 * Flags unusual market behaviour. Reports only; acting on an anomaly is up to the caller.
 */
@Component
@RequiredArgsConstructor
public class AnomalyDetector {

    private static final int VOLUME_LOOKBACK = 50;
    private static final double HIGH_SPREAD_BPS = 100.0;

    private final AnomalyProperties properties;
    private final Clock clock;

    // latest candle time seen per symbol; stale data is only judged from the second call on
    private final Map<String, Instant> lastCandleTimeBySymbol = new ConcurrentHashMap<>();

    /**
     * Candles must be in ascending time order. Fewer than the configured minimum yields no anomalies.
     */
    public List<Anomaly> checkCandles(List<Candle> candles) {
        List<Anomaly> anomalies = new ArrayList<>();
        if (candles.size() < properties.minCandles()) {
            return anomalies;
        }

        Candle latest = candles.get(candles.size() - 1);
        Candle previous = candles.get(candles.size() - 2);

        checkVolumeSpike(candles, latest).ifPresent(anomalies::add);
        checkPriceGap(previous, latest).ifPresent(anomalies::add);
        checkWick(latest).ifPresent(anomalies::add);
        checkStaleData(previous, latest).ifPresent(anomalies::add);
        lastCandleTimeBySymbol.put(latest.symbol(), latest.time());

        return anomalies;
    }

    public List<Anomaly> checkTicker(Ticker ticker) {
        List<Anomaly> anomalies = new ArrayList<>();
        double spreadBps = RiskGuards.computeSpreadBps(ticker);

        if (!Double.isFinite(spreadBps)) {
            anomalies.add(new Anomaly(
                    AnomalyType.SPREAD_BLOWOUT,
                    AnomalySeverity.HIGH,
                    String.format(Locale.ROOT, "Spread undefined: non-positive mid (bid %.2f, ask %.2f)", ticker.bid(), ticker.ask()),
                    spreadBps,
                    properties.spreadBlowoutBps(),
                    ticker.time()
            ));
        } else if (spreadBps > properties.spreadBlowoutBps()) {
            anomalies.add(new Anomaly(
                    AnomalyType.SPREAD_BLOWOUT,
                    spreadBps > HIGH_SPREAD_BPS ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM,
                    String.format(Locale.ROOT, "Spread blowout: %.0f bps (bid %.2f, ask %.2f)", spreadBps, ticker.bid(), ticker.ask()),
                    spreadBps,
                    properties.spreadBlowoutBps(),
                    ticker.time()
            ));
        }

        return anomalies;
    }

    private Optional<Anomaly> checkVolumeSpike(List<Candle> candles, Candle latest) {
        double[] volumes = candles.subList(Math.max(0, candles.size() - VOLUME_LOOKBACK), candles.size())
                .stream()
                .mapToDouble(Candle::volume)
                .sorted()
                .toArray();
        double medianVolume = volumes[volumes.length / 2];
        if (medianVolume <= 0.0) {
            return Optional.empty();
        }

        double ratio = latest.volume() / medianVolume;
        if (ratio <= properties.volumeSpikeThreshold()) {
            return Optional.empty();
        }

        AnomalySeverity severity = ratio > 5.0 ? AnomalySeverity.HIGH
                : ratio > 3.0 ? AnomalySeverity.MEDIUM
                : AnomalySeverity.LOW;
        return Optional.of(new Anomaly(
                AnomalyType.VOLUME_SPIKE,
                severity,
                String.format(Locale.ROOT, "Volume %.1fx median (%.0f vs median %.0f)", ratio, latest.volume(), medianVolume),
                ratio,
                properties.volumeSpikeThreshold(),
                latest.time()
        ));
    }

    private Optional<Anomaly> checkPriceGap(Candle previous, Candle latest) {
        if (previous.close() <= 0.0) {
            return Optional.empty();
        }

        double gap = Math.abs(latest.open() - previous.close()) / previous.close();
        if (gap <= properties.priceGapThreshold()) {
            return Optional.empty();
        }

        AnomalySeverity severity = gap > 0.05 ? AnomalySeverity.HIGH
                : gap > 0.03 ? AnomalySeverity.MEDIUM
                : AnomalySeverity.LOW;
        return Optional.of(new Anomaly(
                AnomalyType.PRICE_GAP,
                severity,
                String.format(Locale.ROOT, "Price gap %.1f%% between candles (%.2f -> %.2f)", gap * 100.0, previous.close(), latest.open()),
                gap,
                properties.priceGapThreshold(),
                latest.time()
        ));
    }

    private Optional<Anomaly> checkWick(Candle latest) {
        double body = Math.abs(latest.close() - latest.open());
        if (body <= 0.0) {
            return Optional.empty();
        }

        double upperWick = latest.high() - Math.max(latest.close(), latest.open());
        double lowerWick = Math.min(latest.close(), latest.open()) - latest.low();
        double ratio = (upperWick + lowerWick) / body;
        if (ratio <= properties.wickAnomalyRatio()) {
            return Optional.empty();
        }

        return Optional.of(new Anomaly(
                AnomalyType.WICK_ANOMALY,
                ratio > 10.0 ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM,
                String.format(Locale.ROOT, "Extreme wicks: wick/body ratio %.1fx", ratio),
                ratio,
                properties.wickAnomalyRatio(),
                latest.time()
        ));
    }

    private Optional<Anomaly> checkStaleData(Candle previous, Candle latest) {
        if (!lastCandleTimeBySymbol.containsKey(latest.symbol())) {
            return Optional.empty();
        }

        Duration expectedInterval = Duration.between(previous.time(), latest.time());
        if (expectedInterval.isZero() || expectedInterval.isNegative()) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        double intervalsSinceLast = (double) Duration.between(latest.time(), now).toMillis() / expectedInterval.toMillis();
        if (intervalsSinceLast <= properties.staleDataMultiplier()) {
            return Optional.empty();
        }

        return Optional.of(new Anomaly(
                AnomalyType.STALE_DATA,
                intervalsSinceLast > 5.0 ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM,
                String.format(Locale.ROOT, "No new candle for %d min (expected every %d min)",
                        Duration.between(latest.time(), now).toMinutes(), expectedInterval.toMinutes()),
                intervalsSinceLast,
                properties.staleDataMultiplier(),
                now
        ));
    }
}

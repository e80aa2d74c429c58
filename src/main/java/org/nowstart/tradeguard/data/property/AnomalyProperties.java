package org.nowstart.tradeguard.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tradeguard.anomaly")
public record AnomalyProperties(
        // current volume / median volume
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("3.0") double volumeSpikeThreshold,
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("50") double spreadBlowoutBps,
        // |open - previous close| / previous close
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.02") double priceGapThreshold,
        // total wick length / body length
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("5.0") double wickAnomalyRatio,
        // missed candle intervals before data is considered stale
        @DecimalMin(value = "1") @DefaultValue("3") double staleDataMultiplier,
        @Min(2) @DefaultValue("20") int minCandles
) {
}

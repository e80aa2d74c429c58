package org.nowstart.tradeguard.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tradeguard.risk")
public record RiskProperties(
        @DecimalMin("0") @DefaultValue("150") double maxDailyLossUsd,
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("250") double maxPositionUsd,
        @Positive @DefaultValue("2") int maxOpenPositions,
        // no new entries on a symbol for this long after it was stopped out at a loss
        @NotNull @DefaultValue("15m") Duration cooldown,
        // floor applied to the confidence-scaled order notional
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("25") double minOrderNotionalUsd,
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.000001") double minOrderQuantity,
        @DecimalMin("0") @DefaultValue("25") double maxSpreadBps,
        @DecimalMin("0") @DefaultValue("20") double maxSlippageBps,
        @DecimalMin("0") @DefaultValue("0") double minVolume
) {
}

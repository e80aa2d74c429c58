package org.nowstart.tradeguard.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tradeguard.kill-switch")
public record KillSwitchProperties(
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("5") double maxDrawdownPct,
        @Positive @DefaultValue("3") int maxConsecutiveLosses,
        @Positive @DefaultValue("5") int apiErrorThreshold,
        @Positive @DefaultValue("3") int spreadViolationsLimit,
        @NotNull @DefaultValue("10m") Duration spreadViolationsWindow
) {
}

package org.nowstart.tradeguard.data.property;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tradeguard.exchange")
public record ExchangeProperties(
        // REST exchange gateway base URL
        @NotBlank @DefaultValue("http://localhost:8090") String baseUrl,
        @DefaultValue("") String apiKey,
        // HMAC-SHA256 signing secret
        @DefaultValue("") String apiSecret,
        @NotNull @DefaultValue("5s") Duration connectTimeout,
        @NotNull @DefaultValue("10s") Duration readTimeout,
        // total attempts per call, the first one included
        @Positive @DefaultValue("3") int retryAttempts,
        // attempt n waits n * retryBaseDelay
        @NotNull @DefaultValue("200ms") Duration retryBaseDelay,
        @Positive @DefaultValue("5") int circuitMaxFailures,
        @NotNull @DefaultValue("5m") Duration circuitResetTimeout
) {
}

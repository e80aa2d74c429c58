package org.nowstart.tradeguard.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.nowstart.tradeguard.data.type.ExecutionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tradeguard.trading")
public record TradingProperties(
        // PAPER simulates fills locally, LIVE dispatches to the exchange
        @NotNull @DefaultValue("PAPER") ExecutionMode executionMode,
        // second switch required before LIVE orders are allowed through the risk evaluator
        @DefaultValue("false") boolean allowLiveTrading,
        @NotEmpty @DefaultValue({"BTC-USD", "ETH-USD"}) List<String> symbols,
        // empty list allows every configured symbol
        @NotNull @DefaultValue List<String> allowedPairs,
        // delay between two trading cycles
        @NotNull @DefaultValue("30s") Duration interval,
        @NotBlank @DefaultValue("1h") String candleInterval,
        @Positive @DefaultValue("200") int candleCount,
        @DecimalMin("0") @DefaultValue("10000") BigDecimal paperStartingCashUsd,
        @NotBlank @DefaultValue("USD") String quoteCurrency
) {
}

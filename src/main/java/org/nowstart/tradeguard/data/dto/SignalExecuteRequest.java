package org.nowstart.tradeguard.data.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.nowstart.tradeguard.data.type.SignalAction;

public record SignalExecuteRequest(
        @NotBlank String symbol,
        @NotNull SignalAction action,
        @DecimalMin("0") @DecimalMax("1") double confidence,
        String reason,
        String idempotencyKey
) {
}

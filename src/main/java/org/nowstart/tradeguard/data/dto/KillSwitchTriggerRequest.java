package org.nowstart.tradeguard.data.dto;

import jakarta.validation.constraints.NotBlank;

public record KillSwitchTriggerRequest(
        @NotBlank String reason
) {
}

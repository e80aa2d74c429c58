package org.nowstart.tradeguard.data.dto;

import java.math.BigDecimal;

public record Balance(
        String asset,
        BigDecimal free,
        BigDecimal locked
) {
}

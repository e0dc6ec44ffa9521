package com.coinbasis.api.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record OpeningBalanceResponse(
        String sourceRef,
        String asset,
        BigDecimal amount,
        BigDecimal unitCostUsd,
        Instant acquiredAt
) {
}

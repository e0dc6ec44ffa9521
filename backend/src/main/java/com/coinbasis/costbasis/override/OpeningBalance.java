package com.coinbasis.costbasis.override;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Holding the user declares for history the imports do not cover. clientId makes resubmission idempotent.
 */
public record OpeningBalance(
        String owner,
        String asset,
        BigDecimal amount,
        BigDecimal unitCostUsd,
        Instant acquiredAt,
        String clientId,
        String note
) {
}

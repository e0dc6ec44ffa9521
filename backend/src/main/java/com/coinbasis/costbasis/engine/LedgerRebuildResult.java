package com.coinbasis.costbasis.engine;

import java.math.BigDecimal;

/**
 * Summary of one (owner, asset) rebuild.
 */
public record LedgerRebuildResult(
        String owner,
        String asset,
        int lots,
        int disposals,
        int needsReview,
        BigDecimal remainingAmount
) {
}

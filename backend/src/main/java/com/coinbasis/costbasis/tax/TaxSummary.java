package com.coinbasis.costbasis.tax;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Realized gains of an owner for an inclusive period of UTC dates. Always recomputed from disposals.
 * unresolvedProceedsUsd holds proceeds of portions whose cost basis is unknown; those portions are not in the
 * gain totals.
 */
public record TaxSummary(
        LocalDate periodStart,
        LocalDate periodEnd,
        BigDecimal shortTermGainUsd,
        BigDecimal longTermGainUsd,
        BigDecimal totalRealizedGainUsd,
        BigDecimal totalProceedsUsd,
        BigDecimal totalCostBasisUsd,
        BigDecimal deductibleFeesUsd,
        int disposalCount,
        int needsReviewCount,
        BigDecimal unresolvedProceedsUsd,
        List<CapitalGainLine> lines
) {
}

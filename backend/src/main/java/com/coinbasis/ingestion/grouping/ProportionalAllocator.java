package com.coinbasis.ingestion.grouping;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits an amount by weight. The last share takes the remainder so the shares sum exactly to the total.
 */
final class ProportionalAllocator {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private ProportionalAllocator() {
    }

    static List<BigDecimal> allocate(BigDecimal total, List<BigDecimal> weights) {
        if (weights.isEmpty()) {
            return List.of();
        }
        if (weights.size() == 1) {
            return List.of(total);
        }
        BigDecimal weightSum = weights.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        if (weightSum.signum() == 0) {
            throw new IllegalArgumentException("weights must not sum to zero");
        }
        List<BigDecimal> shares = new ArrayList<>(weights.size());
        BigDecimal allocated = BigDecimal.ZERO;
        for (int i = 0; i < weights.size() - 1; i++) {
            BigDecimal share = total.multiply(weights.get(i)).divide(weightSum, SCALE, ROUNDING);
            shares.add(share);
            allocated = allocated.add(share);
        }
        shares.add(total.subtract(allocated));
        return shares;
    }
}

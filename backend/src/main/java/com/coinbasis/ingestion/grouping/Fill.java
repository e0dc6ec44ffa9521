package com.coinbasis.ingestion.grouping;

import com.coinbasis.domain.TransactionEvent;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Consecutive legs of one bucket that form a single real-world trade. A bucket holds several fills when
 * the same (role, asset) shows up again after the current fill is already balanced, e.g. two back-to-back
 * {BUY SHIB, SPEND USDT} pairs within one minute. A repeated quote or fee leg only opens a new fill when an
 * asset leg is still to come; otherwise it belongs to the current one, so rows listed by type
 * {BUY, BUY, SPEND, SPEND} stay one fill.
 */
final class Fill {

    private final List<Leg> legs = new ArrayList<>();
    private final Set<String> roleAssets = new HashSet<>();

    static List<Fill> split(List<Leg> bucketLegs) {
        List<Fill> fills = new ArrayList<>();
        Fill current = new Fill();
        for (int i = 0; i < bucketLegs.size(); i++) {
            Leg leg = bucketLegs.get(i);
            if (current.startsNewFill(leg, assetLegFollows(bucketLegs, i + 1))) {
                fills.add(current);
                current = new Fill();
            }
            current.add(leg);
        }
        if (!current.legs.isEmpty()) {
            fills.add(current);
        }
        return fills;
    }

    private boolean startsNewFill(Leg leg, boolean assetLegFollows) {
        if (!roleAssets.contains(leg.roleAssetKey()) || !isBalanced()) {
            return false;
        }
        return isAssetLeg(leg) || assetLegFollows;
    }

    private static boolean assetLegFollows(List<Leg> bucketLegs, int from) {
        for (int i = from; i < bucketLegs.size(); i++) {
            if (isAssetLeg(bucketLegs.get(i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isAssetLeg(Leg leg) {
        return leg.role() == LegRole.ACQUIRED || leg.role() == LegRole.DISPOSED;
    }

    private void add(Leg leg) {
        legs.add(leg);
        roleAssets.add(leg.roleAssetKey());
    }

    boolean has(LegRole role) {
        return legs.stream().anyMatch(l -> l.role() == role);
    }

    boolean isBalanced() {
        boolean acquired = has(LegRole.ACQUIRED);
        boolean disposed = has(LegRole.DISPOSED);
        return (acquired && (disposed || has(LegRole.QUOTE_OUT)))
                || (disposed && has(LegRole.QUOTE_IN))
                || (!acquired && !disposed && has(LegRole.QUOTE_IN) && has(LegRole.QUOTE_OUT));
    }

    List<Leg> legs(LegRole role) {
        return legs.stream().filter(l -> l.role() == role).toList();
    }

    List<Leg> quoteLegs() {
        return legs.stream().filter(l -> l.role() == LegRole.QUOTE_IN || l.role() == LegRole.QUOTE_OUT).toList();
    }

    /**
     * Gross quantity per asset for the given role, in first-seen order.
     */
    Map<String, BigDecimal> grossByAsset(LegRole role) {
        Map<String, BigDecimal> gross = new LinkedHashMap<>();
        for (Leg leg : legs(role)) {
            gross.merge(leg.asset(), leg.amount(), BigDecimal::add);
        }
        return gross;
    }

    /**
     * Fees per asset: explicit FEE legs, plus fees embedded in leg remarks for assets with no explicit fee leg.
     */
    Map<String, BigDecimal> fees() {
        Map<String, BigDecimal> fees = grossByAsset(LegRole.FEE);
        Map<String, BigDecimal> embedded = new LinkedHashMap<>();
        for (Leg leg : legs) {
            BigDecimal fee = leg.event().getEmbeddedFee();
            if (leg.role() != LegRole.FEE && fee != null && !fees.containsKey(leg.asset())) {
                embedded.merge(leg.asset(), fee, BigDecimal::add);
            }
        }
        embedded.forEach((asset, fee) -> fees.merge(asset, fee, BigDecimal::add));
        return fees;
    }

    List<TransactionEvent> events() {
        return legs.stream().map(Leg::event).toList();
    }

    Instant timestamp() {
        return legs.stream()
                .map(l -> l.event().getTimestamp())
                .min(Comparator.naturalOrder())
                .orElseThrow();
    }

    int size() {
        return legs.size();
    }
}

package com.coinbasis.costbasis.tax;

import com.coinbasis.domain.Disposal;
import com.coinbasis.domain.DisposalPortion;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Splits disposals into short-term and long-term gains. Pure: disposals are read, never modified.
 */
@Component
public class TaxCategorizer {

    /**
     * Aggregates the disposals whose UTC disposal date falls in [periodStart, periodEnd].
     * Fees are totaled separately as deductible; they are already netted out of proceeds.
     */
    public TaxSummary categorize(Collection<Disposal> disposals, LocalDate periodStart, LocalDate periodEnd) {
        if (periodStart == null || periodEnd == null || periodEnd.isBefore(periodStart)) {
            throw new IllegalArgumentException("Invalid period " + periodStart + ".." + periodEnd);
        }
        BigDecimal shortTerm = BigDecimal.ZERO;
        BigDecimal longTerm = BigDecimal.ZERO;
        BigDecimal proceeds = BigDecimal.ZERO;
        BigDecimal costBasis = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        BigDecimal unresolved = BigDecimal.ZERO;
        int disposalCount = 0;
        int needsReviewCount = 0;
        List<CapitalGainLine> lines = new ArrayList<>();

        List<Disposal> inPeriod = disposals.stream()
                .filter(d -> inPeriod(d, periodStart, periodEnd))
                .sorted(Comparator.comparing(Disposal::getDisposedAt))
                .toList();
        for (Disposal disposal : inPeriod) {
            disposalCount++;
            if (disposal.isNeedsReview()) {
                needsReviewCount++;
            }
            if (disposal.getFeeUsd() != null) {
                fees = fees.add(disposal.getFeeUsd());
            }
            LocalDate sold = utcDate(disposal);
            for (DisposalPortion portion : disposal.getPortions()) {
                BigDecimal portionProceeds = portion.getProceedsUsd();
                if (!portion.isMatched() || !portion.hasKnownCost() || portionProceeds == null) {
                    if (portionProceeds != null) {
                        unresolved = unresolved.add(portionProceeds);
                    }
                    continue;
                }
                BigDecimal gain = portionProceeds.subtract(portion.getCostBasisUsd());
                boolean isShort = Boolean.TRUE.equals(portion.getShortTerm());
                if (isShort) {
                    shortTerm = shortTerm.add(gain);
                } else {
                    longTerm = longTerm.add(gain);
                }
                proceeds = proceeds.add(portionProceeds);
                costBasis = costBasis.add(portion.getCostBasisUsd());
                lines.add(new CapitalGainLine(
                        portion.getAmountConsumed().stripTrailingZeros().toPlainString() + " " + disposal.getAsset(),
                        portion.getAcquiredAt().atZone(ZoneOffset.UTC).toLocalDate(),
                        sold,
                        portionProceeds,
                        portion.getCostBasisUsd(),
                        gain,
                        isShort));
            }
        }
        return new TaxSummary(periodStart, periodEnd, shortTerm, longTerm, shortTerm.add(longTerm),
                proceeds, costBasis, fees, disposalCount, needsReviewCount, unresolved, List.copyOf(lines));
    }

    private static boolean inPeriod(Disposal disposal, LocalDate start, LocalDate end) {
        if (disposal.getDisposedAt() == null) {
            return false;
        }
        LocalDate date = utcDate(disposal);
        return !date.isBefore(start) && !date.isAfter(end);
    }

    private static LocalDate utcDate(Disposal disposal) {
        return disposal.getDisposedAt().atZone(ZoneOffset.UTC).toLocalDate();
    }
}

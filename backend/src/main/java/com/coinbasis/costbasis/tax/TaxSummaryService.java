package com.coinbasis.costbasis.tax;

import com.coinbasis.domain.Disposal;
import com.coinbasis.domain.DisposalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.MonthDay;
import java.time.Year;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Loads the persisted disposals of a period and hands them to {@link TaxCategorizer}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaxSummaryService {

    private final DisposalRepository disposalRepository;
    private final TaxCategorizer taxCategorizer;

    public TaxSummary summarize(String owner, LocalDate from, LocalDate to) {
        if (from == null || to == null || to.isBefore(from)) {
            throw new IllegalArgumentException("Invalid period " + from + ".." + to);
        }
        List<Disposal> disposals = disposalRepository
                .findByOwnerAndDisposedAtGreaterThanEqualAndDisposedAtLessThanOrderByDisposedAtAsc(
                        owner,
                        from.atStartOfDay(ZoneOffset.UTC).toInstant(),
                        to.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant());
        TaxSummary summary = taxCategorizer.categorize(disposals, from, to);
        log.debug("Tax summary for owner {} {}..{}: {} disposals, {} need review",
                owner, from, to, summary.disposalCount(), summary.needsReviewCount());
        return summary;
    }

    /**
     * Summary of a calendar tax year, January 1 to December 31 inclusive.
     */
    public TaxSummary summarizeYear(String owner, int year) {
        Year y = Year.of(year);
        return summarize(owner, y.atDay(1), y.atMonthDay(MonthDay.of(12, 31)));
    }
}

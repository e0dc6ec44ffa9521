package com.coinbasis.costbasis.tax;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One row of a capital-gains form: a disposed portion matched against a single lot.
 */
public record CapitalGainLine(
        String description,
        LocalDate acquired,
        LocalDate sold,
        BigDecimal proceedsUsd,
        BigDecimal costBasisUsd,
        BigDecimal gainUsd,
        boolean shortTerm
) {
}

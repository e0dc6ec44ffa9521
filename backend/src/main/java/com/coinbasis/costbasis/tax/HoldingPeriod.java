package com.coinbasis.costbasis.tax;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Short/long-term classification on UTC calendar dates: at most 365 days held is short-term.
 */
public final class HoldingPeriod {

    public static final long SHORT_TERM_MAX_DAYS = 365;

    private HoldingPeriod() {
    }

    public static long daysHeld(Instant acquiredAt, Instant disposedAt) {
        return ChronoUnit.DAYS.between(
                acquiredAt.atOffset(ZoneOffset.UTC).toLocalDate(),
                disposedAt.atOffset(ZoneOffset.UTC).toLocalDate());
    }

    public static boolean isShortTerm(Instant acquiredAt, Instant disposedAt) {
        return daysHeld(acquiredAt, disposedAt) <= SHORT_TERM_MAX_DAYS;
    }
}

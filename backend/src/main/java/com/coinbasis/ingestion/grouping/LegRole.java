package com.coinbasis.ingestion.grouping;

/**
 * Role of an event inside a trade bucket, decided by sign and whether the asset is a quote currency.
 */
public enum LegRole {
    /** Positive non-quote leg. */
    ACQUIRED,
    /** Negative non-quote leg. */
    DISPOSED,
    /** Positive quote-currency leg (revenue). */
    QUOTE_IN,
    /** Negative quote-currency leg (spend). */
    QUOTE_OUT,
    FEE
}

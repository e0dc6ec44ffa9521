package com.coinbasis.ingestion.grouping;

public enum GroupingErrorCode {
    /** Acquired or disposed legs without a matching counter leg. */
    UNBALANCED_LEGS,
    /** Fee legs with nothing to attach them to. */
    ORPHAN_FEE,
    /** Convert with no offsetting leg on either side. */
    UNMATCHED_CONVERT,
    /** Cross pair with several assets on one side; value cannot be attributed. */
    AMBIGUOUS_CROSS_PAIR,
    /** No historical price for any side of a market-valued trade. */
    PRICE_UNAVAILABLE
}

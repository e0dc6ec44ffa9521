package com.coinbasis.domain;

/**
 * Why a disposal needs manual review.
 */
public enum ReviewReason {
    /** Lot history ran out before the disposed amount was matched. */
    INSUFFICIENT_LOTS,
    /** A consumed lot has no known unit cost. */
    UNKNOWN_COST_BASIS
}

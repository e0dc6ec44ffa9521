package com.coinbasis.domain;

/**
 * Where a USD price came from.
 */
public enum PriceSource {
    STABLECOIN,
    SWAP_DERIVED,
    EXTERNAL,
    MANUAL,
    FALLBACK,
    UNKNOWN
}

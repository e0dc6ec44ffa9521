package com.coinbasis.ingestion.normalizer;

public enum FillType {
    BUY,
    SELL,
    /** Acquire the fill asset by giving up quantity × price of the quote asset, without a market order. */
    CONVERT,
    DEPOSIT,
    WITHDRAWAL,
    TRANSFER
}

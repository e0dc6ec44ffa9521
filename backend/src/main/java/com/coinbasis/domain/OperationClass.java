package com.coinbasis.domain;

/**
 * Grouping class of an operation. Only TRADE and CONVERT events are bucketed into trades.
 */
public enum OperationClass {
    TRADE,
    CONVERT,
    TRANSFER,
    PASS_THROUGH,
    IGNORED
}

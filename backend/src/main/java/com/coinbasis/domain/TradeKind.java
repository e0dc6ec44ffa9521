package com.coinbasis.domain;

public enum TradeKind {
    BUY,
    SELL,
    CONVERT_BUY,
    CONVERT_SELL;

    /** True for kinds that open a lot. */
    public boolean isAcquisition() {
        return this == BUY || this == CONVERT_BUY;
    }

    /** True for kinds that consume lots. */
    public boolean isDisposal() {
        return this == SELL || this == CONVERT_SELL;
    }
}

package com.coinbasis.domain;

/**
 * Canonical operation kind assigned at the normalizer boundary. Downstream logic switches on this enum,
 * never on provider labels.
 */
public enum OperationKind {
    BUY_LEG(OperationClass.TRADE),
    SELL_LEG(OperationClass.TRADE),
    SPEND_LEG(OperationClass.TRADE),
    REVENUE_LEG(OperationClass.TRADE),
    FEE_LEG(OperationClass.TRADE),
    CONVERT_LEG(OperationClass.CONVERT),
    /** Fee paid in a third asset for a convert; buckets with the convert it belongs to. */
    CONVERT_FEE_LEG(OperationClass.CONVERT),
    /** Movement between the owner's own accounts; no tax effect. */
    TRANSFER(OperationClass.TRANSFER),
    /** External inflow: deposit, airdrop, reward, distribution. */
    DEPOSIT(OperationClass.PASS_THROUGH),
    WITHDRAWAL(OperationClass.PASS_THROUGH),
    IGNORED(OperationClass.IGNORED);

    private final OperationClass operationClass;

    OperationKind(OperationClass operationClass) {
        this.operationClass = operationClass;
    }

    public OperationClass operationClass() {
        return operationClass;
    }

    public boolean isFee() {
        return this == FEE_LEG || this == CONVERT_FEE_LEG;
    }

    public boolean isGroupable() {
        return operationClass == OperationClass.TRADE || operationClass == OperationClass.CONVERT;
    }
}

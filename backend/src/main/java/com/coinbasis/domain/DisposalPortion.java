package com.coinbasis.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Part of a disposal matched against one lot. lotId and costBasisUsd are null for the unmatched remainder;
 * costBasisUsd is also null when the consumed lot has no known cost.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class DisposalPortion {

    private String lotId;
    private Instant acquiredAt;
    private BigDecimal amountConsumed;
    private BigDecimal costBasisUsd;
    private BigDecimal proceedsUsd;
    /** Null when there is no acquisition date to measure the holding period against. */
    private Boolean shortTerm;

    public boolean isMatched() {
        return lotId != null;
    }

    public boolean hasKnownCost() {
        return costBasisUsd != null;
    }
}

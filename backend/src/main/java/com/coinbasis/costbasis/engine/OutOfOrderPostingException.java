package com.coinbasis.costbasis.engine;

import lombok.Getter;

import java.time.Instant;

/**
 * Thrown when an acquisition older than the last disposal of its key is posted incrementally. Earlier
 * disposals would have matched different lots, so the key has to be rebuilt from scratch instead.
 */
@Getter
public class OutOfOrderPostingException extends RuntimeException {

    private final LotKey key;
    private final Instant acquiredAt;
    private final Instant lastDisposalAt;

    public OutOfOrderPostingException(LotKey key, Instant acquiredAt, Instant lastDisposalAt) {
        super("Acquisition at " + acquiredAt + " for " + key + " precedes last disposal at " + lastDisposalAt
                + "; rebuild the ledger for this key");
        this.key = key;
        this.acquiredAt = acquiredAt;
        this.lastDisposalAt = lastDisposalAt;
    }
}

package com.coinbasis.costbasis.engine;

import java.util.Objects;

/**
 * Ledger partition: one FIFO lot queue per (owner, asset).
 */
public record LotKey(String owner, String asset) {

    public LotKey {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(asset, "asset");
    }
}

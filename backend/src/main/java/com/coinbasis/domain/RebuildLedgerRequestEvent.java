package com.coinbasis.domain;

import java.util.Set;

/**
 * Application event: rebuild the lot ledger for an owner's assets (e.g. after an import batch).
 * Published by ingestion; consumed by costbasis. An empty asset set means every asset of the owner.
 */
public record RebuildLedgerRequestEvent(String owner, Set<String> assets) {

    public RebuildLedgerRequestEvent {
        assets = assets == null ? Set.of() : Set.copyOf(assets);
    }
}

package com.coinbasis.costbasis.engine;

import com.coinbasis.domain.RebuildLedgerRequestEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Listens for RebuildLedgerRequestEvent (import batches, opening balances); rebuilds the named assets,
 * or every asset of the owner when none are named.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerRebuildEventListener {

    private final LedgerRebuildService ledgerRebuildService;

    @EventListener
    public void onRebuildRequest(RebuildLedgerRequestEvent event) {
        log.debug("Ledger rebuild requested for owner {} assets {}", event.owner(), event.assets());
        if (event.assets().isEmpty()) {
            ledgerRebuildService.rebuildOwner(event.owner());
        } else {
            ledgerRebuildService.rebuildAssets(event.owner(), event.assets());
        }
    }
}

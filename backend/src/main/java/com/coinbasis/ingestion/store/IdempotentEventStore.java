package com.coinbasis.ingestion.store;

import com.coinbasis.domain.TransactionEvent;
import com.coinbasis.domain.TransactionEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Upserts transaction events keyed by (owner, sourceRef). Re-importing a row replaces the stored event
 * with the freshly normalized one under the same id, so no duplicates are created.
 */
@Service
@RequiredArgsConstructor
public class IdempotentEventStore {

    private final TransactionEventRepository repository;

    /**
     * Upsert by (owner, sourceRef). Returns the saved event carrying the stored id.
     */
    public TransactionEvent upsert(TransactionEvent event) {
        if (event.getOwner() == null || event.getSourceRef() == null) {
            throw new IllegalArgumentException("event needs owner and sourceRef to be stored idempotently");
        }
        return repository.findByOwnerAndSourceRef(event.getOwner(), event.getSourceRef())
                .map(existing -> event.toBuilder().id(existing.getId()).build())
                .map(repository::save)
                .orElseGet(() -> repository.save(event));
    }
}

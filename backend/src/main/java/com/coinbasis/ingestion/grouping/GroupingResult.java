package com.coinbasis.ingestion.grouping;

import com.coinbasis.domain.Trade;
import com.coinbasis.domain.TransactionEvent;

import java.util.List;

/**
 * Output of grouping: trades to upsert, unresolved fills, events passed through unchanged (deposits,
 * withdrawals), trades discarded for a non-positive net amount, and events dropped by configuration.
 */
public record GroupingResult(
        List<Trade> trades,
        List<GroupingError> errors,
        List<TransactionEvent> passThrough,
        int discardedTrades,
        int droppedEvents
) {

    public GroupingResult {
        trades = List.copyOf(trades);
        errors = List.copyOf(errors);
        passThrough = List.copyOf(passThrough);
    }
}

package com.coinbasis.ingestion.grouping;

import com.coinbasis.domain.TransactionEvent;

import java.util.List;

/**
 * A fill the grouper could not resolve. Carries the raw events for manual review; never fails the batch.
 */
public record GroupingError(String bucketKey, GroupingErrorCode code, String message, List<TransactionEvent> events) {

    public GroupingError {
        events = List.copyOf(events);
    }

    public String describe() {
        return bucketKey + ": " + code + " " + message;
    }
}

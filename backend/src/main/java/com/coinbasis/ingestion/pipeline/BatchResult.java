package com.coinbasis.ingestion.pipeline;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one import. Partial failures are counted here; errors holds the first N row and grouping problems.
 */
public record BatchResult(
        String owner,
        String provider,
        int recordsReceived,
        int eventsStored,
        int tradesUpserted,
        int tradesRemoved,
        int tradesDiscarded,
        int groupingErrors,
        long parseErrors,
        Map<String, Integer> unknownOperations,
        int passThroughEvents,
        List<String> errors
) {

    public BatchResult {
        unknownOperations = Map.copyOf(unknownOperations);
        errors = List.copyOf(errors);
    }
}

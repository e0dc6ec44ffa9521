package com.coinbasis.ingestion.normalizer;

import com.coinbasis.domain.TransactionEvent;

import java.util.List;
import java.util.Map;

/**
 * Output of normalizing a batch. unknownOperationCounts holds each unknown label once with its row count.
 */
public record NormalizationResult(
        List<TransactionEvent> events,
        List<RowDiagnostic> diagnostics,
        Map<String, Integer> unknownOperationCounts
) {

    public NormalizationResult {
        events = List.copyOf(events);
        diagnostics = List.copyOf(diagnostics);
        unknownOperationCounts = Map.copyOf(unknownOperationCounts);
    }

    public long parseErrorCount() {
        return diagnostics.stream().filter(d -> d.code() == DiagnosticCode.PARSE_ERROR).count();
    }

    public int unknownOperationRowCount() {
        return unknownOperationCounts.values().stream().mapToInt(Integer::intValue).sum();
    }
}

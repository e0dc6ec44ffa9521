package com.coinbasis.ingestion.normalizer;

import com.coinbasis.domain.TransactionEvent;

import java.util.Optional;

/**
 * Either a normalized event or the diagnostic explaining why the row was skipped.
 */
public record NormalizationOutcome(TransactionEvent event, RowDiagnostic diagnostic) {

    public static NormalizationOutcome of(TransactionEvent event) {
        return new NormalizationOutcome(event, null);
    }

    public static NormalizationOutcome skipped(int rowIndex, DiagnosticCode code, String message) {
        return new NormalizationOutcome(null, new RowDiagnostic(rowIndex, code, message));
    }

    public Optional<TransactionEvent> getEvent() {
        return Optional.ofNullable(event);
    }

    public boolean isSkipped() {
        return event == null;
    }
}

package com.coinbasis.ingestion.normalizer;

/**
 * Per-row problem reported with the batch result.
 */
public record RowDiagnostic(int rowIndex, DiagnosticCode code, String message) {

    public String describe() {
        return "row " + rowIndex + ": " + code + " " + message;
    }
}

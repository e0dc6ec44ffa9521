package com.coinbasis.ingestion.normalizer;

public enum DiagnosticCode {
    /** Bad timestamp, amount or asset on one row; the row is skipped. */
    PARSE_ERROR,
    /** Operation label absent from the provider mapping; the row is skipped. */
    UNKNOWN_OPERATION
}

package com.coinbasis.ingestion.normalizer;

import lombok.Getter;

/**
 * Thrown when a batch is structurally invalid (missing owner, unknown provider, missing required columns).
 * Fatal for the whole batch and raised before anything is stored. API maps it to 400 with the error code.
 */
@Getter
public class StructuralInputException extends RuntimeException {

    public static final String MISSING_COLUMNS = "MISSING_COLUMNS";
    public static final String UNKNOWN_PROVIDER = "UNKNOWN_PROVIDER";
    public static final String MISSING_OWNER = "MISSING_OWNER";
    public static final String EMPTY_BATCH = "EMPTY_BATCH";

    private final String errorCode;

    public StructuralInputException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}

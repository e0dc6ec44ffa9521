package com.coinbasis.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Error response body: a machine-readable error code, a human message, per-field details when a request
 * failed validation on several fields, and the time of the failure.
 */
public record ErrorBody(String error, String message,
                        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> details,
                        Instant timestamp) {

    public ErrorBody {
        details = details == null ? List.of() : List.copyOf(details);
    }

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, List.of(), Instant.now());
    }

    public static ErrorBody of(String error, String message, List<String> details) {
        return new ErrorBody(error, message, details, Instant.now());
    }
}

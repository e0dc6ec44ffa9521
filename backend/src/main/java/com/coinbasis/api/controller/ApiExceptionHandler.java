package com.coinbasis.api.controller;

import com.coinbasis.api.dto.ErrorBody;
import com.coinbasis.costbasis.override.OpeningBalanceException;
import com.coinbasis.ingestion.normalizer.StructuralInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.List;
import java.util.Optional;

/**
 * Maps validation failures (@Valid) and structurally invalid input to 400 with ErrorBody.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        List<String> details = ex.getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .toList();
        String message = details.isEmpty() ? "Validation failed" : details.get(0);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message, details));
    }

    @ExceptionHandler(StructuralInputException.class)
    public ResponseEntity<ErrorBody> handleStructuralInput(StructuralInputException ex) {
        log.info("Rejected import: {} {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(OpeningBalanceException.class)
    public ResponseEntity<ErrorBody> handleOpeningBalance(OpeningBalanceException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }
}

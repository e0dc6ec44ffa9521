package com.coinbasis.api.dto;

import com.coinbasis.ingestion.normalizer.FillType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.time.Instant;

public record FillRequest(
        @NotNull(message = "INVALID_FILL")
        FillType type,
        @NotBlank(message = "INVALID_FILL")
        String asset,
        @NotNull(message = "INVALID_FILL")
        @Positive(message = "INVALID_FILL")
        BigDecimal quantity,
        BigDecimal price,
        BigDecimal feeAmount,
        String feeAsset,
        String quoteAsset,
        String externalId,
        @NotNull(message = "INVALID_FILL")
        Instant timestamp
) {
}

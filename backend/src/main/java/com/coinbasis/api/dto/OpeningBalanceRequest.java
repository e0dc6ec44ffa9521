package com.coinbasis.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * POST /api/v1/owners/{owner}/opening-balances request body. clientId makes retries idempotent.
 */
public record OpeningBalanceRequest(
        @NotBlank(message = "INVALID_OPENING_BALANCE")
        String asset,

        @NotNull(message = "INVALID_OPENING_BALANCE")
        @Positive(message = "INVALID_OPENING_BALANCE")
        BigDecimal amount,

        @NotNull(message = "INVALID_OPENING_BALANCE")
        @PositiveOrZero(message = "INVALID_OPENING_BALANCE")
        BigDecimal unitCostUsd,

        @NotNull(message = "INVALID_OPENING_BALANCE")
        Instant acquiredAt,

        String clientId,
        String note
) {
}

package com.coinbasis.api.dto;

import com.coinbasis.domain.PriceSource;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Lot as returned by GET /api/v1/owners/{owner}/lots. unitCostUsd is null when the acquisition was never valued.
 */
public record LotResponse(
        String id,
        String asset,
        Instant acquiredAt,
        BigDecimal originalAmount,
        BigDecimal remainingAmount,
        BigDecimal unitCostUsd,
        PriceSource costSource,
        String sourceTradeId,
        String sourceRef
) {
}

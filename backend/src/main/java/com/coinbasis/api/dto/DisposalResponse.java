package com.coinbasis.api.dto;

import com.coinbasis.domain.ReviewReason;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Disposal as returned by GET /api/v1/owners/{owner}/disposals. Cost and PnL are null while the disposal needs review.
 */
public record DisposalResponse(
        String id,
        String asset,
        Instant disposedAt,
        BigDecimal amount,
        BigDecimal proceedsUsd,
        BigDecimal feeUsd,
        BigDecimal totalCostBasisUsd,
        BigDecimal realizedPnlUsd,
        BigDecimal unmatchedAmount,
        boolean needsReview,
        ReviewReason reviewReason,
        List<PortionResponse> portions
) {
}

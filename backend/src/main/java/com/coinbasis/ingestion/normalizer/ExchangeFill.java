package com.coinbasis.ingestion.normalizer;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Normalized exchange-API fill or transfer. price is in quoteAsset units; quantity is unsigned.
 * quoteAsset may be null, in which case the configured default quote asset applies.
 */
public record ExchangeFill(
        FillType type,
        String asset,
        BigDecimal quantity,
        BigDecimal price,
        BigDecimal feeAmount,
        String feeAsset,
        String quoteAsset,
        String externalId,
        Instant timestamp
) {
}

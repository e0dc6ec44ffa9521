package com.coinbasis.pricing;

import com.coinbasis.domain.PriceSource;

import java.math.BigDecimal;

/**
 * Resolves the historical USD price of an asset. Chain: Stablecoin → external lookup → configured fallback → UNKNOWN.
 */
public interface HistoricalPriceResolver {

    /**
     * Resolve USD price for the request. Returns UNKNOWN when all resolvers in the chain fail.
     */
    PriceResolutionResult resolve(HistoricalPriceRequest request);

    /**
     * Resolve, substituting the caller-supplied default when the chain has no price. A null default keeps UNKNOWN.
     */
    default PriceResolutionResult resolveOrDefault(HistoricalPriceRequest request, BigDecimal defaultPriceUsd) {
        return resolve(request).orElseGet(() -> PriceResolutionResult.known(defaultPriceUsd, PriceSource.FALLBACK));
    }
}

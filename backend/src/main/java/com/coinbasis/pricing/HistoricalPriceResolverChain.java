package com.coinbasis.pricing;

import com.coinbasis.domain.PriceSource;
import com.coinbasis.pricing.config.PricingProperties;
import com.coinbasis.pricing.resolver.ExternalPriceLookupResolver;
import com.coinbasis.pricing.resolver.StablecoinResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Chain: Stablecoin → external lookup → configured fallback price → UNKNOWN.
 */
@Component
@RequiredArgsConstructor
public class HistoricalPriceResolverChain implements HistoricalPriceResolver {

    private final StablecoinResolver stablecoinResolver;
    private final ExternalPriceLookupResolver externalPriceLookupResolver;
    private final PricingProperties pricingProperties;

    @Override
    public PriceResolutionResult resolve(HistoricalPriceRequest request) {
        return stablecoinResolver.resolve(request)
                .orElseGet(() -> externalPriceLookupResolver.resolve(request))
                .orElseGet(() -> PriceResolutionResult.known(pricingProperties.getFallbackPriceUsd(), PriceSource.FALLBACK));
    }
}

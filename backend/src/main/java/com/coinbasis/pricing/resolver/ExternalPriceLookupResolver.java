package com.coinbasis.pricing.resolver;

import com.coinbasis.domain.PriceSource;
import com.coinbasis.pricing.HistoricalPriceLookup;
import com.coinbasis.pricing.HistoricalPriceRequest;
import com.coinbasis.pricing.PriceResolutionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Delegates to the collaborator-supplied {@link HistoricalPriceLookup}. Cache key (asset, UTC date), TTL 24h.
 * Lookup failures are logged and reported as UNKNOWN.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExternalPriceLookupResolver {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final HistoricalPriceLookup historicalPriceLookup;

    @Cacheable(cacheNames = "historicalPriceCache", key = "#request.asset + '-' + #request.date")
    public PriceResolutionResult resolve(HistoricalPriceRequest request) {
        if (request == null || request.getAsset() == null || request.getTimestamp() == null) {
            return PriceResolutionResult.unknown();
        }
        try {
            Optional<BigDecimal> price = historicalPriceLookup.findPriceUsd(request.getAsset(), request.getTimestamp());
            return price
                    .map(p -> PriceResolutionResult.known(p.setScale(SCALE, ROUNDING), PriceSource.EXTERNAL))
                    .orElseGet(() -> {
                        log.debug("No historical price for {} on {}", request.getAsset(), request.getDate());
                        return PriceResolutionResult.unknown();
                    });
        } catch (RuntimeException e) {
            log.warn("Historical price lookup failed for {} on {}: {}", request.getAsset(), request.getDate(), e.getMessage());
            return PriceResolutionResult.unknown();
        }
    }
}

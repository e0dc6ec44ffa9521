package com.coinbasis.pricing.config;

import com.coinbasis.pricing.HistoricalPriceLookup;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Default lookup backed by the configured reference price table. Ignores the timestamp.
 */
public class ReferencePriceLookup implements HistoricalPriceLookup {

    private final Map<String, BigDecimal> pricesUsd;

    public ReferencePriceLookup(Map<String, BigDecimal> pricesUsd) {
        this.pricesUsd = pricesUsd == null ? Map.of() : Map.copyOf(pricesUsd);
    }

    @Override
    public Optional<BigDecimal> findPriceUsd(String asset, Instant timestamp) {
        if (asset == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(pricesUsd.get(asset.strip().toUpperCase(Locale.ROOT)));
    }
}

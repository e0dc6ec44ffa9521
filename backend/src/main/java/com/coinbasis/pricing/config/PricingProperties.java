package com.coinbasis.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Pricing module configuration. Documented in application.yml under coinbasis.pricing.
 */
@ConfigurationProperties(prefix = "coinbasis.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * Price used when no source knows the asset. Unset by default: unresolved prices stay UNKNOWN and the
     * affected trade or lot is surfaced for review instead of being valued with an invented number.
     */
    private BigDecimal fallbackPriceUsd;

    /**
     * Static USD prices served by the built-in lookup (symbol, upper case, to price). Replace the
     * HistoricalPriceLookup bean to plug in a real market-data source.
     */
    private Map<String, BigDecimal> referencePricesUsd = new HashMap<>();
}

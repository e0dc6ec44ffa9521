package com.coinbasis.pricing.config;

import com.coinbasis.pricing.HistoricalPriceLookup;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pricing module configuration: properties and the default price lookup.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    @Bean
    @ConditionalOnMissingBean(HistoricalPriceLookup.class)
    public HistoricalPriceLookup referencePriceLookup(PricingProperties pricingProperties) {
        return new ReferencePriceLookup(pricingProperties.getReferencePricesUsd());
    }
}

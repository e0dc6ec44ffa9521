package com.coinbasis.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

/**
 * MongoDB configuration: amounts, prices and cost bases are stored as Decimal128 so no precision is lost.
 * Indexes are created from @CompoundIndex on the domain documents at startup.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(DecimalConverters.all());
    }
}

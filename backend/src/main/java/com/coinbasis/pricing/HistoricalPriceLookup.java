package com.coinbasis.pricing;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Price source supplied by a collaborator (market-data service, exchange kline cache). The core never
 * performs network I/O itself; implementations may, and may throw, which the chain treats as "no price".
 */
@FunctionalInterface
public interface HistoricalPriceLookup {

    Optional<BigDecimal> findPriceUsd(String asset, Instant timestamp);
}

package com.coinbasis.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface TradeRepository extends MongoRepository<Trade, String> {

    List<Trade> findByOwnerAndAssetOrderByTimestampAsc(String owner, String asset);

    List<Trade> findByOwner(String owner);

    List<Trade> findByOwnerAndProviderAndTimestampGreaterThanEqualAndTimestampLessThan(
            String owner, String provider, Instant from, Instant to);
}

package com.coinbasis.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface LotRepository extends MongoRepository<Lot, String> {

    List<Lot> findByOwnerAndAssetOrderByAcquiredAtAsc(String owner, String asset);

    List<Lot> findByOwnerOrderByAcquiredAtAsc(String owner);

    void deleteByOwnerAndAsset(String owner, String asset);
}

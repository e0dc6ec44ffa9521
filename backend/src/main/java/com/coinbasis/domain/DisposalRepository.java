package com.coinbasis.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface DisposalRepository extends MongoRepository<Disposal, String> {

    List<Disposal> findByOwnerAndDisposedAtGreaterThanEqualAndDisposedAtLessThanOrderByDisposedAtAsc(
            String owner, Instant from, Instant to);

    List<Disposal> findByOwnerOrderByDisposedAtAsc(String owner);

    List<Disposal> findByOwnerAndNeedsReviewOrderByDisposedAtAsc(String owner, boolean needsReview);

    void deleteByOwnerAndAsset(String owner, String asset);
}

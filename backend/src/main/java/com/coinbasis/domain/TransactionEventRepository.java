package com.coinbasis.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TransactionEventRepository extends MongoRepository<TransactionEvent, String> {

    Optional<TransactionEvent> findByOwnerAndSourceRef(String owner, String sourceRef);

    /** Events of one provider in [from, to), used to regroup the minutes touched by a batch. */
    List<TransactionEvent> findByOwnerAndProviderAndTimestampGreaterThanEqualAndTimestampLessThan(
            String owner, String provider, Instant from, Instant to);

    List<TransactionEvent> findByOwnerAndAssetAndOperationKindInOrderByTimestampAsc(
            String owner, String asset, Collection<OperationKind> kinds);

    List<TransactionEvent> findByOwnerAndOperationKindIn(String owner, Collection<OperationKind> kinds);
}

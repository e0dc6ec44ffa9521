package com.coinbasis.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Canonical account activity record produced by the normalizer. Immutable once built; the idempotency
 * key is (owner, sourceRef), so re-importing the same rows upserts the same documents.
 */
@Document(collection = "transaction_events")
@CompoundIndexes({
    @CompoundIndex(name = "owner_sourceRef", def = "{'owner': 1, 'sourceRef': 1}", unique = true),
    @CompoundIndex(name = "owner_provider_timestamp", def = "{'owner': 1, 'provider': 1, 'timestamp': 1}"),
    @CompoundIndex(name = "owner_asset_kind", def = "{'owner': 1, 'asset': 1, 'operationKind': 1}")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TransactionEvent {

    @Id
    private String id;
    @EqualsAndHashCode.Include
    private String owner;
    private String provider;
    private Instant timestamp;
    private OperationKind operationKind;
    /** Provider label the kind was mapped from, kept for review screens. */
    private String operationLabel;
    private String asset;
    private BigDecimal signedAmount;
    @EqualsAndHashCode.Include
    private String sourceRef;
    private String remark;
    /** Fee parsed from the remark, denominated in {@link #asset}; null when the remark carries none. */
    private BigDecimal embeddedFee;
    /** Row position inside its batch; breaks ties between legs with equal timestamps. */
    private int sequence;
    /** Unit cost declared by the user for manual opening balances. */
    private BigDecimal declaredUnitCostUsd;

    public boolean isInflow() {
        return signedAmount != null && signedAmount.signum() > 0;
    }

    public boolean isOutflow() {
        return signedAmount != null && signedAmount.signum() < 0;
    }

    public BigDecimal absoluteAmount() {
        return signedAmount == null ? BigDecimal.ZERO : signedAmount.abs();
    }
}

package com.coinbasis.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical trade derived from one group of transaction events. Recomputable: the id is deterministic,
 * so reprocessing the same events upserts the same document.
 */
@Document(collection = "trades")
@CompoundIndexes({
    @CompoundIndex(name = "owner_asset_timestamp", def = "{'owner': 1, 'asset': 1, 'timestamp': 1}"),
    @CompoundIndex(name = "owner_provider_timestamp", def = "{'owner': 1, 'provider': 1, 'timestamp': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Trade {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String owner;
    private String provider;
    private TradeKind kind;
    private Instant timestamp;
    private String bucketKey;
    /** Primary traded asset. */
    private String asset;
    /** Quote currency paid or received; null for cross pairs and converts valued at market. */
    private String quoteAsset;
    /** Quantity acquired or disposed after own-asset fees. Always positive for persisted trades. */
    private BigDecimal netAmount;
    private BigDecimal counterValueUsd;
    private BigDecimal unitPriceUsd;
    private PriceSource priceSource;
    private BigDecimal feeAmount;
    private String feeAsset;
    private BigDecimal feeUsd;
    /** Part of feeUsd added to the acquisition cost (quote and third-asset fees on acquisitions). */
    private BigDecimal capitalizedFeeUsd;
    private List<String> sourceRefs = new ArrayList<>();

    public BigDecimal feeUsdOrZero() {
        return feeUsd == null ? BigDecimal.ZERO : feeUsd;
    }

    public BigDecimal capitalizedFeeUsdOrZero() {
        return capitalizedFeeUsd == null ? BigDecimal.ZERO : capitalizedFeeUsd;
    }
}

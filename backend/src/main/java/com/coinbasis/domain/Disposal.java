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
 * Result of matching a SELL or CONVERT_SELL trade against lots in acquisition order. The id is the trade id.
 * totalCostBasisUsd and realizedPnlUsd are null whenever any portion lacks a cost basis.
 */
@Document(collection = "disposals")
@CompoundIndexes({
    @CompoundIndex(name = "owner_disposedAt", def = "{'owner': 1, 'disposedAt': 1}"),
    @CompoundIndex(name = "owner_asset_disposedAt", def = "{'owner': 1, 'asset': 1, 'disposedAt': 1}"),
    @CompoundIndex(name = "owner_needsReview", def = "{'owner': 1, 'needsReview': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Disposal {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String tradeId;
    private String owner;
    private String asset;
    private Instant disposedAt;
    private BigDecimal amount;
    /** counterValueUsd minus feeUsd. */
    private BigDecimal proceedsUsd;
    private BigDecimal feeUsd;
    private List<DisposalPortion> portions = new ArrayList<>();
    private BigDecimal totalCostBasisUsd;
    private BigDecimal realizedPnlUsd;
    private BigDecimal unmatchedAmount;
    private boolean needsReview;
    private ReviewReason reviewReason;
}

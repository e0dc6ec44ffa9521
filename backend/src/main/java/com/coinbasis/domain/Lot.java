package com.coinbasis.domain;

import lombok.AccessLevel;
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
import java.util.Objects;

/**
 * Acquisition lot. remainingAmount only decreases, through {@link #consume(BigDecimal)}, and stays within
 * [0, originalAmount]. unitCostUsd is null when the acquisition could not be valued.
 */
@Document(collection = "lots")
@CompoundIndexes({
    @CompoundIndex(name = "owner_asset_acquiredAt", def = "{'owner': 1, 'asset': 1, 'acquiredAt': 1}")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Lot {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String owner;
    private String asset;
    private Instant acquiredAt;
    private BigDecimal originalAmount;
    private BigDecimal remainingAmount;
    private BigDecimal unitCostUsd;
    private PriceSource costSource;
    /** Trade that opened the lot; null for deposits and opening balances. */
    private String sourceTradeId;
    /** Event that opened the lot when it did not come from a trade. */
    private String sourceRef;

    private Lot(String id, String owner, String asset, Instant acquiredAt, BigDecimal amount,
                BigDecimal unitCostUsd, PriceSource costSource, String sourceTradeId, String sourceRef) {
        this.id = Objects.requireNonNull(id, "id");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.asset = Objects.requireNonNull(asset, "asset");
        this.acquiredAt = Objects.requireNonNull(acquiredAt, "acquiredAt");
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("lot amount must be positive: " + amount);
        }
        this.originalAmount = amount;
        this.remainingAmount = amount;
        this.unitCostUsd = unitCostUsd;
        this.costSource = unitCostUsd == null ? PriceSource.UNKNOWN : costSource;
        this.sourceTradeId = sourceTradeId;
        this.sourceRef = sourceRef;
    }

    public static Lot fromTrade(String id, Trade trade, BigDecimal unitCostUsd) {
        return new Lot(id, trade.getOwner(), trade.getAsset(), trade.getTimestamp(), trade.getNetAmount(),
                unitCostUsd, trade.getPriceSource(), trade.getId(), null);
    }

    public static Lot fromEvent(String id, TransactionEvent event, BigDecimal unitCostUsd, PriceSource costSource) {
        return new Lot(id, event.getOwner(), event.getAsset(), event.getTimestamp(), event.absoluteAmount(),
                unitCostUsd, costSource, null, event.getSourceRef());
    }

    /**
     * Decrements remainingAmount by the given positive amount.
     *
     * @throws IllegalArgumentException if amount is not positive or exceeds remainingAmount
     */
    public void consume(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("consumed amount must be positive: " + amount);
        }
        if (amount.compareTo(remainingAmount) > 0) {
            throw new IllegalArgumentException("lot " + id + " has " + remainingAmount + " left, cannot consume " + amount);
        }
        remainingAmount = remainingAmount.subtract(amount);
    }

    public boolean isExhausted() {
        return remainingAmount.signum() == 0;
    }

    public boolean hasKnownCost() {
        return unitCostUsd != null;
    }

    public Lot copy() {
        Lot copy = new Lot(id, owner, asset, acquiredAt, originalAmount, unitCostUsd, costSource, sourceTradeId, sourceRef);
        copy.remainingAmount = remainingAmount;
        return copy;
    }
}

package com.coinbasis.ingestion.grouping;

import com.coinbasis.common.QuoteCurrencyRegistry;
import com.coinbasis.domain.OperationClass;
import com.coinbasis.domain.PriceSource;
import com.coinbasis.domain.Trade;
import com.coinbasis.domain.TradeKind;
import com.coinbasis.domain.TransactionEvent;
import com.coinbasis.ingestion.config.IngestionProperties;
import com.coinbasis.pricing.HistoricalPriceRequest;
import com.coinbasis.pricing.HistoricalPriceResolver;
import com.coinbasis.pricing.PriceResolutionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Collapses transaction events into canonical trades.
 * <p>
 * Events are bucketed by (UTC minute, operation class). Each bucket is split into fills, and each fill
 * resolves to BUY/SELL trades (quote-currency counter leg, shared quote split by gross quantity), a
 * SELL + BUY pair (cross pair valued at market), or CONVERT_SELL/CONVERT_BUY trades (each side valued at
 * its own historical price). Fills that cannot be balanced become {@link GroupingError}s.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TradeGrouper {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final QuoteCurrencyRegistry quoteCurrencyRegistry;
    private final HistoricalPriceResolver historicalPriceResolver;
    private final IngestionProperties ingestionProperties;

    public GroupingResult group(String owner, String provider, List<TransactionEvent> events) {
        List<TransactionEvent> ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparing(TransactionEvent::getTimestamp));

        Map<BucketKey, List<Leg>> buckets = new LinkedHashMap<>();
        List<TransactionEvent> passThrough = new ArrayList<>();
        int dropped = 0;
        for (TransactionEvent event : ordered) {
            OperationClass operationClass = event.getOperationKind().operationClass();
            switch (operationClass) {
                case TRADE, CONVERT -> {
                    if (event.getSignedAmount().signum() == 0) {
                        dropped++;
                    } else {
                        buckets.computeIfAbsent(BucketKey.of(event.getTimestamp(), operationClass), k -> new ArrayList<>())
                                .add(new Leg(event, roleOf(event)));
                    }
                }
                case PASS_THROUGH -> passThrough.add(event);
                case TRANSFER -> {
                    if (ingestionProperties.isDropInternalTransfers()) {
                        dropped++;
                    } else {
                        passThrough.add(event);
                    }
                }
                case IGNORED -> dropped++;
            }
        }

        Batch batch = new Batch(owner, provider);
        buckets.forEach((key, legs) -> {
            List<Fill> fills = Fill.split(legs);
            for (int ordinal = 0; ordinal < fills.size(); ordinal++) {
                resolve(batch, key, fills.get(ordinal), ordinal);
            }
        });
        log.info("Grouped {} events for owner {} ({}): {} trades, {} errors, {} discarded, {} passed through, {} dropped",
                events.size(), owner, provider, batch.trades.size(), batch.errors.size(), batch.discarded,
                passThrough.size(), dropped + batch.dropped);
        return new GroupingResult(batch.trades, batch.errors, passThrough, batch.discarded, dropped + batch.dropped);
    }

    private LegRole roleOf(TransactionEvent event) {
        if (event.getOperationKind().isFee()) {
            return LegRole.FEE;
        }
        boolean quote = quoteCurrencyRegistry.isQuoteCurrency(event.getAsset());
        if (event.isInflow()) {
            return quote ? LegRole.QUOTE_IN : LegRole.ACQUIRED;
        }
        return quote ? LegRole.QUOTE_OUT : LegRole.DISPOSED;
    }

    private void resolve(Batch batch, BucketKey key, Fill fill, int ordinal) {
        boolean convert = key.operationClass() == OperationClass.CONVERT;
        boolean acquired = fill.has(LegRole.ACQUIRED);
        boolean disposed = fill.has(LegRole.DISPOSED);
        List<Leg> quoteLegs = fill.quoteLegs();

        if (!acquired && !disposed) {
            if (fill.has(LegRole.QUOTE_IN) && fill.has(LegRole.QUOTE_OUT)) {
                log.debug("Bucket {}: quote-to-quote exchange, no lot effect", key);
                batch.dropped += fill.size();
            } else if (quoteLegs.isEmpty()) {
                batch.error(key, GroupingErrorCode.ORPHAN_FEE, "fee legs without a trade", fill);
            } else {
                batch.error(key, convert ? GroupingErrorCode.UNMATCHED_CONVERT : GroupingErrorCode.UNBALANCED_LEGS,
                        "quote leg without an asset leg", fill);
            }
            return;
        }

        List<Draft> drafts;
        if (acquired && disposed) {
            if (!quoteLegs.isEmpty()) {
                batch.error(key, GroupingErrorCode.UNBALANCED_LEGS, "acquired, disposed and quote legs in one fill", fill);
                return;
            }
            Set<String> bothSides = fill.grossByAsset(LegRole.ACQUIRED).keySet();
            if (bothSides.stream().anyMatch(fill.grossByAsset(LegRole.DISPOSED)::containsKey)) {
                batch.error(key, GroupingErrorCode.UNBALANCED_LEGS, "same asset acquired and disposed in one fill", fill);
                return;
            }
            drafts = convert ? convertDrafts(batch, key, fill) : crossPairDrafts(batch, key, fill);
        } else {
            BigDecimal quoteNet = quoteLegs.stream()
                    .map(l -> l.event().getSignedAmount())
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            boolean balanced = acquired ? quoteNet.signum() < 0 : quoteNet.signum() > 0;
            if (!balanced) {
                batch.error(key, convert ? GroupingErrorCode.UNMATCHED_CONVERT : GroupingErrorCode.UNBALANCED_LEGS,
                        acquired ? "acquired legs with no matching spend leg" : "disposed legs with no matching revenue leg",
                        fill);
                return;
            }
            drafts = quoteDrafts(fill, acquired, convert, quoteNet.abs());
        }
        if (drafts != null) {
            emit(batch, key, fill, ordinal, drafts);
        }
    }

    /**
     * One trade per asset on the traded side, the quote amount split by gross quantity share.
     */
    private static List<Draft> quoteDrafts(Fill fill, boolean acquisition, boolean convert, BigDecimal quoteTotal) {
        LegRole side = acquisition ? LegRole.ACQUIRED : LegRole.DISPOSED;
        LegRole counterRole = acquisition ? LegRole.QUOTE_OUT : LegRole.QUOTE_IN;
        TradeKind kind = kind(acquisition, convert);
        String quoteAsset = fill.legs(counterRole).stream().map(Leg::asset).findFirst().orElse(null);

        Map<String, BigDecimal> gross = fill.grossByAsset(side);
        List<String> assets = new ArrayList<>(gross.keySet());
        List<BigDecimal> shares = ProportionalAllocator.allocate(quoteTotal, new ArrayList<>(gross.values()));
        List<Draft> drafts = new ArrayList<>();
        for (int i = 0; i < assets.size(); i++) {
            drafts.add(new Draft(kind, assets.get(i), gross.get(assets.get(i)), shares.get(i), PriceSource.STABLECOIN, quoteAsset));
        }
        return drafts;
    }

    /**
     * Asset-for-asset trade outside a convert: both sides share one market value, taken from the disposed
     * asset's price, else from the acquired asset's price.
     */
    private List<Draft> crossPairDrafts(Batch batch, BucketKey key, Fill fill) {
        Map<String, BigDecimal> acquired = fill.grossByAsset(LegRole.ACQUIRED);
        Map<String, BigDecimal> disposed = fill.grossByAsset(LegRole.DISPOSED);
        if (acquired.size() != 1 || disposed.size() != 1) {
            batch.error(key, GroupingErrorCode.AMBIGUOUS_CROSS_PAIR,
                    "cross pair with assets " + disposed.keySet() + " -> " + acquired.keySet(), fill);
            return null;
        }
        Map.Entry<String, BigDecimal> in = acquired.entrySet().iterator().next();
        Map.Entry<String, BigDecimal> out = disposed.entrySet().iterator().next();
        Instant at = fill.timestamp();

        PriceResolutionResult outPrice = price(out.getKey(), at);
        if (outPrice.isKnown()) {
            BigDecimal value = outPrice.valueOf(out.getValue()).orElseThrow();
            return List.of(
                    new Draft(TradeKind.SELL, out.getKey(), out.getValue(), value, outPrice.getPriceSource(), null),
                    new Draft(TradeKind.BUY, in.getKey(), in.getValue(), value, PriceSource.SWAP_DERIVED, null));
        }
        PriceResolutionResult inPrice = price(in.getKey(), at);
        if (inPrice.isKnown()) {
            BigDecimal value = inPrice.valueOf(in.getValue()).orElseThrow();
            return List.of(
                    new Draft(TradeKind.SELL, out.getKey(), out.getValue(), value, PriceSource.SWAP_DERIVED, null),
                    new Draft(TradeKind.BUY, in.getKey(), in.getValue(), value, inPrice.getPriceSource(), null));
        }
        batch.error(key, GroupingErrorCode.PRICE_UNAVAILABLE,
                "no price for " + out.getKey() + " or " + in.getKey() + " at " + at, fill);
        return null;
    }

    /**
     * Convert without a quote leg: every disposed asset becomes a CONVERT_SELL and every acquired asset a
     * CONVERT_BUY, each valued at its own historical price. With one asset per side, a missing price is
     * derived from the other side's value.
     */
    private List<Draft> convertDrafts(Batch batch, BucketKey key, Fill fill) {
        Map<String, BigDecimal> acquired = fill.grossByAsset(LegRole.ACQUIRED);
        Map<String, BigDecimal> disposed = fill.grossByAsset(LegRole.DISPOSED);
        Instant at = fill.timestamp();
        Map<String, PriceResolutionResult> prices = new LinkedHashMap<>();
        disposed.keySet().forEach(asset -> prices.put(asset, price(asset, at)));
        acquired.keySet().forEach(asset -> prices.putIfAbsent(asset, price(asset, at)));

        Set<String> unpriced = prices.entrySet().stream()
                .filter(e -> e.getValue().isUnknown())
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());
        boolean onePerSide = acquired.size() == 1 && disposed.size() == 1;
        if (!unpriced.isEmpty() && !(onePerSide && unpriced.size() == 1)) {
            batch.error(key, GroupingErrorCode.PRICE_UNAVAILABLE, "no price for " + unpriced + " at " + at, fill);
            return null;
        }

        List<Draft> drafts = new ArrayList<>();
        disposed.forEach((asset, gross) ->
                drafts.add(new Draft(TradeKind.CONVERT_SELL, asset, gross, null, null, null)));
        acquired.forEach((asset, gross) ->
                drafts.add(new Draft(TradeKind.CONVERT_BUY, asset, gross, null, null, null)));

        List<Draft> valued = new ArrayList<>();
        for (Draft draft : drafts) {
            PriceResolutionResult price = prices.get(draft.asset());
            if (price.isUnknown()) {
                Draft other = drafts.stream().filter(d -> d != draft).findFirst().orElseThrow();
                BigDecimal otherValue = prices.get(other.asset()).valueOf(other.gross()).orElseThrow();
                valued.add(draft.valued(otherValue, PriceSource.SWAP_DERIVED));
            } else {
                valued.add(draft.valued(price.valueOf(draft.gross()).orElseThrow(), price.getPriceSource()));
            }
        }
        return valued;
    }

    private void emit(Batch batch, BucketKey key, Fill fill, int ordinal, List<Draft> drafts) {
        Instant at = fill.timestamp();
        Map<String, BigDecimal> fees = fill.fees();
        Set<String> tradedAssets = drafts.stream().map(Draft::asset).collect(Collectors.toSet());

        // fees in an asset no trade of this fill carries are shared by the acquisitions (else the disposals)
        List<Draft> bearers = drafts.stream().filter(d -> d.kind().isAcquisition()).toList();
        if (bearers.isEmpty()) {
            bearers = drafts;
        }
        BigDecimal sharedFeeUsd = BigDecimal.ZERO;
        String sharedFeeAsset = null;
        BigDecimal sharedFeeAmount = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> fee : fees.entrySet()) {
            if (tradedAssets.contains(fee.getKey())) {
                continue;
            }
            if (sharedFeeAsset == null) {
                sharedFeeAsset = fee.getKey();
                sharedFeeAmount = fee.getValue();
            }
            PriceResolutionResult feePrice = price(fee.getKey(), at);
            if (feePrice.isUnknown()) {
                log.warn("Bucket {}: no price for fee {} {}, fee left out of USD totals", key, fee.getValue(), fee.getKey());
                continue;
            }
            sharedFeeUsd = sharedFeeUsd.add(feePrice.valueOf(fee.getValue()).orElseThrow());
        }
        List<BigDecimal> bearerWeights = bearers.stream().map(Draft::gross).toList();
        List<BigDecimal> feeUsdShares = ProportionalAllocator.allocate(sharedFeeUsd, bearerWeights);
        List<BigDecimal> feeAmountShares = ProportionalAllocator.allocate(sharedFeeAmount, bearerWeights);

        List<String> sourceRefs = fill.events().stream().map(TransactionEvent::getSourceRef).toList();
        for (Draft draft : drafts) {
            BigDecimal ownFee = fees.getOrDefault(draft.asset(), BigDecimal.ZERO);
            // an acquisition receives less than gross; a disposal still gives up the gross amount and
            // the fee only reduces its proceeds
            BigDecimal net = draft.kind().isAcquisition() ? draft.gross().subtract(ownFee) : draft.gross();
            if (net.signum() <= 0) {
                log.warn("Bucket {}: {} {} nets to {} after fees, trade discarded", key, draft.kind(), draft.asset(), net);
                batch.discarded++;
                continue;
            }
            BigDecimal unitPrice = draft.counterValueUsd().divide(net, SCALE, ROUNDING);
            int bearerIndex = bearers.indexOf(draft);
            BigDecimal sharedUsd = bearerIndex < 0 ? BigDecimal.ZERO : feeUsdShares.get(bearerIndex);

            Trade trade = new Trade();
            trade.setId(TradeIdGenerator.tradeId(batch.owner, batch.provider, key, draft.kind(), draft.asset(), ordinal));
            trade.setOwner(batch.owner);
            trade.setProvider(batch.provider);
            trade.setKind(draft.kind());
            trade.setTimestamp(at);
            trade.setBucketKey(key.asString());
            trade.setAsset(draft.asset());
            trade.setQuoteAsset(draft.quoteAsset());
            trade.setNetAmount(net);
            trade.setCounterValueUsd(draft.counterValueUsd());
            trade.setUnitPriceUsd(unitPrice);
            trade.setPriceSource(draft.priceSource());
            trade.setFeeUsd(scaled(ownFee.multiply(unitPrice)).add(sharedUsd));
            trade.setCapitalizedFeeUsd(draft.kind().isAcquisition() ? sharedUsd : BigDecimal.ZERO);
            if (ownFee.signum() > 0) {
                trade.setFeeAsset(draft.asset());
                trade.setFeeAmount(ownFee);
            } else if (bearerIndex >= 0 && sharedFeeAsset != null) {
                trade.setFeeAsset(sharedFeeAsset);
                trade.setFeeAmount(feeAmountShares.get(bearerIndex));
            } else {
                trade.setFeeAmount(BigDecimal.ZERO);
            }
            trade.setSourceRefs(new ArrayList<>(sourceRefs));
            batch.trades.add(trade);
            log.debug("Bucket {} fill {}: {} {} {} for {} USD (unit {})",
                    key, ordinal, draft.kind(), net, draft.asset(), draft.counterValueUsd(), unitPrice);
        }
    }

    private PriceResolutionResult price(String asset, Instant at) {
        return historicalPriceResolver.resolve(HistoricalPriceRequest.of(asset, at));
    }

    private static TradeKind kind(boolean acquisition, boolean convert) {
        if (convert) {
            return acquisition ? TradeKind.CONVERT_BUY : TradeKind.CONVERT_SELL;
        }
        return acquisition ? TradeKind.BUY : TradeKind.SELL;
    }

    private static BigDecimal scaled(BigDecimal value) {
        return value.setScale(SCALE, ROUNDING);
    }

    private record Draft(TradeKind kind, String asset, BigDecimal gross, BigDecimal counterValueUsd,
                         PriceSource priceSource, String quoteAsset) {

        Draft valued(BigDecimal value, PriceSource source) {
            return new Draft(kind, asset, gross, value, source, quoteAsset);
        }
    }

    private static final class Batch {
        private final String owner;
        private final String provider;
        private final List<Trade> trades = new ArrayList<>();
        private final List<GroupingError> errors = new ArrayList<>();
        private int discarded;
        private int dropped;

        Batch(String owner, String provider) {
            this.owner = owner;
            this.provider = provider;
        }

        void error(BucketKey key, GroupingErrorCode code, String message, Fill fill) {
            log.warn("Bucket {}: {} {}", key, code, message);
            errors.add(new GroupingError(key.asString(), code, message, fill.events()));
        }
    }
}

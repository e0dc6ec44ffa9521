package com.coinbasis.costbasis.engine;

import com.coinbasis.common.QuoteCurrencyRegistry;
import com.coinbasis.domain.Disposal;
import com.coinbasis.domain.DisposalRepository;
import com.coinbasis.domain.Lot;
import com.coinbasis.domain.LotRepository;
import com.coinbasis.domain.OperationKind;
import com.coinbasis.domain.PriceSource;
import com.coinbasis.domain.Trade;
import com.coinbasis.domain.TradeRepository;
import com.coinbasis.domain.TransactionEvent;
import com.coinbasis.domain.TransactionEventRepository;
import com.coinbasis.pricing.HistoricalPriceRequest;
import com.coinbasis.pricing.HistoricalPriceResolver;
import com.coinbasis.pricing.PriceResolutionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Rebuilds the lot ledger of an (owner, asset) from scratch: loads all trades and deposit events, replays
 * them in timestamp order (acquisitions before disposals at equal timestamps) and replaces the persisted lots
 * and disposals. Safe to abort and retry: everything is derived from the stored events and trades.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerRebuildService {

    private static final List<OperationKind> LOT_OPENING_EVENTS = List.of(OperationKind.DEPOSIT);

    private final FifoLotLedger ledger;
    private final TradeRepository tradeRepository;
    private final TransactionEventRepository transactionEventRepository;
    private final LotRepository lotRepository;
    private final DisposalRepository disposalRepository;
    private final HistoricalPriceResolver historicalPriceResolver;
    private final QuoteCurrencyRegistry quoteCurrencyRegistry;
    private final LedgerProperties ledgerProperties;

    public LedgerRebuildResult rebuild(String owner, String asset) {
        LotKey key = new LotKey(owner, asset);
        // postings are read under the key lock so a concurrent rebuild can never persist an older read
        return ledger.withLock(key, () -> {
            try {
                List<Posting> postings = loadPostings(owner, asset);
                ledger.reset(key);
                List<Disposal> disposals = new ArrayList<>();
                for (Posting posting : postings) {
                    if (posting.trade() == null) {
                        ledger.postAcquisition(posting.deposit(), posting.unitCostUsd(), posting.costSource());
                    } else if (posting.trade().getKind().isAcquisition()) {
                        ledger.postBuy(posting.trade());
                    } else {
                        disposals.add(ledger.postSell(posting.trade()));
                    }
                }
                List<Lot> lots = ledger.snapshot(key);
                lotRepository.deleteByOwnerAndAsset(owner, asset);
                lotRepository.saveAll(lots);
                disposalRepository.deleteByOwnerAndAsset(owner, asset);
                disposalRepository.saveAll(disposals);

                int needsReview = (int) disposals.stream().filter(Disposal::isNeedsReview).count();
                BigDecimal remaining = lots.stream().map(Lot::getRemainingAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
                log.info("Rebuilt ledger {}: {} postings, {} lots, {} disposals ({} need review), {} remaining",
                        key, postings.size(), lots.size(), disposals.size(), needsReview, remaining);
                return new LedgerRebuildResult(owner, asset, lots.size(), disposals.size(), needsReview, remaining);
            } finally {
                ledger.evict(key);
            }
        });
    }

    /**
     * Rebuilds every non-quote asset the owner has trades or deposits for.
     */
    public List<LedgerRebuildResult> rebuildOwner(String owner) {
        Set<String> assets = new TreeSet<>();
        tradeRepository.findByOwner(owner).forEach(t -> assets.add(t.getAsset()));
        transactionEventRepository.findByOwnerAndOperationKindIn(owner, LOT_OPENING_EVENTS)
                .forEach(e -> assets.add(e.getAsset()));
        return rebuildAssets(owner, assets);
    }

    public List<LedgerRebuildResult> rebuildAssets(String owner, Set<String> assets) {
        return assets.stream()
                .filter(asset -> !quoteCurrencyRegistry.isQuoteCurrency(asset))
                .sorted()
                .map(asset -> rebuild(owner, asset))
                .toList();
    }

    private List<Posting> loadPostings(String owner, String asset) {
        List<Posting> postings = new ArrayList<>();
        for (Trade trade : tradeRepository.findByOwnerAndAssetOrderByTimestampAsc(owner, asset)) {
            postings.add(new Posting(trade.getTimestamp(), trade.getKind().isAcquisition(), trade.getId(), trade, null, null, null));
        }
        if (ledgerProperties.isDepositsCreateLots()) {
            for (TransactionEvent deposit : transactionEventRepository
                    .findByOwnerAndAssetAndOperationKindInOrderByTimestampAsc(owner, asset, LOT_OPENING_EVENTS)) {
                if (!deposit.isInflow()) {
                    continue;
                }
                PriceResolutionResult cost = valueDeposit(deposit);
                postings.add(new Posting(deposit.getTimestamp(), true, deposit.getSourceRef(), null, deposit,
                        cost.getPriceUsd().orElse(null), cost.getPriceSource()));
            }
        }
        postings.sort(Comparator.comparing(Posting::timestamp)
                .thenComparing(p -> !p.acquisition())
                .thenComparing(Posting::id));
        return postings;
    }

    private PriceResolutionResult valueDeposit(TransactionEvent deposit) {
        if (deposit.getDeclaredUnitCostUsd() != null) {
            return PriceResolutionResult.known(deposit.getDeclaredUnitCostUsd(), PriceSource.MANUAL);
        }
        PriceResolutionResult price = historicalPriceResolver.resolve(
                HistoricalPriceRequest.of(deposit.getAsset(), deposit.getTimestamp()));
        if (price.isUnknown()) {
            log.warn("No price for deposit {} of {} {} at {}; lot opened with unknown cost",
                    deposit.getSourceRef(), deposit.getSignedAmount(), deposit.getAsset(), deposit.getTimestamp());
        }
        return price;
    }

    private record Posting(Instant timestamp, boolean acquisition, String id, Trade trade, TransactionEvent deposit,
                           BigDecimal unitCostUsd, PriceSource costSource) {
    }
}

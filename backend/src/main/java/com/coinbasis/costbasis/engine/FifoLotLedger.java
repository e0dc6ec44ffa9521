package com.coinbasis.costbasis.engine;

import com.coinbasis.common.DeterministicIds;
import com.coinbasis.costbasis.tax.HoldingPeriod;
import com.coinbasis.domain.Disposal;
import com.coinbasis.domain.DisposalPortion;
import com.coinbasis.domain.Lot;
import com.coinbasis.domain.PriceSource;
import com.coinbasis.domain.ReviewReason;
import com.coinbasis.domain.Trade;
import com.coinbasis.domain.TransactionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory FIFO lot arena, one queue per (owner, asset). All mutation of lot remaining amounts goes through
 * {@link #postBuy}, {@link #postAcquisition} and {@link #postSell}; posts for the same key are serialized by a
 * per-key lock, so two disposals never decrement from the same baseline.
 * <p>
 * Queues only live while a key is being replayed: once its lots are persisted the caller {@link #evict}s the
 * key. Only the per-key locks outlive a rebuild.
 */
@Component
@Slf4j
public class FifoLotLedger {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final ConcurrentMap<LotKey, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentMap<LotKey, LotQueue> queues = new ConcurrentHashMap<>();

    /**
     * Opens a lot for a BUY or CONVERT_BUY trade with unitCost = (counterValueUsd + capitalizedFeeUsd) / netAmount.
     *
     * @throws OutOfOrderPostingException if the trade is older than the key's last disposal
     */
    public Lot postBuy(Trade trade) {
        if (trade.getKind() == null || !trade.getKind().isAcquisition()) {
            throw new IllegalArgumentException("postBuy needs an acquisition trade, got " + trade.getKind());
        }
        BigDecimal unitCost = trade.getCounterValueUsd() == null
                ? null
                : trade.getCounterValueUsd().add(trade.capitalizedFeeUsdOrZero())
                        .divide(trade.getNetAmount(), SCALE, ROUNDING);
        Lot lot = Lot.fromTrade(DeterministicIds.of("lot", trade.getOwner(), trade.getId()), trade, unitCost);
        return insert(lot);
    }

    /**
     * Opens a lot for an external inflow (deposit, airdrop, opening balance). unitCostUsd may be null when the
     * inflow could not be valued; disposals consuming such a lot are flagged for review.
     *
     * @throws OutOfOrderPostingException if the event is older than the key's last disposal
     */
    public Lot postAcquisition(TransactionEvent event, BigDecimal unitCostUsd, PriceSource costSource) {
        if (!event.isInflow()) {
            throw new IllegalArgumentException("postAcquisition needs an inflow, got " + event.getSignedAmount());
        }
        Lot lot = Lot.fromEvent(DeterministicIds.of("lot", event.getOwner(), event.getSourceRef()), event,
                unitCostUsd, costSource);
        return insert(lot);
    }

    /**
     * Matches a SELL or CONVERT_SELL trade against the key's lots, oldest first, consuming
     * min(remaining, lot.remaining) from each lot acquired at or before the trade. Whatever the lots cannot cover
     * is recorded as an unmatched portion with a null cost basis and the disposal is flagged for review.
     */
    public Disposal postSell(Trade trade) {
        if (trade.getKind() == null || !trade.getKind().isDisposal()) {
            throw new IllegalArgumentException("postSell needs a disposal trade, got " + trade.getKind());
        }
        LotKey key = new LotKey(trade.getOwner(), trade.getAsset());
        return withLock(key, () -> {
            LotQueue queue = queue(key);
            BigDecimal remaining = trade.getNetAmount();
            List<DisposalPortion> portions = new ArrayList<>();
            for (Lot lot : queue.lots) {
                if (remaining.signum() <= 0 || lot.getAcquiredAt().isAfter(trade.getTimestamp())) {
                    break;
                }
                if (lot.isExhausted()) {
                    continue;
                }
                BigDecimal take = remaining.min(lot.getRemainingAmount());
                lot.consume(take);
                remaining = remaining.subtract(take);
                BigDecimal cost = lot.hasKnownCost() ? take.multiply(lot.getUnitCostUsd()).setScale(SCALE, ROUNDING) : null;
                portions.add(new DisposalPortion(lot.getId(), lot.getAcquiredAt(), take, cost, null,
                        HoldingPeriod.isShortTerm(lot.getAcquiredAt(), trade.getTimestamp())));
            }
            if (remaining.signum() > 0) {
                portions.add(new DisposalPortion(null, null, remaining, null, null, null));
                log.warn("Insufficient lots for {}: {} of {} unmatched on trade {}",
                        key, remaining, trade.getNetAmount(), trade.getId());
            }
            queue.lastDisposalAt = queue.lastDisposalAt == null || trade.getTimestamp().isAfter(queue.lastDisposalAt)
                    ? trade.getTimestamp()
                    : queue.lastDisposalAt;
            return toDisposal(trade, portions, remaining);
        });
    }

    /**
     * Runs the action while holding the key's lock. The lock is reentrant, so the action may post to the same key.
     */
    public <T> T withLock(LotKey key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every lot of the key. Callers rebuilding a key hold its lock across reset and replay.
     */
    public void reset(LotKey key) {
        withLock(key, () -> queues.remove(key));
    }

    /**
     * Releases the key's queue once its lots are persisted. The next post to the key starts from an empty queue.
     */
    public void evict(LotKey key) {
        withLock(key, () -> {
            LotQueue evicted = queues.remove(key);
            if (evicted != null) {
                log.debug("Evicted {} lots of {}", evicted.lots.size(), key);
            }
            return null;
        });
    }

    /**
     * Keys whose lots are currently held in memory.
     */
    public Set<LotKey> residentKeys() {
        return Set.copyOf(queues.keySet());
    }

    /**
     * Copies of the key's lots in FIFO order.
     */
    public List<Lot> snapshot(LotKey key) {
        return withLock(key, () -> {
            LotQueue queue = queues.get(key);
            return queue == null ? List.<Lot>of() : queue.lots.stream().map(Lot::copy).toList();
        });
    }

    private Lot insert(Lot lot) {
        LotKey key = new LotKey(lot.getOwner(), lot.getAsset());
        return withLock(key, () -> {
            LotQueue queue = queue(key);
            if (queue.lastDisposalAt != null && lot.getAcquiredAt().isBefore(queue.lastDisposalAt)) {
                throw new OutOfOrderPostingException(key, lot.getAcquiredAt(), queue.lastDisposalAt);
            }
            int index = queue.lots.size();
            while (index > 0 && queue.lots.get(index - 1).getAcquiredAt().isAfter(lot.getAcquiredAt())) {
                index--;
            }
            queue.lots.add(index, lot);
            log.debug("Opened lot {} for {}: {} at {}", lot.getId(), key, lot.getOriginalAmount(), lot.getUnitCostUsd());
            return lot;
        });
    }

    private Disposal toDisposal(Trade trade, List<DisposalPortion> portions, BigDecimal unmatched) {
        BigDecimal proceeds = trade.getCounterValueUsd() == null
                ? null
                : trade.getCounterValueUsd().subtract(trade.feeUsdOrZero());
        allocateProceeds(portions, proceeds, trade.getNetAmount());

        boolean insufficient = unmatched.signum() > 0;
        boolean unknownCost = portions.stream().anyMatch(p -> p.isMatched() && !p.hasKnownCost());
        BigDecimal totalCost = null;
        if (!insufficient && !unknownCost) {
            totalCost = portions.stream().map(DisposalPortion::getCostBasisUsd).reduce(BigDecimal.ZERO, BigDecimal::add);
        }

        Disposal disposal = new Disposal();
        disposal.setId(trade.getId());
        disposal.setTradeId(trade.getId());
        disposal.setOwner(trade.getOwner());
        disposal.setAsset(trade.getAsset());
        disposal.setDisposedAt(trade.getTimestamp());
        disposal.setAmount(trade.getNetAmount());
        disposal.setProceedsUsd(proceeds);
        disposal.setFeeUsd(trade.feeUsdOrZero());
        disposal.setPortions(portions);
        disposal.setTotalCostBasisUsd(totalCost);
        disposal.setRealizedPnlUsd(totalCost == null || proceeds == null ? null : proceeds.subtract(totalCost));
        disposal.setUnmatchedAmount(unmatched.max(BigDecimal.ZERO));
        disposal.setNeedsReview(insufficient || unknownCost);
        disposal.setReviewReason(insufficient ? ReviewReason.INSUFFICIENT_LOTS
                : unknownCost ? ReviewReason.UNKNOWN_COST_BASIS : null);
        return disposal;
    }

    private static void allocateProceeds(List<DisposalPortion> portions, BigDecimal proceeds, BigDecimal amount) {
        if (proceeds == null || portions.isEmpty()) {
            return;
        }
        BigDecimal allocated = BigDecimal.ZERO;
        for (int i = 0; i < portions.size(); i++) {
            DisposalPortion portion = portions.get(i);
            BigDecimal share = i == portions.size() - 1
                    ? proceeds.subtract(allocated)
                    : proceeds.multiply(portion.getAmountConsumed()).divide(amount, SCALE, ROUNDING);
            portion.setProceedsUsd(share);
            allocated = allocated.add(share);
        }
    }

    private LotQueue queue(LotKey key) {
        return queues.computeIfAbsent(key, k -> new LotQueue());
    }

    private static final class LotQueue {
        private final List<Lot> lots = new ArrayList<>();
        private Instant lastDisposalAt;
    }
}

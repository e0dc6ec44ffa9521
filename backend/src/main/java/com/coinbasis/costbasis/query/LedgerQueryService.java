package com.coinbasis.costbasis.query;

import com.coinbasis.domain.Disposal;
import com.coinbasis.domain.DisposalRepository;
import com.coinbasis.domain.Lot;
import com.coinbasis.domain.LotRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Read side of the persisted ledger: lot snapshots and disposals.
 */
@Service
@RequiredArgsConstructor
public class LedgerQueryService {

    private final LotRepository lotRepository;
    private final DisposalRepository disposalRepository;

    /**
     * Lots of the owner in FIFO order; all assets when asset is null.
     */
    public List<Lot> findLots(String owner, String asset) {
        if (asset == null || asset.isBlank()) {
            return lotRepository.findByOwnerOrderByAcquiredAtAsc(owner);
        }
        return lotRepository.findByOwnerAndAssetOrderByAcquiredAtAsc(owner, asset.strip().toUpperCase(Locale.ROOT));
    }

    /**
     * Disposals of the owner by disposal time; only those with the given review flag when needsReview is set.
     */
    public List<Disposal> findDisposals(String owner, Boolean needsReview) {
        if (needsReview == null) {
            return disposalRepository.findByOwnerOrderByDisposedAtAsc(owner);
        }
        return disposalRepository.findByOwnerAndNeedsReviewOrderByDisposedAtAsc(owner, needsReview);
    }
}

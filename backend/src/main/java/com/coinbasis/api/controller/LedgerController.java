package com.coinbasis.api.controller;

import com.coinbasis.api.dto.DisposalResponse;
import com.coinbasis.api.dto.LotResponse;
import com.coinbasis.api.dto.OpeningBalanceRequest;
import com.coinbasis.api.dto.OpeningBalanceResponse;
import com.coinbasis.api.dto.PortionResponse;
import com.coinbasis.api.dto.RebuildResponse;
import com.coinbasis.costbasis.engine.LedgerRebuildResult;
import com.coinbasis.costbasis.engine.LedgerRebuildService;
import com.coinbasis.costbasis.override.OpeningBalance;
import com.coinbasis.costbasis.override.OpeningBalanceService;
import com.coinbasis.costbasis.query.LedgerQueryService;
import com.coinbasis.domain.Disposal;
import com.coinbasis.domain.Lot;
import com.coinbasis.domain.TransactionEvent;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lots, disposals, opening balances and on-demand ledger rebuilds for one owner.
 */
@RestController
@RequestMapping("/api/v1/owners/{owner}")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerQueryService ledgerQueryService;
    private final LedgerRebuildService ledgerRebuildService;
    private final OpeningBalanceService openingBalanceService;

    @GetMapping("/lots")
    public ResponseEntity<List<LotResponse>> getLots(@PathVariable String owner,
                                                     @RequestParam(required = false) String asset) {
        return ResponseEntity.ok(ledgerQueryService.findLots(owner.trim(), asset).stream()
                .map(LedgerController::toLotResponse)
                .toList());
    }

    @GetMapping("/disposals")
    public ResponseEntity<List<DisposalResponse>> getDisposals(@PathVariable String owner,
                                                               @RequestParam(required = false) Boolean needsReview) {
        return ResponseEntity.ok(ledgerQueryService.findDisposals(owner.trim(), needsReview).stream()
                .map(LedgerController::toDisposalResponse)
                .toList());
    }

    /**
     * Rebuilds one asset when asset is given, otherwise every asset the owner has traded or deposited.
     */
    @PostMapping("/ledger/rebuild")
    public ResponseEntity<List<RebuildResponse>> rebuild(@PathVariable String owner,
                                                         @RequestParam(required = false) String asset) {
        List<LedgerRebuildResult> results = asset == null || asset.isBlank()
                ? ledgerRebuildService.rebuildOwner(owner.trim())
                : ledgerRebuildService.rebuildAssets(owner.trim(), Set.of(asset.trim().toUpperCase(Locale.ROOT)));
        return ResponseEntity.ok(results.stream()
                .map(r -> new RebuildResponse(r.asset(), r.lots(), r.disposals(), r.needsReview(), r.remainingAmount()))
                .toList());
    }

    @PostMapping("/opening-balances")
    public ResponseEntity<OpeningBalanceResponse> addOpeningBalance(@PathVariable String owner,
                                                                    @RequestBody @Valid OpeningBalanceRequest request) {
        TransactionEvent event = openingBalanceService.record(new OpeningBalance(owner.trim(), request.asset(),
                request.amount(), request.unitCostUsd(), request.acquiredAt(), request.clientId(), request.note()));
        return ResponseEntity.accepted().body(new OpeningBalanceResponse(event.getSourceRef(), event.getAsset(),
                event.getSignedAmount(), event.getDeclaredUnitCostUsd(), event.getTimestamp()));
    }

    private static LotResponse toLotResponse(Lot lot) {
        return new LotResponse(lot.getId(), lot.getAsset(), lot.getAcquiredAt(), lot.getOriginalAmount(),
                lot.getRemainingAmount(), lot.getUnitCostUsd(), lot.getCostSource(), lot.getSourceTradeId(),
                lot.getSourceRef());
    }

    private static DisposalResponse toDisposalResponse(Disposal d) {
        List<PortionResponse> portions = d.getPortions().stream()
                .map(p -> new PortionResponse(p.getLotId(), p.getAcquiredAt(), p.getAmountConsumed(),
                        p.getCostBasisUsd(), p.getProceedsUsd(), p.getShortTerm()))
                .toList();
        return new DisposalResponse(d.getId(), d.getAsset(), d.getDisposedAt(), d.getAmount(), d.getProceedsUsd(),
                d.getFeeUsd(), d.getTotalCostBasisUsd(), d.getRealizedPnlUsd(), d.getUnmatchedAmount(),
                d.isNeedsReview(), d.getReviewReason(), portions);
    }
}

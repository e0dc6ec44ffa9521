package com.coinbasis.costbasis.override;

import com.coinbasis.common.DeterministicIds;
import com.coinbasis.domain.OperationKind;
import com.coinbasis.domain.RebuildLedgerRequestEvent;
import com.coinbasis.domain.TransactionEvent;
import com.coinbasis.domain.TransactionEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Records manual opening balances: a DEPOSIT event with provider "manual" and a declared unit cost, stored
 * idempotently by clientId. Used to resolve disposals flagged INSUFFICIENT_LOTS; publishes a ledger rebuild
 * for the asset.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OpeningBalanceService {

    public static final String MANUAL_PROVIDER = "manual";
    private static final String LABEL = "Opening balance";

    private final TransactionEventRepository transactionEventRepository;
    private final ApplicationEventPublisher applicationEventPublisher;

    /**
     * Stores the opening balance (or returns the one already stored for the same clientId) and requests a
     * rebuild of the asset's ledger.
     *
     * @throws OpeningBalanceException INVALID_OPENING_BALANCE if a field is missing or not positive
     */
    public TransactionEvent record(OpeningBalance balance) {
        validate(balance);
        String asset = balance.asset().strip().toUpperCase(Locale.ROOT);
        String clientId = balance.clientId() != null && !balance.clientId().isBlank()
                ? balance.clientId().strip()
                : DeterministicIds.of(balance.owner(), asset, balance.acquiredAt().toString(),
                        balance.amount().stripTrailingZeros().toPlainString());
        String sourceRef = MANUAL_PROVIDER + ":" + clientId;

        Optional<TransactionEvent> existing = transactionEventRepository.findByOwnerAndSourceRef(balance.owner(), sourceRef);
        if (existing.isPresent()) {
            log.info("Opening balance {} for owner {} already recorded", sourceRef, balance.owner());
            return existing.get();
        }
        TransactionEvent event = transactionEventRepository.save(TransactionEvent.builder()
                .owner(balance.owner())
                .provider(MANUAL_PROVIDER)
                .timestamp(balance.acquiredAt())
                .operationKind(OperationKind.DEPOSIT)
                .operationLabel(LABEL)
                .asset(asset)
                .signedAmount(balance.amount())
                .sourceRef(sourceRef)
                .remark(balance.note())
                .declaredUnitCostUsd(balance.unitCostUsd())
                .build());
        applicationEventPublisher.publishEvent(new RebuildLedgerRequestEvent(balance.owner(), Set.of(asset)));
        log.info("Opening balance {} {} at {} USD recorded for owner {}",
                balance.amount(), asset, balance.unitCostUsd(), balance.owner());
        return event;
    }

    private static void validate(OpeningBalance balance) {
        if (balance.owner() == null || balance.owner().isBlank()) {
            throw invalid("owner is required");
        }
        if (balance.asset() == null || balance.asset().isBlank()) {
            throw invalid("asset is required");
        }
        if (balance.amount() == null || balance.amount().signum() <= 0) {
            throw invalid("amount must be positive");
        }
        if (balance.unitCostUsd() == null || balance.unitCostUsd().signum() < 0) {
            throw invalid("unitCostUsd must be zero or positive");
        }
        if (balance.acquiredAt() == null) {
            throw invalid("acquiredAt is required");
        }
    }

    private static OpeningBalanceException invalid(String message) {
        return new OpeningBalanceException(OpeningBalanceException.INVALID_OPENING_BALANCE, message);
    }
}

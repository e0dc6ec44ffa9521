package com.coinbasis.costbasis.override;

import com.coinbasis.domain.OperationKind;
import com.coinbasis.domain.RebuildLedgerRequestEvent;
import com.coinbasis.domain.TransactionEvent;
import com.coinbasis.domain.TransactionEventRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpeningBalanceServiceTest {

    private static final String OWNER = "user-1";
    private static final Instant ACQUIRED = Instant.parse("2021-05-01T00:00:00Z");

    @Mock
    TransactionEventRepository transactionEventRepository;
    @Mock
    ApplicationEventPublisher applicationEventPublisher;

    @InjectMocks
    OpeningBalanceService openingBalanceService;

    @Test
    @DisplayName("stores a manual DEPOSIT with the declared cost and requests a rebuild of the asset")
    void record_storesManualDeposit() {
        when(transactionEventRepository.findByOwnerAndSourceRef(OWNER, "manual:ob-1")).thenReturn(Optional.empty());
        when(transactionEventRepository.save(any(TransactionEvent.class))).thenAnswer(inv -> inv.getArgument(0));

        TransactionEvent event = openingBalanceService.record(new OpeningBalance(OWNER, " btc ", new BigDecimal("0.5"),
                new BigDecimal("42000"), ACQUIRED, "ob-1", "cold wallet"));

        assertThat(event.getProvider()).isEqualTo(OpeningBalanceService.MANUAL_PROVIDER);
        assertThat(event.getOperationKind()).isEqualTo(OperationKind.DEPOSIT);
        assertThat(event.getAsset()).isEqualTo("BTC");
        assertThat(event.getSignedAmount()).isEqualByComparingTo("0.5");
        assertThat(event.getDeclaredUnitCostUsd()).isEqualByComparingTo("42000");
        assertThat(event.getSourceRef()).isEqualTo("manual:ob-1");
        assertThat(event.getTimestamp()).isEqualTo(ACQUIRED);
        assertThat(event.getRemark()).isEqualTo("cold wallet");

        ArgumentCaptor<RebuildLedgerRequestEvent> captor = ArgumentCaptor.forClass(RebuildLedgerRequestEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().owner()).isEqualTo(OWNER);
        assertThat(captor.getValue().assets()).isEqualTo(Set.of("BTC"));
    }

    @Test
    @DisplayName("resubmitting the same clientId returns the stored event without a second write")
    void record_idempotentByClientId() {
        TransactionEvent stored = TransactionEvent.builder()
                .owner(OWNER).asset("BTC").sourceRef("manual:ob-1").signedAmount(new BigDecimal("0.5")).build();
        when(transactionEventRepository.findByOwnerAndSourceRef(OWNER, "manual:ob-1")).thenReturn(Optional.of(stored));

        TransactionEvent event = openingBalanceService.record(new OpeningBalance(OWNER, "BTC", new BigDecimal("0.5"),
                new BigDecimal("42000"), ACQUIRED, "ob-1", null));

        assertThat(event).isSameAs(stored);
        verify(transactionEventRepository, never()).save(any());
        verify(applicationEventPublisher, never()).publishEvent(any());
    }

    @Test
    @DisplayName("without clientId the sourceRef is derived from the balance itself")
    void record_derivedSourceRef() {
        when(transactionEventRepository.findByOwnerAndSourceRef(anyString(), anyString())).thenReturn(Optional.empty());
        when(transactionEventRepository.save(any(TransactionEvent.class))).thenAnswer(inv -> inv.getArgument(0));

        TransactionEvent first = openingBalanceService.record(new OpeningBalance(OWNER, "ETH", new BigDecimal("2.0"),
                new BigDecimal("1500"), ACQUIRED, null, null));
        TransactionEvent second = openingBalanceService.record(new OpeningBalance(OWNER, "eth", new BigDecimal("2"),
                new BigDecimal("1500"), ACQUIRED, " ", null));

        assertThat(first.getSourceRef()).startsWith("manual:").isEqualTo(second.getSourceRef());
    }

    @Test
    void record_nonPositiveAmount_rejected() {
        assertThatThrownBy(() -> openingBalanceService.record(new OpeningBalance(OWNER, "BTC", BigDecimal.ZERO,
                new BigDecimal("42000"), ACQUIRED, "ob-1", null)))
                .isInstanceOf(OpeningBalanceException.class)
                .satisfies(e -> assertThat(((OpeningBalanceException) e).getErrorCode())
                        .isEqualTo(OpeningBalanceException.INVALID_OPENING_BALANCE));
        verify(transactionEventRepository, never()).save(any());
    }

    @Test
    void record_missingCostOrDate_rejected() {
        assertThatThrownBy(() -> openingBalanceService.record(new OpeningBalance(OWNER, "BTC", BigDecimal.ONE,
                null, ACQUIRED, "ob-1", null)))
                .isInstanceOf(OpeningBalanceException.class);
        assertThatThrownBy(() -> openingBalanceService.record(new OpeningBalance(OWNER, "BTC", BigDecimal.ONE,
                BigDecimal.TEN, null, "ob-1", null)))
                .isInstanceOf(OpeningBalanceException.class);
    }
}

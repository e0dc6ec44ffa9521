package com.coinbasis.costbasis.engine;

import com.coinbasis.common.QuoteCurrencyRegistry;
import com.coinbasis.domain.Disposal;
import com.coinbasis.domain.DisposalRepository;
import com.coinbasis.domain.Lot;
import com.coinbasis.domain.LotRepository;
import com.coinbasis.domain.OperationKind;
import com.coinbasis.domain.PriceSource;
import com.coinbasis.domain.RebuildLedgerRequestEvent;
import com.coinbasis.domain.Trade;
import com.coinbasis.domain.TradeKind;
import com.coinbasis.domain.TradeRepository;
import com.coinbasis.domain.TransactionEvent;
import com.coinbasis.domain.TransactionEventRepository;
import com.coinbasis.pricing.HistoricalPriceResolver;
import com.coinbasis.pricing.PriceResolutionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerRebuildServiceTest {

    private static final String OWNER = "user-1";
    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    TradeRepository tradeRepository;
    @Mock
    TransactionEventRepository transactionEventRepository;
    @Mock
    LotRepository lotRepository;
    @Mock
    DisposalRepository disposalRepository;
    @Mock
    HistoricalPriceResolver historicalPriceResolver;

    private LedgerProperties ledgerProperties;
    private FifoLotLedger ledger;
    private LedgerRebuildService service;

    @BeforeEach
    void setUp() {
        ledgerProperties = new LedgerProperties();
        ledger = new FifoLotLedger();
        service = new LedgerRebuildService(ledger, tradeRepository, transactionEventRepository,
                lotRepository, disposalRepository, historicalPriceResolver, new QuoteCurrencyRegistry(), ledgerProperties);
    }

    @Test
    @DisplayName("buy and sell in the same instant: the buy is replayed first")
    void acquisitionsBeforeDisposalsAtSameTimestamp() {
        when(tradeRepository.findByOwnerAndAssetOrderByTimestampAsc(OWNER, "ETH")).thenReturn(List.of(
                trade("s1", TradeKind.SELL, "1", "3500", T0),
                trade("b1", TradeKind.BUY, "1", "3000", T0)));
        when(transactionEventRepository.findByOwnerAndAssetAndOperationKindInOrderByTimestampAsc(
                eq(OWNER), eq("ETH"), anyList())).thenReturn(List.of());

        LedgerRebuildResult result = service.rebuild(OWNER, "ETH");

        assertThat(result.lots()).isEqualTo(1);
        assertThat(result.disposals()).isEqualTo(1);
        assertThat(result.needsReview()).isZero();
        assertThat(result.remainingAmount()).isEqualByComparingTo("0");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Disposal>> disposals = ArgumentCaptor.forClass(List.class);
        verify(disposalRepository).saveAll(disposals.capture());
        assertThat(disposals.getValue()).singleElement()
                .satisfies(d -> assertThat(d.getRealizedPnlUsd()).isEqualByComparingTo("500"));
    }

    @Test
    @DisplayName("persisted lots and disposals are replaced, deletes before saves")
    void replacesPersistedState() {
        when(tradeRepository.findByOwnerAndAssetOrderByTimestampAsc(OWNER, "ETH")).thenReturn(List.of(
                trade("b1", TradeKind.BUY, "2", "6000", T0)));
        when(transactionEventRepository.findByOwnerAndAssetAndOperationKindInOrderByTimestampAsc(
                eq(OWNER), eq("ETH"), anyList())).thenReturn(List.of());

        service.rebuild(OWNER, "ETH");

        InOrder order = inOrder(lotRepository, disposalRepository);
        order.verify(lotRepository).deleteByOwnerAndAsset(OWNER, "ETH");
        order.verify(lotRepository).saveAll(anyList());
        order.verify(disposalRepository).deleteByOwnerAndAsset(OWNER, "ETH");
        order.verify(disposalRepository).saveAll(anyList());
    }

    @Test
    @DisplayName("rebuilding twice produces identical lots")
    void rebuildIsRepeatable() {
        when(tradeRepository.findByOwnerAndAssetOrderByTimestampAsc(OWNER, "ETH")).thenReturn(List.of(
                trade("b1", TradeKind.BUY, "2", "6000", T0),
                trade("s1", TradeKind.SELL, "0.5", "2000", T0.plusSeconds(3600))));
        when(transactionEventRepository.findByOwnerAndAssetAndOperationKindInOrderByTimestampAsc(
                eq(OWNER), eq("ETH"), anyList())).thenReturn(List.of());

        LedgerRebuildResult first = service.rebuild(OWNER, "ETH");
        LedgerRebuildResult second = service.rebuild(OWNER, "ETH");

        assertThat(second).isEqualTo(first);
        assertThat(second.remainingAmount()).isEqualByComparingTo("1.5");
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Lot>> lots = ArgumentCaptor.forClass(List.class);
        verify(lotRepository, times(2)).saveAll(lots.capture());
        assertThat(lots.getAllValues().get(0)).extracting(Lot::getId)
                .isEqualTo(lots.getAllValues().get(1).stream().map(Lot::getId).toList());
    }

    @Test
    @DisplayName("a rebuilt key's lots are released from memory once persisted")
    void rebuildEvictsInMemoryLots() {
        when(tradeRepository.findByOwnerAndAssetOrderByTimestampAsc(OWNER, "ETH")).thenReturn(List.of(
                trade("b1", TradeKind.BUY, "2", "6000", T0)));
        when(transactionEventRepository.findByOwnerAndAssetAndOperationKindInOrderByTimestampAsc(
                eq(OWNER), eq("ETH"), anyList())).thenReturn(List.of());

        LedgerRebuildResult result = service.rebuild(OWNER, "ETH");

        assertThat(result.lots()).isEqualTo(1);
        assertThat(ledger.residentKeys()).isEmpty();
        assertThat(ledger.snapshot(new LotKey(OWNER, "ETH"))).isEmpty();
    }

    @Test
    @DisplayName("a failed save still releases the key's lots")
    void failedPersistStillEvicts() {
        when(tradeRepository.findByOwnerAndAssetOrderByTimestampAsc(OWNER, "ETH")).thenReturn(List.of(
                trade("b1", TradeKind.BUY, "2", "6000", T0)));
        when(transactionEventRepository.findByOwnerAndAssetAndOperationKindInOrderByTimestampAsc(
                eq(OWNER), eq("ETH"), anyList())).thenReturn(List.of());
        when(lotRepository.saveAll(anyList())).thenThrow(new IllegalStateException("mongo down"));

        assertThatThrownBy(() -> service.rebuild(OWNER, "ETH")).isInstanceOf(IllegalStateException.class);
        assertThat(ledger.residentKeys()).isEmpty();
    }

    @Test
    @DisplayName("concurrent rebuilds of one key read their postings one at a time")
    void concurrentRebuilds_readUnderKeyLock() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        CountDownLatch firstReadStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(tradeRepository.findByOwnerAndAssetOrderByTimestampAsc(OWNER, "ETH")).thenAnswer(invocation -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            firstReadStarted.countDown();
            release.await(5, TimeUnit.SECONDS);
            inFlight.decrementAndGet();
            return List.of(trade("b1", TradeKind.BUY, "2", "6000", T0));
        });
        when(transactionEventRepository.findByOwnerAndAssetAndOperationKindInOrderByTimestampAsc(
                eq(OWNER), eq("ETH"), anyList())).thenReturn(List.of());

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<LedgerRebuildResult> first = pool.submit(() -> service.rebuild(OWNER, "ETH"));
            assertThat(firstReadStarted.await(5, TimeUnit.SECONDS)).isTrue();
            Future<LedgerRebuildResult> second = pool.submit(() -> service.rebuild(OWNER, "ETH"));
            Thread.sleep(200);
            release.countDown();

            assertThat(first.get(10, TimeUnit.SECONDS).lots()).isEqualTo(1);
            assertThat(second.get(10, TimeUnit.SECONDS).lots()).isEqualTo(1);
            assertThat(maxInFlight.get()).isEqualTo(1);
            verify(tradeRepository, times(2)).findByOwnerAndAssetOrderByTimestampAsc(OWNER, "ETH");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("declared opening balance cost wins over market price")
    void depositWithDeclaredCost_manualLot() {
        when(tradeRepository.findByOwnerAndAssetOrderByTimestampAsc(OWNER, "ETH")).thenReturn(List.of());
        when(transactionEventRepository.findByOwnerAndAssetAndOperationKindInOrderByTimestampAsc(
                eq(OWNER), eq("ETH"), anyList())).thenReturn(List.of(
                deposit("manual:ob-1", "3", T0, new BigDecimal("1800"))));

        service.rebuild(OWNER, "ETH");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Lot>> lots = ArgumentCaptor.forClass(List.class);
        verify(lotRepository).saveAll(lots.capture());
        assertThat(lots.getValue()).singleElement().satisfies(lot -> {
            assertThat(lot.getUnitCostUsd()).isEqualByComparingTo("1800");
            assertThat(lot.getCostSource()).isEqualTo(PriceSource.MANUAL);
            assertThat(lot.getSourceRef()).isEqualTo("manual:ob-1");
        });
        verifyNoInteractions(historicalPriceResolver);
    }

    @Test
    @DisplayName("deposit without declared cost is valued at its historical price, or left unknown")
    void depositValuedByResolver() {
        when(tradeRepository.findByOwnerAndAssetOrderByTimestampAsc(OWNER, "ETH")).thenReturn(List.of());
        when(transactionEventRepository.findByOwnerAndAssetAndOperationKindInOrderByTimestampAsc(
                eq(OWNER), eq("ETH"), anyList())).thenReturn(List.of(
                deposit("binance:ext:d1", "1", T0, null),
                deposit("binance:ext:d2", "1", T0.plusSeconds(60), null)));
        when(historicalPriceResolver.resolve(any()))
                .thenReturn(PriceResolutionResult.known(new BigDecimal("3100"), PriceSource.EXTERNAL))
                .thenReturn(PriceResolutionResult.unknown());

        service.rebuild(OWNER, "ETH");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Lot>> lots = ArgumentCaptor.forClass(List.class);
        verify(lotRepository).saveAll(lots.capture());
        assertThat(lots.getValue()).hasSize(2);
        assertThat(lots.getValue().get(0).getUnitCostUsd()).isEqualByComparingTo("3100");
        assertThat(lots.getValue().get(1).hasKnownCost()).isFalse();
        assertThat(lots.getValue().get(1).getCostSource()).isEqualTo(PriceSource.UNKNOWN);
    }

    @Test
    void depositsIgnoredWhenDisabled() {
        ledgerProperties.setDepositsCreateLots(false);
        when(tradeRepository.findByOwnerAndAssetOrderByTimestampAsc(OWNER, "ETH")).thenReturn(List.of());

        LedgerRebuildResult result = service.rebuild(OWNER, "ETH");

        assertThat(result.lots()).isZero();
        verifyNoInteractions(transactionEventRepository);
    }

    @Test
    @DisplayName("owner rebuild covers traded and deposited assets, never quote currencies")
    void rebuildOwner_skipsQuoteCurrencies() {
        when(tradeRepository.findByOwner(OWNER)).thenReturn(List.of(trade("b1", TradeKind.BUY, "1", "3000", T0)));
        when(transactionEventRepository.findByOwnerAndOperationKindIn(eq(OWNER), anyList())).thenReturn(List.of(
                deposit("d-usdt", "100", T0, null).toBuilder().asset("USDT").build(),
                deposit("d-btc", "0.1", T0, new BigDecimal("60000")).toBuilder().asset("BTC").build()));
        when(tradeRepository.findByOwnerAndAssetOrderByTimestampAsc(eq(OWNER), any())).thenReturn(List.of());
        when(transactionEventRepository.findByOwnerAndAssetAndOperationKindInOrderByTimestampAsc(
                eq(OWNER), any(), anyList())).thenReturn(List.of());

        List<LedgerRebuildResult> results = service.rebuildOwner(OWNER);

        assertThat(results).extracting(LedgerRebuildResult::asset).containsExactly("BTC", "ETH");
        verify(lotRepository, never()).deleteByOwnerAndAsset(OWNER, "USDT");
    }

    @Test
    void listener_rebuildsNamedAssetsOrWholeOwner() {
        LedgerRebuildService mockService = mock(LedgerRebuildService.class);
        LedgerRebuildEventListener listener = new LedgerRebuildEventListener(mockService);

        listener.onRebuildRequest(new RebuildLedgerRequestEvent(OWNER, Set.of("ETH")));
        listener.onRebuildRequest(new RebuildLedgerRequestEvent(OWNER, null));

        verify(mockService).rebuildAssets(OWNER, Set.of("ETH"));
        verify(mockService).rebuildOwner(OWNER);
    }

    private static Trade trade(String id, TradeKind kind, String amount, String counterUsd, Instant at) {
        Trade trade = new Trade();
        trade.setId(id);
        trade.setOwner(OWNER);
        trade.setProvider("binance");
        trade.setKind(kind);
        trade.setAsset("ETH");
        trade.setTimestamp(at);
        trade.setNetAmount(new BigDecimal(amount));
        trade.setCounterValueUsd(new BigDecimal(counterUsd));
        trade.setPriceSource(PriceSource.STABLECOIN);
        return trade;
    }

    private static TransactionEvent deposit(String sourceRef, String amount, Instant at, BigDecimal declaredCost) {
        return TransactionEvent.builder()
                .owner(OWNER)
                .provider("binance")
                .timestamp(at)
                .operationKind(OperationKind.DEPOSIT)
                .operationLabel("Deposit")
                .asset("ETH")
                .signedAmount(new BigDecimal(amount))
                .sourceRef(sourceRef)
                .declaredUnitCostUsd(declaredCost)
                .build();
    }
}

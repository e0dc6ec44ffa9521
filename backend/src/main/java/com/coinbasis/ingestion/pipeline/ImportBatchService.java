package com.coinbasis.ingestion.pipeline;

import com.coinbasis.domain.RebuildLedgerRequestEvent;
import com.coinbasis.domain.Trade;
import com.coinbasis.domain.TradeRepository;
import com.coinbasis.domain.TransactionEvent;
import com.coinbasis.domain.TransactionEventRepository;
import com.coinbasis.ingestion.config.IngestionProperties;
import com.coinbasis.ingestion.grouping.GroupingError;
import com.coinbasis.ingestion.grouping.GroupingResult;
import com.coinbasis.ingestion.grouping.TradeGrouper;
import com.coinbasis.ingestion.normalizer.EventNormalizer;
import com.coinbasis.ingestion.normalizer.ExchangeFill;
import com.coinbasis.ingestion.normalizer.ExchangeFillNormalizer;
import com.coinbasis.ingestion.normalizer.NormalizationResult;
import com.coinbasis.ingestion.normalizer.ProviderMapping;
import com.coinbasis.ingestion.normalizer.ProviderMappingRegistry;
import com.coinbasis.ingestion.normalizer.RawBatch;
import com.coinbasis.ingestion.normalizer.RowDiagnostic;
import com.coinbasis.ingestion.normalizer.StructuralInputException;
import com.coinbasis.ingestion.store.IdempotentEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Import pipeline: normalize → upsert events → regroup every stored event in the minutes the batch touched →
 * replace the trades of those minutes → request a ledger rebuild for the affected assets.
 * Structural problems throw before anything is written; everything else is reported in the {@link BatchResult}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportBatchService {

    private static final Comparator<TransactionEvent> STORED_ORDER = Comparator
            .comparing(TransactionEvent::getTimestamp)
            .thenComparingInt(TransactionEvent::getSequence)
            .thenComparing(TransactionEvent::getSourceRef);

    private final ProviderMappingRegistry providerMappingRegistry;
    private final EventNormalizer eventNormalizer;
    private final ExchangeFillNormalizer exchangeFillNormalizer;
    private final IdempotentEventStore idempotentEventStore;
    private final TransactionEventRepository transactionEventRepository;
    private final TradeRepository tradeRepository;
    private final TradeGrouper tradeGrouper;
    private final IngestionProperties ingestionProperties;
    private final ApplicationEventPublisher applicationEventPublisher;

    /**
     * Import file rows.
     *
     * @throws StructuralInputException UNKNOWN_PROVIDER, MISSING_OWNER, MISSING_COLUMNS or EMPTY_BATCH
     */
    public BatchResult importRows(RawBatch batch) {
        ProviderMapping mapping = providerMappingRegistry.get(batch.provider());
        if (batch.rows().isEmpty()) {
            throw new StructuralInputException(StructuralInputException.EMPTY_BATCH, "Batch has no rows");
        }
        NormalizationResult normalized = eventNormalizer.normalizeAll(batch, mapping);
        return storeAndRegroup(batch.owner(), mapping.provider(), batch.rows().size(), normalized);
    }

    /**
     * Import exchange-API fills and transfers.
     *
     * @throws StructuralInputException MISSING_OWNER, UNKNOWN_PROVIDER or EMPTY_BATCH
     */
    public BatchResult importFills(String owner, String provider, List<ExchangeFill> fills) {
        if (provider == null || provider.isBlank()) {
            throw new StructuralInputException(StructuralInputException.UNKNOWN_PROVIDER, "Fills must name a provider");
        }
        if (fills == null || fills.isEmpty()) {
            throw new StructuralInputException(StructuralInputException.EMPTY_BATCH, "Batch has no fills");
        }
        NormalizationResult normalized = exchangeFillNormalizer.normalizeAll(owner, provider, fills);
        return storeAndRegroup(owner, provider.strip().toLowerCase(Locale.ROOT), fills.size(), normalized);
    }

    private BatchResult storeAndRegroup(String owner, String provider, int received, NormalizationResult normalized) {
        List<TransactionEvent> stored = normalized.events().stream()
                .map(idempotentEventStore::upsert)
                .toList();

        GroupingResult grouping = new GroupingResult(List.of(), List.of(), List.of(), 0, 0);
        int removed = 0;
        if (!stored.isEmpty()) {
            Instant from = stored.stream().map(TransactionEvent::getTimestamp).min(Comparator.naturalOrder())
                    .orElseThrow().truncatedTo(ChronoUnit.MINUTES);
            Instant to = stored.stream().map(TransactionEvent::getTimestamp).max(Comparator.naturalOrder())
                    .orElseThrow().truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);

            List<TransactionEvent> window = new ArrayList<>(transactionEventRepository
                    .findByOwnerAndProviderAndTimestampGreaterThanEqualAndTimestampLessThan(owner, provider, from, to));
            window.sort(STORED_ORDER);
            grouping = tradeGrouper.group(owner, provider, window);

            Set<String> regroupedIds = grouping.trades().stream().map(Trade::getId).collect(Collectors.toSet());
            List<Trade> previous = tradeRepository
                    .findByOwnerAndProviderAndTimestampGreaterThanEqualAndTimestampLessThan(owner, provider, from, to);
            List<Trade> stale = previous.stream().filter(t -> !regroupedIds.contains(t.getId())).toList();
            if (!stale.isEmpty()) {
                tradeRepository.deleteAll(stale);
                removed = stale.size();
            }
            tradeRepository.saveAll(grouping.trades());

            Set<String> assets = Stream.of(
                            stored.stream().map(TransactionEvent::getAsset),
                            previous.stream().map(Trade::getAsset),
                            grouping.trades().stream().map(Trade::getAsset))
                    .flatMap(s -> s)
                    .collect(Collectors.toCollection(TreeSet::new));
            applicationEventPublisher.publishEvent(new RebuildLedgerRequestEvent(owner, assets));
        }

        BatchResult result = new BatchResult(
                owner,
                provider,
                received,
                stored.size(),
                grouping.trades().size(),
                removed,
                grouping.discardedTrades(),
                grouping.errors().size(),
                normalized.parseErrorCount(),
                normalized.unknownOperationCounts(),
                grouping.passThrough().size(),
                firstErrors(normalized.diagnostics(), grouping.errors()));
        log.info("Import for owner {} ({}): {} records, {} events stored, {} trades upserted, {} removed, {} grouping errors, {} parse errors",
                owner, provider, received, result.eventsStored(), result.tradesUpserted(), removed,
                result.groupingErrors(), result.parseErrors());
        return result;
    }

    private List<String> firstErrors(List<RowDiagnostic> diagnostics, List<GroupingError> groupingErrors) {
        return Stream.concat(
                        diagnostics.stream().map(RowDiagnostic::describe),
                        groupingErrors.stream().map(GroupingError::describe))
                .limit(Math.max(0, ingestionProperties.getMaxReportedErrors()))
                .toList();
    }
}

package com.coinbasis.ingestion.normalizer;

import com.coinbasis.domain.OperationKind;
import com.coinbasis.domain.TransactionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps provider rows to {@link TransactionEvent}s through the provider's operation dictionary.
 * Pure: nothing is stored, and every skipped row comes back as a {@link RowDiagnostic}.
 */
@Component
@Slf4j
public class EventNormalizer {

    /**
     * Normalize one row for the given owner. Unknown operation labels and unparseable values yield a
     * skipped outcome, never an exception. Rows without an external id get occurrence 0 in their fingerprint.
     */
    public NormalizationOutcome normalize(String owner, RawRecord record, ProviderMapping mapping) {
        int row = record.rowIndex();
        Optional<OperationKind> kind = mapping.kindFor(record.operation());
        if (kind.isEmpty()) {
            return NormalizationOutcome.skipped(row, DiagnosticCode.UNKNOWN_OPERATION,
                    "unknown operation '" + record.operation() + "'");
        }
        Optional<Instant> timestamp = TimestampParser.parse(record.timestamp());
        if (timestamp.isEmpty()) {
            return NormalizationOutcome.skipped(row, DiagnosticCode.PARSE_ERROR,
                    "unparseable timestamp '" + record.timestamp() + "'");
        }
        Optional<BigDecimal> amount = parseAmount(record.change());
        if (amount.isEmpty()) {
            return NormalizationOutcome.skipped(row, DiagnosticCode.PARSE_ERROR,
                    "unparseable amount '" + record.change() + "'");
        }
        String asset = normalizeAsset(record.asset());
        if (asset == null) {
            return NormalizationOutcome.skipped(row, DiagnosticCode.PARSE_ERROR, "missing asset");
        }
        String sourceRef = hasText(record.externalId())
                ? SourceRefs.external(mapping.provider(), record.externalId())
                : SourceRefs.fingerprint(mapping.provider(), timestamp.get(), record.operation(), asset,
                        amount.get(), record.remark(), 0);
        return NormalizationOutcome.of(TransactionEvent.builder()
                .owner(owner)
                .provider(mapping.provider())
                .timestamp(timestamp.get())
                .operationKind(kind.get())
                .operationLabel(record.operation().strip())
                .asset(asset)
                .signedAmount(amount.get())
                .sourceRef(sourceRef)
                .remark(hasText(record.remark()) ? record.remark().strip() : null)
                .embeddedFee(embeddedFee(kind.get(), record.remark(), amount.get()))
                .sequence(row)
                .build());
    }

    /**
     * Normalize a whole batch. Validates the batch structure first; identical rows without external ids
     * are numbered by occurrence so each keeps its own sourceRef.
     *
     * @throws StructuralInputException when the owner is missing or required columns are absent
     */
    public NormalizationResult normalizeAll(RawBatch batch, ProviderMapping mapping) {
        if (!hasText(batch.owner())) {
            throw new StructuralInputException(StructuralInputException.MISSING_OWNER, "Batch has no owner");
        }
        List<String> missing = mapping.missingColumns(batch.columns());
        if (!missing.isEmpty()) {
            throw new StructuralInputException(StructuralInputException.MISSING_COLUMNS,
                    "Missing required columns for " + mapping.provider() + ": " + missing);
        }

        List<TransactionEvent> events = new ArrayList<>();
        List<RowDiagnostic> diagnostics = new ArrayList<>();
        Map<String, Integer> unknownCounts = new LinkedHashMap<>();
        Map<String, Integer> occurrences = new HashMap<>();

        for (RawRecord record : batch.rows()) {
            NormalizationOutcome outcome = normalize(batch.owner(), record, mapping);
            if (outcome.isSkipped()) {
                RowDiagnostic diagnostic = outcome.diagnostic();
                if (diagnostic.code() == DiagnosticCode.UNKNOWN_OPERATION) {
                    String label = record.operation() == null ? "" : record.operation().strip();
                    if (unknownCounts.merge(label, 1, Integer::sum) == 1) {
                        diagnostics.add(diagnostic);
                    }
                } else {
                    diagnostics.add(diagnostic);
                }
                continue;
            }
            TransactionEvent event = outcome.event();
            if (!hasText(record.externalId())) {
                int occurrence = occurrences.merge(event.getSourceRef(), 1, Integer::sum) - 1;
                if (occurrence > 0) {
                    event = event.toBuilder()
                            .sourceRef(SourceRefs.fingerprint(mapping.provider(), event.getTimestamp(),
                                    record.operation(), event.getAsset(), event.getSignedAmount(),
                                    record.remark(), occurrence))
                            .build();
                }
            }
            events.add(event);
        }
        if (!unknownCounts.isEmpty()) {
            log.warn("Batch for owner {} ({}): skipped unknown operations {}", batch.owner(), mapping.provider(), unknownCounts);
        }
        log.info("Normalized {} of {} rows for owner {} ({}), {} diagnostics",
                events.size(), batch.rows().size(), batch.owner(), mapping.provider(), diagnostics.size());
        return new NormalizationResult(events, diagnostics, unknownCounts);
    }

    static Optional<BigDecimal> parseAmount(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String cleaned = value.strip().replace(",", "").replace(" ", "");
        try {
            return Optional.of(new BigDecimal(cleaned));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static BigDecimal embeddedFee(OperationKind kind, String remark, BigDecimal amount) {
        if (kind.isFee() || kind == OperationKind.IGNORED) {
            return null;
        }
        return RemarkFeeExtractor.extract(remark)
                .filter(fee -> fee.compareTo(amount.abs()) < 0)
                .orElse(null);
    }

    private static String normalizeAsset(String asset) {
        if (!hasText(asset)) {
            return null;
        }
        return asset.strip().toUpperCase(Locale.ROOT);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

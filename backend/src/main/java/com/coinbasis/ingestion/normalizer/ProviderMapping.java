package com.coinbasis.ingestion.normalizer;

import com.coinbasis.domain.OperationKind;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Provider operation dictionary: label to {@link OperationKind} plus the columns a file batch must carry.
 */
public final class ProviderMapping {

    private final String provider;
    private final List<String> requiredColumns;
    private final Map<String, OperationKind> kindsByLabel;

    public ProviderMapping(String provider, List<String> requiredColumns, Map<String, OperationKind> kindsByLabel) {
        this.provider = provider;
        this.requiredColumns = requiredColumns == null ? List.of() : List.copyOf(requiredColumns);
        Map<String, OperationKind> normalized = new HashMap<>();
        if (kindsByLabel != null) {
            kindsByLabel.forEach((label, kind) -> normalized.put(normalizeLabel(label), kind));
        }
        this.kindsByLabel = Map.copyOf(normalized);
    }

    public String provider() {
        return provider;
    }

    public List<String> requiredColumns() {
        return requiredColumns;
    }

    public Optional<OperationKind> kindFor(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(kindsByLabel.get(normalizeLabel(label)));
    }

    /**
     * Required columns absent from the given header, compared case-insensitively.
     */
    public List<String> missingColumns(List<String> columns) {
        List<String> present = columns == null ? List.of() : columns.stream()
                .filter(c -> c != null)
                .map(ProviderMapping::normalizeLabel)
                .toList();
        return requiredColumns.stream()
                .filter(required -> !present.contains(normalizeLabel(required)))
                .toList();
    }

    private static String normalizeLabel(String label) {
        return label.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}

package com.coinbasis.ingestion.normalizer;

import com.coinbasis.domain.OperationKind;
import com.coinbasis.ingestion.config.IngestionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Provider mappings built once from {@link IngestionProperties}.
 */
@Component
@Slf4j
public class ProviderMappingRegistry {

    private final Map<String, ProviderMapping> mappings;

    public ProviderMappingRegistry(IngestionProperties properties) {
        Map<String, ProviderMapping> built = new HashMap<>();
        properties.getProviders().forEach((name, provider) -> {
            Map<String, OperationKind> kinds = new LinkedHashMap<>();
            for (IngestionProperties.OperationMapping op : provider.getOperations()) {
                if (op.getLabel() == null || op.getKind() == null) {
                    log.warn("Skipping incomplete operation mapping for provider {}: label={}, kind={}",
                            name, op.getLabel(), op.getKind());
                    continue;
                }
                kinds.put(op.getLabel(), op.getKind());
            }
            String key = name.toLowerCase(Locale.ROOT);
            built.put(key, new ProviderMapping(key, provider.getRequiredColumns(), kinds));
        });
        this.mappings = Map.copyOf(built);
        log.info("Loaded operation mappings for providers {}", mappings.keySet());
    }

    /**
     * @throws StructuralInputException UNKNOWN_PROVIDER when no mapping is configured
     */
    public ProviderMapping get(String provider) {
        ProviderMapping mapping = provider == null ? null : mappings.get(provider.strip().toLowerCase(Locale.ROOT));
        if (mapping == null) {
            throw new StructuralInputException(StructuralInputException.UNKNOWN_PROVIDER,
                    "No operation mapping configured for provider '" + provider + "'");
        }
        return mapping;
    }

    public Set<String> providers() {
        return mappings.keySet();
    }
}

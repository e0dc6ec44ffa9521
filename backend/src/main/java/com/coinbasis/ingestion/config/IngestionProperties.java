package com.coinbasis.ingestion.config;

import com.coinbasis.domain.OperationKind;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Import and grouping configuration (coinbasis.ingestion). Provider operation dictionaries are data: add a
 * provider by adding a block under providers, not by writing code.
 */
@ConfigurationProperties(prefix = "coinbasis.ingestion")
@Getter
@Setter
public class IngestionProperties {

    /**
     * Size of the bounded error list returned with a batch result.
     */
    private int maxReportedErrors = 10;

    /**
     * When true, TRANSFER events (moves between the owner's own accounts) are dropped by the grouper.
     * When false they are passed through untouched.
     */
    private boolean dropInternalTransfers = true;

    /**
     * Quote asset assumed for exchange fills that do not name one.
     */
    private String defaultQuoteAsset = "USDT";

    /**
     * Provider name (lower case) to its column and operation dictionary.
     */
    private Map<String, ProviderProperties> providers = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class ProviderProperties {
        /** Header columns a file batch from this provider must carry. */
        private List<String> requiredColumns = new ArrayList<>();
        /** Operation label to kind. Labels match case-insensitively. */
        private List<OperationMapping> operations = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class OperationMapping {
        private String label;
        private OperationKind kind;
    }
}

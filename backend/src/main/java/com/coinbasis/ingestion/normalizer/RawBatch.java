package com.coinbasis.ingestion.normalizer;

import java.util.List;

/**
 * Rows of one import, with the header columns the parser saw.
 */
public record RawBatch(String owner, String provider, List<String> columns, List<RawRecord> rows) {

    public RawBatch {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}

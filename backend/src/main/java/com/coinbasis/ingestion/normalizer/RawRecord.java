package com.coinbasis.ingestion.normalizer;

/**
 * One provider row as delivered by the file parser. All values are raw strings; externalId and remark are optional.
 */
public record RawRecord(
        int rowIndex,
        String timestamp,
        String operation,
        String asset,
        String change,
        String remark,
        String externalId
) {
}

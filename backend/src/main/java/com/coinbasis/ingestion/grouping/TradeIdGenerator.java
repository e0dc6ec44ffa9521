package com.coinbasis.ingestion.grouping;

import com.coinbasis.common.DeterministicIds;
import com.coinbasis.domain.TradeKind;

/**
 * Trade ids from (owner, provider, bucket key, kind, asset). The fill ordinal is appended only for the
 * second and later fills of a bucket, so single-fill buckets keep the plain key.
 */
public final class TradeIdGenerator {

    private TradeIdGenerator() {
    }

    public static String tradeId(String owner, String provider, BucketKey bucketKey, TradeKind kind,
                                 String asset, int fillOrdinal) {
        if (fillOrdinal == 0) {
            return DeterministicIds.of(owner, provider, bucketKey.asString(), kind.name(), asset);
        }
        return DeterministicIds.of(owner, provider, bucketKey.asString(), kind.name(), asset, "#" + fillOrdinal);
    }
}

package com.coinbasis.ingestion.grouping;

import com.coinbasis.domain.OperationClass;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Grouping bucket: the event's UTC minute plus its operation class.
 */
public record BucketKey(Instant minute, OperationClass operationClass) {

    public static BucketKey of(Instant timestamp, OperationClass operationClass) {
        return new BucketKey(timestamp.truncatedTo(ChronoUnit.MINUTES), operationClass);
    }

    public String asString() {
        return minute + "|" + operationClass;
    }

    @Override
    public String toString() {
        return asString();
    }
}

package com.coinbasis.pricing;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;

/**
 * Request for the USD price of an asset at a point in time.
 */
@NoArgsConstructor
@Getter
@Setter
public class HistoricalPriceRequest {

    private String asset;
    private Instant timestamp;

    public static HistoricalPriceRequest of(String asset, Instant timestamp) {
        HistoricalPriceRequest request = new HistoricalPriceRequest();
        request.setAsset(asset == null ? null : asset.strip().toUpperCase(Locale.ROOT));
        request.setTimestamp(timestamp);
        return request;
    }

    public LocalDate getDate() {
        return timestamp == null ? null : timestamp.atOffset(ZoneOffset.UTC).toLocalDate();
    }
}

package com.coinbasis.pricing.resolver;

import com.coinbasis.domain.PriceSource;
import com.coinbasis.pricing.HistoricalPriceLookup;
import com.coinbasis.pricing.HistoricalPriceRequest;
import com.coinbasis.pricing.PriceResolutionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExternalPriceLookupResolverTest {

    private static final Instant AT = Instant.parse("2025-01-06T23:30:00Z");

    @Mock
    HistoricalPriceLookup historicalPriceLookup;

    @InjectMocks
    ExternalPriceLookupResolver resolver;

    @Test
    @DisplayName("lookup price is returned with EXTERNAL source")
    void knownPrice() {
        when(historicalPriceLookup.findPriceUsd("SHIB", AT)).thenReturn(Optional.of(new BigDecimal("0.0000238")));

        PriceResolutionResult r = resolver.resolve(HistoricalPriceRequest.of("shib", AT));

        assertThat(r.getPriceUsd()).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("0.0000238"));
        assertThat(r.getPriceSource()).isEqualTo(PriceSource.EXTERNAL);
    }

    @Test
    void missingPrice_unknown() {
        when(historicalPriceLookup.findPriceUsd("SHIB", AT)).thenReturn(Optional.empty());

        assertThat(resolver.resolve(HistoricalPriceRequest.of("SHIB", AT)).isUnknown()).isTrue();
    }

    @Test
    @DisplayName("lookup failure is reported as UNKNOWN, not thrown")
    void lookupFailure_unknown() {
        when(historicalPriceLookup.findPriceUsd("SHIB", AT)).thenThrow(new IllegalStateException("rate limited"));

        assertThat(resolver.resolve(HistoricalPriceRequest.of("SHIB", AT)).isUnknown()).isTrue();
    }

    @Test
    void incompleteRequest_unknownWithoutLookup() {
        assertThat(resolver.resolve(HistoricalPriceRequest.of("SHIB", null)).isUnknown()).isTrue();
        verifyNoInteractions(historicalPriceLookup);
    }

    @Test
    @DisplayName("cache key date is the UTC calendar date")
    void requestDateIsUtc() {
        assertThat(HistoricalPriceRequest.of("SHIB", AT).getDate()).isEqualTo(LocalDate.of(2025, 1, 6));
    }
}

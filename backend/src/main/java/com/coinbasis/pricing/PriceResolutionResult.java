package com.coinbasis.pricing;

import com.coinbasis.domain.PriceSource;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Outcome of a historical price lookup: a non-negative USD price with the source that produced it, or UNKNOWN.
 * Resolvers are chained with {@link #orElseGet}; callers value quantities with {@link #valueOf}.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class PriceResolutionResult {

    private static final int SCALE = 18;
    private static final PriceResolutionResult UNKNOWN = new PriceResolutionResult(null, PriceSource.UNKNOWN);

    private final BigDecimal priceUsd;
    private final PriceSource priceSource;

    private PriceResolutionResult(BigDecimal priceUsd, PriceSource priceSource) {
        this.priceUsd = priceUsd;
        this.priceSource = priceSource;
    }

    /**
     * A priced result. Negative or missing prices and the UNKNOWN source collapse to {@link #unknown()}.
     */
    public static PriceResolutionResult known(BigDecimal priceUsd, PriceSource source) {
        if (priceUsd == null || priceUsd.signum() < 0 || source == null || source == PriceSource.UNKNOWN) {
            return UNKNOWN;
        }
        return new PriceResolutionResult(priceUsd, source);
    }

    public static PriceResolutionResult unknown() {
        return UNKNOWN;
    }

    public boolean isKnown() {
        return priceUsd != null;
    }

    public boolean isUnknown() {
        return !isKnown();
    }

    public Optional<BigDecimal> getPriceUsd() {
        return Optional.ofNullable(priceUsd);
    }

    /**
     * USD value of the quantity at this price, scale 18 HALF_UP; empty when the price is unknown.
     */
    public Optional<BigDecimal> valueOf(BigDecimal quantity) {
        return getPriceUsd().map(p -> quantity.multiply(p).setScale(SCALE, RoundingMode.HALF_UP));
    }

    /**
     * This result when priced, else the next resolver's.
     */
    public PriceResolutionResult orElseGet(Supplier<PriceResolutionResult> next) {
        return isKnown() ? this : next.get();
    }
}

package com.coinbasis.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * BigDecimal &lt;-&gt; Decimal128 mapping for every amount, price and cost basis stored in MongoDB.
 * Writes round to the 34 significant digits Decimal128 holds; reads refuse NaN and infinities, which no
 * ledger value can be.
 */
public final class DecimalConverters {

    private DecimalConverters() {
    }

    public static List<Converter<?, ?>> all() {
        return List.of(ToDecimal128.INSTANCE, FromDecimal128.INSTANCE);
    }

    @WritingConverter
    enum ToDecimal128 implements Converter<BigDecimal, Decimal128> {
        INSTANCE;

        @Override
        public Decimal128 convert(BigDecimal source) {
            return new Decimal128(source.round(MathContext.DECIMAL128));
        }
    }

    @ReadingConverter
    enum FromDecimal128 implements Converter<Decimal128, BigDecimal> {
        INSTANCE;

        @Override
        public BigDecimal convert(Decimal128 source) {
            if (source.isNaN() || source.isInfinite()) {
                throw new IllegalStateException("Stored decimal " + source + " is not a finite number");
            }
            return source.bigDecimalValue();
        }
    }
}

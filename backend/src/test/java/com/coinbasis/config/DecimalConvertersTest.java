package com.coinbasis.config;

import org.bson.types.Decimal128;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecimalConvertersTest {

    @Test
    @DisplayName("values beyond 34 significant digits are rounded half-even on write")
    void write_roundsToDecimal128Precision() {
        BigDecimal value = new BigDecimal("1234567890.123456789012345678901234567");

        Decimal128 stored = DecimalConverters.ToDecimal128.INSTANCE.convert(value);

        assertThat(stored.bigDecimalValue()).isEqualByComparingTo("1234567890.123456789012345678901235");
    }

    @Test
    void read_returnsExactValue() {
        BigDecimal read = DecimalConverters.FromDecimal128.INSTANCE.convert(Decimal128.parse("0.000000000123456789"));

        assertThat(read).isEqualByComparingTo("0.000000000123456789");
    }

    @Test
    @DisplayName("NaN and infinities are rejected on read")
    void read_rejectsNonFinite() {
        assertThatThrownBy(() -> DecimalConverters.FromDecimal128.INSTANCE.convert(Decimal128.NaN))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not a finite number");
        assertThatThrownBy(() -> DecimalConverters.FromDecimal128.INSTANCE.convert(Decimal128.POSITIVE_INFINITY))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void all_registersBothDirections() {
        assertThat(DecimalConverters.all()).containsExactly(
                DecimalConverters.ToDecimal128.INSTANCE, DecimalConverters.FromDecimal128.INSTANCE);
    }
}

package com.coinbasis.ingestion.grouping;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProportionalAllocatorTest {

    @Test
    void twoToOne_sumsExactly() {
        List<BigDecimal> shares = ProportionalAllocator.allocate(new BigDecimal("200"),
                List.of(new BigDecimal("2"), new BigDecimal("1")));

        assertThat(shares).hasSize(2);
        assertThat(shares.get(0)).isEqualByComparingTo("133.333333333333333333");
        assertThat(shares.get(1)).isEqualByComparingTo("66.666666666666666667");
        assertThat(shares.get(0).add(shares.get(1))).isEqualByComparingTo("200");
    }

    @Test
    void thirds_sumExactly() {
        List<BigDecimal> shares = ProportionalAllocator.allocate(BigDecimal.ONE,
                List.of(BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE));

        assertThat(shares.stream().reduce(BigDecimal.ZERO, BigDecimal::add)).isEqualByComparingTo("1");
    }

    @Test
    void singleWeight_getsTotal() {
        assertThat(ProportionalAllocator.allocate(new BigDecimal("5"), List.of(new BigDecimal("0.1"))))
                .containsExactly(new BigDecimal("5"));
    }

    @Test
    void emptyWeights_empty() {
        assertThat(ProportionalAllocator.allocate(BigDecimal.TEN, List.of())).isEmpty();
    }

    @Test
    void zeroWeights_rejected() {
        assertThatThrownBy(() -> ProportionalAllocator.allocate(BigDecimal.TEN, List.of(BigDecimal.ZERO, BigDecimal.ZERO)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.finscan.compliance.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AmountsTest {

    @Test
    void roundsHalfAwayFromZeroOnBothSides() {
        assertThat(Amounts.round(0.125)).isEqualTo(0.13);
        assertThat(Amounts.round(-0.125)).isEqualTo(-0.13);
        assertThat(Amounts.round(12.3449)).isEqualTo(12.34);
    }

    @Test
    void veryLargeValuesKeepTheirMagnitude() {
        assertThat(Amounts.round(4.0E17)).isEqualTo(4.0E17);
        assertThat(Amounts.round(-1.0E18)).isEqualTo(-1.0E18);
    }

    @Test
    void nonFiniteValuesPassThrough() {
        assertThat(Amounts.round(Double.POSITIVE_INFINITY)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(Amounts.round(Double.NaN)).isNaN();
    }

    @Test
    void formatsAsDollars() {
        assertThat(Amounts.format(1234.5)).isEqualTo("$1,234.50");
    }
}

package com.finscan.compliance.engine;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CurrencyNormalizerTest {

    @Test
    void parenthesesMakeTheValueNegative() {
        assertThat(CurrencyNormalizer.normalize("(500)")).isEqualTo(-500.0);
        assertThat(CurrencyNormalizer.normalize("($1,250.50)")).isEqualTo(-1250.5);
    }

    @Test
    void stripsCurrencySymbolsAndGrouping() {
        assertThat(CurrencyNormalizer.normalize("$1,000.00")).isEqualTo(1000.0);
        assertThat(CurrencyNormalizer.normalize("  42 ")).isEqualTo(42.0);
    }

    @Test
    void appliesMillionAndThousandSuffixes() {
        assertThat(CurrencyNormalizer.normalize("1M")).isEqualTo(1_000_000.0);
        assertThat(CurrencyNormalizer.normalize("$2.5m")).isEqualTo(2_500_000.0);
        assertThat(CurrencyNormalizer.normalize("15K")).isEqualTo(15_000.0);
        assertThat(CurrencyNormalizer.normalize("(3k)")).isEqualTo(-3_000.0);
    }

    @Test
    void managementTextSuppressesTheMillionMultiplier() {
        assertThat(CurrencyNormalizer.normalize("Management fee 2M")).isEqualTo(2.0);
    }

    @Test
    void placeholdersReadAsZero() {
        assertThat(CurrencyNormalizer.normalize("")).isEqualTo(0.0);
        assertThat(CurrencyNormalizer.normalize(null)).isEqualTo(0.0);
        assertThat(CurrencyNormalizer.normalize("   ")).isEqualTo(0.0);
        assertThat(CurrencyNormalizer.normalize("-")).isEqualTo(0.0);
        assertThat(CurrencyNormalizer.normalize("—")).isEqualTo(0.0);
        assertThat(CurrencyNormalizer.normalize("–")).isEqualTo(0.0);
        assertThat(CurrencyNormalizer.normalize("N/A")).isEqualTo(0.0);
    }

    @Test
    void textWithoutDigitsIsUnparseable() {
        assertThat(CurrencyNormalizer.normalize("abc")).isNull();
        assertThat(CurrencyNormalizer.normalize("n.m.")).isNull();
        assertThat(CurrencyNormalizer.normalize("1.2.3")).isNull();
    }
}

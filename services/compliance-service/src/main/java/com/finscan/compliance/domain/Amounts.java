package com.finscan.compliance.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Rounding and display helpers for derived monetary values.
 */
public final class Amounts {

    private Amounts() {
    }

    public static double round(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    public static String format(double value) {
        return String.format(Locale.US, "$%,.2f", value);
    }
}

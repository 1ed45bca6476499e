package com.finscan.compliance.engine;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns free-form amount text such as {@code $1,000.00}, {@code (500)} or {@code 1.2M} into a
 * signed number.
 *
 * <p>Placeholders ({@code -}, dashes, {@code N/A}, blank) read as zero. Text with no digits left
 * after stripping reads as {@code null}, which callers treat as "not applicable" rather than zero.
 */
public final class CurrencyNormalizer {

    private static final Set<String> ZERO_PLACEHOLDERS = Set.of("", "-", "—", "–", "N/A", "n/a");
    private static final Pattern NON_NUMERIC = Pattern.compile("[^\\d.]");

    private CurrencyNormalizer() {
    }

    public static Double normalize(String text) {
        if (text == null) {
            return 0.0;
        }
        String trimmed = text.strip();
        if (ZERO_PLACEHOLDERS.contains(trimmed)) {
            return 0.0;
        }

        boolean negative = trimmed.contains("(") && trimmed.contains(")");
        String cleaned = NON_NUMERIC.matcher(trimmed).replaceAll("");
        if (cleaned.isEmpty()) {
            return null;
        }

        double value;
        try {
            value = Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }

        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (upper.contains("M") && !upper.contains("MANAGEMENT")) {
            value *= 1_000_000;
        } else if (upper.contains("K")) {
            value *= 1_000;
        }
        return negative ? -value : value;
    }
}

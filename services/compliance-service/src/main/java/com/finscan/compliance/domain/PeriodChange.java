package com.finscan.compliance.domain;

import java.util.Map;

/**
 * Period-over-period movement of one table row. {@code changes} is keyed
 * {@code "<current>_vs_<previous>"} for every adjacent pair of periods that both carry a value.
 */
public record PeriodChange(
    String metric,
    int page,
    Map<String, Double> periods,
    Map<String, Change> changes
) {

    public record Change(
        double absolute,
        Double percent,
        boolean material,
        String direction
    ) {
    }
}

package com.finscan.compliance.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DiscrepancyKind {
    BALANCE_SHEET_IMBALANCE("Balance Sheet Imbalance"),
    INCOME_STATEMENT_MISMATCH("Income Statement Mismatch"),
    COLUMN_SUM_MISMATCH("Column Sum Mismatch");

    private final String label;

    DiscrepancyKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}

package com.finscan.compliance.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StatementType {
    BALANCE_SHEET("Balance Sheet"),
    INCOME_STATEMENT("Income Statement"),
    CASH_FLOW_STATEMENT("Cash Flow Statement"),
    INVOICE("Invoice");

    private final String label;

    StatementType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}

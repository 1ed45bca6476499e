package com.finscan.compliance.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RedFlagCategory {
    GOING_CONCERN("going_concern", Severity.CRITICAL),
    MATERIAL_WEAKNESS("material_weakness", Severity.CRITICAL),
    RESTATEMENT("restatement", Severity.CRITICAL),
    SIGNIFICANT_DEFICIENCY("significant_deficiency", Severity.HIGH),
    QUALIFIED_OPINION("qualified_opinion", Severity.HIGH),
    ADVERSE_OPINION("adverse_opinion", Severity.HIGH),
    RELATED_PARTY("related_party", Severity.MEDIUM),
    SUBSEQUENT_EVENT("subsequent_event", Severity.MEDIUM),
    CONTINGENT_LIABILITY("contingent_liability", Severity.MEDIUM);

    private final String label;
    private final Severity severity;

    RedFlagCategory(String label, Severity severity) {
        this.label = label;
        this.severity = severity;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public Severity severity() {
        return severity;
    }
}

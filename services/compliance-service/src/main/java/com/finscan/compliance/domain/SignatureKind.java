package com.finscan.compliance.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SignatureKind {
    DIGITAL("digital_signature"),
    TEXTUAL("text_mention");

    private final String label;

    SignatureKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}

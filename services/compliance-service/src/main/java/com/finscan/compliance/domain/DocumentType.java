package com.finscan.compliance.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

public enum DocumentType {
    TEN_K("10-K"),
    SOX_404("SOX 404"),
    EIGHT_K("8-K"),
    INVOICE("Invoice");

    private final String label;

    DocumentType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<DocumentType> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.label.equals(label))
            .findFirst();
    }
}

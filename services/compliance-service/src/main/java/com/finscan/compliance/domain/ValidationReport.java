package com.finscan.compliance.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ValidationReport(
    boolean success,
    Validation validation
) {

    public record Validation(
        @JsonProperty("tables_checked") int tablesChecked,
        List<Discrepancy> errors,
        List<Discrepancy> warnings
    ) {
    }
}

package com.finscan.compliance.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ComparativeReport(
    boolean success,
    @JsonProperty("comparative_data") List<PeriodChange> comparativeData
) {
}

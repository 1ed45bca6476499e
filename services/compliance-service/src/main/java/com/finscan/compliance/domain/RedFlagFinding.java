package com.finscan.compliance.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RedFlagFinding(
    String phrase,
    @JsonProperty("type") RedFlagCategory category,
    Severity severity,
    int page,
    String excerpt,
    String context
) {
}

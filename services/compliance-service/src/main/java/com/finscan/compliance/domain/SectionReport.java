package com.finscan.compliance.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record SectionReport(
    boolean success,
    @JsonProperty("doc_type") String docType,
    @JsonProperty("sections_found") Map<String, SectionStatus> sectionsFound,
    Summary summary
) {

    public record SectionStatus(
        boolean required,
        boolean critical,
        boolean found,
        Integer page,
        String excerpt
    ) {
        public static SectionStatus of(SectionRequirement requirement, SearchHit hit) {
            return new SectionStatus(true, requirement.critical(), hit.found(), hit.page(), hit.excerpt());
        }
    }

    public record Summary(
        @JsonProperty("total_required") int totalRequired,
        @JsonProperty("total_found") int totalFound,
        @JsonProperty("missing_critical") List<String> missingCritical
    ) {
    }
}

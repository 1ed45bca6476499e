package com.finscan.compliance.domain;

import java.util.List;

public record SectionRequirement(
    String name,
    boolean critical,
    List<String> searchTerms
) {
    public SectionRequirement {
        searchTerms = List.copyOf(searchTerms);
    }

    public static SectionRequirement critical(String name, String... searchTerms) {
        return new SectionRequirement(name, true, List.of(searchTerms));
    }

    public static SectionRequirement optional(String name, String... searchTerms) {
        return new SectionRequirement(name, false, List.of(searchTerms));
    }
}

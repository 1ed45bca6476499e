package com.finscan.compliance.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record RedFlagReport(
    boolean success,
    @JsonProperty("red_flags") List<RedFlagFinding> redFlags,
    Summary summary
) {

    public record Summary(
        @JsonProperty("total_flags") int totalFlags,
        int critical,
        int high,
        int medium
    ) {
        public static Summary of(List<RedFlagFinding> flags) {
            return new Summary(
                flags.size(),
                count(flags, Severity.CRITICAL),
                count(flags, Severity.HIGH),
                count(flags, Severity.MEDIUM)
            );
        }

        private static int count(List<RedFlagFinding> flags, Severity severity) {
            return (int) flags.stream().filter(flag -> flag.severity() == severity).count();
        }
    }
}

package com.finscan.compliance.domain;

import java.util.List;

public record StatementReport(
    boolean success,
    List<ClassifiedStatement> statements
) {
}

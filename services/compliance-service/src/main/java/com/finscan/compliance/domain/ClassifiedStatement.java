package com.finscan.compliance.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * A table found on a classified page, with the reporting periods read from its header and the
 * recognised line items keyed by their literal row label.
 */
public record ClassifiedStatement(
    StatementType type,
    int page,
    List<String> periods,
    @JsonProperty("key_items") Map<String, Map<String, Double>> keyItems,
    @JsonProperty("table_data") List<List<String>> tableData
) {
}

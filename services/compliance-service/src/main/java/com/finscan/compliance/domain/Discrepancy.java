package com.finscan.compliance.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An arithmetic inconsistency found in a table. Only the numeric fields relevant to the
 * {@link DiscrepancyKind} are populated; the rest stay null and are left out of the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Discrepancy(
    @JsonProperty("type") DiscrepancyKind kind,
    int page,
    Severity severity,
    @JsonProperty("table_number") Integer tableNumber,
    Integer column,
    Double assets,
    @JsonProperty("liabilities_equity") Double liabilitiesEquity,
    Double revenue,
    Double expenses,
    @JsonProperty("expected_net") Double expectedNet,
    @JsonProperty("reported_net") Double reportedNet,
    @JsonProperty("calculated_sum") Double calculatedSum,
    @JsonProperty("reported_sum") Double reportedSum,
    double difference,
    String description
) {

    public static Discrepancy balanceSheetImbalance(int page, double assets, double liabilitiesEquity, double difference) {
        return new Discrepancy(
            DiscrepancyKind.BALANCE_SHEET_IMBALANCE,
            page,
            Severity.CRITICAL,
            null,
            null,
            assets,
            liabilitiesEquity,
            null,
            null,
            null,
            null,
            null,
            null,
            Amounts.round(difference),
            "Assets (" + Amounts.format(assets) + ") != Liabilities + Equity (" + Amounts.format(liabilitiesEquity) + ")"
        );
    }

    public static Discrepancy incomeStatementMismatch(
        int page,
        double revenue,
        double expenses,
        double expectedNet,
        double reportedNet,
        double difference
    ) {
        return new Discrepancy(
            DiscrepancyKind.INCOME_STATEMENT_MISMATCH,
            page,
            Severity.CRITICAL,
            null,
            null,
            null,
            null,
            revenue,
            expenses,
            Amounts.round(expectedNet),
            reportedNet,
            null,
            null,
            Amounts.round(difference),
            "Revenue - Expenses (" + Amounts.format(expectedNet) + ") != Net Income (" + Amounts.format(reportedNet) + ")"
        );
    }

    public static Discrepancy columnSumMismatch(
        int page,
        int tableNumber,
        int column,
        double calculatedSum,
        double reportedSum
    ) {
        return new Discrepancy(
            DiscrepancyKind.COLUMN_SUM_MISMATCH,
            page,
            Severity.HIGH,
            tableNumber,
            column,
            null,
            null,
            null,
            null,
            null,
            null,
            Amounts.round(calculatedSum),
            Amounts.round(reportedSum),
            Amounts.round(calculatedSum - reportedSum),
            "Column total mismatch: calculated " + Amounts.format(calculatedSum)
                + ", reported " + Amounts.format(reportedSum)
        );
    }
}

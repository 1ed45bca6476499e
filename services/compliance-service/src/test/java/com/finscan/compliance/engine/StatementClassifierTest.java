package com.finscan.compliance.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import com.finscan.compliance.document.InMemoryPage;
import com.finscan.compliance.document.Table;
import com.finscan.compliance.domain.ClassifiedStatement;
import com.finscan.compliance.domain.StatementType;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class StatementClassifierTest {

    private final StatementClassifier classifier = new StatementClassifier();

    @Test
    void balanceSheetPhrasesTakePrecedence() {
        assertThat(classifier.classify("Consolidated Balance Sheet and Cash Flow summary"))
            .contains(StatementType.BALANCE_SHEET);
        assertThat(classifier.classify("Statement of Operations")).contains(StatementType.INCOME_STATEMENT);
        assertThat(classifier.classify("Quarterly P&L")).contains(StatementType.INCOME_STATEMENT);
        assertThat(classifier.classify("Statement of cash flows")).contains(StatementType.CASH_FLOW_STATEMENT);
        assertThat(classifier.classify("BILL TO: Acme Corp")).contains(StatementType.INVOICE);
        assertThat(classifier.classify("Letter to shareholders")).isEmpty();
    }

    @Test
    void extractsPeriodsAndKeyItems() {
        Table table = Table.of(
            List.of("", "2023", "2022"),
            List.of("Cash", "100", "90"),
            List.of("Total assets", "$1,000", "$900"),
            List.of("Total liabilities", "(600)", "500"),
            List.of("Total equity", "400")
        );

        List<ClassifiedStatement> statements = classifier.extract(InMemoryPage.of(4, "Consolidated Balance Sheet", table));

        assertThat(statements).hasSize(1);
        ClassifiedStatement statement = statements.get(0);
        assertThat(statement.type()).isEqualTo(StatementType.BALANCE_SHEET);
        assertThat(statement.page()).isEqualTo(4);
        assertThat(statement.periods()).containsExactly("2023", "2022");
        assertThat(statement.keyItems()).containsOnlyKeys("Total assets", "Total liabilities", "Total equity");
        assertThat(statement.keyItems().get("Total assets")).containsExactly(entry("2023", 1000.0), entry("2022", 900.0));
        assertThat(statement.keyItems().get("Total liabilities")).containsExactly(entry("2023", -600.0), entry("2022", 500.0));
        assertThat(statement.keyItems().get("Total equity")).containsExactly(entry("2023", 400.0));
        assertThat(statement.tableData()).hasSize(5);
    }

    @Test
    void valuesComeFromThePeriodColumn() {
        Table table = Table.of(
            List.of("", "Note", "FY 2023"),
            List.of("Net income", "4", "250")
        );

        ClassifiedStatement statement = classifier.extract(InMemoryPage.of(1, "Income Statement", table)).get(0);

        assertThat(statement.periods()).containsExactly("FY 2023");
        assertThat(statement.keyItems().get("Net income")).containsExactly(entry("FY 2023", 250.0));
    }

    @Test
    void unclassifiedPagesAreSkippedEvenWithTables() {
        Table table = Table.of(List.of("", "2023"), List.of("Total assets", "10"));

        assertThat(classifier.extract(InMemoryPage.of(1, "Selected data", table))).isEmpty();
    }

    @Test
    void classifiedPageWithoutTablesContributesNothing() {
        assertThat(classifier.extract(InMemoryPage.of(1, "Balance Sheet"))).isEmpty();
    }

    @Test
    void rawTableDataIsLimitedToTenRows() {
        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of("Item", "2023"));
        for (int i = 0; i < 14; i++) {
            rows.add(List.of("Line " + i, String.valueOf(i)));
        }

        ClassifiedStatement statement = classifier.extract(InMemoryPage.of(1, "Cash Flow", new Table(rows))).get(0);

        assertThat(statement.tableData()).hasSize(StatementClassifier.RAW_ROW_LIMIT);
        assertThat(statement.tableData().get(0)).containsExactly("Item", "2023");
    }
}

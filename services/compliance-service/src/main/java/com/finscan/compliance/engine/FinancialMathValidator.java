package com.finscan.compliance.engine;

import com.finscan.compliance.document.Table;
import com.finscan.compliance.domain.Discrepancy;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Arithmetic checks over extracted tables: the accounting equation, the income equation and
 * column totals. Statement checks read the first value column; differences up to
 * {@link #TOLERANCE} are not reported.
 *
 * <p>Known false positives: a table without a trailing total row fails the column check, and a
 * "Total liabilities and stockholders' equity" row is read as total liabilities.
 */
@Component
public class FinancialMathValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(FinancialMathValidator.class);

    public static final double TOLERANCE = 0.01;

    private static final List<String> BALANCE_SHEET_PHRASES = List.of("balance sheet", "statement of financial position");
    private static final List<String> INCOME_STATEMENT_PHRASES = List.of("income statement", "statement of operations");

    public List<Discrepancy> validate(int page, String pageText, int tableNumber, Table table) {
        List<Discrepancy> discrepancies = new ArrayList<>();
        if (table.rowCount() < 2) {
            LOGGER.debug("Skipping table {} on page {}: {} rows", tableNumber, page, table.rowCount());
            return discrepancies;
        }

        String lower = pageText == null ? "" : pageText.toLowerCase(Locale.ROOT);
        if (BALANCE_SHEET_PHRASES.stream().anyMatch(lower::contains)) {
            checkBalanceSheet(page, table).ifPresent(discrepancies::add);
        }
        if (INCOME_STATEMENT_PHRASES.stream().anyMatch(lower::contains)) {
            checkIncomeStatement(page, table).ifPresent(discrepancies::add);
        }
        discrepancies.addAll(checkColumnSums(page, tableNumber, table));
        return discrepancies;
    }

    public Optional<Discrepancy> checkBalanceSheet(int page, Table table) {
        Double assets = null;
        Double liabilities = null;
        Double equity = null;

        for (int row = 0; row < table.rowCount(); row++) {
            if (!table.hasCell(row, 1)) {
                continue;
            }
            String label = lowerLabel(table, row);
            if (label.contains("total assets")) {
                assets = CurrencyNormalizer.normalize(table.cell(row, 1));
            } else if (label.contains("total liabilities")) {
                liabilities = CurrencyNormalizer.normalize(table.cell(row, 1));
            } else if (label.contains("total equity") || label.contains("total stockholders")) {
                equity = CurrencyNormalizer.normalize(table.cell(row, 1));
            }
        }

        if (assets == null || liabilities == null || equity == null) {
            return Optional.empty();
        }
        double liabilitiesEquity = liabilities + equity;
        double difference = Math.abs(assets - liabilitiesEquity);
        if (!exceedsTolerance(difference)) {
            return Optional.empty();
        }
        return Optional.of(Discrepancy.balanceSheetImbalance(page, assets, liabilitiesEquity, difference));
    }

    public Optional<Discrepancy> checkIncomeStatement(int page, Table table) {
        Double revenue = null;
        Double expenses = null;
        Double netIncome = null;

        for (int row = 0; row < table.rowCount(); row++) {
            if (!table.hasCell(row, 1)) {
                continue;
            }
            String label = lowerLabel(table, row);
            if (label.contains("total revenue") || label.contains("net revenue")) {
                revenue = CurrencyNormalizer.normalize(table.cell(row, 1));
            } else if (label.contains("total expenses") || label.contains("total operating expenses")) {
                expenses = CurrencyNormalizer.normalize(table.cell(row, 1));
            } else if (label.contains("net income") || label.contains("net loss")) {
                netIncome = CurrencyNormalizer.normalize(table.cell(row, 1));
            }
        }

        if (revenue == null || expenses == null || netIncome == null) {
            return Optional.empty();
        }
        double expected = revenue - expenses;
        double difference = Math.abs(expected - netIncome);
        if (!exceedsTolerance(difference)) {
            return Optional.empty();
        }
        return Optional.of(Discrepancy.incomeStatementMismatch(page, revenue, expenses, expected, netIncome, difference));
    }

    // data rows 1..n-2 against the last row
    public List<Discrepancy> checkColumnSums(int page, int tableNumber, Table table) {
        List<Discrepancy> discrepancies = new ArrayList<>();
        int rows = table.rowCount();
        if (rows < 3) {
            return discrepancies;
        }

        int lastRow = rows - 1;
        int columns = table.header().size();
        for (int column = 1; column < columns; column++) {
            double calculated = 0.0;
            int counted = 0;
            for (int row = 1; row < lastRow; row++) {
                if (!table.hasCell(row, column)) {
                    continue;
                }
                Double value = CurrencyNormalizer.normalize(table.cell(row, column));
                if (value != null) {
                    calculated += value;
                    counted++;
                }
            }
            if (counted == 0 || !table.hasCell(lastRow, column)) {
                continue;
            }

            Double reported = CurrencyNormalizer.normalize(table.cell(lastRow, column));
            if (reported != null && exceedsTolerance(calculated - reported)) {
                discrepancies.add(Discrepancy.columnSumMismatch(page, tableNumber, column + 1, calculated, reported));
            }
        }
        return discrepancies;
    }

    private static boolean exceedsTolerance(double difference) {
        return Math.abs(difference) > TOLERANCE;
    }

    private static String lowerLabel(Table table, int row) {
        String label = table.cell(row, 0);
        return label == null ? "" : label.toLowerCase(Locale.ROOT);
    }
}

package com.finscan.compliance.engine;

import com.finscan.compliance.document.DocumentPage;
import com.finscan.compliance.document.Table;
import com.finscan.compliance.domain.ClassifiedStatement;
import com.finscan.compliance.domain.StatementType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Labels the tables of a page with the statement type the page text announces, and pulls the
 * reporting periods and recognised line items out of each table.
 */
@Component
public class StatementClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(StatementClassifier.class);

    static final int RAW_ROW_LIMIT = 10;

    private static final Pattern PERIOD = Pattern.compile("20\\d{2}");

    private static final Map<StatementType, List<String>> TYPE_PHRASES = new LinkedHashMap<>();

    static {
        TYPE_PHRASES.put(StatementType.BALANCE_SHEET, List.of("balance sheet", "statement of financial position"));
        TYPE_PHRASES.put(StatementType.INCOME_STATEMENT, List.of("income statement", "statement of operations", "p&l"));
        TYPE_PHRASES.put(StatementType.CASH_FLOW_STATEMENT, List.of("cash flow"));
        TYPE_PHRASES.put(StatementType.INVOICE, List.of("invoice", "bill to"));
    }

    private static final List<String> LINE_ITEM_KEYWORDS = List.of(
        "total assets",
        "total liabilities",
        "total equity",
        "stockholders",
        "revenue",
        "net income",
        "net loss",
        "total",
        "subtotal",
        "operating",
        "investing",
        "financing"
    );

    public Optional<StatementType> classify(String pageText) {
        if (pageText == null) {
            return Optional.empty();
        }
        String lower = pageText.toLowerCase(Locale.ROOT);
        for (Map.Entry<StatementType, List<String>> entry : TYPE_PHRASES.entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public List<ClassifiedStatement> extract(DocumentPage page) {
        Optional<StatementType> type = classify(page.text());
        if (type.isEmpty()) {
            return List.of();
        }

        List<ClassifiedStatement> statements = new ArrayList<>();
        for (Table table : page.tables()) {
            List<PeriodColumn> periodColumns = periodColumns(table);
            List<String> periods = periodColumns.stream().map(PeriodColumn::label).toList();
            statements.add(new ClassifiedStatement(
                type.get(),
                page.number(),
                periods,
                keyItems(table, periodColumns),
                rawRows(table)
            ));
        }
        LOGGER.debug("Page {} classified as {} with {} tables", page.number(), type.get(), statements.size());
        return statements;
    }

    List<PeriodColumn> periodColumns(Table table) {
        List<PeriodColumn> columns = new ArrayList<>();
        List<String> header = table.header();
        for (int column = 0; column < header.size(); column++) {
            String cell = header.get(column);
            if (cell != null && PERIOD.matcher(cell).find()) {
                columns.add(new PeriodColumn(cell.strip(), column));
            }
        }
        return columns;
    }

    private Map<String, Map<String, Double>> keyItems(Table table, List<PeriodColumn> periodColumns) {
        Map<String, Map<String, Double>> items = new LinkedHashMap<>();
        for (int row = 1; row < table.rowCount(); row++) {
            if (table.row(row).isEmpty()) {
                continue;
            }
            String label = table.cell(row, 0) == null ? "" : table.cell(row, 0).strip();
            if (!isLineItem(label)) {
                continue;
            }
            Map<String, Double> values = new LinkedHashMap<>();
            for (PeriodColumn period : periodColumns) {
                if (table.hasCell(row, period.column())) {
                    values.put(period.label(), CurrencyNormalizer.normalize(table.cell(row, period.column())));
                }
            }
            items.put(label, values);
        }
        return items;
    }

    private boolean isLineItem(String label) {
        String lower = label.toLowerCase(Locale.ROOT);
        return LINE_ITEM_KEYWORDS.stream().anyMatch(lower::contains);
    }

    private List<List<String>> rawRows(Table table) {
        return table.rows().subList(0, Math.min(RAW_ROW_LIMIT, table.rowCount()));
    }

    record PeriodColumn(String label, int column) {
    }
}

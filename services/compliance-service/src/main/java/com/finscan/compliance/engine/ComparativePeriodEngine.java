package com.finscan.compliance.engine;

import com.finscan.compliance.document.Table;
import com.finscan.compliance.domain.Amounts;
import com.finscan.compliance.domain.PeriodChange;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Period-over-period changes for tables whose header carries at least two distinct years.
 */
@Component
public class ComparativePeriodEngine {

    public static final double MATERIAL_PERCENT = 10.0;
    public static final double MATERIAL_ABSOLUTE = 100_000.0;

    private static final Pattern YEAR = Pattern.compile("(20\\d{2})");
    private static final int MIN_METRIC_LENGTH = 3;

    public List<PeriodChange> compare(int page, Table table) {
        List<PeriodChange> results = new ArrayList<>();
        if (table.rowCount() < 2) {
            return results;
        }

        Map<String, Integer> periodColumns = periodColumns(table.header());
        if (periodColumns.size() < 2) {
            return results;
        }
        List<String> descending = new ArrayList<>(periodColumns.keySet());
        descending.sort(Comparator.reverseOrder());

        for (int row = 1; row < table.rowCount(); row++) {
            List<String> cells = table.row(row);
            if (cells.size() < 2) {
                continue;
            }
            String metric = cells.get(0) == null ? "" : cells.get(0).strip();
            if (metric.length() < MIN_METRIC_LENGTH) {
                continue;
            }

            Map<String, Double> values = new LinkedHashMap<>();
            periodColumns.forEach((period, column) -> {
                if (column < cells.size()) {
                    Double value = CurrencyNormalizer.normalize(cells.get(column));
                    if (value != null) {
                        values.put(period, value);
                    }
                }
            });
            if (values.size() < 2) {
                continue;
            }

            Map<String, PeriodChange.Change> changes = new LinkedHashMap<>();
            for (int i = 0; i < descending.size() - 1; i++) {
                String current = descending.get(i);
                String previous = descending.get(i + 1);
                if (values.containsKey(current) && values.containsKey(previous)) {
                    changes.put(current + "_vs_" + previous, change(values.get(current), values.get(previous)));
                }
            }
            if (!changes.isEmpty()) {
                results.add(new PeriodChange(metric, page, values, changes));
            }
        }
        return results;
    }

    public PeriodChange.Change change(double current, double previous) {
        double absolute = current - previous;
        Double percent = previous != 0 ? absolute / Math.abs(previous) * 100 : null;
        boolean material = (percent != null && Math.abs(percent) > MATERIAL_PERCENT)
            || Math.abs(absolute) > MATERIAL_ABSOLUTE;
        return new PeriodChange.Change(
            Amounts.round(absolute),
            percent == null ? null : Amounts.round(percent),
            material,
            absolute > 0 ? "increase" : "decrease"
        );
    }

    private Map<String, Integer> periodColumns(List<String> header) {
        Map<String, Integer> columns = new LinkedHashMap<>();
        for (int column = 0; column < header.size(); column++) {
            String cell = header.get(column);
            if (cell == null) {
                continue;
            }
            Matcher matcher = YEAR.matcher(cell);
            if (matcher.find()) {
                columns.put(matcher.group(1), column);
            }
        }
        return columns;
    }
}

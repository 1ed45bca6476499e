package com.finscan.compliance.document;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A row/column grid as produced by table extraction. Row 0 is the header. Rows may be shorter
 * than the header; a cell past the end of its row reads as missing ({@code null}).
 */
public record Table(List<List<String>> rows) {

    public Table {
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            copy.add(row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
    }

    @SafeVarargs
    public static Table of(List<String>... rows) {
        return new Table(Arrays.asList(rows));
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<String> row(int index) {
        return rows.get(index);
    }

    public List<String> header() {
        return rows.isEmpty() ? List.of() : rows.get(0);
    }

    public String cell(int row, int column) {
        List<String> cells = rows.get(row);
        return column < cells.size() ? cells.get(column) : null;
    }

    public boolean hasCell(int row, int column) {
        return column < rows.get(row).size();
    }
}

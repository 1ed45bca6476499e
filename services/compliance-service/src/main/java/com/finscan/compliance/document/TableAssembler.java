package com.finscan.compliance.document;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rebuilds simple grids from positioned text. A horizontal gap wider than {@code columnGap}
 * starts a new cell; consecutive lines with at least two cells form one table whose first
 * line is the header. A single multi-cell line on its own is not a table.
 */
final class TableAssembler {

    private static final int MIN_CELLS = 2;
    private static final int MIN_ROWS = 2;

    private final float columnGap;

    TableAssembler(float columnGap) {
        this.columnGap = columnGap;
    }

    List<Table> assemble(List<TextLine> lines) {
        List<TextLine> ordered = new ArrayList<>(lines);
        ordered.sort(Comparator.comparing(TextLine::y));

        List<Table> tables = new ArrayList<>();
        List<List<String>> current = new ArrayList<>();
        for (TextLine line : ordered) {
            List<String> cells = splitCells(line);
            if (cells.size() >= MIN_CELLS) {
                current.add(cells);
            } else {
                flush(current, tables);
                current = new ArrayList<>();
            }
        }
        flush(current, tables);
        return tables;
    }

    List<String> splitCells(TextLine line) {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        PositionedToken previous = null;
        for (PositionedToken token : line.tokens()) {
            if (previous != null && token.x() - previous.endX() > columnGap) {
                cells.add(cell.toString().trim());
                cell.setLength(0);
            } else if (cell.length() > 0) {
                cell.append(' ');
            }
            cell.append(token.text().trim());
            previous = token;
        }
        if (previous != null) {
            cells.add(cell.toString().trim());
        }
        return cells;
    }

    private void flush(List<List<String>> rows, List<Table> tables) {
        if (rows.size() >= MIN_ROWS) {
            tables.add(new Table(rows));
        }
    }
}

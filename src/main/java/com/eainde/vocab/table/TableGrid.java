package com.eainde.vocab.table;

import com.eainde.vocab.canonical.RowCanonicalizer;
import com.eainde.vocab.model.Row;

import java.util.ArrayList;
import java.util.List;

/**
 * Two-dimensional cell grid used by spreadsheet-like stores, header row first.
 */
public final class TableGrid {

    static final int NARROW = 3;
    static final int WIDE = 5;

    private TableGrid() {
    }

    /**
     * @return three headers when every row fits in three columns, otherwise five
     */
    public static List<String> headersFor(List<Row> rows) {
        int width = rows.stream().mapToInt(Row::width).max().orElse(NARROW);
        return width >= WIDE ? Row.HEADERS : Row.HEADERS.subList(0, NARROW);
    }

    public static List<List<String>> toGrid(List<Row> rows) {
        List<String> headers = headersFor(rows);
        List<List<String>> grid = new ArrayList<>(rows.size() + 1);
        grid.add(headers);
        for (Row row : rows) {
            grid.add(row.fields().subList(0, headers.size()));
        }
        return grid;
    }

    /**
     * Drops the header row, right-pads short rows and skips rows whose cells are all blank.
     */
    public static List<Row> fromGrid(List<List<String>> grid) {
        List<Row> rows = new ArrayList<>();
        for (int i = 1; i < grid.size(); i++) {
            List<String> cells = grid.get(i);
            if (cells == null || cells.stream().limit(WIDE).allMatch(c -> c == null || c.isBlank())) continue;
            rows.add(RowCanonicalizer.canonicalize(cells));
        }
        return rows;
    }
}

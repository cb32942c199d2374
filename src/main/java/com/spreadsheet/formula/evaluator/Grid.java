package com.spreadsheet.formula.evaluator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Row-major 2-D block of values produced by a cell reference (1x1) or a range.
 * Members are Double, String or null for a hole (empty or erroring cell).
 */
public final class Grid {
    private final List<List<Object>> rows;
    private final int rowCount;
    private final int colCount;

    public Grid(List<List<Object>> rows) {
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
        this.rowCount = copy.size();
        this.colCount = copy.isEmpty() ? 0 : copy.get(0).size();
    }

    public static Grid single(Object value) {
        List<Object> row = new ArrayList<>(1);
        row.add(value);
        return new Grid(List.of(row));
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColCount() {
        return colCount;
    }

    public Object get(int row, int col) {
        return rows.get(row).get(col);
    }

    public List<Object> getRow(int row) {
        return rows.get(row);
    }

    public List<Object> getColumn(int col) {
        List<Object> column = new ArrayList<>(rowCount);
        for (List<Object> row : rows) {
            column.add(row.get(col));
        }
        return column;
    }

    public boolean isSingleCell() {
        return rowCount == 1 && colCount == 1;
    }

    public boolean sameShapeAs(Grid other) {
        return rowCount == other.rowCount && colCount == other.colCount;
    }

    /**
     * All members in row-major order, holes included.
     */
    public List<Object> values() {
        List<Object> all = new ArrayList<>(rowCount * colCount);
        for (List<Object> row : rows) {
            all.addAll(row);
        }
        return all;
    }

    @Override
    public String toString() {
        return rows.toString();
    }
}

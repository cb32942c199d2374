package com.spreadsheet.formula.models;

import com.spreadsheet.formula.parser.CellReferences;

import java.util.Objects;

/**
 * Zero-based (row, col) pair. "A1" is (0, 0), "C5" is (4, 2).
 */
public final class CellPosition {
    private final int row;
    private final int col;

    public CellPosition(int row, int col) {
        this.row = row;
        this.col = col;
    }

    /**
     * Parses a cell ID such as "B12". Throws if the ID isn't cell-reference shaped.
     */
    public static CellPosition fromCellId(String cellId) {
        return new CellPosition(CellReferences.rowOf(cellId) - 1, CellReferences.columnOf(cellId) - 1);
    }

    public String toCellId() {
        return CellReferences.cellId(col + 1, row + 1);
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellPosition)) {
            return false;
        }
        CellPosition other = (CellPosition) o;
        return row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}

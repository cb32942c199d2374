package com.spreadsheet.formula.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rectangular range such as A1:B3, stored as a row-major grid of cell IDs:
 * [[A1, B1], [A2, B2], [A3, B3]].
 */
public final class RangeNode implements AstNode {
    private final List<List<String>> cells;
    private final int rows;
    private final int cols;

    public RangeNode(List<List<String>> cells) {
        if (cells.isEmpty() || cells.get(0).isEmpty()) {
            throw new IllegalArgumentException("A range needs at least one cell");
        }
        List<List<String>> copy = new ArrayList<>(cells.size());
        for (List<String> row : cells) {
            copy.add(List.copyOf(row));
        }
        this.cells = Collections.unmodifiableList(copy);
        this.rows = copy.size();
        this.cols = copy.get(0).size();
    }

    public List<List<String>> getCells() {
        return cells;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    // Top-left corner
    public String getStart() {
        return cells.get(0).get(0);
    }

    // Bottom-right corner
    public String getEnd() {
        return cells.get(rows - 1).get(cols - 1);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRange(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RangeNode && ((RangeNode) o).cells.equals(cells);
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return "Range(" + getStart() + ":" + getEnd() + ")";
    }
}

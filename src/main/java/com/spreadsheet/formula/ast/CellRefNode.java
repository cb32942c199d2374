package com.spreadsheet.formula.ast;

/**
 * Reference to a single cell, e.g. B5.
 * After a column/row deletion the ID may be the {@link #INVALID_REFERENCE} marker.
 */
public final class CellRefNode implements AstNode {

    public static final String INVALID_REFERENCE = "#REF!";

    private final String cellId;

    public CellRefNode(String cellId) {
        this.cellId = cellId;
    }

    public String getCellId() {
        return cellId;
    }

    public boolean isInvalidReference() {
        return INVALID_REFERENCE.equals(cellId);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCellRef(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CellRefNode && ((CellRefNode) o).cellId.equals(cellId);
    }

    @Override
    public int hashCode() {
        return cellId.hashCode();
    }

    @Override
    public String toString() {
        return "CellRef(" + cellId + ")";
    }
}

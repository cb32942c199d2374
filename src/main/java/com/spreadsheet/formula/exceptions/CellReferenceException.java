package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a single referenced cell is absent, holds an error,
 * or has no value. For example, "Cell A1 has no value".
 */
public class CellReferenceException extends FormulaException {
    private final String cellId;

    public CellReferenceException(String cellId, String reason) {
        super("Cell " + cellId + " " + reason);
        this.cellId = cellId;
    }

    public String getCellId() {
        return cellId;
    }
}

package com.spreadsheet.formula.models;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - which column (columnName) and which row (rowIndex, 1-based)
 * - content (literal text, or a formula starting with "=")
 * - result (the last value or error the engine committed)
 */
public class Cell {
    private final String columnName;
    private final int rowIndex;
    private String content;
    private EvalResult result;

    public Cell(String columnName, int rowIndex, String content) {
        this.columnName = columnName;
        this.rowIndex = rowIndex;
        this.content = content;
    }

    public String getColumnName() {
        return columnName;
    }

    public int getRowIndex() {
        return rowIndex;
    }

    public String getCellId() {
        return columnName + rowIndex;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    // Null until the engine has evaluated the cell at least once
    public EvalResult getResult() {
        return result;
    }

    public void setResult(EvalResult result) {
        this.result = result;
    }
}

package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a request names a sheet ID that {@code SheetService} never created.
 */
public class SheetNotFoundException extends RuntimeException {

    private final long sheetId;

    public SheetNotFoundException(long sheetId) {
        super("Sheet not found: " + sheetId);
        this.sheetId = sheetId;
    }

    public long getSheetId() {
        return sheetId;
    }
}

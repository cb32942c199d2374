package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a caller addresses a cell with a malformed ID
 * or one that lies outside the configured sheet bounds.
 * For example, "Invalid cell reference: 1A".
 */
public class InvalidCellReferenceException extends RuntimeException {
    public InvalidCellReferenceException(String message) {
        super(message);
    }
}

package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a structural edit names an axis other than "row" or "column".
 */
public class InvalidAxisException extends RuntimeException {
    public InvalidAxisException(String message) {
        super(message);
    }
}

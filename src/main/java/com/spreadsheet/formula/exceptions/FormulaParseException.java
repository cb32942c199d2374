package com.spreadsheet.formula.exceptions;

/**
 * Thrown for malformed formula text: a bad character, an unterminated string,
 * an invalid identifier, a missing parenthesis or a malformed/reversed range.
 * Also used when a value cannot be coerced to a number.
 */
public class FormulaParseException extends FormulaException {
    public FormulaParseException(String message) {
        super(message);
    }
}

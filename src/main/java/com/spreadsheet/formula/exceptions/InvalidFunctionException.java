package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a formula calls a function name the registry doesn't know.
 */
public class InvalidFunctionException extends FormulaException {
    public InvalidFunctionException(String functionName) {
        super("Unknown function: " + functionName);
    }
}

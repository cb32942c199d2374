package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a built-in function gets the wrong number or kind of arguments.
 * The message is prefixed with the function name, e.g. "IF: requires exactly 3 arguments".
 */
public class FunctionArgumentException extends FormulaException {
    public FunctionArgumentException(String functionName, String message) {
        super(functionName + ": " + message);
    }
}

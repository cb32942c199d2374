package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a numeric division has a zero divisor,
 * whether through the '/' operator or DIV/DIVIDE/AVERAGE.
 */
public class DivisionByZeroException extends FormulaException {
    public DivisionByZeroException() {
        super("Division by zero");
    }
}

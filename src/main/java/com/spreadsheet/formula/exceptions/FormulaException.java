package com.spreadsheet.formula.exceptions;

/**
 * Base type for every error a formula can produce.
 * These never leave the engine: the evaluation boundary converts them
 * into an error result carrying {@link #getMessage()}.
 */
public abstract class FormulaException extends RuntimeException {
    protected FormulaException(String message) {
        super(message);
    }
}

package com.spreadsheet.formula.functions;

import java.util.List;

/**
 * Implementation of one built-in. Arguments arrive evaluated but not flattened:
 * each is a Double, a String or a {@link com.spreadsheet.formula.evaluator.Grid}.
 * Returns a Double or a String.
 */
@FunctionalInterface
public interface SpreadsheetFunction {

    Object apply(List<Object> args);
}

package com.spreadsheet.formula.evaluator;

import com.spreadsheet.formula.models.EvalResult;

/**
 * Read-only view of already computed results. Returns null for a cell
 * that has never been evaluated.
 */
@FunctionalInterface
public interface CellLookup {

    EvalResult getCellResult(String cellId);
}

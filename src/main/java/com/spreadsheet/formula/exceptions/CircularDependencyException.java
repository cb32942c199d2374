package com.spreadsheet.formula.exceptions;

import java.util.List;

/**
 * Thrown when committing a cell's references would create a circular
 * dependency (a cell referencing itself, or a multi-cell loop).
 * The cycle is reported in reading order, e.g. "A1 -> B1 -> A1".
 */
public class CircularDependencyException extends FormulaException {
    private final List<String> cycle;

    public CircularDependencyException(List<String> cycle) {
        super("Circular dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}

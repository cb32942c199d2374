package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluator.Grid;
import com.spreadsheet.formula.evaluator.Values;
import com.spreadsheet.formula.exceptions.FunctionArgumentException;

import java.util.ArrayList;
import java.util.List;

/**
 * Argument helpers for built-ins: flattening, scalar and grid extraction.
 */
final class Arguments {

    private Arguments() {
    }

    /**
     * Flattens scalars and grids into one row-major sequence, skipping holes.
     */
    static List<Object> flatten(List<Object> args) {
        List<Object> values = new ArrayList<>();
        for (Object arg : args) {
            if (arg instanceof Grid) {
                for (Object value : ((Grid) arg).values()) {
                    if (value != null) {
                        values.add(value);
                    }
                }
            } else if (arg != null) {
                values.add(arg);
            }
        }
        return values;
    }

    /**
     * A single value: scalars as-is, 1x1 grids collapsed. Larger grids and holes fail.
     */
    static Object scalar(String functionName, Object arg, String label) {
        Object value = arg;
        if (arg instanceof Grid) {
            Grid grid = (Grid) arg;
            if (!grid.isSingleCell()) {
                throw new FunctionArgumentException(functionName, label + " must be a single value, not a range");
            }
            value = grid.get(0, 0);
        }
        if (value == null) {
            throw new FunctionArgumentException(functionName, label + " is empty");
        }
        return value;
    }

    static double number(String functionName, Object arg, String label) {
        return Values.toNumber(scalar(functionName, arg, label));
    }

    static String text(String functionName, Object arg, String label) {
        return Values.stringify(scalar(functionName, arg, label));
    }

    /**
     * A positive whole number such as a 1-based index.
     */
    static int index(String functionName, Object arg, String label) {
        double n = number(functionName, arg, label);
        if (n < 1 || n != Math.rint(n) || n > Integer.MAX_VALUE) {
            throw new FunctionArgumentException(functionName, label + " must be a positive integer");
        }
        return (int) n;
    }

    /**
     * A grid argument. Cell references already arrive as 1x1 grids; a bare literal is rejected.
     */
    static Grid grid(String functionName, Object arg, String label) {
        if (!(arg instanceof Grid)) {
            throw new FunctionArgumentException(functionName, label + " must be a range");
        }
        return (Grid) arg;
    }

    /**
     * Like {@link #grid} but a literal is treated as a 1x1 grid.
     */
    static Grid asGrid(Object arg) {
        return arg instanceof Grid ? (Grid) arg : Grid.single(arg);
    }
}

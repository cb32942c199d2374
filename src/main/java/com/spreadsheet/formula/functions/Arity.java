package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.FunctionArgumentException;

/**
 * Argument-count contract of a function, checked before it runs.
 */
public final class Arity {
    private final int min;
    private final int max;

    private Arity(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public static Arity exactly(int count) {
        return new Arity(count, count);
    }

    public static Arity none() {
        return exactly(0);
    }

    public static Arity atLeastOne() {
        return atLeast(1);
    }

    public static Arity atLeast(int count) {
        return new Arity(count, Integer.MAX_VALUE);
    }

    public static Arity between(int min, int max) {
        return new Arity(min, max);
    }

    public void check(String functionName, int count) {
        if (count >= min && count <= max) {
            return;
        }
        if (min == max) {
            if (min == 0) {
                throw new FunctionArgumentException(functionName, "requires no arguments");
            }
            throw new FunctionArgumentException(functionName,
                    "requires exactly " + min + " argument" + (min == 1 ? "" : "s"));
        }
        if (isUnbounded()) {
            if (min == 1) {
                throw new FunctionArgumentException(functionName, "requires at least one argument");
            }
            throw new FunctionArgumentException(functionName, "requires at least " + min + " arguments");
        }
        throw new FunctionArgumentException(functionName,
                "requires between " + min + " and " + max + " arguments, got " + count);
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    public boolean isUnbounded() {
        return max == Integer.MAX_VALUE;
    }
}

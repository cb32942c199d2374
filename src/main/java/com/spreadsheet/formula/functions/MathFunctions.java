package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluator.Values;
import com.spreadsheet.formula.exceptions.DivisionByZeroException;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregates (SUM, AVERAGE, MIN, MAX, COUNT) and the two-argument
 * arithmetic functions (ADD, SUB, MUL, DIV).
 */
final class MathFunctions {

    private MathFunctions() {
    }

    static Object sum(List<Object> args) {
        double total = 0;
        for (double n : numbers(args)) {
            total += n;
        }
        return total;
    }

    static Object average(List<Object> args) {
        List<Double> numbers = numbers(args);
        if (numbers.isEmpty()) {
            throw new DivisionByZeroException();
        }
        double total = 0;
        for (double n : numbers) {
            total += n;
        }
        return total / numbers.size();
    }

    static Object min(List<Object> args) {
        List<Double> numbers = numbers(args);
        double min = numbers.isEmpty() ? 0 : Double.POSITIVE_INFINITY;
        for (double n : numbers) {
            min = Math.min(min, n);
        }
        return min;
    }

    static Object max(List<Object> args) {
        List<Double> numbers = numbers(args);
        double max = numbers.isEmpty() ? 0 : Double.NEGATIVE_INFINITY;
        for (double n : numbers) {
            max = Math.max(max, n);
        }
        return max;
    }

    // Numbers and numeric text count; words and holes don't
    static Object count(List<Object> args) {
        int count = 0;
        for (Object value : Arguments.flatten(args)) {
            if (Values.isNumeric(value)) {
                count++;
            }
        }
        return (double) count;
    }

    static Object add(List<Object> args) {
        return Arguments.number("ADD", args.get(0), "first argument")
                + Arguments.number("ADD", args.get(1), "second argument");
    }

    static Object sub(List<Object> args) {
        return Arguments.number("SUB", args.get(0), "first argument")
                - Arguments.number("SUB", args.get(1), "second argument");
    }

    static Object mul(List<Object> args) {
        return Arguments.number("MUL", args.get(0), "first argument")
                * Arguments.number("MUL", args.get(1), "second argument");
    }

    static Object div(List<Object> args) {
        double dividend = Arguments.number("DIV", args.get(0), "first argument");
        double divisor = Arguments.number("DIV", args.get(1), "second argument");
        if (divisor == 0) {
            throw new DivisionByZeroException();
        }
        return dividend / divisor;
    }

    /**
     * Flattened numeric members; anything without a numeric reading is skipped.
     */
    private static List<Double> numbers(List<Object> args) {
        List<Double> numbers = new ArrayList<>();
        for (Object value : Arguments.flatten(args)) {
            Double n = Values.tryToNumber(value);
            if (n != null) {
                numbers.add(n);
            }
        }
        return numbers;
    }
}

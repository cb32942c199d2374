package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluator.Values;

import java.util.List;
import java.util.Locale;

/**
 * CONCATENATE, LEFT, RIGHT, TRIM, UPPER, LOWER.
 */
final class TextFunctions {

    private TextFunctions() {
    }

    static Object concatenate(List<Object> args) {
        StringBuilder sb = new StringBuilder();
        for (Object value : Arguments.flatten(args)) {
            sb.append(Values.stringify(value));
        }
        return sb.toString();
    }

    static Object left(List<Object> args) {
        String text = Arguments.text("LEFT", args.get(0), "text");
        int count = clampCount(Arguments.number("LEFT", args.get(1), "num_chars"), text.length());
        return text.substring(0, count);
    }

    static Object right(List<Object> args) {
        String text = Arguments.text("RIGHT", args.get(0), "text");
        int count = clampCount(Arguments.number("RIGHT", args.get(1), "num_chars"), text.length());
        return text.substring(text.length() - count);
    }

    static Object trim(List<Object> args) {
        return Arguments.text("TRIM", args.get(0), "text").strip();
    }

    static Object upper(List<Object> args) {
        return Arguments.text("UPPER", args.get(0), "text").toUpperCase(Locale.ROOT);
    }

    static Object lower(List<Object> args) {
        return Arguments.text("LOWER", args.get(0), "text").toLowerCase(Locale.ROOT);
    }

    // Fractions truncate; the result lies in [0, length]
    private static int clampCount(double requested, int length) {
        if (Double.isNaN(requested) || requested <= 0) {
            return 0;
        }
        return (int) Math.min(Math.floor(requested), length);
    }
}

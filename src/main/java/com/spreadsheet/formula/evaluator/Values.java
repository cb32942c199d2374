package com.spreadsheet.formula.evaluator;

import com.spreadsheet.formula.exceptions.FormulaParseException;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coercions shared by the evaluator and the built-in functions.
 * Scalars are Double or String; null marks a hole in a range.
 */
public final class Values {

    static final String RANGE_IN_EXPRESSION = "Ranges cannot be used directly in expressions or comparisons";

    // Leading numeric prefix, e.g. "12.5kg" -> 12.5
    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");

    // Whole-string number shape, e.g. " 42 ", "-3.5", "1e3"
    private static final Pattern NUMBER_SHAPE =
            Pattern.compile("^\\s*[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?\\s*$");

    private Values() {
    }

    /**
     * Permissive conversion: numbers as-is, strings by their leading numeric prefix.
     * Returns null when nothing numeric can be read.
     */
    public static Double tryToNumber(Object value) {
        if (value instanceof Double) {
            return (Double) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            Matcher m = LEADING_NUMBER.matcher((String) value);
            if (m.find()) {
                return Double.parseDouble(m.group(1));
            }
        }
        return null;
    }

    public static double toNumber(Object value) {
        Double number = tryToNumber(value);
        if (number == null) {
            throw new FormulaParseException("Cannot convert '" + (value == null ? "" : value) + "' to number");
        }
        return number;
    }

    /**
     * True for numbers and for strings that are a number in full.
     */
    public static boolean isNumeric(Object value) {
        if (value instanceof Number) {
            return true;
        }
        return value instanceof String && isNumberShape((String) value);
    }

    public static boolean isNumberShape(String text) {
        return NUMBER_SHAPE.matcher(text).matches();
    }

    /**
     * Numeric truthiness: non-zero numbers are true. Text "TRUE"/"FALSE" is honoured,
     * numeric text goes by its number, empty text is false and any other text is true.
     */
    public static boolean toBoolean(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true")) {
            return true;
        }
        if (text.equalsIgnoreCase("false") || text.isEmpty()) {
            return false;
        }
        if (isNumberShape(text)) {
            return Double.parseDouble(text.trim()) != 0;
        }
        return true;
    }

    /**
     * Display text of a scalar. Whole numbers print without a fraction ("5", not "5.0").
     */
    public static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Number) {
            return formatNumber(((Number) value).doubleValue());
        }
        return value.toString();
    }

    public static String formatNumber(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return Double.toString(number);
        }
        if (number == 0) {
            return "0";
        }
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }

    /**
     * Equality by type and value, as used by "=" and "<>".
     */
    public static boolean strictEquals(Object left, Object right) {
        if (left instanceof Double && right instanceof Double) {
            return ((Double) left).doubleValue() == ((Double) right).doubleValue();
        }
        if (left instanceof String && right instanceof String) {
            return left.equals(right);
        }
        return left == null && right == null;
    }

    /**
     * Collapses a 1x1 grid to its member. Scalars pass through; larger grids fail.
     */
    public static Object unwrap(Object value) {
        if (value instanceof Grid) {
            Grid grid = (Grid) value;
            if (!grid.isSingleCell()) {
                throw new FormulaParseException(RANGE_IN_EXPRESSION);
            }
            return grid.get(0, 0);
        }
        return value;
    }

    public static String upper(String text) {
        return text.toUpperCase(Locale.ROOT);
    }
}

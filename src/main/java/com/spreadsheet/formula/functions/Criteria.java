package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluator.Values;
import com.spreadsheet.formula.exceptions.FunctionArgumentException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A COUNTIF/SUMIF style condition. Either a numeric comparison such as ">5",
 * "<=10" or "<>0", or an exact match against a number or case-insensitive text.
 */
final class Criteria {

    // "<>" before "<" so the longer operator wins
    private static final Pattern COMPARISON = Pattern.compile("^(<>|>=?|<=?|=)(.+)$");

    private final String operator;
    private final double operand;
    private final String text;
    private final Double exactNumber;

    private Criteria(String operator, double operand, String text, Double exactNumber) {
        this.operator = operator;
        this.operand = operand;
        this.text = text;
        this.exactNumber = exactNumber;
    }

    static Criteria parse(String functionName, Object criteria) {
        String text = Values.stringify(criteria);
        Matcher m = COMPARISON.matcher(text);
        if (m.matches()) {
            Double operand = Values.tryToNumber(m.group(2));
            if (operand == null) {
                throw new FunctionArgumentException(functionName, "invalid comparison value: " + m.group(2));
            }
            return new Criteria(m.group(1), operand, text, null);
        }
        Double exact = Values.isNumeric(text) ? Values.toNumber(text) : null;
        return new Criteria(null, 0, text.toLowerCase(Locale.ROOT), exact);
    }

    boolean matches(Object value) {
        if (operator == null) {
            return matchesExactly(value);
        }
        Double number = Values.tryToNumber(value);
        if (number == null) {
            return false;
        }
        switch (operator) {
            case ">":
                return number > operand;
            case "<":
                return number < operand;
            case ">=":
                return number >= operand;
            case "<=":
                return number <= operand;
            case "=":
                return number == operand;
            case "<>":
                return number != operand;
            default:
                return false;
        }
    }

    private boolean matchesExactly(Object value) {
        if (value == null) {
            return false;
        }
        if (exactNumber != null && value instanceof Double) {
            return (Double) value == exactNumber.doubleValue();
        }
        return Values.stringify(value).toLowerCase(Locale.ROOT).equals(text);
    }

    @Override
    public String toString() {
        return operator == null ? text : operator + Values.formatNumber(operand);
    }
}

package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.exceptions.FormulaParseException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for cell IDs like "B12": column letters followed by a 1-based row.
 * Columns map to numbers in base 26 without a zero digit (A=1, Z=26, AA=27, ...).
 */
public final class CellReferences {

    // One or more uppercase letters followed by one or more digits
    public static final Pattern CELL_REF = Pattern.compile("^([A-Z]+)([0-9]+)$");

    private CellReferences() {
    }

    public static boolean isCellReference(String text) {
        return text != null && CELL_REF.matcher(text).matches();
    }

    /**
     * Converts column letters to a 1-based column number (A=1, B=2, Z=26, AA=27, ...).
     */
    public static int columnToNumber(String letters) {
        if (letters == null || letters.isEmpty()) {
            throw new IllegalArgumentException("Column letters must not be empty");
        }
        int result = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = letters.charAt(i);
            if (c < 'A' || c > 'Z') {
                throw new IllegalArgumentException("Invalid column letter: " + letters);
            }
            result = Math.addExact(Math.multiplyExact(result, 26), c - 'A' + 1);
        }
        return result;
    }

    /**
     * Converts a 1-based column number back to letters (1=A, 26=Z, 27=AA, ...).
     */
    public static String numberToColumn(int number) {
        if (number < 1) {
            throw new IllegalArgumentException("Column number must be positive: " + number);
        }
        StringBuilder sb = new StringBuilder();
        int n = number;
        while (n > 0) {
            int remainder = (n - 1) % 26;
            sb.insert(0, (char) ('A' + remainder));
            n = (n - 1) / 26;
        }
        return sb.toString();
    }

    /**
     * Builds an ID from a 1-based column number and a 1-based row.
     */
    public static String cellId(int column, int row) {
        return numberToColumn(column) + row;
    }

    public static int columnOf(String cellId) {
        Matcher m = match(cellId);
        try {
            return columnToNumber(m.group(1));
        } catch (ArithmeticException e) {
            throw new FormulaParseException("Invalid cell reference: " + cellId);
        }
    }

    public static int rowOf(String cellId) {
        Matcher m = match(cellId);
        try {
            return Integer.parseInt(m.group(2));
        } catch (NumberFormatException e) {
            throw new FormulaParseException("Invalid cell reference: " + cellId);
        }
    }

    private static Matcher match(String cellId) {
        Matcher m = CELL_REF.matcher(cellId == null ? "" : cellId);
        if (!m.matches()) {
            throw new FormulaParseException("Invalid cell reference: " + cellId);
        }
        return m;
    }
}

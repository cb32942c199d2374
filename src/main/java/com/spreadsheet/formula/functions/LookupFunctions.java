package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluator.Grid;
import com.spreadsheet.formula.evaluator.Values;
import com.spreadsheet.formula.exceptions.FunctionArgumentException;

import java.util.List;

/**
 * VLOOKUP, HLOOKUP, INDEX and MATCH.
 */
final class LookupFunctions {

    private LookupFunctions() {
    }

    /**
     * VLOOKUP(lookup_value, table_range, col_index_num, [range_lookup]).
     * Exact match unless range_lookup is truthy.
     */
    static Object vlookup(List<Object> args) {
        Object lookup = Arguments.scalar("VLOOKUP", args.get(0), "lookup_value");
        Grid table = Arguments.grid("VLOOKUP", args.get(1), "table_range");
        int colIndex = Arguments.index("VLOOKUP", args.get(2), "col_index_num");
        if (colIndex > table.getColCount()) {
            throw new FunctionArgumentException("VLOOKUP", "col_index_num (" + colIndex
                    + ") exceeds number of columns in range (" + table.getColCount() + ")");
        }
        boolean approximate = args.size() == 4
                && Values.toBoolean(Arguments.scalar("VLOOKUP", args.get(3), "range_lookup"));

        int row = find("VLOOKUP", lookup, table.getColumn(0), approximate);
        return result("VLOOKUP", table.get(row, colIndex - 1));
    }

    /**
     * HLOOKUP(lookup_value, table_range, row_index_num, [range_lookup]).
     * Approximate match unless range_lookup is falsy.
     */
    static Object hlookup(List<Object> args) {
        Object lookup = Arguments.scalar("HLOOKUP", args.get(0), "lookup_value");
        Grid table = Arguments.grid("HLOOKUP", args.get(1), "table_range");
        int rowIndex = Arguments.index("HLOOKUP", args.get(2), "row_index_num");
        if (rowIndex > table.getRowCount()) {
            throw new FunctionArgumentException("HLOOKUP", "row_index_num (" + rowIndex
                    + ") exceeds number of rows in range (" + table.getRowCount() + ")");
        }
        boolean approximate = args.size() != 4
                || Values.toBoolean(Arguments.scalar("HLOOKUP", args.get(3), "range_lookup"));

        int col = find("HLOOKUP", lookup, table.getRow(0), approximate);
        return result("HLOOKUP", table.get(rowIndex - 1, col));
    }

    /**
     * INDEX(array, row_num, [column_num]). A single row or column may be
     * indexed by position alone.
     */
    static Object index(List<Object> args) {
        Grid array = Arguments.asGrid(args.get(0));
        int rowNum = Arguments.index("INDEX", args.get(1), "row_num");
        Integer colNum = args.size() == 3 ? Arguments.index("INDEX", args.get(2), "column_num") : null;

        if (colNum == null) {
            if (array.getColCount() == 1) {
                checkBound("row_num", rowNum, array.getRowCount(), "rows");
                return result("INDEX", array.get(rowNum - 1, 0));
            }
            if (array.getRowCount() == 1) {
                checkBound("row_num", rowNum, array.getColCount(), "elements");
                return result("INDEX", array.get(0, rowNum - 1));
            }
            throw new FunctionArgumentException("INDEX", "column_num is required when array has multiple columns");
        }
        checkBound("row_num", rowNum, array.getRowCount(), "rows");
        checkBound("column_num", colNum, array.getColCount(), "columns");
        return result("INDEX", array.get(rowNum - 1, colNum - 1));
    }

    /**
     * MATCH(lookup_value, lookup_array, [match_type]); returns a 1-based position.
     * Type 1 (default) finds the largest value at most lookup_value in ascending data,
     * -1 the smallest value at least lookup_value in descending data, 0 an exact match.
     */
    static Object match(List<Object> args) {
        Object lookup = Arguments.scalar("MATCH", args.get(0), "lookup_value");
        int matchType = 1;
        if (args.size() == 3) {
            double type = Arguments.number("MATCH", args.get(2), "match_type");
            if (type != -1 && type != 0 && type != 1) {
                throw new FunctionArgumentException("MATCH", "match_type must be -1, 0, or 1");
            }
            matchType = (int) type;
        }
        List<Object> values = Arguments.asGrid(args.get(1)).values();

        if (matchType == 0) {
            for (int i = 0; i < values.size(); i++) {
                if (sameTypeEquals(lookup, values.get(i))) {
                    return (double) (i + 1);
                }
            }
            throw new FunctionArgumentException("MATCH",
                    "Value \"" + Values.stringify(lookup) + "\" not found in lookup_array");
        }

        double target = Values.toNumber(lookup);
        int best = -1;
        for (int i = 0; i < values.size(); i++) {
            Double n = Values.tryToNumber(values.get(i));
            if (n == null) {
                continue;
            }
            boolean inOrder = matchType == 1 ? n <= target : n >= target;
            if (!inOrder) {
                break;
            }
            best = i;
        }
        if (best == -1) {
            throw new FunctionArgumentException("MATCH", "No value " + (matchType == 1 ? "<=" : ">=")
                    + " \"" + Values.stringify(lookup) + "\" found in lookup_array");
        }
        return (double) (best + 1);
    }

    /**
     * Position of the lookup value in the key row or column.
     */
    private static int find(String functionName, Object lookup, List<Object> keys, boolean approximate) {
        if (approximate) {
            Double target = Values.tryToNumber(lookup);
            int best = -1;
            double bestValue = 0;
            for (int i = 0; i < keys.size() && target != null; i++) {
                Double key = Values.tryToNumber(keys.get(i));
                if (key != null && key <= target && (best == -1 || key > bestValue)) {
                    best = i;
                    bestValue = key;
                }
            }
            if (best != -1) {
                return best;
            }
        } else {
            for (int i = 0; i < keys.size(); i++) {
                if (sameTypeEquals(lookup, keys.get(i))) {
                    return i;
                }
            }
            for (int i = 0; i < keys.size(); i++) {
                if (crossTypeEquals(lookup, keys.get(i))) {
                    return i;
                }
            }
        }
        throw new FunctionArgumentException(functionName,
                "no match found for '" + Values.stringify(lookup) + "'");
    }

    // Numbers by value, text case-insensitively; mixed types never match
    private static boolean sameTypeEquals(Object lookup, Object key) {
        if (lookup instanceof Double && key instanceof Double) {
            return ((Double) lookup).doubleValue() == (Double) key;
        }
        if (lookup instanceof String && key instanceof String) {
            return ((String) lookup).equalsIgnoreCase((String) key);
        }
        return false;
    }

    private static boolean crossTypeEquals(Object lookup, Object key) {
        if (lookup instanceof Double && key instanceof String) {
            Double parsed = Values.tryToNumber(key);
            return parsed != null && parsed.doubleValue() == (Double) lookup;
        }
        if (lookup instanceof String && key instanceof Double) {
            Double parsed = Values.tryToNumber(lookup);
            return parsed != null && parsed.doubleValue() == (Double) key;
        }
        return false;
    }

    private static Object result(String functionName, Object value) {
        if (value == null) {
            throw new FunctionArgumentException(functionName, "result cell is empty");
        }
        return value;
    }

    private static void checkBound(String label, int value, int size, String unit) {
        if (value > size) {
            throw new FunctionArgumentException("INDEX",
                    label + " " + value + " is out of range (array has " + size + " " + unit + ")");
        }
    }
}

package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.exceptions.FormulaParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure helper turning a range reference into a row-major grid of cell IDs.
 * <pre>
 * expand("A1:C2") -> [[A1, B1, C1], [A2, B2, C2]]
 * expand("A1:A3") -> [[A1], [A2], [A3]]
 * expand("A1")    -> [[A1]]
 * </pre>
 */
public final class RangeExpander {

    // Largest range a formula may mention; every member becomes a cell ID
    public static final int MAX_RANGE_CELLS = 100_000;

    private RangeExpander() {
    }

    public static List<List<String>> expand(String range) {
        int colon = range.indexOf(':');
        if (colon < 0) {
            // Single cell reference
            return List.of(List.of(range));
        }
        String start = range.substring(0, colon);
        String end = range.substring(colon + 1);

        if (!CellReferences.isCellReference(start)) {
            throw new FormulaParseException("Invalid range start: " + start);
        }
        if (!CellReferences.isCellReference(end)) {
            throw new FormulaParseException("Invalid range end: " + end);
        }

        int startCol = CellReferences.columnOf(start);
        int startRow = CellReferences.rowOf(start);
        int endCol = CellReferences.columnOf(end);
        int endRow = CellReferences.rowOf(end);

        if (startRow < 1) {
            throw new FormulaParseException("Invalid range start: " + start);
        }
        if (endRow < 1) {
            throw new FormulaParseException("Invalid range end: " + end);
        }

        if (startCol > endCol || startRow > endRow) {
            throw new FormulaParseException("Invalid range: start must be before end in " + range);
        }
        return grid(startCol, startRow, endCol, endRow);
    }

    /**
     * Builds the grid for 1-based inclusive bounds. Callers are expected to pass
     * start <= end.
     *
     * @throws FormulaParseException if the range holds more than {@link #MAX_RANGE_CELLS} cells
     */
    public static List<List<String>> grid(int startCol, int startRow, int endCol, int endRow) {
        long rowCount = (long) endRow - startRow + 1;
        long colCount = (long) endCol - startCol + 1;
        if (Math.multiplyExact(rowCount, colCount) > MAX_RANGE_CELLS) {
            throw new FormulaParseException("Invalid range: " + CellReferences.cellId(startCol, startRow) + ":"
                    + CellReferences.cellId(endCol, endRow) + " has more than " + MAX_RANGE_CELLS + " cells");
        }
        List<List<String>> rows = new ArrayList<>((int) rowCount);
        // Iterate by offset; endRow may be Integer.MAX_VALUE
        for (int r = 0; r < rowCount; r++) {
            List<String> cells = new ArrayList<>((int) colCount);
            for (int c = 0; c < colCount; c++) {
                cells.add(CellReferences.cellId(startCol + c, startRow + r));
            }
            rows.add(cells);
        }
        return rows;
    }
}

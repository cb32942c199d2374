package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.exceptions.FormulaParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for range expansion and column letter conversion.
 */
class RangeExpanderTest {

    @Test
    void testExpandRectangle() {
        assertEquals(List.of(List.of("A1", "B1", "C1"), List.of("A2", "B2", "C2")),
                RangeExpander.expand("A1:C2"));
    }

    @Test
    void testExpandColumnAndSingleCell() {
        assertEquals(List.of(List.of("A1"), List.of("A2"), List.of("A3")), RangeExpander.expand("A1:A3"));
        assertEquals(List.of(List.of("B7")), RangeExpander.expand("B7"));
        assertEquals(List.of(List.of("B7")), RangeExpander.expand("B7:B7"));
    }

    @Test
    void testExpandAcrossZ() {
        assertEquals(List.of(List.of("Y1", "Z1", "AA1", "AB1")), RangeExpander.expand("Y1:AB1"));
    }

    @Test
    void testReversedRange() {
        FormulaParseException ex = assertThrows(FormulaParseException.class, () -> RangeExpander.expand("B1:A1"));
        assertEquals("Invalid range: start must be before end in B1:A1", ex.getMessage());
        assertThrows(FormulaParseException.class, () -> RangeExpander.expand("A2:A1"));
    }

    @Test
    void testMalformedEndpoints() {
        FormulaParseException start = assertThrows(FormulaParseException.class, () -> RangeExpander.expand("1A:B2"));
        assertEquals("Invalid range start: 1A", start.getMessage());
        FormulaParseException end = assertThrows(FormulaParseException.class, () -> RangeExpander.expand("A1:B"));
        assertEquals("Invalid range end: B", end.getMessage());
    }

    @Test
    void testRowZeroEndpointsRejected() {
        FormulaParseException start = assertThrows(FormulaParseException.class, () -> RangeExpander.expand("A0:A3"));
        assertEquals("Invalid range start: A0", start.getMessage());
        FormulaParseException end = assertThrows(FormulaParseException.class, () -> RangeExpander.expand("A1:B0"));
        assertEquals("Invalid range end: B0", end.getMessage());
    }

    @Test
    void testOversizedRangeRejected() {
        FormulaParseException ex = assertThrows(FormulaParseException.class,
                () -> RangeExpander.expand("A1:A2147483647"));
        assertEquals("Invalid range: A1:A2147483647 has more than 100000 cells", ex.getMessage());
        assertThrows(FormulaParseException.class, () -> RangeExpander.expand("A1:ZZ1000"));
        assertEquals(100_000, RangeExpander.expand("A1:A100000").size());
        assertEquals(List.of(List.of("A2147483647")), RangeExpander.expand("A2147483647:A2147483647"));
    }

    @ParameterizedTest
    @CsvSource({
            "A, 1",
            "Z, 26",
            "AA, 27",
            "AZ, 52",
            "ZZ, 702",
            "AAA, 703",
            "ZZZ, 18278"
    })
    void testColumnConversion(String letters, int number) {
        assertEquals(number, CellReferences.columnToNumber(letters));
        assertEquals(letters, CellReferences.numberToColumn(number));
    }

    /**
     * Every column from A through ZZZ survives letters -> number -> letters.
     */
    @Test
    void testColumnConversionRoundTrip() {
        for (int n = 1; n <= 18278; n++) {
            String letters = CellReferences.numberToColumn(n);
            assertEquals(n, CellReferences.columnToNumber(letters), letters);
        }
    }

    @Test
    void testInvalidColumns() {
        assertThrows(IllegalArgumentException.class, () -> CellReferences.numberToColumn(0));
        assertThrows(IllegalArgumentException.class, () -> CellReferences.columnToNumber(""));
        assertThrows(IllegalArgumentException.class, () -> CellReferences.columnToNumber("a"));
    }

    @Test
    void testCellIdParts() {
        assertEquals(28, CellReferences.columnOf("AB12"));
        assertEquals(12, CellReferences.rowOf("AB12"));
        assertEquals("AB12", CellReferences.cellId(28, 12));
        assertThrows(FormulaParseException.class, () -> CellReferences.rowOf("A"));
    }
}

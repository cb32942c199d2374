package com.spreadsheet.formula.translator;

import com.spreadsheet.formula.models.Axis;
import com.spreadsheet.formula.models.CellPosition;
import com.spreadsheet.formula.parser.FormulaParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for rewriting references on copy, insert and delete.
 */
class ReferenceTranslatorTest {

    @Test
    void testCopyShiftsRelativeReferences() {
        assertEquals("=B2+C3", ReferenceTranslator.translateForCopy("=A1+B2",
                new CellPosition(0, 0), new CellPosition(1, 1)));
        assertEquals("=SUM(B2:C3)", ReferenceTranslator.translate("=SUM(A1:B2)", 1, 1));
    }

    /**
     * A reference that would move off the sheet keeps its original position.
     */
    @Test
    void testShiftOffSheetKeepsReference() {
        assertEquals("=A1+A1", ReferenceTranslator.translate("=A1+B2", -1, -1));
        assertEquals("=A5", ReferenceTranslator.translate("=B5", 0, -1));
    }

    @Test
    void testNonFormulaAndUnparsableTextUnchanged() {
        assertEquals("hello A1", ReferenceTranslator.translate("hello A1", 1, 1));
        assertEquals("=1+", ReferenceTranslator.translate("=1+", 1, 1));
        assertEquals("", ReferenceTranslator.translate("", 1, 1));
        assertNull(ReferenceTranslator.translate(null, 1, 1));
    }

    @Test
    void testOversizedRangesAreLeftAlone() {
        assertEquals("=SUM(A0:A2147483647)", ReferenceTranslator.translate("=SUM(A0:A2147483647)", 1, 0));
        assertEquals("=SUM(A1:A100000000)", ReferenceTranslator.translate("=SUM(A1:A100000000)", 0, 1));
        assertEquals("=SUM(A1:A100000000)",
                ReferenceTranslator.translateForInsert("=SUM(A1:A100000000)", Axis.ROW, 0));
        assertEquals("=SUM(A1:A100000000)",
                ReferenceTranslator.translateForDelete("=SUM(A1:A100000000)", Axis.COLUMN, 3));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "=A1",
            "=A1 + B2 * 3",
            "=SUM(B2:D5) / COUNT(B2:D5)",
            "=IF(C3 >= 10, \"A1 stays text\", -(D4 - E5))",
            "=CONCATENATE(\"x\", LEFT(F6, 2), VLOOKUP(G7, H1:J9, 2))",
            "=NOW()"
    })
    void testZeroOffsetIsIdentity(String formula) {
        assertSame(formula, ReferenceTranslator.translate(formula, 0, 0));
    }

    /**
     * Shifting by (r, c) and back by (-r, -c) restores every reference.
     */
    @ParameterizedTest
    @ValueSource(strings = {
            "=A1",
            "=A1 + B2 * 3",
            "=SUM(B2:D5) / COUNT(B2:D5)",
            "=IF(C3 >= 10, \"A1 stays text\", -(D4 - E5))",
            "=CONCATENATE(\"x\", LEFT(F6, 2), VLOOKUP(G7, H1:J9, 2))",
            "=NOW()"
    })
    void testShiftThereAndBackRestoresFormula(String formula) {
        String canonical = "=" + FormulaSerializer.serialize(FormulaParser.parse(formula.substring(1)));
        int[][] offsets = {{1, 0}, {0, 1}, {3, 2}, {25, 7}};
        for (int[] offset : offsets) {
            String shifted = ReferenceTranslator.translate(formula, offset[0], offset[1]);
            assertEquals(canonical, ReferenceTranslator.translate(shifted, -offset[0], -offset[1]), shifted);
        }
    }

    @Test
    void testInsertColumn() {
        assertEquals("=B1", ReferenceTranslator.translateForInsert("=A1", Axis.COLUMN, 0));
        assertEquals("=A1+C1", ReferenceTranslator.translateForInsert("=A1+B1", Axis.COLUMN, 1));
    }

    @Test
    void testInsertRow() {
        assertEquals("=A1+A3+A4", ReferenceTranslator.translateForInsert("=A1+A2+A3", Axis.ROW, 1));
        assertEquals("=SUM(A1:A4)", ReferenceTranslator.translateForInsert("=SUM(A1:A3)", Axis.ROW, 1));
    }

    @Test
    void testDeleteColumnProducesRef() {
        assertEquals("=#REF!+A1", ReferenceTranslator.translateForDelete("=A1+B1", Axis.COLUMN, 0));
    }

    @Test
    void testDeleteRowShrinksRange() {
        assertEquals("=SUM(A1:A2)", ReferenceTranslator.translateForDelete("=SUM(A1:A3)", Axis.ROW, 1));
        assertEquals("=SUM(#REF!)", ReferenceTranslator.translateForDelete("=SUM(A2:A3)", Axis.ROW, 1));
        assertEquals("=A1*2", ReferenceTranslator.translateForDelete("=A1*2", Axis.ROW, 4));
    }

    @Test
    void testExistingRefMarkerSurvives() {
        assertEquals("=#REF!+B1", ReferenceTranslator.translate("=#REF!+A1", 0, 1));
    }

    @Test
    void testFunctionsAndStringsArePreserved() {
        assertEquals("=IF(B1>1, \"A1\", C1)", ReferenceTranslator.translate("=IF(A1 > 1, \"A1\", B1)", 0, 1));
    }
}

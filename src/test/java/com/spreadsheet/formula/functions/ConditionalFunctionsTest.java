package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluator.FormulaEvaluator;
import com.spreadsheet.formula.models.EvalResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * COUNTIF, SUMIF and SUMIFS over a small table:
 * <pre>
 *      A        B    C
 * 1    apple    1    10
 * 2    pear     2    20
 * 3    Apple    3    30
 * 4    plum     4    40
 * </pre>
 */
class ConditionalFunctionsTest {

    private Map<String, EvalResult> cells;
    private FormulaEvaluator evaluator;

    @BeforeEach
    void setUp() {
        cells = new HashMap<>();
        evaluator = new FormulaEvaluator(cells::get, FunctionRegistry.createDefault());
        String[] fruit = {"apple", "pear", "Apple", "plum"};
        for (int row = 1; row <= 4; row++) {
            cells.put("A" + row, EvalResult.of(fruit[row - 1]));
            cells.put("B" + row, EvalResult.of((double) row));
            cells.put("C" + row, EvalResult.of(row * 10.0));
        }
    }

    @Test
    void testCountIfComparison() {
        assertEquals(EvalResult.of(2.0), evaluator.calculate("COUNTIF(B1:B4, \">2\")"));
        assertEquals(EvalResult.of(3.0), evaluator.calculate("COUNTIF(B1:B4, \"<>2\")"));
        assertEquals(EvalResult.of(2.0), evaluator.calculate("COUNTIF(B1:B4, \"<=2\")"));
    }

    @Test
    void testCountIfExactMatch() {
        assertEquals(EvalResult.of(2.0), evaluator.calculate("COUNTIF(A1:A4, \"APPLE\")"));
        assertEquals(EvalResult.of(1.0), evaluator.calculate("COUNTIF(B1:B4, 3)"));
        assertEquals(EvalResult.of(0.0), evaluator.calculate("COUNTIF(A1:A4, \"kiwi\")"));
    }

    @Test
    void testCountIfInvalidComparison() {
        assertEquals(EvalResult.error("COUNTIF: invalid comparison value: abc"),
                evaluator.calculate("COUNTIF(B1:B4, \">abc\")"));
    }

    @Test
    void testCountIfRequiresRange() {
        assertEquals(EvalResult.error("COUNTIF: first argument must be a range"),
                evaluator.calculate("COUNTIF(5, \">2\")"));
    }

    @Test
    void testSumIf() {
        assertEquals(EvalResult.of(70.0), evaluator.calculate("SUMIF(B1:B4, \">2\", C1:C4)"));
        assertEquals(EvalResult.of(7.0), evaluator.calculate("SUMIF(B1:B4, \">2\")"));
        assertEquals(EvalResult.of(40.0), evaluator.calculate("SUMIF(A1:A4, \"apple\", C1:C4)"));
    }

    @Test
    void testSumIfSizeMismatch() {
        assertEquals(EvalResult.error("SUMIF: range and sum_range must be the same size"),
                evaluator.calculate("SUMIF(B1:B4, \">2\", C1:C3)"));
    }

    @Test
    void testSumIfs() {
        assertEquals(EvalResult.of(30.0), evaluator.calculate("SUMIFS(C1:C4, A1:A4, \"apple\", B1:B4, \">1\")"));
        assertEquals(EvalResult.of(40.0), evaluator.calculate("SUMIFS(C1:C4, A1:A4, \"apple\")"));
    }

    @Test
    void testSumIfsArgumentErrors() {
        assertEquals(EvalResult.error("SUMIFS: requires at least 3 arguments"),
                evaluator.calculate("SUMIFS(C1:C4, A1:A4)"));
        assertEquals(EvalResult.error("SUMIFS: requires sum_range and at least one criteria_range/criteria pair"
                        + " (odd number of arguments)"),
                evaluator.calculate("SUMIFS(C1:C4, A1:A4, \"apple\", B1:B4)"));
        assertEquals(EvalResult.error("SUMIFS: all ranges must be the same size"),
                evaluator.calculate("SUMIFS(C1:C4, A1:A3, \"apple\")"));
    }
}

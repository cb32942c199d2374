package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluator.FormulaEvaluator;
import com.spreadsheet.formula.models.EvalResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Aggregates and arithmetic functions, evaluated through formulas.
 */
class MathFunctionsTest {

    private Map<String, EvalResult> cells;
    private FormulaEvaluator evaluator;

    @BeforeEach
    void setUp() {
        cells = new HashMap<>();
        evaluator = new FormulaEvaluator(cells::get, FunctionRegistry.createDefault());
        // A1..A4 = 1, "x", (empty), 4
        cells.put("A1", EvalResult.of(1.0));
        cells.put("A2", EvalResult.of("x"));
        cells.put("A4", EvalResult.of(4.0));
    }

    @Test
    void testSumSkipsTextAndHoles() {
        assertEquals(EvalResult.of(5.0), evaluator.calculate("SUM(A1:A4)"));
        assertEquals(EvalResult.of(15.0), evaluator.calculate("SUM(A1:A4, 10)"));
    }

    @Test
    void testAverage() {
        assertEquals(EvalResult.of(2.5), evaluator.calculate("AVERAGE(A1:A4)"));
        assertEquals(EvalResult.of(3.0), evaluator.calculate("AVG(2, 4)"));
        assertEquals(EvalResult.error("Division by zero"), evaluator.calculate("AVERAGE(\"x\")"));
    }

    @Test
    void testMinMax() {
        assertEquals(EvalResult.of(1.0), evaluator.calculate("MIN(A1:A4)"));
        assertEquals(EvalResult.of(4.0), evaluator.calculate("MAX(A1:A4)"));
        assertEquals(EvalResult.of(-2.0), evaluator.calculate("MIN(3, -2, 7)"));
        // Nothing numeric: zero, not infinity
        assertEquals(EvalResult.of(0.0), evaluator.calculate("MAX(B1:B3)"));
    }

    @Test
    void testCountCountsNumbersAndNumericText() {
        assertEquals(EvalResult.of(2.0), evaluator.calculate("COUNT(A1:A4)"));
        assertEquals(EvalResult.of(2.0), evaluator.calculate("COUNT(1, \"2\", \"x\")"));
    }

    @Test
    void testBinaryFunctions() {
        assertEquals(EvalResult.of(5.0), evaluator.calculate("ADD(2, 3)"));
        assertEquals(EvalResult.of(-1.0), evaluator.calculate("SUB(2, 3)"));
        assertEquals(EvalResult.of(6.0), evaluator.calculate("MULTIPLY(2, 3)"));
        assertEquals(EvalResult.of(2.5), evaluator.calculate("DIV(5, 2)"));
        assertEquals(EvalResult.error("Division by zero"), evaluator.calculate("DIVIDE(1, 0)"));
    }

    @Test
    void testBinaryFunctionRejectsRange() {
        assertEquals(EvalResult.error("ADD: first argument must be a single value, not a range"),
                evaluator.calculate("ADD(A1:A4, 1)"));
    }

    @Test
    void testSumRequiresArguments() {
        assertEquals(EvalResult.error("SUM: requires at least one argument"), evaluator.calculate("SUM()"));
    }
}

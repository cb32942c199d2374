package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluator.FormulaEvaluator;
import com.spreadsheet.formula.models.EvalResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Text functions and IF, evaluated through formulas.
 */
class TextFunctionsTest {

    private Map<String, EvalResult> cells;
    private FormulaEvaluator evaluator;

    @BeforeEach
    void setUp() {
        cells = new HashMap<>();
        evaluator = new FormulaEvaluator(cells::get, FunctionRegistry.createDefault());
    }

    @Test
    void testConcatenateFlattensAndFormatsNumbers() {
        cells.put("A1", EvalResult.of("x"));
        cells.put("B1", EvalResult.of(2.0));
        assertEquals(EvalResult.of("a1x2"), evaluator.calculate("CONCATENATE(\"a\", 1, A1:B1)"));
        assertEquals(EvalResult.of("1.5-"), evaluator.calculate("CONCAT(1.5, \"-\")"));
    }

    @Test
    void testLeftAndRight() {
        assertEquals(EvalResult.of("he"), evaluator.calculate("LEFT(\"hello\", 2)"));
        assertEquals(EvalResult.of("llo"), evaluator.calculate("RIGHT(\"hello\", 3)"));
        assertEquals(EvalResult.of("hello"), evaluator.calculate("RIGHT(\"hello\", 10)"));
        assertEquals(EvalResult.of(""), evaluator.calculate("LEFT(\"hello\", -1)"));
        assertEquals(EvalResult.of("he"), evaluator.calculate("LEFT(\"hello\", 2.9)"));
    }

    @Test
    void testTrimUpperLower() {
        assertEquals(EvalResult.of("hi there"), evaluator.calculate("TRIM(\"  hi there  \")"));
        assertEquals(EvalResult.of("ABC"), evaluator.calculate("UPPER(\"abc\")"));
        assertEquals(EvalResult.of("abc"), evaluator.calculate("LOWER(\"ABC\")"));
        assertEquals(EvalResult.of("12"), evaluator.calculate("UPPER(12)"));
    }

    @Test
    void testTextFunctionOnEmptyCell() {
        cells.put("A1", EvalResult.of("x"));
        assertEquals(EvalResult.error("UPPER: text is empty"), evaluator.calculate("UPPER(B1:B1)"));
    }

    /**
     * Only the chosen branch must be a single value.
     */
    @Test
    void testIfEvaluatesChosenBranch() {
        cells.put("A1", EvalResult.of(1.0));
        assertEquals(EvalResult.of(1.0), evaluator.calculate("IF(1, A1, A1:B2)"));
        assertEquals(EvalResult.error("IF: value_if_true must be a single value, not a range"),
                evaluator.calculate("IF(1, A1:B2, 0)"));
        assertEquals(EvalResult.error("IF: condition must be a single value, not a range"),
                evaluator.calculate("IF(A1:B2, 1, 0)"));
    }

    @Test
    void testIfTextConditions() {
        assertEquals(EvalResult.of("t"), evaluator.calculate("IF(\"TRUE\", \"t\", \"f\")"));
        assertEquals(EvalResult.of("f"), evaluator.calculate("IF(\"false\", \"t\", \"f\")"));
        assertEquals(EvalResult.of("f"), evaluator.calculate("IF(\"\", \"t\", \"f\")"));
    }
}

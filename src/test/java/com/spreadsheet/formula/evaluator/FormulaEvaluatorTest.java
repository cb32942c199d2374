package com.spreadsheet.formula.evaluator;

import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.EvalResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for evaluating formulas against a fixed set of cell results.
 */
class FormulaEvaluatorTest {

    private Map<String, EvalResult> results;
    private FormulaEvaluator evaluator;

    @BeforeEach
    void setUp() {
        results = new HashMap<>();
        evaluator = new FormulaEvaluator(results::get, FunctionRegistry.createDefault());
    }

    @Test
    void testOperatorPrecedence() {
        assertEquals(EvalResult.of(11.0), evaluator.calculate("5 + 3 * 2"));
        assertEquals(EvalResult.of(16.0), evaluator.calculate("(5 + 3) * 2"));
        assertEquals(EvalResult.of(3.0), evaluator.calculate("10 - 4 - 3"));
        assertEquals(EvalResult.of(-6.0), evaluator.calculate("-3 * 2"));
    }

    @Test
    void testDivisionByZero() {
        assertEquals(EvalResult.error("Division by zero"), evaluator.calculate("10 / 0"));
    }

    @Test
    void testSumOfCellsAndLiteral() {
        results.put("A1", EvalResult.of(10.0));
        results.put("A2", EvalResult.of(5.0));
        assertEquals(EvalResult.of(20.0), evaluator.calculate("SUM(A1, A2, 5)"));
    }

    @Test
    void testIfWithFalsyCondition() {
        assertEquals(EvalResult.of("no"), evaluator.calculate("IF(5 - 5, \"yes\", \"no\")"));
        assertEquals(EvalResult.of("yes"), evaluator.calculate("IF(2 > 1, \"yes\", \"no\")"));
    }

    @Test
    void testMissingCell() {
        assertEquals(EvalResult.error("Cell A1 has no value"), evaluator.calculate("A1 + 5"));
    }

    @Test
    void testEmptyCellHasNoValue() {
        results.put("A1", EvalResult.empty());
        assertEquals(EvalResult.error("Cell A1 has no value"), evaluator.calculate("A1"));
    }

    @Test
    void testErrorInReferencedCell() {
        results.put("A1", EvalResult.error("Division by zero"));
        assertEquals(EvalResult.error("Cell A1 has error: Division by zero"), evaluator.calculate("A1 + 1"));
    }

    @Test
    void testInvalidReferenceMarker() {
        assertEquals(EvalResult.error("Cell #REF! is an invalid reference"), evaluator.calculate("#REF! + 1"));
    }

    @Test
    void testCellTextValue() {
        results.put("A1", EvalResult.of("hello"));
        assertEquals(EvalResult.of("hello"), evaluator.calculate("A1"));
    }

    /**
     * Text converts through its leading number; text without one is an error.
     */
    @Test
    void testTextToNumberConversion() {
        assertEquals(EvalResult.of(24.0), evaluator.calculate("\"12kg\" * 2"));
        assertEquals(EvalResult.error("Cannot convert 'abc' to number"), evaluator.calculate("\"abc\" + 1"));
    }

    @Test
    void testComparisonsYieldOneOrZero() {
        assertEquals(EvalResult.of(1.0), evaluator.calculate("1 < 2"));
        assertEquals(EvalResult.of(0.0), evaluator.calculate("2 <= 1"));
        assertEquals(EvalResult.of(1.0), evaluator.calculate("\"a\" = \"a\""));
        assertEquals(EvalResult.of(1.0), evaluator.calculate("3 <> 4"));
        // Equality never crosses types
        assertEquals(EvalResult.of(0.0), evaluator.calculate("1 = \"1\""));
    }

    @Test
    void testRangeInArithmeticIsAnError() {
        results.put("A1", EvalResult.of(1.0));
        results.put("B2", EvalResult.of(2.0));
        assertEquals(EvalResult.error("Ranges cannot be used directly in expressions or comparisons"),
                evaluator.calculate("A1:B2 + 1"));
    }

    @Test
    void testSingleCellRangeCollapses() {
        results.put("A1", EvalResult.of(4.0));
        assertEquals(EvalResult.of(8.0), evaluator.calculate("A1:A1 * 2"));
    }

    /**
     * A finished formula always carries a value or an error, never neither.
     */
    @Test
    void testEmptySingleCellRangeAtTopLevel() {
        EvalResult result = evaluator.calculate("B1:B1");
        assertEquals(EvalResult.error("Cell B1 has no value"), result);
        assertNull(result.getValue());
        assertNotNull(result.getError());
    }

    /**
     * Unknown names fail before arguments are evaluated, so the name error wins.
     */
    @Test
    void testUnknownFunction() {
        assertEquals(EvalResult.error("Unknown function: FOO"), evaluator.calculate("FOO(1)"));
        assertEquals(EvalResult.error("Unknown function: FOO"), evaluator.calculate("FOO(1 / 0)"));
    }

    @Test
    void testParseErrorBecomesResult() {
        assertEquals(EvalResult.error("Unexpected end of input"), evaluator.calculate(""));
        assertTrue(evaluator.calculate("1 +").hasError());
    }

    @Test
    void testRangesReachFunctionsWithHoles() {
        results.put("A1", EvalResult.of(1.0));
        results.put("A3", EvalResult.of(3.0));
        results.put("A4", EvalResult.error("boom"));
        assertEquals(EvalResult.of(4.0), evaluator.calculate("SUM(A1:A4)"));
        assertEquals(EvalResult.of(2.0), evaluator.calculate("COUNT(A1:A4)"));
    }
}

package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.Axis;
import com.spreadsheet.formula.models.CellPosition;
import com.spreadsheet.formula.models.EvalResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the orchestrator, with plain maps standing in for the host's storage.
 */
class EvalEngineTest {

    private Map<String, String> contents;
    private Map<String, EvalResult> results;
    private List<String> evaluated;
    private EvalEngine engine;

    @BeforeEach
    void setUp() {
        contents = new HashMap<>();
        results = new HashMap<>();
        evaluated = new ArrayList<>();
        engine = new EvalEngine(contents::get, results::get, (cellId, result) -> {
            evaluated.add(cellId);
            results.put(cellId, result);
        }, FunctionRegistry.createDefault());
    }

    private void set(String cellId, String content) {
        contents.put(cellId, content);
        engine.onCellChanged(cellId);
    }

    @Test
    void testLiteralContent() {
        set("A1", "42");
        set("A2", " 3.5 ");
        set("A3", "hello");
        set("A4", "12kg");
        assertEquals(EvalResult.of(42.0), results.get("A1"));
        assertEquals(EvalResult.of(3.5), results.get("A2"));
        assertEquals(EvalResult.of("hello"), results.get("A3"));
        assertEquals(EvalResult.of("12kg"), results.get("A4"));
    }

    /**
     * Ranges too large to expand become error results instead of escaping.
     */
    @Test
    void testOversizedRangesAreErrorResults() {
        set("B1", "=SUM(A0:A2147483647)");
        assertEquals(EvalResult.error("Invalid range start: A0"), results.get("B1"));

        set("B2", "=SUM(A1:A100000000)");
        assertEquals(EvalResult.error("Invalid range: A1:A100000000 has more than 100000 cells"),
                results.get("B2"));

        // The formula still tracks the range endpoints it names
        set("A1", "5");
        assertTrue(engine.getDependencyGraph().getDependents("A1").contains("B2"));
        assertTrue(results.get("B2").hasError());
    }

    @Test
    void testChangePropagatesToDependents() {
        set("A1", "5");
        set("B1", "=A1 * 2");
        set("C1", "=B1 + A1");
        assertEquals(EvalResult.of(15.0), results.get("C1"));

        set("A1", "7");
        assertEquals(EvalResult.of(14.0), results.get("B1"));
        assertEquals(EvalResult.of(21.0), results.get("C1"));
    }

    /**
     * Diamond A1 -> (B1, C1) -> D1: one change evaluates each affected cell once.
     */
    @Test
    void testEachAffectedCellEvaluatedOnce() {
        set("A1", "1");
        set("B1", "=A1 + 1");
        set("C1", "=A1 + 2");
        set("D1", "=B1 + C1");
        evaluated.clear();

        set("A1", "10");
        assertEquals(4, evaluated.size());
        assertEquals("A1", evaluated.get(0));
        assertEquals("D1", evaluated.get(3));
        assertEquals(EvalResult.of(23.0), results.get("D1"));
    }

    @Test
    void testErrorsPropagate() {
        set("A1", "=1 / 0");
        set("B1", "=A1 + 1");
        assertEquals(EvalResult.error("Division by zero"), results.get("A1"));
        assertEquals(EvalResult.error("Cell A1 has error: Division by zero"), results.get("B1"));

        set("A1", "2");
        assertEquals(EvalResult.of(3.0), results.get("B1"));
    }

    @Test
    void testEmptyCellHasNoValue() {
        set("A1", "");
        set("B1", "=A1");
        assertEquals(EvalResult.empty(), results.get("A1"));
        assertEquals(EvalResult.error("Cell A1 has no value"), results.get("B1"));
    }

    @Test
    void testSelfReference() {
        set("A1", "=A1 + 1");
        assertEquals(EvalResult.error("Circular dependency: A1 -> A1"), results.get("A1"));
        assertTrue(engine.getCircularCells().contains("A1"));
    }

    @Test
    void testTwoCellCycle() {
        set("A1", "=B1");
        assertEquals(EvalResult.error("Cell B1 has no value"), results.get("A1"));

        set("B1", "=A1");
        assertEquals(EvalResult.error("Circular dependency: B1 -> A1 -> B1"), results.get("B1"));
        assertEquals(EvalResult.error("Cell B1 has error: Circular dependency: B1 -> A1 -> B1"), results.get("A1"));

        // Breaking the cycle at the rejected cell
        set("B1", "3");
        assertEquals(EvalResult.of(3.0), results.get("B1"));
        assertEquals(EvalResult.of(3.0), results.get("A1"));
        assertTrue(engine.getCircularCells().isEmpty());
    }

    /**
     * A rejected cell recovers by itself once another edit breaks the loop.
     */
    @Test
    void testCycleBrokenElsewhere() {
        set("A1", "=B1");
        set("B1", "=A1 * 2");
        assertTrue(results.get("B1").hasError());

        set("A1", "4");
        assertEquals(EvalResult.of(4.0), results.get("A1"));
        assertEquals(EvalResult.of(8.0), results.get("B1"));
        assertEquals(List.of("B1"), List.copyOf(engine.getDependencyGraph().getDependents("A1")));
    }

    @Test
    void testRangesTrackEveryMember() {
        set("A1", "1");
        set("A2", "2");
        set("B1", "=SUM(A1:A3)");
        assertEquals(EvalResult.of(3.0), results.get("B1"));

        set("A3", "10");
        assertEquals(EvalResult.of(13.0), results.get("B1"));
    }

    @Test
    void testCalculate() {
        set("A1", "2");
        assertEquals(EvalResult.of(6.0), engine.calculate("=A1 * 3"));
        assertEquals(EvalResult.of(6.0), engine.calculate("A1 * 3"));
        assertEquals(EvalResult.error("Cell Z9 has no value"), engine.calculate("Z9"));
        // Nothing is committed by calculate
        assertFalse(results.containsKey("Z9"));
    }

    @Test
    void testRecalculateAll() {
        contents.put("A1", "2");
        contents.put("B1", "=A1 + 1");
        contents.put("C1", "=B1 * 2");
        contents.put("D1", "=D1");
        engine.recalculateAll(List.of("C1", "B1", "A1", "D1"));

        assertEquals(EvalResult.of(6.0), results.get("C1"));
        assertEquals(EvalResult.error("Circular dependency: D1 -> D1"), results.get("D1"));
        assertEquals(List.of("A1"), List.copyOf(engine.getDependencyGraph().getDependencies("B1")));
    }

    @Test
    void testTranslationDelegates() {
        assertEquals("=B2", engine.translateForCopy("=A1", new CellPosition(0, 0), new CellPosition(1, 1)));
        assertEquals("=A2", engine.translateForInsert("=A1", Axis.ROW, 0));
        assertEquals("=#REF!", engine.translateForDelete("=A1", Axis.ROW, 0));
        assertFalse(engine.listFunctions().isEmpty());
    }
}

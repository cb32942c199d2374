package com.spreadsheet.formula.models;

import com.spreadsheet.formula.engine.EvalEngine;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.parser.CellReferences;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire spreadsheet:
 * - Has a unique ID
 * - A map of cellId ("B3") -> Cell
 * - Its own evaluation engine, which owns the dependency graph
 * - A read/write lock for concurrency
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final Map<String, Cell> cells = new ConcurrentHashMap<>();
    private final EvalEngine engine;

    // Lock to prevent race conditions when multiple threads update the same Sheet
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(FunctionRegistry functionRegistry) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.engine = new EvalEngine(this::getCellContent, this::getCellResult, this::setCellResult, functionRegistry);
    }

    public long getId() {
        return id;
    }

    public Map<String, Cell> getCells() {
        return cells;
    }

    public EvalEngine getEngine() {
        return engine;
    }

    /**
     * Content of the cell, or null if it was never set.
     */
    public String getCellContent(String cellId) {
        Cell cell = cells.get(cellId);
        return cell == null ? null : cell.getContent();
    }

    /**
     * Last committed result, or null if the cell doesn't exist or was never evaluated.
     */
    public EvalResult getCellResult(String cellId) {
        Cell cell = cells.get(cellId);
        return cell == null ? null : cell.getResult();
    }

    public void setCellContent(String cellId, String content) {
        cells.computeIfAbsent(cellId, Sheet::newCell).setContent(content);
    }

    public void setCellResult(String cellId, EvalResult result) {
        cells.computeIfAbsent(cellId, Sheet::newCell).setResult(result);
    }

    public void removeCell(String cellId) {
        cells.remove(cellId);
    }

    /**
     * Swaps in a whole new set of cells, as after inserting or deleting a row or column.
     */
    public void replaceCells(Map<String, Cell> newCells) {
        cells.clear();
        cells.putAll(newCells);
    }

    // Basic getters for the adjacency maps
    public Map<String, Set<String>> getForwardGraph() {
        return engine.getDependencyGraph().getForwardGraph();
    }

    public Map<String, Set<String>> getReverseGraph() {
        return engine.getDependencyGraph().getReverseGraph();
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }

    static Cell newCell(String cellId) {
        return new Cell(CellReferences.numberToColumn(CellReferences.columnOf(cellId)),
                CellReferences.rowOf(cellId), "");
    }
}

package com.spreadsheet.formula.services;

import com.spreadsheet.formula.config.SheetProperties;
import com.spreadsheet.formula.engine.EvalEngine;
import com.spreadsheet.formula.exceptions.FormulaParseException;
import com.spreadsheet.formula.exceptions.InvalidCellReferenceException;
import com.spreadsheet.formula.exceptions.SheetNotFoundException;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.Axis;
import com.spreadsheet.formula.models.Cell;
import com.spreadsheet.formula.models.CellPosition;
import com.spreadsheet.formula.models.EvalResult;
import com.spreadsheet.formula.models.FunctionInfo;
import com.spreadsheet.formula.models.Sheet;
import com.spreadsheet.formula.parser.CellReferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main business logic for creating sheets, setting cell contents,
 * copying and filling formulas, and inserting or deleting rows and columns.
 * Every mutation of a sheet runs under its write lock; reads take the read lock.
 */
@Service
public class SheetService {

    private static final Logger log = LoggerFactory.getLogger(SheetService.class);

    // Row-major order for listings: A1, B1, ..., A2, B2, ...
    private static final Comparator<CellPosition> ROW_MAJOR =
            Comparator.comparingInt(CellPosition::getRow).thenComparingInt(CellPosition::getCol);

    // All sheets live here in memory; no persistent DB
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final FunctionRegistry functionRegistry;
    private final SheetProperties properties;

    public SheetService(FunctionRegistry functionRegistry, SheetProperties properties) {
        this.functionRegistry = functionRegistry;
        this.properties = properties;
    }

    /**
     * Creates a new empty Sheet and returns its ID.
     */
    public long createSheet() {
        Sheet sheet = new Sheet(functionRegistry);
        sheets.put(sheet.getId(), sheet);
        log.info("Created sheet {}", sheet.getId());
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException(sheetId);
        }
        return sheet;
    }

    /**
     * Sets a cell's content (literal or "=formula") and recomputes everything that
     * depends on it. Empty content clears the cell. Returns the cell's new result.
     */
    public EvalResult setCellContent(long sheetId, String cellId, String content) {
        Sheet sheet = getSheet(sheetId);
        String id = normalizeCellId(cellId);

        sheet.getLock().writeLock().lock();
        try {
            return applyContent(sheet, id, content == null ? "" : content);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    public EvalResult getCellResult(long sheetId, String cellId) {
        Sheet sheet = getSheet(sheetId);
        String id = normalizeCellId(cellId);

        sheet.getLock().readLock().lock();
        try {
            EvalResult result = sheet.getCellResult(id);
            return result == null ? EvalResult.empty() : result;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Returns cellId -> result for every non-empty cell, in row-major order.
     * No evaluation happens here; results were computed when contents changed.
     */
    public Map<String, EvalResult> getSheetData(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            List<CellPosition> positions = new ArrayList<>();
            for (String cellId : sheet.getCells().keySet()) {
                positions.add(CellPosition.fromCellId(cellId));
            }
            positions.sort(ROW_MAJOR);

            Map<String, EvalResult> data = new LinkedHashMap<>();
            for (CellPosition position : positions) {
                String cellId = position.toCellId();
                EvalResult result = sheet.getCellResult(cellId);
                data.put(cellId, result == null ? EvalResult.empty() : result);
            }
            return data;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Evaluates a formula against the sheet without storing it anywhere.
     */
    public EvalResult calculate(long sheetId, String formula) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            return sheet.getEngine().calculate(formula);
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Copies the content of {@code from} into {@code to}, shifting relative references
     * by the distance between them.
     */
    public EvalResult copyCell(long sheetId, String from, String to) {
        Sheet sheet = getSheet(sheetId);
        String source = normalizeCellId(from);
        String target = normalizeCellId(to);

        sheet.getLock().writeLock().lock();
        try {
            String content = sheet.getCellContent(source);
            String translated = sheet.getEngine().translateForCopy(content == null ? "" : content,
                    CellPosition.fromCellId(source), CellPosition.fromCellId(target));
            log.debug("Copy {} -> {}: {}", source, target, translated);
            return applyContent(sheet, target, translated);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Fills the cells between {@code from} and {@code to} with the content of {@code from},
     * like dragging a fill handle. Works along a single row or column; a diagonal
     * span fills nothing. Returns the IDs of the filled cells.
     */
    public List<String> fillRange(long sheetId, String from, String to) {
        Sheet sheet = getSheet(sheetId);
        String source = normalizeCellId(from);
        CellPosition start = CellPosition.fromCellId(source);
        CellPosition end = CellPosition.fromCellId(normalizeCellId(to));

        List<String> filled = new ArrayList<>();
        if (start.getRow() != end.getRow() && start.getCol() != end.getCol()) {
            log.debug("Ignoring diagonal fill {} -> {}", source, end.toCellId());
            return filled;
        }

        sheet.getLock().writeLock().lock();
        try {
            String content = sheet.getCellContent(source);
            String sourceContent = content == null ? "" : content;
            boolean horizontal = start.getRow() == end.getRow();
            int from0 = horizontal ? start.getCol() : start.getRow();
            int to0 = horizontal ? end.getCol() : end.getRow();

            for (int i = Math.min(from0, to0); i <= Math.max(from0, to0); i++) {
                if (i == from0) {
                    continue;
                }
                CellPosition target = horizontal
                        ? new CellPosition(start.getRow(), i)
                        : new CellPosition(i, start.getCol());
                String translated = sheet.getEngine().translateForCopy(sourceContent, start, target);
                applyContent(sheet, target.toCellId(), translated);
                filled.add(target.toCellId());
            }
            log.info("Filled {} cells from {} in sheet {}", filled.size(), source, sheetId);
            return filled;
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Inserts an empty row or column before the zero-based {@code index}.
     * Cells pushed past the sheet bounds are dropped.
     */
    public void insert(long sheetId, Axis axis, int index) {
        Sheet sheet = getSheet(sheetId);
        checkIndex(axis, index);

        sheet.getLock().writeLock().lock();
        try {
            EvalEngine engine = sheet.getEngine();
            Map<String, Cell> moved = new HashMap<>();
            for (Cell cell : sheet.getCells().values()) {
                CellPosition position = CellPosition.fromCellId(cell.getCellId());
                CellPosition target = shift(position, axis, index, 1);
                if (!inBounds(target)) {
                    log.debug("Dropping {} pushed past the sheet bounds", cell.getCellId());
                    continue;
                }
                moved.put(target.toCellId(),
                        newCell(target, engine.translateForInsert(cell.getContent(), axis, index)));
            }
            replaceAndRecalculate(sheet, moved);
            log.info("Inserted {} at index {} in sheet {}", axis, index, sheetId);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Deletes the row or column at the zero-based {@code index}. References to it
     * become #REF! and later rows or columns move back by one.
     */
    public void delete(long sheetId, Axis axis, int index) {
        Sheet sheet = getSheet(sheetId);
        checkIndex(axis, index);

        sheet.getLock().writeLock().lock();
        try {
            EvalEngine engine = sheet.getEngine();
            Map<String, Cell> moved = new HashMap<>();
            for (Cell cell : sheet.getCells().values()) {
                CellPosition position = CellPosition.fromCellId(cell.getCellId());
                int line = axis == Axis.ROW ? position.getRow() : position.getCol();
                if (line == index) {
                    continue;
                }
                CellPosition target = shift(position, axis, index + 1, -1);
                moved.put(target.toCellId(),
                        newCell(target, engine.translateForDelete(cell.getContent(), axis, index)));
            }
            replaceAndRecalculate(sheet, moved);
            log.info("Deleted {} at index {} in sheet {}", axis, index, sheetId);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    public Map<String, Set<String>> getForwardDependencies(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            return sheet.getForwardGraph();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public Map<String, Set<String>> getReverseDependencies(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            return sheet.getReverseGraph();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public List<FunctionInfo> listFunctions() {
        return functionRegistry.listFunctions();
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    /**
     * Stores content and lets the engine recompute. Caller holds the write lock.
     */
    private EvalResult applyContent(Sheet sheet, String cellId, String content) {
        sheet.setCellContent(cellId, content);
        sheet.getEngine().onCellChanged(cellId);

        EvalResult result = sheet.getCellResult(cellId);
        if (content.isEmpty()) {
            // Cleared cells keep no entry; readers see them as having no value
            sheet.removeCell(cellId);
        }
        log.debug("Set {} in sheet {} -> {}", cellId, sheet.getId(), result);
        return result == null ? EvalResult.empty() : result;
    }

    private void replaceAndRecalculate(Sheet sheet, Map<String, Cell> cells) {
        sheet.replaceCells(cells);
        sheet.getEngine().recalculateAll(new ArrayList<>(cells.keySet()));
    }

    /**
     * Upper-cases and validates a cell ID such as "b3", checking it against the sheet bounds.
     */
    private String normalizeCellId(String cellId) {
        String id = cellId == null ? "" : cellId.trim().toUpperCase(Locale.ROOT);
        if (!CellReferences.isCellReference(id)) {
            throw new InvalidCellReferenceException("Invalid cell reference: " + cellId);
        }
        CellPosition position;
        try {
            position = CellPosition.fromCellId(id);
        } catch (FormulaParseException e) {
            throw new InvalidCellReferenceException("Invalid cell reference: " + cellId);
        }
        if (!inBounds(position)) {
            throw new InvalidCellReferenceException("Cell " + id + " is outside the sheet ("
                    + properties.getMaxColumns() + " columns, " + properties.getMaxRows() + " rows)");
        }
        return id;
    }

    private boolean inBounds(CellPosition position) {
        return position.getRow() >= 0 && position.getRow() < properties.getMaxRows()
                && position.getCol() >= 0 && position.getCol() < properties.getMaxColumns();
    }

    private void checkIndex(Axis axis, int index) {
        int limit = axis == Axis.ROW ? properties.getMaxRows() : properties.getMaxColumns();
        if (index < 0 || index >= limit) {
            throw new InvalidCellReferenceException(
                    axis + " index " + index + " is outside the sheet (0.." + (limit - 1) + ")");
        }
    }

    // Moves positions at or after 'from' on the axis by 'delta'
    private static CellPosition shift(CellPosition position, Axis axis, int from, int delta) {
        if (axis == Axis.ROW) {
            return position.getRow() >= from ? new CellPosition(position.getRow() + delta, position.getCol()) : position;
        }
        return position.getCol() >= from ? new CellPosition(position.getRow(), position.getCol() + delta) : position;
    }

    private static Cell newCell(CellPosition position, String content) {
        return new Cell(CellReferences.numberToColumn(position.getCol() + 1), position.getRow() + 1, content);
    }
}

package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.evaluator.FormulaEvaluator;
import com.spreadsheet.formula.evaluator.Values;
import com.spreadsheet.formula.exceptions.CircularDependencyException;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.Axis;
import com.spreadsheet.formula.models.CellPosition;
import com.spreadsheet.formula.models.EvalResult;
import com.spreadsheet.formula.models.FunctionInfo;
import com.spreadsheet.formula.translator.ReferenceTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Keeps computed cell results consistent with cell contents.
 *
 * The host owns storage and hands in three callbacks: read a cell's content,
 * read its committed result, and commit a new result. When a cell changes the
 * engine updates the dependency graph, then re-evaluates the cell and every
 * transitive dependent exactly once, dependencies first.
 *
 * A change that would close a cycle marks the cell with a circular-dependency
 * error; the cell is retried after later changes and recovers once the cycle is broken.
 */
public class EvalEngine {

    private static final Logger log = LoggerFactory.getLogger(EvalEngine.class);

    private final Function<String, String> getCellContent;
    private final BiConsumer<String, EvalResult> setCellResult;
    private final FunctionRegistry functionRegistry;
    private final FormulaEvaluator evaluator;
    private final DependencyGraph dependencyGraph = new DependencyGraph();

    // Cells whose latest content was rejected as circular
    private final Set<String> circularCells = new LinkedHashSet<>();

    public EvalEngine(Function<String, String> getCellContent,
                      Function<String, EvalResult> getCellResult,
                      BiConsumer<String, EvalResult> setCellResult,
                      FunctionRegistry functionRegistry) {
        this.getCellContent = getCellContent;
        this.setCellResult = setCellResult;
        this.functionRegistry = functionRegistry;
        this.evaluator = new FormulaEvaluator(getCellResult::apply, functionRegistry);
    }

    /**
     * Evaluates free-standing formula text against the committed results.
     * A leading "=" is optional. Never throws; failures are error results.
     */
    public EvalResult calculate(String formula) {
        String text = formula == null ? "" : formula;
        return evaluator.calculate(text.startsWith("=") ? text.substring(1) : text);
    }

    /**
     * Re-derives the dependencies of {@code cellId} from its current content and
     * recomputes it along with everything that depends on it.
     */
    public void onCellChanged(String cellId) {
        Set<String> references = DependencyGraph.extractReferences(getCellContent.apply(cellId));
        try {
            dependencyGraph.setDependencies(cellId, references);
            circularCells.remove(cellId);
            log.debug("Dependencies of {} set to {}", cellId, references);
            evaluateAll(dependencyGraph.getRecomputeOrder(cellId));
        } catch (CircularDependencyException e) {
            markCircular(cellId, e);
            List<String> dependents = new ArrayList<>(dependencyGraph.getRecomputeOrder(cellId));
            dependents.remove(cellId);
            evaluateAll(dependents);
        }
        retryCircularCells();
    }

    /**
     * Rebuilds the dependency graph for the given cells from scratch and recomputes
     * all of them. Used after edits that move many cells at once.
     */
    public void recalculateAll(Collection<String> cellIds) {
        dependencyGraph.clear();
        circularCells.clear();
        for (String cellId : cellIds) {
            try {
                dependencyGraph.setDependencies(cellId, DependencyGraph.extractReferences(getCellContent.apply(cellId)));
            } catch (CircularDependencyException e) {
                markCircular(cellId, e);
            }
        }
        List<String> order = dependencyGraph.getRecomputeOrder(cellIds);
        log.debug("Recalculating {} cells", order.size());
        evaluateAll(order);
    }

    public String translateForCopy(String content, CellPosition from, CellPosition to) {
        return ReferenceTranslator.translateForCopy(content, from, to);
    }

    public String translateForInsert(String content, Axis axis, int index) {
        return ReferenceTranslator.translateForInsert(content, axis, index);
    }

    public String translateForDelete(String content, Axis axis, int index) {
        return ReferenceTranslator.translateForDelete(content, axis, index);
    }

    public List<FunctionInfo> listFunctions() {
        return functionRegistry.listFunctions();
    }

    public DependencyGraph getDependencyGraph() {
        return dependencyGraph;
    }

    public Set<String> getCircularCells() {
        return Collections.unmodifiableSet(circularCells);
    }

    private void evaluateAll(List<String> order) {
        for (String cellId : order) {
            if (!circularCells.contains(cellId)) {
                evaluateCell(cellId);
            }
        }
    }

    private void evaluateCell(String cellId) {
        String content = getCellContent.apply(cellId);
        EvalResult result;
        if (content == null || content.isEmpty()) {
            result = EvalResult.empty();
        } else if (content.startsWith("=")) {
            result = evaluator.calculate(content.substring(1));
        } else if (Values.isNumberShape(content)) {
            result = EvalResult.of(Double.parseDouble(content.trim()));
        } else {
            result = EvalResult.of(content);
        }
        log.debug("Evaluated {} -> {}", cellId, result);
        setCellResult.accept(cellId, result);
    }

    private void markCircular(String cellId, CircularDependencyException e) {
        log.warn("Rejected content of {}: {}", cellId, e.getMessage());
        // The cell reads nothing until its content stops being circular
        dependencyGraph.setDependencies(cellId, Collections.emptySet());
        circularCells.add(cellId);
        setCellResult.accept(cellId, EvalResult.error(e.getMessage()));
    }

    private void retryCircularCells() {
        for (String cellId : new ArrayList<>(circularCells)) {
            try {
                dependencyGraph.setDependencies(cellId, DependencyGraph.extractReferences(getCellContent.apply(cellId)));
            } catch (CircularDependencyException e) {
                log.trace("{} is still circular: {}", cellId, e.getMessage());
                continue;
            }
            circularCells.remove(cellId);
            log.debug("Cycle through {} is broken, recomputing", cellId);
            evaluateAll(dependencyGraph.getRecomputeOrder(cellId));
        }
    }
}

package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.cache.CacheStats;
import com.spreadsheet.formula.cache.FormulaCache;
import com.spreadsheet.formula.config.FormulaEngineProperties;
import com.spreadsheet.formula.evaluator.FormulaEvaluator;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.Cell;
import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.Sheet;
import com.spreadsheet.formula.parser.FormulaParser;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * One sheet's formula machinery: an evaluator (with its dependency
 * graph) plus a result cache. Each sheet owns its own instance, so
 * sheets and tests never share state.
 * <p>
 * Two ways of refreshing values coexist:
 * - pull: {@link #evaluate} recursively evaluates every formula cell it reads;
 * - push: {@link #recalculate} re-runs a set of cells in dependency order.
 * A single edit can therefore compute a dependent twice (once pulled by a
 * later dependent, once pushed). That cost is accepted: collapsing the two
 * paths would change which error or sentinel a cell ends up showing.
 */
public class FormulaEngine {

    private static final String DETACHED_CELL_ID = "#EVAL";

    private final FormulaEvaluator evaluator;
    private final FormulaCache cache;

    public FormulaEngine() {
        this(new FormulaEvaluator(), new FormulaCache());
    }

    public FormulaEngine(FormulaEngineProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public FormulaEngine(FormulaEngineProperties properties, Clock clock) {
        this(new FormulaEvaluator(
                new FormulaParser(properties.getMaxDepth(), properties.getMaxRangeCells()),
                FunctionRegistry.withBuiltins(), properties.getMaxDepth()),
                new FormulaCache(clock));
    }

    public FormulaEngine(FormulaEvaluator evaluator, FormulaCache cache) {
        this.evaluator = evaluator;
        this.cache = cache;
    }

    /**
     * Evaluates a cell's formula and caches the result along with the
     * cells it read. Errors propagate and leave the cache untouched.
     */
    public CellValue evaluate(String cellId, String formula, Sheet sheet) {
        CellValue value = evaluator.evaluate(cellId, formula, sheet);
        cache.set(cellId, value, evaluator.getReferences(cellId));
        return value;
    }

    /**
     * Evaluates a formula that doesn't belong to any cell. Nothing is
     * cached and no dependency edges survive the call.
     */
    public CellValue evaluateDetached(String formula, Sheet sheet) {
        try {
            return evaluator.evaluate(DETACHED_CELL_ID, formula, sheet);
        } finally {
            evaluator.removeDependencies(DETACHED_CELL_ID);
        }
    }

    /**
     * Cells whose formulas read {@code cellId} directly.
     */
    public Set<String> getDependents(String cellId) {
        return evaluator.getDependents(cellId);
    }

    public Set<String> getTransitiveDependents(String cellId) {
        return evaluator.getTransitiveDependents(cellId);
    }

    /**
     * Recomputes the given cells from the formulas stored in the sheet,
     * dependencies first. A failing cell becomes an "#ERROR:" value
     * without stopping the others.
     *
     * @return each cell's new value, in computation order
     */
    public Map<String, CellValue> recalculate(Collection<String> cellIds, Sheet sheet) {
        return cache.batchRecalculate(cellIds, cellId -> computeStored(cellId, sheet));
    }

    /**
     * Called when a cell stops holding a formula: its outgoing edges
     * go away and its cached result is dropped.
     */
    public void removeFormula(String cellId) {
        evaluator.removeDependencies(cellId);
        cache.invalidate(cellId);
    }

    public void invalidate(String cellId) {
        cache.invalidate(cellId);
    }

    public void invalidateCascade(String cellId) {
        cache.invalidateCascade(cellId);
    }

    public int evictOldEntries(Duration maxAge) {
        return cache.evictOldEntries(maxAge);
    }

    public CellValue getCachedValue(String cellId) {
        return cache.get(cellId);
    }

    public CacheStats getStats() {
        return cache.getStats();
    }

    public Map<String, Set<String>> getForwardGraph() {
        return evaluator.getForwardGraph();
    }

    public Map<String, Set<String>> getReverseGraph() {
        return evaluator.getReverseGraph();
    }

    private CellValue computeStored(String cellId, Sheet sheet) {
        Cell cell = sheet.getCell(cellId);
        if (cell == null) {
            return CellValue.NULL;
        }
        if (!cell.hasFormula()) {
            return cell.getValue();
        }
        return evaluate(cellId, cell.getFormula(), sheet);
    }
}

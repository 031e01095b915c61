package com.spreadsheet.formula.services;

import com.spreadsheet.formula.cache.CacheStats;
import com.spreadsheet.formula.config.FormulaEngineProperties;
import com.spreadsheet.formula.engine.FormulaEngine;
import com.spreadsheet.formula.exceptions.FormulaException;
import com.spreadsheet.formula.exceptions.SheetNotFoundException;
import com.spreadsheet.formula.models.Cell;
import com.spreadsheet.formula.models.CellReference;
import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Main business logic for creating sheets, setting cell values
 * (literals or formulas) and pushing recalculation to dependent cells.
 * Each sheet gets its own {@link FormulaEngine}; all engine calls for a
 * sheet happen under that sheet's lock.
 */
@Service
public class SheetService {

    private static final Logger logger = LoggerFactory.getLogger(SheetService.class);

    private static final Pattern DECIMAL = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");
    private static final Pattern ISO_INSTANT = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T.*Z$");

    // All sheets live here in memory; no persistent store
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();
    private final Map<Long, FormulaEngine> engines = new ConcurrentHashMap<>();

    private final FormulaEngineProperties properties;

    public SheetService() {
        this(new FormulaEngineProperties());
    }

    @Autowired
    public SheetService(FormulaEngineProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates an empty sheet with its own formula engine and returns its ID.
     */
    public long createSheet(String name) {
        Sheet sheet = new Sheet(name);
        sheets.put(sheet.getId(), sheet);
        engines.put(sheet.getId(), new FormulaEngine(properties));
        logger.info("Created sheet {} ({})", sheet.getId(), sheet.getName());
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    public FormulaEngine getEngine(long sheetId) {
        getSheet(sheetId);
        return engines.get(sheetId);
    }

    /**
     * Sets a cell's content with these steps:
     * 1) Parse the reference (InvalidCellReferenceException if it isn't A1 syntax).
     * 2) "=..." is a formula: evaluate it now; a formula error becomes the
     *    cell's "#ERROR: ..." value instead of failing the request.
     * 3) Anything else is a literal (boolean, number, ISO instant or text);
     *    empty text clears the cell.
     * 4) Recalculate every cell that depends on this one, nearest first.
     */
    public void setCellValue(long sheetId, String cellRef, String rawValue) {
        Sheet sheet = getSheet(sheetId);
        FormulaEngine engine = engines.get(sheetId);
        CellReference reference = CellReference.parse(cellRef);
        String cellId = reference.toId();
        String raw = rawValue == null ? "" : rawValue;

        sheet.getLock().writeLock().lock();
        try {
            if (raw.trim().isEmpty()) {
                sheet.removeCell(cellId);
                engine.removeFormula(cellId);
                logger.debug("Cleared {} in sheet {}", cellId, sheetId);
            } else {
                // The cell is only touched once the new value is known
                String formula = raw.startsWith("=") ? raw : null;
                CellValue value = formula != null
                        ? evaluateOrMark(engine, cellId, formula, sheet)
                        : parseLiteral(raw);

                Cell cell = sheet.getCell(cellId);
                if (cell == null) {
                    cell = new Cell(reference);
                    sheet.setCell(cell);
                }
                cell.setRawValue(raw);
                cell.setFormula(formula);
                cell.setValue(value);
                if (formula == null) {
                    engine.removeFormula(cellId);
                }
                logger.debug("Set {} in sheet {} to {}", cellId, sheetId, value);
            }

            recalculateDependents(sheet, engine, cellId);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Returns a map of cell id -> current value for all cells,
     * ordered by row, then column.
     */
    public Map<String, Object> getSheetData(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            sheet.getCells().values().stream()
                    .sorted(Comparator.comparing((Cell c) -> c.getReference().getRowIndex())
                            .thenComparing(c -> c.getReference().getColumnIndex()))
                    .forEach(cell -> data.put(cell.getId(), cell.getValue().toJavaObject()));
            return data;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Returns the cell at {@code cellRef}, or null if it was never set.
     */
    public Cell getCell(long sheetId, String cellRef) {
        Sheet sheet = getSheet(sheetId);
        String cellId = CellReference.parse(cellRef).toId();

        sheet.getLock().readLock().lock();
        try {
            return sheet.getCell(cellId);
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Evaluates a formula against the sheet without storing it anywhere.
     * Formula errors propagate to the caller.
     */
    public CellValue evaluateFormula(long sheetId, String formula) {
        Sheet sheet = getSheet(sheetId);
        FormulaEngine engine = engines.get(sheetId);

        // The evaluator's graph is touched, so this is a write
        sheet.getLock().writeLock().lock();
        try {
            return engine.evaluateDetached(formula, sheet);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    public Map<String, Set<String>> getForwardDependencies(long sheetId) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return engines.get(sheetId).getForwardGraph();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public Map<String, Set<String>> getReverseDependencies(long sheetId) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return engines.get(sheetId).getReverseGraph();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public CacheStats getCacheStats(long sheetId) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return engines.get(sheetId).getStats();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    @Scheduled(fixedDelayString = "${formula.engine.eviction-interval-ms:60000}")
    public void scheduledEviction() {
        evictStaleCacheEntries();
    }

    /**
     * Drops cached results older than the configured age in every sheet.
     * Cell values are unaffected; only the cache shrinks.
     *
     * @return how many entries were dropped
     */
    public int evictStaleCacheEntries() {
        int evicted = 0;
        for (Map.Entry<Long, Sheet> entry : sheets.entrySet()) {
            Sheet sheet = entry.getValue();
            sheet.getLock().writeLock().lock();
            try {
                evicted += engines.get(entry.getKey()).evictOldEntries(properties.getCacheMaxAge());
            } finally {
                sheet.getLock().writeLock().unlock();
            }
        }
        if (evicted > 0) {
            logger.debug("Evicted {} stale cache entries", evicted);
        }
        return evicted;
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private CellValue evaluateOrMark(FormulaEngine engine, String cellId, String formula, Sheet sheet) {
        try {
            return engine.evaluate(cellId, formula, sheet);
        } catch (FormulaException e) {
            logger.debug("Formula in {} failed: {}", cellId, e.getMessage());
            engine.invalidate(cellId);
            return CellValue.errorMarker(e.getMessage());
        }
    }

    /**
     * Re-evaluates every cell that depends on 'startCellId', using the
     * reverse dependency graph; the engine orders them so each cell runs
     * after the cells it reads.
     */
    private void recalculateDependents(Sheet sheet, FormulaEngine engine, String startCellId) {
        Set<String> dependents = engine.getTransitiveDependents(startCellId);
        dependents.remove(startCellId);
        if (dependents.isEmpty()) {
            return;
        }

        Map<String, CellValue> updated = engine.recalculate(dependents, sheet);
        updated.forEach((cellId, value) -> {
            Cell cell = sheet.getCell(cellId);
            if (cell != null) {
                cell.setValue(value);
            }
        });
        logger.debug("Recalculated {} dependents of {}", updated.size(), startCellId);
    }

    /**
     * Converts literal text to the matching value: "true"/"false",
     * a decimal number, an ISO-8601 instant, or else plain text.
     */
    private CellValue parseLiteral(String raw) {
        String trimmed = raw.trim();
        if (trimmed.equalsIgnoreCase("true") || trimmed.equalsIgnoreCase("false")) {
            return CellValue.bool(Boolean.parseBoolean(trimmed));
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            return CellValue.number(Double.parseDouble(trimmed));
        }
        if (ISO_INSTANT.matcher(trimmed).matches()) {
            try {
                return CellValue.date(Instant.parse(trimmed));
            } catch (DateTimeParseException e) {
                logger.debug("'{}' looks like an instant but isn't one; keeping it as text", trimmed);
            }
        }
        return CellValue.text(raw);
    }
}

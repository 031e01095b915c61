package com.spreadsheet.formula.models;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire spreadsheet:
 * - Has a unique ID and a display name
 * - A map of cell id ("B12") -> Cell
 * - A read/write lock; the formula engine has no locking of its own,
 *   so every caller goes through this lock
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final String name;
    private final Map<String, Cell> cells = new ConcurrentHashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(String name) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.name = name == null || name.isBlank() ? "Sheet" + id : name;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Map<String, Cell> getCells() {
        return cells;
    }

    /**
     * Looks a cell up by 0-based column (A=0) and 0-based row.
     * Returns null for a cell that was never set.
     */
    public Cell getCellAt(int columnIndex, int rowIndex) {
        if (columnIndex < 0 || rowIndex < 0) {
            return null;
        }
        return cells.get(new CellReference(columnIndex, rowIndex).toId());
    }

    public Cell getCell(String cellId) {
        return cells.get(cellId);
    }

    /**
     * Inserts or replaces a cell, keyed by its canonical id.
     */
    public void setCell(Cell cell) {
        cells.put(cell.getId(), cell);
    }

    public void removeCell(String cellId) {
        cells.remove(cellId);
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}

package com.spreadsheet.formula.cache;

import java.time.Instant;

/**
 * Diagnostic snapshot of a {@link FormulaCache}; nothing in the engine
 * makes decisions based on it.
 */
public class CacheStats {
    private final int size;
    private final int dependencies;
    private final Instant oldestEntry;

    public CacheStats(int size, int dependencies, Instant oldestEntry) {
        this.size = size;
        this.dependencies = dependencies;
        this.oldestEntry = oldestEntry;
    }

    public int getSize() {
        return size;
    }

    /**
     * Number of cached cells that record at least one dependency.
     */
    public int getDependencies() {
        return dependencies;
    }

    /**
     * Timestamp of the oldest entry, or null when the cache is empty.
     */
    public Instant getOldestEntry() {
        return oldestEntry;
    }
}

package com.spreadsheet.formula.cache;

import com.spreadsheet.formula.models.CellValue;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A computed formula result together with the cells it was computed from.
 */
public final class CacheEntry {
    private final CellValue value;
    private final Instant timestamp;
    private final Set<String> dependencies;

    public CacheEntry(CellValue value, Instant timestamp, Set<String> dependencies) {
        this.value = value;
        this.timestamp = timestamp;
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
    }

    public CellValue getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Set<String> getDependencies() {
        return dependencies;
    }
}

package com.spreadsheet.formula.cache;

import com.spreadsheet.formula.dependency.DependencyGraph;
import com.spreadsheet.formula.exceptions.FormulaException;
import com.spreadsheet.formula.models.CellValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Cache of computed formula values, keyed by cell id.
 * Each entry records the cells it was computed from; those records
 * drive cascade invalidation and the ordering of batch recalculation.
 * Not thread-safe; callers serialise access.
 */
public class FormulaCache {

    private static final Logger logger = LoggerFactory.getLogger(FormulaCache.class);

    public static final Duration DEFAULT_MAX_AGE = Duration.ofMinutes(5);

    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final DependencyGraph dependencies = new DependencyGraph();
    private final Clock clock;

    public FormulaCache() {
        this(Clock.systemUTC());
    }

    public FormulaCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * Cached value, or null when the cell has no entry.
     */
    public CellValue get(String cellId) {
        CacheEntry entry = entries.get(cellId);
        return entry == null ? null : entry.getValue();
    }

    public CacheEntry getEntry(String cellId) {
        return entries.get(cellId);
    }

    public boolean has(String cellId) {
        return entries.containsKey(cellId);
    }

    public void set(String cellId, CellValue value) {
        set(cellId, value, Collections.emptySet());
    }

    /**
     * Stores a value and replaces the cell's recorded dependencies.
     */
    public void set(String cellId, CellValue value, Collection<String> cellDependencies) {
        Set<String> deps = new LinkedHashSet<>(cellDependencies);
        entries.put(cellId, new CacheEntry(value, clock.instant(), deps));
        dependencies.setDependencies(cellId, deps);
    }

    /**
     * Drops one entry. Cells computed from it keep their entries.
     */
    public void invalidate(String cellId) {
        entries.remove(cellId);
    }

    /**
     * Drops the entry for {@code cellId} and for every cell that
     * depends on it, directly or transitively.
     */
    public void invalidateCascade(String cellId) {
        Set<String> affected = new LinkedHashSet<>();
        affected.add(cellId);
        affected.addAll(dependencies.getTransitiveDependents(cellId));

        affected.forEach(entries::remove);
        logger.debug("Cascade from {} invalidated {} entries", cellId, affected.size());
    }

    /**
     * Removes entries older than {@code maxAge}, together with their
     * edges in both directions.
     *
     * @return the number of entries removed
     */
    public int evictOldEntries(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        List<String> expired = new ArrayList<>();
        for (Map.Entry<String, CacheEntry> entry : entries.entrySet()) {
            if (entry.getValue().getTimestamp().isBefore(cutoff)) {
                expired.add(entry.getKey());
            }
        }

        for (String cellId : expired) {
            entries.remove(cellId);
            dependencies.remove(cellId);
        }
        if (!expired.isEmpty()) {
            logger.debug("Evicted {} cache entries older than {}", expired.size(), maxAge);
        }
        return expired.size();
    }

    public int evictOldEntries() {
        return evictOldEntries(DEFAULT_MAX_AGE);
    }

    public void clear() {
        entries.clear();
        dependencies.clear();
    }

    /**
     * Recomputes the given cells so that each one runs after the cells
     * it depends on, as recorded in the cache. Only the requested cells
     * are computed; other cached cells only influence the order.
     * <p>
     * A cell whose computation fails is cached as an "#ERROR:" value and
     * the remaining cells still run.
     *
     * @return the new values, in the order they were computed
     */
    public Map<String, CellValue> batchRecalculate(Collection<String> cellIds, Function<String, CellValue> compute) {
        Map<String, CellValue> results = new LinkedHashMap<>();

        for (String cellId : topologicalOrder(cellIds)) {
            CacheEntry previous = entries.get(cellId);
            Set<String> deps = previous == null ? Collections.emptySet() : previous.getDependencies();

            CellValue value;
            try {
                value = compute.apply(cellId);
            } catch (FormulaException e) {
                logger.warn("Recalculation of {} failed: {}", cellId, e.getMessage());
                value = CellValue.errorMarker(e.getMessage());
            }

            // compute() may have re-cached the cell with fresher dependencies
            CacheEntry current = entries.get(cellId);
            if (current != null && current != previous) {
                deps = current.getDependencies();
            }
            set(cellId, value, deps);
            results.put(cellId, value);
        }
        return results;
    }

    public CacheStats getStats() {
        Instant oldest = null;
        for (CacheEntry entry : entries.values()) {
            if (oldest == null || entry.getTimestamp().isBefore(oldest)) {
                oldest = entry.getTimestamp();
            }
        }
        return new CacheStats(entries.size(), dependencies.size(), oldest);
    }

    // Depth-first: dependencies are emitted before the cells that read them
    private List<String> topologicalOrder(Collection<String> cellIds) {
        Set<String> requested = new HashSet<>(cellIds);
        Set<String> visited = new HashSet<>();
        List<String> order = new ArrayList<>();
        for (String cellId : cellIds) {
            visit(cellId, requested, visited, order);
        }
        return order;
    }

    private void visit(String cellId, Set<String> requested, Set<String> visited, List<String> order) {
        if (!visited.add(cellId)) {
            return;
        }
        CacheEntry entry = entries.get(cellId);
        if (entry != null) {
            for (String dependency : entry.getDependencies()) {
                visit(dependency, requested, visited, order);
            }
        }
        if (requested.contains(cellId)) {
            order.add(cellId);
        }
    }
}

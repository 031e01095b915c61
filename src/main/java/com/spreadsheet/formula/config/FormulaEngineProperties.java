package com.spreadsheet.formula.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for every per-sheet formula engine, bound from
 * "formula.engine.*" in application.properties.
 */
@ConfigurationProperties(prefix = "formula.engine")
public class FormulaEngineProperties {

    /**
     * Deepest chain of formula cells reading formula cells before
     * evaluation gives up. Also caps how deeply a single formula may nest
     * parentheses, signs, function calls and operator chains.
     */
    private int maxDepth = 256;

    /**
     * Largest range, in cells, a formula may reference.
     */
    private long maxRangeCells = 100_000;

    /**
     * Cached results older than this are dropped by the periodic sweep.
     */
    private Duration cacheMaxAge = Duration.ofMinutes(5);

    /**
     * Delay between two cache sweeps, in milliseconds.
     */
    private long evictionIntervalMs = 60_000;

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public long getMaxRangeCells() {
        return maxRangeCells;
    }

    public void setMaxRangeCells(long maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }

    public Duration getCacheMaxAge() {
        return cacheMaxAge;
    }

    public void setCacheMaxAge(Duration cacheMaxAge) {
        this.cacheMaxAge = cacheMaxAge;
    }

    public long getEvictionIntervalMs() {
        return evictionIntervalMs;
    }

    public void setEvictionIntervalMs(long evictionIntervalMs) {
        this.evictionIntervalMs = evictionIntervalMs;
    }
}

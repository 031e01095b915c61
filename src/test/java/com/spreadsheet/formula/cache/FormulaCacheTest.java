package com.spreadsheet.formula.cache;

import com.spreadsheet.formula.exceptions.DivisionByZeroException;
import com.spreadsheet.formula.models.CellValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FormulaCacheTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private MutableClock clock;
    private FormulaCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        cache = new FormulaCache(clock);
    }

    @Test
    void testGetMissingIsNull() {
        assertNull(cache.get("A1"));
        assertFalse(cache.has("A1"));
    }

    @Test
    void testSetRecordsDependenciesAndTimestamp() {
        cache.set("C1", CellValue.number(3), Arrays.asList("A1", "B1"));

        CacheEntry entry = cache.getEntry("C1");
        assertEquals(CellValue.number(3), entry.getValue());
        assertEquals(START, entry.getTimestamp());
        assertTrue(entry.getDependencies().containsAll(Arrays.asList("A1", "B1")));
    }

    @Test
    void testInvalidateDropsOnlyThatEntry() {
        cache.set("A1", CellValue.number(1));
        cache.set("B1", CellValue.number(2), Collections.singletonList("A1"));

        cache.invalidate("A1");

        assertFalse(cache.has("A1"));
        assertEquals(CellValue.number(2), cache.get("B1"));
    }

    @Test
    void testInvalidateCascade() {
        cache.set("A1", CellValue.number(1));
        cache.set("B1", CellValue.number(2), Collections.singletonList("A1"));
        cache.set("C1", CellValue.number(3), Collections.singletonList("B1"));
        cache.set("D1", CellValue.number(4));

        cache.invalidateCascade("A1");

        assertFalse(cache.has("A1"));
        assertFalse(cache.has("B1"));
        assertFalse(cache.has("C1"));
        assertTrue(cache.has("D1"));
    }

    @Test
    void testEvictOldEntries() {
        cache.set("A1", CellValue.number(1));
        clock.advance(Duration.ofMinutes(4));
        cache.set("B1", CellValue.number(2), Collections.singletonList("A1"));
        clock.advance(Duration.ofMinutes(2));

        int evicted = cache.evictOldEntries(Duration.ofMinutes(5));

        assertEquals(1, evicted);
        assertFalse(cache.has("A1"));
        assertTrue(cache.has("B1"));
        // B1's edge to the evicted A1 is gone too
        assertEquals(0, cache.getStats().getDependencies());
    }

    @Test
    void testDefaultMaxAgeIsFiveMinutes() {
        cache.set("A1", CellValue.number(1));
        clock.advance(Duration.ofMinutes(5));
        assertEquals(0, cache.evictOldEntries());
        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, cache.evictOldEntries());
    }

    @Test
    void testBatchRecalculateRunsDependenciesFirst() {
        cache.set("A1", CellValue.number(1));
        cache.set("B1", CellValue.number(0), Collections.singletonList("A1"));
        cache.set("C1", CellValue.number(0), Collections.singletonList("B1"));

        List<String> computed = new ArrayList<>();
        Map<String, CellValue> results = cache.batchRecalculate(Arrays.asList("C1", "B1"), id -> {
            computed.add(id);
            return CellValue.number(computed.size());
        });

        assertEquals(Arrays.asList("B1", "C1"), computed);
        assertEquals(Arrays.asList("B1", "C1"), new ArrayList<>(results.keySet()));
        assertEquals(CellValue.number(2), cache.get("C1"));
        // A1 was not requested, so it isn't recomputed
        assertEquals(CellValue.number(1), cache.get("A1"));
    }

    @Test
    void testBatchRecalculateIsolatesFailures() {
        cache.set("B1", CellValue.number(0));
        cache.set("C1", CellValue.number(0));

        Map<String, CellValue> results = cache.batchRecalculate(Arrays.asList("B1", "C1"), id -> {
            if (id.equals("B1")) {
                throw new DivisionByZeroException();
            }
            return CellValue.number(7);
        });

        assertEquals(CellValue.errorMarker("Division by zero"), results.get("B1"));
        assertEquals(CellValue.number(7), results.get("C1"));
        assertTrue(cache.get("B1").isErrorMarker());
    }

    @Test
    void testStats() {
        assertNull(cache.getStats().getOldestEntry());

        cache.set("A1", CellValue.number(1));
        clock.advance(Duration.ofSeconds(30));
        cache.set("B1", CellValue.number(2), Collections.singletonList("A1"));

        CacheStats stats = cache.getStats();
        assertEquals(2, stats.getSize());
        assertEquals(1, stats.getDependencies());
        assertEquals(START, stats.getOldestEntry());
    }

    @Test
    void testClear() {
        cache.set("A1", CellValue.number(1));
        cache.set("B1", CellValue.number(2), Collections.singletonList("A1"));
        cache.clear();
        assertEquals(0, cache.getStats().getSize());
        assertEquals(0, cache.getStats().getDependencies());
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

package com.github.rudygunawan.fetcher;

import com.github.rudygunawan.fetcher.model.CacheStats;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheStatsTest {

    @Test
    void testEmptyStats() {
        CacheStats stats = CacheStats.empty();

        assertEquals(0, stats.requestCount());
        assertEquals(1.0, stats.hitRate(), 0.0001);
        assertEquals(0.0, stats.missRate(), 0.0001);
        assertEquals(0.0, stats.loadFailureRate(), 0.0001);
        assertEquals(0.0, stats.averageLoadPenalty(), 0.0001);
    }

    @Test
    void testRates() {
        // 3 hits, 1 stale hit, 2 coalesced, 2 misses
        CacheStats stats = new CacheStats(3, 1, 2, 2, 3, 1, 400, 5);

        assertEquals(8, stats.requestCount());
        assertEquals(0.5, stats.hitRate(), 0.0001);
        assertEquals(0.25, stats.missRate(), 0.0001);
        assertEquals(4, stats.loadCount());
        assertEquals(0.25, stats.loadFailureRate(), 0.0001);
        assertEquals(100.0, stats.averageLoadPenalty(), 0.0001);
        assertEquals(5, stats.evictionCount());
    }

    @Test
    void testPlusAndMinus() {
        CacheStats a = new CacheStats(10, 2, 3, 4, 5, 1, 1000, 2);
        CacheStats b = new CacheStats(4, 1, 1, 1, 2, 0, 300, 1);

        assertEquals(new CacheStats(14, 3, 4, 5, 7, 1, 1300, 3), a.plus(b));
        assertEquals(new CacheStats(6, 1, 2, 3, 3, 1, 700, 1), a.minus(b));
        // Negative differences clamp at zero
        assertEquals(CacheStats.empty(), b.minus(a));
    }
}

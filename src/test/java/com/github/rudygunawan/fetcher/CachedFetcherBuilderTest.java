package com.github.rudygunawan.fetcher;

import com.github.rudygunawan.fetcher.api.FetchOptions;
import com.github.rudygunawan.fetcher.builder.CachedFetcherBuilder;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CachedFetcherBuilderTest {

    @Test
    void testDefaults() {
        CachedFetcherBuilder<String> builder = CachedFetcherBuilder.newBuilder();

        assertEquals(TimeUnit.SECONDS.toNanos(60), builder.getDefaultTtlNanos());
        assertEquals(0, builder.getCleanIntervalNanos());
        assertFalse(builder.isCachingErrors());
        assertFalse(builder.isDoubleBuffering());
        assertFalse(builder.isRecordingStats());
        assertEquals(16, builder.getConcurrencyLevel());
        assertNull(builder.getFetcher());
        assertNull(builder.getScheduler());
        assertNull(builder.getRemovalListener());
        assertNotNull(builder.getTicker());
    }

    @Test
    void testNonPositiveTtlMeansNoExpiry() {
        assertEquals(0, CachedFetcherBuilder.newBuilder().defaultTtl(0, TimeUnit.SECONDS).getDefaultTtlNanos());
        assertEquals(0, CachedFetcherBuilder.newBuilder().defaultTtl(-10, TimeUnit.SECONDS).getDefaultTtlNanos());
        assertEquals(TimeUnit.MILLISECONDS.toNanos(250),
                CachedFetcherBuilder.newBuilder().defaultTtl(250, TimeUnit.MILLISECONDS).getDefaultTtlNanos());
    }

    @Test
    void testInvalidArguments() {
        CachedFetcherBuilder<String> builder = CachedFetcherBuilder.newBuilder();

        assertThrows(IllegalArgumentException.class, () -> builder.cleanInterval(-1, TimeUnit.SECONDS));
        assertThrows(IllegalArgumentException.class, () -> builder.concurrencyLevel(0));
        assertThrows(NullPointerException.class, () -> builder.defaultTtl(1, null));
        assertThrows(NullPointerException.class, () -> builder.fetcher(null));
        assertThrows(NullPointerException.class, () -> builder.ticker(null));
        assertThrows(NullPointerException.class, () -> builder.scheduler(null));
        assertThrows(NullPointerException.class, () -> builder.removalListener(null));
    }

    @Test
    void testConcurrencyLevelRoundedToPowerOfTwo() {
        assertEquals(1, CachedFetcherBuilder.newBuilder().concurrencyLevel(1).getConcurrencyLevel());
        assertEquals(4, CachedFetcherBuilder.newBuilder().concurrencyLevel(3).getConcurrencyLevel());
        assertEquals(64, CachedFetcherBuilder.newBuilder().concurrencyLevel(64).getConcurrencyLevel());
        assertEquals(1 << 16, CachedFetcherBuilder.newBuilder().concurrencyLevel(Integer.MAX_VALUE).getConcurrencyLevel());
    }

    @Test
    void testFetchOptions() {
        FetchOptions<String> defaults = FetchOptions.defaults();
        assertFalse(defaults.hasTtl());
        assertNull(defaults.getDoubleBuffer());
        assertNull(defaults.getFetcher());
        assertNull(defaults.getParams());

        FetchOptions<String> options = FetchOptions.<String>builder()
                .ttl(-5, TimeUnit.SECONDS)
                .doubleBuffer(true)
                .params("page=2")
                .build();
        assertTrue(options.hasTtl());
        assertEquals(0, options.getTtlNanos());
        assertEquals(Boolean.TRUE, options.getDoubleBuffer());
        assertEquals("page=2", options.getParams());

        assertThrows(NullPointerException.class, () -> FetchOptions.<String>builder().fetcher(null));
    }
}

package com.github.rudygunawan.fetcher;

import com.github.rudygunawan.fetcher.CachedFetcherTest.CountingFetcher;
import com.github.rudygunawan.fetcher.CachedFetcherTest.PendingFetcher;
import com.github.rudygunawan.fetcher.api.CachedFetcher;
import com.github.rudygunawan.fetcher.builder.CachedFetcherBuilder;
import com.github.rudygunawan.fetcher.impl.CachedFetcherImpl;
import com.github.rudygunawan.fetcher.metrics.MicrometerCacheMetrics;
import com.github.rudygunawan.fetcher.time.FakeTicker;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.FunctionTimer;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Micrometer metrics integration.
 */
class MicrometerMetricsTest {

    /**
     * The builder returns the interface; the implementation also exposes {@code CacheMetrics}.
     */
    private static <V> CachedFetcherImpl<V> asMonitorable(CachedFetcher<V> cache) {
        return (CachedFetcherImpl<V>) cache;
    }

    @Test
    void testMetricsRegistered() {
        MeterRegistry registry = new SimpleMeterRegistry();
        CachedFetcher<String> cache = CachedFetcherBuilder.<String>newBuilder()
                .recordStats()
                .build(new CountingFetcher());

        MicrometerCacheMetrics.monitor(registry, asMonitorable(cache), "users");

        assertNotNull(registry.find("cache.size").tag("cache", "users").gauge());
        assertNotNull(registry.find("cache.inflight").gauge());
        assertNotNull(registry.find("cache.hit.ratio").gauge());
        assertNotNull(registry.find("cache.hits").functionCounter());
        assertNotNull(registry.find("cache.stale.hits").functionCounter());
        assertNotNull(registry.find("cache.coalesced").functionCounter());
        assertNotNull(registry.find("cache.misses").functionCounter());
        assertNotNull(registry.find("cache.evictions").functionCounter());
        assertNotNull(registry.find("cache.loads").tag("result", "success").functionCounter());
        assertNotNull(registry.find("cache.loads").tag("result", "failure").functionCounter());
        assertNotNull(registry.find("cache.load.duration").functionTimer());
    }

    @Test
    void testCountersTrackCache() {
        MeterRegistry registry = new SimpleMeterRegistry();
        CachedFetcher<String> cache = CachedFetcherBuilder.<String>newBuilder()
                .recordStats()
                .build(new CountingFetcher());
        MicrometerCacheMetrics.monitor(registry, asMonitorable(cache), "users");

        cache.get("a").join();
        cache.get("a").join();
        cache.get("a").join();
        cache.get("b").join();

        Gauge size = registry.find("cache.size").gauge();
        FunctionCounter hits = registry.find("cache.hits").functionCounter();
        FunctionCounter misses = registry.find("cache.misses").functionCounter();
        FunctionCounter loads = registry.find("cache.loads").tag("result", "all").functionCounter();
        Gauge hitRatio = registry.find("cache.hit.ratio").gauge();
        FunctionTimer loadTimer = registry.find("cache.load.duration").functionTimer();

        assertEquals(2.0, size.value(), 0.01);
        assertEquals(2.0, hits.count(), 0.01);
        assertEquals(2.0, misses.count(), 0.01);
        assertEquals(2.0, loads.count(), 0.01);
        assertEquals(0.5, hitRatio.value(), 0.01);
        assertEquals(2.0, loadTimer.count(), 0.01);
    }

    @Test
    void testInFlightAndFailures() {
        MeterRegistry registry = new SimpleMeterRegistry();
        PendingFetcher fetcher = new PendingFetcher();
        CachedFetcher<String> cache = CachedFetcherBuilder.<String>newBuilder()
                .recordStats()
                .build(fetcher);
        MicrometerCacheMetrics.monitor(registry, asMonitorable(cache), "users", Tags.of("region", "eu"));

        CompletableFuture<String> pending = cache.get("a");
        cache.get("a");
        Gauge inFlight = registry.find("cache.inflight").tag("region", "eu").gauge();
        assertEquals(1.0, inFlight.value(), 0.01);
        assertEquals(1.0, registry.find("cache.coalesced").functionCounter().count(), 0.01);

        fetcher.last().completeExceptionally(new RuntimeException("boom"));
        assertThrows(CompletionException.class, pending::join);

        assertEquals(0.0, inFlight.value(), 0.01);
        assertEquals(1.0, registry.find("cache.loads").tag("result", "failure").functionCounter().count(), 0.01);
        assertEquals(0.0, registry.find("cache.loads").tag("result", "success").functionCounter().count(), 0.01);
    }

    @Test
    void testEvictionsCounted() {
        MeterRegistry registry = new SimpleMeterRegistry();
        FakeTicker ticker = new FakeTicker();
        CachedFetcher<String> cache = CachedFetcherBuilder.<String>newBuilder()
                .ticker(ticker)
                .defaultTtl(1, TimeUnit.SECONDS)
                .recordStats()
                .build(new CountingFetcher());
        MicrometerCacheMetrics.monitor(registry, asMonitorable(cache), "users");

        cache.get("a").join();
        ticker.advance(2, TimeUnit.SECONDS);
        cache.clean();

        assertEquals(1.0, registry.find("cache.evictions").functionCounter().count(), 0.01);
    }
}

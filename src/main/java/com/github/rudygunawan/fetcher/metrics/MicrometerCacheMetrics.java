package com.github.rudygunawan.fetcher.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.FunctionTimer;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer integration for cached fetcher metrics.
 * Binds cache statistics to a MeterRegistry for monitoring and observability.
 *
 * <p>Exposes the following metrics, all tagged with {@code cache=<name>}:
 * <ul>
 *   <li>cache.size - Current number of entries
 *   <li>cache.inflight - Fetches currently outstanding
 *   <li>cache.hits - Calls served from a fresh entry
 *   <li>cache.stale.hits - Calls served from a stale entry during a refresh
 *   <li>cache.coalesced - Calls that joined an in-flight fetch
 *   <li>cache.misses - Calls that started a fetch
 *   <li>cache.evictions - Entries removed by cleanup sweeps
 *   <li>cache.loads - Settled fetches, tagged {@code result=all|success|failure}
 *   <li>cache.load.duration - Time spent waiting for fetchers
 *   <li>cache.hit.ratio - Fresh and stale hits over all calls (0.0 to 1.0)
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * CachedFetcherImpl<User> users = (CachedFetcherImpl<User>) CachedFetcherBuilder.<User>newBuilder()
 *     .recordStats()
 *     .build(userFetcher);
 *
 * MicrometerCacheMetrics.monitor(registry, users, "users");
 * }</pre>
 */
public class MicrometerCacheMetrics implements MeterBinder {

    private final CacheMetrics cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    /**
     * Creates a new MicrometerCacheMetrics instance.
     *
     * @param cache the cache to monitor
     * @param cacheName the name of the cache for metric tags
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerCacheMetrics(CacheMetrics cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Convenience method to monitor a cache with Micrometer.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor
     * @param cacheName the name of the cache
     * @param <C> the cache type
     * @return the cache (for chaining)
     */
    public static <C extends CacheMetrics> C monitor(MeterRegistry registry, C cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    /**
     * Convenience method to monitor a cache with Micrometer with additional tags.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor
     * @param cacheName the name of the cache
     * @param tags additional tags
     * @param <C> the cache type
     * @return the cache (for chaining)
     */
    public static <C extends CacheMetrics> C monitor(
            MeterRegistry registry, C cache, String cacheName, Iterable<Tag> tags) {
        new MicrometerCacheMetrics(cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        Gauge.builder("cache.size", cache, CacheMetrics::size)
                .tags(allTags)
                .description("Current number of entries in the cache")
                .register(registry);

        Gauge.builder("cache.inflight", cache, CacheMetrics::inFlightCount)
                .tags(allTags)
                .description("Number of fetches currently outstanding")
                .register(registry);

        FunctionCounter.builder("cache.hits", cache, CacheMetrics::hitCount)
                .tags(allTags)
                .description("Number of calls served from a fresh entry")
                .register(registry);

        FunctionCounter.builder("cache.stale.hits", cache, CacheMetrics::staleHitCount)
                .tags(allTags)
                .description("Number of calls served from a stale entry while it was refreshed")
                .register(registry);

        FunctionCounter.builder("cache.coalesced", cache, CacheMetrics::coalescedCount)
                .tags(allTags)
                .description("Number of calls that joined an in-flight fetch")
                .register(registry);

        FunctionCounter.builder("cache.misses", cache, CacheMetrics::missCount)
                .tags(allTags)
                .description("Number of calls that started a fetch")
                .register(registry);

        FunctionCounter.builder("cache.evictions", cache, CacheMetrics::evictionCount)
                .tags(allTags)
                .description("Number of expired entries removed by cleanup")
                .register(registry);

        FunctionCounter.builder("cache.loads", cache, c -> c.loadSuccessCount() + c.loadFailureCount())
                .tags(allTags.and("result", "all"))
                .description("Total number of settled fetches")
                .register(registry);

        FunctionCounter.builder("cache.loads", cache, CacheMetrics::loadSuccessCount)
                .tags(allTags.and("result", "success"))
                .description("Number of successful fetches")
                .register(registry);

        FunctionCounter.builder("cache.loads", cache, CacheMetrics::loadFailureCount)
                .tags(allTags.and("result", "failure"))
                .description("Number of failed fetches")
                .register(registry);

        FunctionTimer.builder("cache.load.duration", cache,
                        c -> c.loadSuccessCount() + c.loadFailureCount(),
                        CacheMetrics::totalLoadTimeNanos,
                        TimeUnit.NANOSECONDS)
                .tags(allTags)
                .description("Time spent waiting for fetchers")
                .register(registry);

        Gauge.builder("cache.hit.ratio", cache, c -> {
                    long served = c.hitCount() + c.staleHitCount();
                    long total = served + c.coalescedCount() + c.missCount();
                    return total == 0 ? 0.0 : (double) served / total;
                })
                .tags(allTags)
                .description("Ratio of calls answered without waiting for a fetch (0.0 to 1.0)")
                .register(registry);
    }
}

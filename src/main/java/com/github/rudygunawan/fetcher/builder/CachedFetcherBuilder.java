package com.github.rudygunawan.fetcher.builder;

import com.github.rudygunawan.fetcher.api.CachedFetcher;
import com.github.rudygunawan.fetcher.api.Fetcher;
import com.github.rudygunawan.fetcher.impl.CachedFetcherImpl;
import com.github.rudygunawan.fetcher.listener.RemovalListener;
import com.github.rudygunawan.fetcher.model.CacheStats;
import com.github.rudygunawan.fetcher.time.Ticker;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * A builder of {@link CachedFetcher} instances. Every option has a default:
 *
 * <ul>
 *   <li>{@code defaultTtl}: 60 seconds; zero or less means entries never expire automatically
 *   <li>{@code cleanInterval}: 0, no periodic cleanup
 *   <li>{@code cacheErrors}: false, failed fetches are not cached
 *   <li>{@code doubleBuffer}: false, expired entries are refetched before being returned
 *   <li>{@code fetcher}: none; every call must then supply one through its options
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * CachedFetcher<Post> posts = CachedFetcherBuilder.<Post>newBuilder()
 *     .defaultTtl(30, TimeUnit.SECONDS)
 *     .cleanInterval(1, TimeUnit.MINUTES)
 *     .doubleBuffer(true)
 *     .recordStats()
 *     .build((key, params, cache) -> client.fetchPost(key));
 * }</pre>
 *
 * @param <V> the type of fetched values
 */
public class CachedFetcherBuilder<V> {
    private static final long DEFAULT_TTL_NANOS = TimeUnit.SECONDS.toNanos(60);
    private static final int DEFAULT_CONCURRENCY_LEVEL = 16;
    private static final int MAX_CONCURRENCY_LEVEL = 1 << 16;

    private long defaultTtlNanos = DEFAULT_TTL_NANOS;
    private long cleanIntervalNanos = 0;
    private boolean cacheErrors = false;
    private boolean doubleBuffer = false;
    private boolean recordStats = false;
    private int concurrencyLevel = DEFAULT_CONCURRENCY_LEVEL;
    private Fetcher<V> fetcher;
    private Ticker ticker = Ticker.systemTicker();
    private ScheduledExecutorService scheduler;
    private RemovalListener<? super V> removalListener;

    private CachedFetcherBuilder() {
    }

    /**
     * Constructs a new {@code CachedFetcherBuilder} instance with default settings.
     */
    public static <V> CachedFetcherBuilder<V> newBuilder() {
        return new CachedFetcherBuilder<>();
    }

    /**
     * Builds a cache with default settings around {@code fetcher}.
     */
    public static <V> CachedFetcher<V> of(Fetcher<V> fetcher) {
        return CachedFetcherBuilder.<V>newBuilder().build(fetcher);
    }

    /**
     * Sets how long a committed value stays fresh. Calls may override it through
     * {@code FetchOptions}.
     *
     * <p>A duration of zero or less means committed values never expire; they stay until
     * invalidated.
     *
     * @param duration the time-to-live
     * @param unit the unit that {@code duration} is expressed in
     * @return this builder instance
     */
    public CachedFetcherBuilder<V> defaultTtl(long duration, TimeUnit unit) {
        requireUnit(unit);
        this.defaultTtlNanos = duration <= 0 ? 0 : unit.toNanos(duration);
        return this;
    }

    /**
     * Sets the interval of the periodic sweep that removes expired entries. The sweep starts when
     * the cache is built. Zero disables it.
     *
     * @param interval the delay between two sweeps
     * @param unit the unit that {@code interval} is expressed in
     * @return this builder instance
     * @throws IllegalArgumentException if {@code interval} is negative
     */
    public CachedFetcherBuilder<V> cleanInterval(long interval, TimeUnit unit) {
        requireUnit(unit);
        if (interval < 0) {
            throw new IllegalArgumentException("clean interval must not be negative");
        }
        this.cleanIntervalNanos = unit.toNanos(interval);
        return this;
    }

    /**
     * Controls whether failed fetches are cached. When enabled, the failure is replayed to
     * callers until it expires like a value would; when disabled, the next call fetches again.
     *
     * @return this builder instance
     */
    public CachedFetcherBuilder<V> cacheErrors(boolean cacheErrors) {
        this.cacheErrors = cacheErrors;
        return this;
    }

    /**
     * Sets the default for serving an expired value while it is refreshed in the background.
     * Calls may override it through {@code FetchOptions}.
     *
     * @return this builder instance
     */
    public CachedFetcherBuilder<V> doubleBuffer(boolean doubleBuffer) {
        this.doubleBuffer = doubleBuffer;
        return this;
    }

    /**
     * Sets the fetcher used when a call does not supply its own.
     *
     * @return this builder instance
     */
    public CachedFetcherBuilder<V> fetcher(Fetcher<V> fetcher) {
        if (fetcher == null) {
            throw new NullPointerException("fetcher cannot be null");
        }
        this.fetcher = fetcher;
        return this;
    }

    /**
     * Guides the number of lock stripes guarding per-key decisions. Keys hashing to the same
     * stripe serialize their lookups and commits; fetchers never run under a stripe lock. The
     * value is rounded up to a power of two.
     *
     * <p>This option is not required; by default the concurrency level is 16.
     *
     * @param concurrencyLevel the concurrency level
     * @return this builder instance
     * @throws IllegalArgumentException if {@code concurrencyLevel} is not positive
     */
    public CachedFetcherBuilder<V> concurrencyLevel(int concurrencyLevel) {
        if (concurrencyLevel <= 0) {
            throw new IllegalArgumentException("concurrency level must be positive");
        }
        this.concurrencyLevel = concurrencyLevel;
        return this;
    }

    /**
     * Specifies the time source for expiry deadlines. Mostly useful in tests.
     *
     * @return this builder instance
     */
    public CachedFetcherBuilder<V> ticker(Ticker ticker) {
        if (ticker == null) {
            throw new NullPointerException("ticker cannot be null");
        }
        this.ticker = ticker;
        return this;
    }

    /**
     * Specifies the scheduler that runs the periodic sweep.
     *
     * <p>By default the cache creates a single daemon thread when the cleaner first starts and
     * shuts it down on {@code close()}. A scheduler passed here is not shut down by the cache and
     * must stay running for as long as the cleaner is used.
     *
     * @return this builder instance
     */
    public CachedFetcherBuilder<V> scheduler(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new NullPointerException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
        return this;
    }

    /**
     * Enables the accumulation of {@link CacheStats}. Without this, {@code stats()} returns zero
     * for all counters.
     *
     * @return this builder instance
     */
    public CachedFetcherBuilder<V> recordStats() {
        this.recordStats = true;
        return this;
    }

    /**
     * Specifies a listener notified whenever a committed entry is invalidated, expires or is
     * replaced by a newer fetch.
     *
     * @return this builder instance
     */
    public CachedFetcherBuilder<V> removalListener(RemovalListener<? super V> listener) {
        if (listener == null) {
            throw new NullPointerException("removal listener cannot be null");
        }
        this.removalListener = listener;
        return this;
    }

    /**
     * Builds a cache with the configured fetcher, if any.
     */
    public CachedFetcher<V> build() {
        return new CachedFetcherImpl<>(this);
    }

    /**
     * Builds a cache that uses {@code fetcher} by default.
     */
    public CachedFetcher<V> build(Fetcher<V> fetcher) {
        return fetcher(fetcher).build();
    }

    private static void requireUnit(TimeUnit unit) {
        if (unit == null) {
            throw new NullPointerException("unit cannot be null");
        }
    }

    public long getDefaultTtlNanos() {
        return defaultTtlNanos;
    }

    public long getCleanIntervalNanos() {
        return cleanIntervalNanos;
    }

    public boolean isCachingErrors() {
        return cacheErrors;
    }

    public boolean isDoubleBuffering() {
        return doubleBuffer;
    }

    public boolean isRecordingStats() {
        return recordStats;
    }

    /**
     * Returns the concurrency level rounded up to a power of two.
     */
    public int getConcurrencyLevel() {
        int level = Math.min(concurrencyLevel, MAX_CONCURRENCY_LEVEL);
        return level == 1 ? 1 : Integer.highestOneBit(level - 1) << 1;
    }

    public Fetcher<V> getFetcher() {
        return fetcher;
    }

    public Ticker getTicker() {
        return ticker;
    }

    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    public RemovalListener<? super V> getRemovalListener() {
        return removalListener;
    }
}

package com.github.rudygunawan.fetcher.impl;

import com.github.rudygunawan.fetcher.api.CachedFetcher;
import com.github.rudygunawan.fetcher.api.FetchOptions;
import com.github.rudygunawan.fetcher.api.Fetcher;
import com.github.rudygunawan.fetcher.api.MissingFetcherException;
import com.github.rudygunawan.fetcher.builder.CachedFetcherBuilder;
import com.github.rudygunawan.fetcher.listener.RemovalListener;
import com.github.rudygunawan.fetcher.metrics.CacheMetrics;
import com.github.rudygunawan.fetcher.model.CacheStats;
import com.github.rudygunawan.fetcher.model.FetchEntry;
import com.github.rudygunawan.fetcher.policy.RemovalCause;
import com.github.rudygunawan.fetcher.time.Ticker;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Concurrent {@link CachedFetcher} with single-flight fetching, TTL expiry, optional error caching
 * and stale-while-revalidate serving.
 *
 * <p>Every decision for a key (join, serve, start a fetch) and every commit runs under the lock of
 * the key's stripe, so at most one fetch per key is ever outstanding. Fetchers are invoked and
 * waiters are completed outside the lock.
 *
 * <p>Logging: This class uses java.util.logging. Logger name:
 * "com.github.rudygunawan.fetcher.CachedFetcher".
 * <ul>
 *   <li>WARNING: removal listener failures (operations continue)</li>
 *   <li>FINE: fetch start, commit and failure</li>
 *   <li>FINER: hits, stale hits and joined fetches</li>
 * </ul>
 *
 * @param <V> the type of fetched values
 */
public class CachedFetcherImpl<V> implements CachedFetcher<V>, CacheMetrics {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.fetcher.CachedFetcher");

    private final ConcurrentHashMap<String, FetchEntry<V>> entries;
    private final ReentrantLock[] locks;
    private final Fetcher<V> defaultFetcher;
    private final long defaultTtlNanos;
    private final long cleanIntervalNanos;
    private final boolean cacheErrors;
    private final boolean doubleBuffer;
    private final boolean recordStats;
    private final Ticker ticker;
    private final RemovalListener<? super V> removalListener;
    private final CacheCleaner cleaner;

    // Statistics
    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong staleHitCount = new AtomicLong(0);
    private final AtomicLong coalescedCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);
    private final AtomicLong loadSuccessCount = new AtomicLong(0);
    private final AtomicLong loadFailureCount = new AtomicLong(0);
    private final AtomicLong totalLoadTime = new AtomicLong(0);
    private final AtomicLong evictionCount = new AtomicLong(0);
    private final AtomicLong inFlightCount = new AtomicLong(0);

    public CachedFetcherImpl(CachedFetcherBuilder<V> builder) {
        int stripes = builder.getConcurrencyLevel();
        this.entries = new ConcurrentHashMap<>(16, 0.75f, stripes);
        this.locks = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            locks[i] = new ReentrantLock();
        }
        this.defaultFetcher = builder.getFetcher();
        this.defaultTtlNanos = builder.getDefaultTtlNanos();
        this.cleanIntervalNanos = builder.getCleanIntervalNanos();
        this.cacheErrors = builder.isCachingErrors();
        this.doubleBuffer = builder.isDoubleBuffering();
        this.recordStats = builder.isRecordingStats();
        this.ticker = builder.getTicker();
        this.removalListener = builder.getRemovalListener();
        this.cleaner = new CacheCleaner(this::clean, builder.getScheduler());

        if (cleanIntervalNanos > 0) {
            startCleaner();
        }
    }

    @Override
    public CompletableFuture<V> get(String key) {
        return get(key, FetchOptions.defaults());
    }

    @Override
    public CompletableFuture<V> get(String key, FetchOptions<V> options) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(options, "options cannot be null");

        // Only needed when a fetch has to start; joins and hits work without one
        Fetcher<V> fetcher = options.getFetcher() != null ? options.getFetcher() : defaultFetcher;
        boolean serveStale = options.getDoubleBuffer() != null ? options.getDoubleBuffer() : doubleBuffer;

        FetchEntry<V> started = null;
        FetchEntry<V> stale = null;
        FetchEntry<V> displaced = null;
        CompletableFuture<V> result;

        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            long now = ticker.read();
            FetchEntry<V> current = entries.get(key);

            if (current != null && current.isFetching()) {
                if (recordStats) coalescedCount.incrementAndGet();
                if (LOGGER.isLoggable(Level.FINER)) {
                    LOGGER.finer("Joined in-flight fetch: key=" + key + ", waiters=" + (current.waiterCount() + 1));
                }
                return current.addWaiter();
            }

            if (current != null && !current.isExpired(now)) {
                if (recordStats) hitCount.incrementAndGet();
                if (LOGGER.isLoggable(Level.FINER)) {
                    LOGGER.finer("Cache hit: key=" + key);
                }
                return current.toFuture();
            }

            if (current != null && serveStale) {
                // The stale entry stays mapped until its replacement commits
                if (current.getRefresh() == null && fetcher == null) {
                    return CompletableFuture.failedFuture(new MissingFetcherException(key));
                }
                if (recordStats) staleHitCount.incrementAndGet();
                if (current.getRefresh() == null) {
                    started = FetchEntry.inFlight(now);
                    current.setRefresh(started);
                    stale = current;
                }
                if (LOGGER.isLoggable(Level.FINER)) {
                    LOGGER.finer("Serving stale entry: key=" + key + ", refreshStarted=" + (started != null));
                }
                result = current.toFuture();
            } else if (current != null && current.getRefresh() != null) {
                if (recordStats) coalescedCount.incrementAndGet();
                if (LOGGER.isLoggable(Level.FINER)) {
                    LOGGER.finer("Joined background refresh: key=" + key);
                }
                return current.getRefresh().addWaiter();
            } else {
                if (fetcher == null) {
                    return CompletableFuture.failedFuture(new MissingFetcherException(key));
                }
                if (recordStats) missCount.incrementAndGet();
                started = FetchEntry.inFlight(now);
                result = started.addWaiter();
                displaced = entries.put(key, started);
            }
        } finally {
            lock.unlock();
        }

        if (displaced != null) {
            fireRemovalEvent(key, displaced, RemovalCause.REPLACED);
        }
        if (started != null) {
            invoke(key, options, fetcher, started, stale);
        }
        return result;
    }

    private void invoke(String key, FetchOptions<V> options, Fetcher<V> fetcher,
                        FetchEntry<V> entry, FetchEntry<V> stale) {
        long ttlNanos = options.hasTtl() ? options.getTtlNanos() : defaultTtlNanos;
        inFlightCount.incrementAndGet();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine((stale != null ? "Refreshing stale entry in background: key=" : "Fetching: key=") + key);
        }

        CompletableFuture<V> future;
        try {
            future = fetcher.fetch(key, options.getParams(), this);
            if (future == null) {
                throw new NullPointerException("fetcher returned null instead of a future for key: " + key);
            }
        } catch (Throwable t) {
            // A fetcher that throws must still settle its waiters
            commit(key, entry, stale, ttlNanos, null, t);
            return;
        }
        future.whenComplete((value, error) -> commit(key, entry, stale, ttlNanos, value, error));
    }

    /**
     * Records the outcome of a fetch, applies the caching policy and completes the waiters. Runs
     * exactly once per fetch.
     */
    private void commit(String key, FetchEntry<V> entry, FetchEntry<V> stale, long ttlNanos,
                        V value, Throwable error) {
        Throwable failure = error == null ? null : unwrap(error);
        List<CompletableFuture<V>> waiters;
        FetchEntry<V> removed = null;
        RemovalCause removalCause = null;
        long loadTime;

        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            long now = ticker.read();
            if (failure != null) {
                entry.fail(failure);
            } else {
                entry.succeed(value);
            }
            waiters = entry.commit(now, ttlNanos);
            loadTime = now - entry.getCreatedAt();
            if (stale != null) {
                stale.setRefresh(null);
            }

            // Invalidated while fetching: deliver but do not cache
            FetchEntry<V> current = entries.get(key);
            boolean owned = current == entry || (stale != null && current == stale);
            if (owned) {
                if (failure == null || cacheErrors) {
                    entries.put(key, entry);
                    if (stale != null) {
                        removed = stale;
                        removalCause = RemovalCause.REPLACED;
                    }
                } else {
                    entries.remove(key);
                    if (stale != null) {
                        removed = stale;
                        removalCause = RemovalCause.EXPIRED;
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        inFlightCount.decrementAndGet();

        if (recordStats) {
            if (failure == null) {
                loadSuccessCount.incrementAndGet();
            } else {
                loadFailureCount.incrementAndGet();
            }
            totalLoadTime.addAndGet(Math.max(0, loadTime));
        }
        if (failure != null) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.log(Level.FINE, "Fetch failed: key=" + key + ", waiters=" + waiters.size()
                        + ", cached=" + cacheErrors, failure);
            }
        } else if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Fetch committed: key=" + key + ", waiters=" + waiters.size()
                    + ", loadTime=" + TimeUnit.NANOSECONDS.toMillis(loadTime) + "ms");
        }

        if (removed != null) {
            fireRemovalEvent(key, removed, removalCause);
        }
        entry.deliver(waiters);
    }

    @Override
    public void invalidate(String key) {
        Objects.requireNonNull(key, "key cannot be null");

        FetchEntry<V> removed;
        boolean committed;
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            removed = entries.remove(key);
            committed = removed != null && !removed.isFetching();
        } finally {
            lock.unlock();
        }
        if (committed) {
            fireRemovalEvent(key, removed, RemovalCause.EXPLICIT);
        }
    }

    @Override
    public void invalidateAll() {
        // Snapshot so concurrent inserts do not extend the iteration
        List<String> keys = new ArrayList<>(entries.keySet());
        for (String key : keys) {
            invalidate(key);
        }
    }

    @Override
    public void clean() {
        long now = ticker.read();
        int removedCount = 0;

        for (String key : entries.keySet()) {
            FetchEntry<V> expired = null;
            ReentrantLock lock = lockFor(key);
            lock.lock();
            try {
                FetchEntry<V> entry = entries.get(key);
                // A stale entry with a refresh running is swapped by that refresh
                if (entry != null && entry.isExpired(now) && entry.getRefresh() == null) {
                    entries.remove(key);
                    expired = entry;
                }
            } finally {
                lock.unlock();
            }
            if (expired != null) {
                removedCount++;
                if (recordStats) evictionCount.incrementAndGet();
                fireRemovalEvent(key, expired, RemovalCause.EXPIRED);
            }
        }

        if (removedCount > 0 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Removed expired entries: count=" + removedCount + ", size=" + entries.size());
        }
    }

    @Override
    public void startCleaner() {
        cleaner.start(cleanIntervalNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void startCleaner(long interval, TimeUnit unit) {
        cleaner.start(interval, unit);
    }

    @Override
    public void stopCleaner() {
        cleaner.stop();
    }

    @Override
    public boolean isCleanerRunning() {
        return cleaner.isRunning();
    }

    @Override
    public long size() {
        return entries.size();
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(
                hitCount.get(),
                staleHitCount.get(),
                coalescedCount.get(),
                missCount.get(),
                loadSuccessCount.get(),
                loadFailureCount.get(),
                totalLoadTime.get(),
                evictionCount.get()
        );
    }

    @Override
    public void close() {
        cleaner.close();
    }

    // Helper methods

    private ReentrantLock lockFor(String key) {
        int h = key.hashCode();
        h ^= (h >>> 16);
        return locks[h & (locks.length - 1)];
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private void fireRemovalEvent(String key, FetchEntry<V> entry, RemovalCause cause) {
        if (removalListener != null) {
            try {
                removalListener.onRemoval(key, entry.getValue(), cause);
            } catch (Exception e) {
                // Log and swallow exceptions from listener
                LOGGER.log(Level.WARNING, "RemovalListener threw exception for key: " + key +
                          ", cause: " + cause, e);
            }
        }
    }

    // CacheMetrics interface implementation for Micrometer integration

    @Override
    public long inFlightCount() {
        return inFlightCount.get();
    }

    @Override
    public long hitCount() {
        return hitCount.get();
    }

    @Override
    public long staleHitCount() {
        return staleHitCount.get();
    }

    @Override
    public long coalescedCount() {
        return coalescedCount.get();
    }

    @Override
    public long missCount() {
        return missCount.get();
    }

    @Override
    public long evictionCount() {
        return evictionCount.get();
    }

    @Override
    public long loadSuccessCount() {
        return loadSuccessCount.get();
    }

    @Override
    public long loadFailureCount() {
        return loadFailureCount.get();
    }

    @Override
    public long totalLoadTimeNanos() {
        return totalLoadTime.get();
    }

    @Override
    public String toString() {
        return "CachedFetcher{size=" + entries.size()
                + ", inFlight=" + inFlightCount.get()
                + ", defaultTtl=" + TimeUnit.NANOSECONDS.toMillis(defaultTtlNanos) + "ms"
                + ", cacheErrors=" + cacheErrors
                + ", doubleBuffer=" + doubleBuffer
                + '}';
    }
}

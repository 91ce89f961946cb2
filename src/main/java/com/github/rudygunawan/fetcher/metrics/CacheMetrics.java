package com.github.rudygunawan.fetcher.metrics;

/**
 * Interface for cached fetcher implementations to provide metrics data.
 * This is used by MicrometerCacheMetrics to collect and expose metrics.
 */
public interface CacheMetrics {

    /**
     * Returns the current number of entries, including in-flight placeholders.
     */
    long size();

    /**
     * Returns the number of fetches currently outstanding, background refreshes included.
     */
    long inFlightCount();

    /**
     * Returns the total number of calls served from a fresh entry.
     */
    long hitCount();

    /**
     * Returns the total number of calls served from a stale entry during a refresh.
     */
    long staleHitCount();

    /**
     * Returns the total number of calls that joined an in-flight fetch.
     */
    long coalescedCount();

    /**
     * Returns the total number of calls that started a fetch.
     */
    long missCount();

    /**
     * Returns the total number of entries removed by cleanup sweeps.
     */
    long evictionCount();

    long loadSuccessCount();

    long loadFailureCount();

    /**
     * Returns the total time spent waiting for fetchers in nanoseconds.
     */
    long totalLoadTimeNanos();
}

package com.github.rudygunawan.fetcher.model;

import java.util.Objects;

/**
 * Statistics about the performance of a cached fetcher. Instances of this class are immutable.
 *
 * <p>Every {@code get} call is counted exactly once, under one of these outcomes:
 *
 * <ul>
 *   <li>served a fresh committed entry: {@code hitCount} is incremented.
 *   <li>served an expired entry while it is refreshed in the background: {@code staleHitCount}
 *       is incremented.
 *   <li>joined a fetch already in flight for the key: {@code coalescedCount} is incremented.
 *   <li>started a new fetch: {@code missCount} is incremented.
 * </ul>
 *
 * <p>Each settled fetch, including background refreshes, increments {@code loadSuccessCount} or
 * {@code loadFailureCount} and adds its duration to {@code totalLoadTime}. Entries removed by a
 * cleanup sweep increment {@code evictionCount}.
 */
public class CacheStats {
    private final long hitCount;
    private final long staleHitCount;
    private final long coalescedCount;
    private final long missCount;
    private final long loadSuccessCount;
    private final long loadFailureCount;
    private final long totalLoadTime;
    private final long evictionCount;

    /**
     * Constructs a new {@code CacheStats} instance.
     */
    public CacheStats(
            long hitCount,
            long staleHitCount,
            long coalescedCount,
            long missCount,
            long loadSuccessCount,
            long loadFailureCount,
            long totalLoadTime,
            long evictionCount) {
        this.hitCount = hitCount;
        this.staleHitCount = staleHitCount;
        this.coalescedCount = coalescedCount;
        this.missCount = missCount;
        this.loadSuccessCount = loadSuccessCount;
        this.loadFailureCount = loadFailureCount;
        this.totalLoadTime = totalLoadTime;
        this.evictionCount = evictionCount;
    }

    /**
     * Returns a {@code CacheStats} with all counters at zero.
     */
    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Returns the number of {@code get} calls, across all outcomes.
     */
    public long requestCount() {
        return hitCount + staleHitCount + coalescedCount + missCount;
    }

    /**
     * Returns the number of calls answered from a fresh committed entry.
     */
    public long hitCount() {
        return hitCount;
    }

    /**
     * Returns the number of calls answered from a stale entry while it was being refreshed.
     */
    public long staleHitCount() {
        return staleHitCount;
    }

    /**
     * Returns the number of calls that joined a fetch already in flight instead of starting one.
     */
    public long coalescedCount() {
        return coalescedCount;
    }

    /**
     * Returns the number of calls that started a new fetch.
     */
    public long missCount() {
        return missCount;
    }

    /**
     * Returns the ratio of calls answered without waiting for a fetch: fresh and stale hits over
     * {@code requestCount}, or {@code 1.0} when there were no requests.
     */
    public double hitRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 1.0 : (double) (hitCount + staleHitCount) / requestCount;
    }

    /**
     * Returns the ratio of calls that started a fetch, or {@code 0.0} when there were no
     * requests.
     */
    public double missRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 0.0 : (double) missCount / requestCount;
    }

    /**
     * Returns the total number of settled fetches, successful or not.
     */
    public long loadCount() {
        return loadSuccessCount + loadFailureCount;
    }

    public long loadSuccessCount() {
        return loadSuccessCount;
    }

    public long loadFailureCount() {
        return loadFailureCount;
    }

    /**
     * Returns the ratio of fetches that failed, or {@code 0.0} when nothing was fetched.
     */
    public double loadFailureRate() {
        long totalLoadCount = loadSuccessCount + loadFailureCount;
        return (totalLoadCount == 0) ? 0.0 : (double) loadFailureCount / totalLoadCount;
    }

    /**
     * Returns the total number of nanoseconds spent waiting for fetchers.
     */
    public long totalLoadTime() {
        return totalLoadTime;
    }

    /**
     * Returns the average fetch duration in nanoseconds.
     */
    public double averageLoadPenalty() {
        long totalLoadCount = loadSuccessCount + loadFailureCount;
        return (totalLoadCount == 0) ? 0.0 : (double) totalLoadTime / totalLoadCount;
    }

    /**
     * Returns the number of entries removed by cleanup sweeps.
     */
    public long evictionCount() {
        return evictionCount;
    }

    /**
     * Returns a new {@code CacheStats} representing the difference between this {@code CacheStats}
     * and {@code other}. Negative differences are rounded up to zero.
     */
    public CacheStats minus(CacheStats other) {
        return new CacheStats(
                Math.max(0, hitCount - other.hitCount),
                Math.max(0, staleHitCount - other.staleHitCount),
                Math.max(0, coalescedCount - other.coalescedCount),
                Math.max(0, missCount - other.missCount),
                Math.max(0, loadSuccessCount - other.loadSuccessCount),
                Math.max(0, loadFailureCount - other.loadFailureCount),
                Math.max(0, totalLoadTime - other.totalLoadTime),
                Math.max(0, evictionCount - other.evictionCount));
    }

    /**
     * Returns a new {@code CacheStats} representing the sum of this {@code CacheStats} and
     * {@code other}.
     */
    public CacheStats plus(CacheStats other) {
        return new CacheStats(
                hitCount + other.hitCount,
                staleHitCount + other.staleHitCount,
                coalescedCount + other.coalescedCount,
                missCount + other.missCount,
                loadSuccessCount + other.loadSuccessCount,
                loadFailureCount + other.loadFailureCount,
                totalLoadTime + other.totalLoadTime,
                evictionCount + other.evictionCount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hitCount, staleHitCount, coalescedCount, missCount,
                loadSuccessCount, loadFailureCount, totalLoadTime, evictionCount);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheStats)) {
            return false;
        }
        CacheStats other = (CacheStats) obj;
        return hitCount == other.hitCount
                && staleHitCount == other.staleHitCount
                && coalescedCount == other.coalescedCount
                && missCount == other.missCount
                && loadSuccessCount == other.loadSuccessCount
                && loadFailureCount == other.loadFailureCount
                && totalLoadTime == other.totalLoadTime
                && evictionCount == other.evictionCount;
    }

    @Override
    public String toString() {
        return "CacheStats{"
                + "hitCount=" + hitCount
                + ", staleHitCount=" + staleHitCount
                + ", coalescedCount=" + coalescedCount
                + ", missCount=" + missCount
                + ", loadSuccessCount=" + loadSuccessCount
                + ", loadFailureCount=" + loadFailureCount
                + ", totalLoadTime=" + totalLoadTime
                + ", evictionCount=" + evictionCount
                + ", hitRate=" + String.format("%.2f%%", hitRate() * 100)
                + '}';
    }
}

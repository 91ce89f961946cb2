package com.github.rudygunawan.fetcher.api;

import com.github.rudygunawan.fetcher.model.CacheStats;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * A cache that memoizes the result of an asynchronous {@link Fetcher} per key, with time-based
 * expiry, at most one fetch in flight per key, and optional stale-while-revalidate serving.
 *
 * <p>Implementations of this interface are thread-safe.
 *
 * <p><b>Example usage:</b>
 * <pre>{@code
 * CachedFetcher<Post> posts = CachedFetcherBuilder.<Post>newBuilder()
 *     .defaultTtl(1, TimeUnit.MINUTES)
 *     .cleanInterval(5, TimeUnit.MINUTES)
 *     .build((key, params, cache) -> client.fetchPost(key));
 *
 * // Ten concurrent callers, one request to the backend
 * List<CompletableFuture<Post>> results = IntStream.range(0, 10)
 *     .mapToObj(i -> posts.get("123"))
 *     .collect(Collectors.toList());
 * }</pre>
 *
 * <p>Callers that arrive while a fetch for the key is in flight share that fetch and all observe
 * the same value, or the same exception, in the order they called. A fetch cannot be cancelled;
 * cancelling a returned future only detaches that caller.
 *
 * @param <V> the type of fetched values
 * @since 1.0.0
 */
public interface CachedFetcher<V> extends AutoCloseable {

    /**
     * Returns the value for {@code key} using the cache configuration.
     *
     * @see #get(String, FetchOptions)
     */
    CompletableFuture<V> get(String key);

    /**
     * Returns the value for {@code key}, fetching it if necessary.
     *
     * <p>The call is answered in one of these ways:
     * <ol>
     *   <li>a fetch for the key is in flight: the call joins it;
     *   <li>the committed entry is fresh: its value is returned, or its cached error rethrown;
     *   <li>the committed entry is stale and double buffering is in effect: the stale outcome is
     *       returned immediately and a single background refresh is started;
     *   <li>otherwise a new fetch is started.
     * </ol>
     *
     * <p>If neither the options nor the cache supply a fetcher the returned future fails with a
     * {@link MissingFetcherException} and nothing is cached.
     *
     * @param key the key whose value is to be returned
     * @param options per-call overrides
     * @return a future of the value associated with {@code key}
     * @throws NullPointerException if {@code key} or {@code options} is null
     */
    CompletableFuture<V> get(String key, FetchOptions<V> options);

    /**
     * Removes the entry for {@code key} whatever its state. Callers already waiting on an
     * in-flight fetch still receive its outcome, but that outcome is not cached.
     */
    void invalidate(String key);

    /**
     * Removes every entry.
     */
    void invalidateAll();

    /**
     * Removes all committed entries whose expiry deadline has passed.
     */
    void clean();

    /**
     * (Re)starts the periodic cleanup with the configured clean interval. Does nothing beyond
     * stopping a running cleaner when that interval is zero.
     */
    void startCleaner();

    /**
     * (Re)starts the periodic cleanup with the given interval. An interval of zero or less stops
     * the cleaner.
     */
    void startCleaner(long interval, TimeUnit unit);

    /**
     * Stops the periodic cleanup. No-op when it is not running.
     */
    void stopCleaner();

    /**
     * Returns true while the periodic cleanup is scheduled.
     */
    boolean isCleanerRunning();

    /**
     * Returns the number of entries, including placeholders of fetches in flight.
     */
    long size();

    /**
     * Returns a snapshot of this cache's statistics. All counters are zero unless statistics
     * recording was enabled on the builder.
     */
    CacheStats stats();

    /**
     * Stops the cleaner and releases the scheduler if the cache created it. Cached entries stay
     * readable.
     */
    @Override
    void close();
}

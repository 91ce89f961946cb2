package com.github.rudygunawan.fetcher.listener;

import com.github.rudygunawan.fetcher.policy.RemovalCause;

/**
 * A listener that receives notification when a committed entry is removed from a cached
 * fetcher.
 *
 * <p>Only committed entries are reported. An in-flight placeholder that is invalidated has no
 * value yet and produces no notification. For a removed cached failure {@code value} is
 * {@code null}.
 *
 * <pre>{@code
 * CachedFetcher<Quote> quotes = CachedFetcherBuilder.<Quote>newBuilder()
 *     .removalListener((key, quote, cause) -> log.info(key + " removed: " + cause))
 *     .build(quoteFetcher);
 * }</pre>
 *
 * @param <V> the type of values
 */
@FunctionalInterface
public interface RemovalListener<V> {

    /**
     * Notifies the listener that a removal occurred.
     *
     * <p>Called synchronously on the thread that performed the removal, so implementations
     * should be fast and non-blocking. Exceptions are logged and otherwise ignored.
     *
     * @param key the key of the removed entry
     * @param value the value of the removed entry, or {@code null} for a cached failure
     * @param cause the reason for the removal
     */
    void onRemoval(String key, V value, RemovalCause cause);
}

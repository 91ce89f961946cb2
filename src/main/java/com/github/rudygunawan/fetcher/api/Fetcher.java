package com.github.rudygunawan.fetcher.api;

import java.util.concurrent.CompletableFuture;

/**
 * Produces the value for a key asynchronously, for use in populating a {@link CachedFetcher}.
 *
 * <p><b>Example usage:</b>
 * <pre>{@code
 * Fetcher<Post> posts = (key, params, cache) ->
 *     httpClient.sendAsync(request("/posts/" + key), BodyHandlers.ofString())
 *         .thenApply(response -> parsePost(response.body()));
 * }</pre>
 *
 * <p>The returned future must eventually settle. A fetcher that throws, or returns {@code null}
 * instead of a future, is treated as a failed fetch and the failure is delivered to every caller
 * waiting on the key.
 *
 * <p><b>Reentrancy:</b> the {@code cache} argument may be used to fetch <i>other</i> keys, for
 * example to resolve a dependency. Calling {@code cache.get} for the key currently being fetched
 * is not allowed: the call joins the fetch it is part of and never completes before it.
 *
 * @param <V> the type of values
 * @since 1.0.0
 */
@FunctionalInterface
public interface Fetcher<V> {

    /**
     * Asynchronously computes or retrieves the value corresponding to {@code key}.
     *
     * @param key the non-null key whose value should be fetched
     * @param params the opaque value passed through from {@link FetchOptions#getParams()}, possibly
     *     {@code null}
     * @param cache the cache that issued this fetch
     * @return a future that completes with the fetched value
     * @throws Exception if the fetch cannot be started
     */
    CompletableFuture<V> fetch(String key, Object params, CachedFetcher<V> cache) throws Exception;
}

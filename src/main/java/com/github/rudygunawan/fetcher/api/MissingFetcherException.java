package com.github.rudygunawan.fetcher.api;

/**
 * Signals that a value had to be fetched but neither the cache nor the call supplied a
 * {@link Fetcher}.
 */
public class MissingFetcherException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public MissingFetcherException(String key) {
        super("No fetcher configured for key: " + key
                + " (set one on the builder or pass it in FetchOptions)");
        this.key = key;
    }

    /**
     * Returns the key of the rejected request.
     */
    public String getKey() {
        return key;
    }
}

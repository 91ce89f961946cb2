package com.github.rudygunawan.fetcher.api;

import java.util.concurrent.TimeUnit;

/**
 * Per-call options for {@link CachedFetcher#get(String, FetchOptions)}. Instances are immutable;
 * create them with {@link #builder()}.
 *
 * <pre>{@code
 * FetchOptions<Quote> options = FetchOptions.<Quote>builder()
 *     .ttl(5, TimeUnit.SECONDS)
 *     .doubleBuffer(true)
 *     .params(Map.of("region", "SG"))
 *     .build();
 * CompletableFuture<Quote> quote = quotes.get("D05", options);
 * }</pre>
 *
 * <p>Every option is optional. Unset options fall back to the cache configuration.
 *
 * @param <V> the type of values
 * @since 1.0.0
 */
public final class FetchOptions<V> {
    private static final FetchOptions<Object> DEFAULTS = new FetchOptions<>(new Builder<>());

    private final boolean ttlSet;
    private final long ttlNanos;
    private final Boolean doubleBuffer;
    private final Object params;
    private final Fetcher<V> fetcher;

    private FetchOptions(Builder<V> builder) {
        this.ttlSet = builder.ttlSet;
        this.ttlNanos = builder.ttlNanos;
        this.doubleBuffer = builder.doubleBuffer;
        this.params = builder.params;
        this.fetcher = builder.fetcher;
    }

    /**
     * Returns options with nothing set.
     */
    @SuppressWarnings("unchecked")
    public static <V> FetchOptions<V> defaults() {
        return (FetchOptions<V>) DEFAULTS;
    }

    public static <V> Builder<V> builder() {
        return new Builder<>();
    }

    /**
     * Returns true if this call overrides the cache's default time-to-live.
     */
    public boolean hasTtl() {
        return ttlSet;
    }

    /**
     * Returns the time-to-live override in nanoseconds. Only meaningful when {@link #hasTtl()}.
     */
    public long getTtlNanos() {
        return ttlNanos;
    }

    /**
     * Returns the double buffering override, or {@code null} to use the cache default.
     */
    public Boolean getDoubleBuffer() {
        return doubleBuffer;
    }

    public Object getParams() {
        return params;
    }

    /**
     * Returns the fetcher override, or {@code null} to use the cache default.
     */
    public Fetcher<V> getFetcher() {
        return fetcher;
    }

    @Override
    public String toString() {
        return "FetchOptions{"
                + "ttl=" + (ttlSet ? ttlNanos + "ns" : "default")
                + ", doubleBuffer=" + (doubleBuffer == null ? "default" : doubleBuffer)
                + ", params=" + params
                + ", fetcher=" + (fetcher == null ? "default" : "custom")
                + '}';
    }

    /**
     * Builder of {@link FetchOptions}.
     *
     * @param <V> the type of values
     */
    public static final class Builder<V> {
        private boolean ttlSet;
        private long ttlNanos;
        private Boolean doubleBuffer;
        private Object params;
        private Fetcher<V> fetcher;

        private Builder() {
        }

        /**
         * Overrides the time-to-live of the value committed by this call's fetch. A duration of
         * zero or less means the value never expires automatically.
         *
         * @param duration the time-to-live
         * @param unit the unit that {@code duration} is expressed in
         * @return this builder instance
         */
        public Builder<V> ttl(long duration, TimeUnit unit) {
            if (unit == null) {
                throw new NullPointerException("unit cannot be null");
            }
            this.ttlSet = true;
            this.ttlNanos = duration <= 0 ? 0 : unit.toNanos(duration);
            return this;
        }

        /**
         * Enables or disables serving a stale value while it is refreshed in the background, for
         * this call only.
         *
         * @return this builder instance
         */
        public Builder<V> doubleBuffer(boolean doubleBuffer) {
            this.doubleBuffer = doubleBuffer;
            return this;
        }

        /**
         * Sets the opaque value handed to the fetcher.
         *
         * @return this builder instance
         */
        public Builder<V> params(Object params) {
            this.params = params;
            return this;
        }

        /**
         * Overrides the cache's fetcher for this call.
         *
         * @return this builder instance
         */
        public Builder<V> fetcher(Fetcher<V> fetcher) {
            if (fetcher == null) {
                throw new NullPointerException("fetcher cannot be null");
            }
            this.fetcher = fetcher;
            return this;
        }

        public FetchOptions<V> build() {
            return new FetchOptions<>(this);
        }
    }
}

package com.github.rudygunawan.fetcher.time;

/**
 * A time source that returns the current time in nanoseconds.
 *
 * <p>Expiry deadlines of fetched entries are measured against this source. Tests can supply a
 * ticker they control to exercise TTL behaviour without sleeping.
 *
 * <pre>{@code
 * CachedFetcher<User> users = CachedFetcherBuilder.<User>newBuilder()
 *     .ticker(Ticker.systemTicker())
 *     .defaultTtl(10, TimeUnit.MINUTES)
 *     .build(userFetcher);
 * }</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the number of nanoseconds elapsed since some fixed but arbitrary point in time.
     *
     * <p>Values must behave like {@link System#nanoTime()}: monotonic and unrelated to wall-clock
     * time.
     *
     * @return the number of nanoseconds elapsed since some arbitrary point in time
     */
    long read();

    /**
     * Returns a ticker that reads the current time using {@link System#nanoTime()}.
     *
     * @return the default system ticker
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    /**
     * Default system ticker implementation using System.nanoTime().
     */
    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}

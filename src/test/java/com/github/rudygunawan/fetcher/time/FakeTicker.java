package com.github.rudygunawan.fetcher.time;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A fake {@link Ticker} for testing expiry without waiting for wall-clock time to pass.
 *
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 * CachedFetcher<String> cache = CachedFetcherBuilder.<String>newBuilder()
 *     .ticker(ticker)
 *     .defaultTtl(10, TimeUnit.MINUTES)
 *     .build(fetcher);
 *
 * cache.get("k").join();
 * ticker.advance(11, TimeUnit.MINUTES);
 * cache.get("k").join(); // fetched again
 * }</pre>
 *
 * <p>This class is thread-safe and can be used in concurrent tests.
 */
public class FakeTicker implements Ticker {

    private final AtomicLong nanos = new AtomicLong(0);

    /**
     * Advances the ticker by the specified duration. Negative durations are ignored.
     *
     * @return this ticker, for method chaining
     */
    public FakeTicker advance(long duration, TimeUnit unit) {
        return advance(unit.toNanos(duration));
    }

    /**
     * Advances the ticker by the specified number of nanoseconds. Negative values are ignored.
     *
     * @return this ticker, for method chaining
     */
    public FakeTicker advance(long nanoseconds) {
        if (nanoseconds > 0) {
            nanos.addAndGet(nanoseconds);
        }
        return this;
    }

    @Override
    public long read() {
        return nanos.get();
    }

    @Override
    public String toString() {
        return "FakeTicker(" + nanos.get() + " ns)";
    }
}

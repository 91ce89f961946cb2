package com.github.rudygunawan.fetcher.model;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Per-key state of a cached fetcher: the committed outcome of the last fetch, its expiry
 * deadline and, while a fetch is outstanding, the callers waiting for it.
 *
 * <p>An entry starts out <i>in flight</i> and is committed exactly once, either with a value or
 * with an error. After the commit the outcome never changes; the next fetch for the key creates
 * a new entry.
 *
 * <p><b>Thread safety:</b> instances are not synchronized. The owning cache guards every access
 * with the lock of the entry's key.
 *
 * @param <V> the type of the fetched value
 */
public final class FetchEntry<V> {
    /** Expiry deadline of entries that never expire automatically. */
    public static final long NEVER = Long.MAX_VALUE;

    private final long createdAt;
    private final List<CompletableFuture<V>> waiters = new ArrayList<>();

    private boolean fetching = true;
    private V value;
    private boolean hasError;
    private Throwable error;
    private long committedAt;
    private long expireAt = NEVER;
    private FetchEntry<V> refresh;

    private FetchEntry(long createdAt) {
        this.createdAt = createdAt;
    }

    /**
     * Creates an entry for a fetch that starts now.
     *
     * @param now the current ticker reading
     */
    public static <V> FetchEntry<V> inFlight(long now) {
        return new FetchEntry<>(now);
    }

    /**
     * Registers a new caller on this in-flight entry.
     *
     * @return a future completed by the commit of this entry
     * @throws IllegalStateException if the entry is already committed
     */
    public CompletableFuture<V> addWaiter() {
        if (!fetching) {
            throw new IllegalStateException("entry is already committed");
        }
        CompletableFuture<V> waiter = new CompletableFuture<>();
        waiters.add(waiter);
        return waiter;
    }

    /**
     * Records a successful outcome.
     */
    public void succeed(V value) {
        this.value = value;
        this.hasError = false;
        this.error = null;
    }

    /**
     * Records a failed outcome.
     */
    public void fail(Throwable error) {
        this.value = null;
        this.hasError = true;
        this.error = error;
    }

    /**
     * Ends the fetch: sets the commit time and expiry deadline, flips the entry out of the
     * fetching state and hands back the waiters in registration order.
     *
     * <p>A {@code ttlNanos} of zero or less leaves the entry without a deadline.
     *
     * @param now the current ticker reading
     * @param ttlNanos the time-to-live of the committed outcome
     * @return the callers to deliver the outcome to, oldest first
     */
    public List<CompletableFuture<V>> commit(long now, long ttlNanos) {
        if (!fetching) {
            throw new IllegalStateException("entry is already committed");
        }
        committedAt = now;
        if (ttlNanos > 0) {
            long deadline = now + ttlNanos;
            expireAt = deadline > now ? deadline : NEVER;
        }
        fetching = false;
        List<CompletableFuture<V>> drained = new ArrayList<>(waiters);
        waiters.clear();
        return drained;
    }

    /**
     * Completes the given callers with this entry's outcome, in list order. Every caller sees the
     * same value instance or the same error instance.
     */
    public void deliver(List<CompletableFuture<V>> callers) {
        for (CompletableFuture<V> caller : callers) {
            if (hasError) {
                caller.completeExceptionally(error);
            } else {
                caller.complete(value);
            }
        }
    }

    /**
     * Returns the committed outcome as an already completed future.
     */
    public CompletableFuture<V> toFuture() {
        if (fetching) {
            throw new IllegalStateException("entry is still fetching");
        }
        return hasError ? CompletableFuture.failedFuture(error) : CompletableFuture.completedFuture(value);
    }

    public boolean isFetching() {
        return fetching;
    }

    public boolean hasError() {
        return hasError;
    }

    public V getValue() {
        return value;
    }

    public Throwable getError() {
        return error;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getCommittedAt() {
        return committedAt;
    }

    public long getExpireAt() {
        return expireAt;
    }

    public boolean hasExpiry() {
        return expireAt != NEVER;
    }

    /**
     * Returns true if this committed entry has a deadline and {@code now} is past it. An entry is
     * still fresh at the exact deadline.
     */
    public boolean isExpired(long now) {
        return !fetching && expireAt != NEVER && now > expireAt;
    }

    /**
     * Returns the number of callers currently waiting on this entry.
     */
    public int waiterCount() {
        return waiters.size();
    }

    /**
     * Returns the replacement being fetched in the background for this stale entry, if any.
     */
    public FetchEntry<V> getRefresh() {
        return refresh;
    }

    public void setRefresh(FetchEntry<V> refresh) {
        this.refresh = refresh;
    }

    @Override
    public String toString() {
        if (fetching) {
            return "FetchEntry{fetching, waiters=" + waiters.size() + '}';
        }
        return "FetchEntry{"
                + (hasError ? "error=" + error : "value=" + value)
                + ", committedAt=" + committedAt
                + ", expireAt=" + (hasExpiry() ? String.valueOf(expireAt) : "never")
                + (refresh != null ? ", refreshing" : "")
                + '}';
    }
}

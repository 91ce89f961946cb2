package com.github.rudygunawan.fetcher.policy;

/**
 * The reason why a committed entry was removed from a cached fetcher.
 */
public enum RemovalCause {
    /**
     * The entry was removed by {@code invalidate} or {@code invalidateAll}.
     */
    EXPLICIT,

    /**
     * The expired entry was superseded by a newer fetch for the same key.
     */
    REPLACED,

    /**
     * The entry's expiry deadline passed and it was removed, either by a cleanup sweep or because
     * its background refresh failed and errors are not cached.
     */
    EXPIRED;

    /**
     * Returns {@code true} if the removal happened automatically rather than through an explicit
     * call or a replacement.
     */
    public boolean wasEvicted() {
        return this == EXPIRED;
    }
}

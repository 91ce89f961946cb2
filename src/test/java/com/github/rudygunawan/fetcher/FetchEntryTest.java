package com.github.rudygunawan.fetcher;

import com.github.rudygunawan.fetcher.model.FetchEntry;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class FetchEntryTest {

    @Test
    void testCommittedValue() {
        FetchEntry<String> entry = FetchEntry.inFlight(100);
        CompletableFuture<String> waiter = entry.addWaiter();
        assertTrue(entry.isFetching());
        assertFalse(entry.hasExpiry());

        entry.succeed("v");
        List<CompletableFuture<String>> waiters = entry.commit(150, 1000);

        assertFalse(entry.isFetching());
        assertFalse(entry.hasError());
        assertNull(entry.getError());
        assertEquals(100, entry.getCreatedAt());
        assertEquals(150, entry.getCommittedAt());
        assertTrue(entry.hasExpiry());
        assertEquals(1150, entry.getExpireAt());
        assertEquals(0, entry.waiterCount());

        // Deadline itself is still fresh
        assertFalse(entry.isExpired(1150));
        assertTrue(entry.isExpired(1151));

        entry.deliver(waiters);
        assertEquals("v", waiter.join());
        assertThrows(IllegalStateException.class, entry::addWaiter);
    }

    @Test
    void testCommittedError() {
        FetchEntry<String> entry = FetchEntry.inFlight(0);
        RuntimeException failure = new RuntimeException("boom");

        entry.fail(failure);
        entry.commit(10, 0);

        assertTrue(entry.hasError());
        assertSame(failure, entry.getError());
        assertNull(entry.getValue());
        assertFalse(entry.hasExpiry());
        assertEquals(FetchEntry.NEVER, entry.getExpireAt());
        assertFalse(entry.isExpired(Long.MAX_VALUE));

        CompletionException e = assertThrows(CompletionException.class, () -> entry.toFuture().join());
        assertSame(failure, e.getCause());
    }

    @Test
    void testOverflowingTtlNeverExpires() {
        FetchEntry<String> entry = FetchEntry.inFlight(0);
        entry.succeed("v");
        entry.commit(Long.MAX_VALUE - 10, 100);

        assertFalse(entry.hasExpiry());
        assertThrows(IllegalStateException.class, () -> entry.commit(0, 0));
    }

    @Test
    void testToString() {
        FetchEntry<String> entry = FetchEntry.inFlight(0);
        entry.addWaiter();
        assertEquals("FetchEntry{fetching, waiters=1}", entry.toString());

        entry.succeed("v");
        entry.commit(5, 0);
        assertEquals("FetchEntry{value=v, committedAt=5, expireAt=never}", entry.toString());
    }
}

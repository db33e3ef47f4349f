package com.changesentinel.pipeline.dedup;

import com.changesentinel.core.model.DedupEntry;
import com.changesentinel.pipeline.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryDedupStoreTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);
    private final InMemoryDedupStore store = new InMemoryDedupStore(clock);

    @Test
    void markedIdsAreSeenUntilReset() {
        store.mark("a");
        store.mark("b");
        store.mark("c");

        assertTrue(store.seen("a"));
        assertFalse(store.seen("d"));

        store.reset();

        assertFalse(store.seen("a"));
        assertTrue(store.entries().isEmpty());
    }

    @Test
    void remarkingKeepsFirstSeenTime() {
        store.mark("a");
        clock.advance(Duration.ofHours(1));
        store.mark("a");

        assertEquals(List.of(new DedupEntry("a", Instant.parse("2026-03-01T08:00:00Z"))), store.entries());
    }

    @Test
    void seenBatchReturnsNewIdsInInputOrderWithoutMarking() {
        store.mark("b");

        List<String> fresh = store.seenBatch(List.of("c", "b", "a", "c"));

        assertEquals(List.of("c", "a"), fresh);
        assertFalse(store.seen("c"));
    }

    @Test
    void claimMarksWhatItReturns() {
        store.mark("x");

        assertEquals(List.of("y", "z"), store.claim(List.of("x", "y", "z")));
        assertEquals(List.of(), store.claim(List.of("x", "y", "z")));
    }

    @Test
    void concurrentClaimsHandOutEachIdOnce() throws Exception {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            ids.add("item-" + i);
        }
        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<List<String>>> results = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return store.claim(ids);
                }));
            }
            start.countDown();

            int handedOut = 0;
            for (Future<List<String>> result : results) {
                handedOut += result.get(5, TimeUnit.SECONDS).size();
            }
            assertEquals(ids.size(), handedOut);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void replaceAllRestoresLoadedEntries() {
        store.mark("stale");
        store.replaceAll(List.of(
                new DedupEntry("a", Instant.parse("2026-01-01T00:00:00Z")),
                new DedupEntry("b", Instant.parse("2026-01-02T00:00:00Z"))
        ));

        assertFalse(store.seen("stale"));
        assertEquals("a", store.entries().get(0).id());
        assertEquals(Instant.parse("2026-01-02T00:00:00Z"), store.entries().get(1).firstSeen());
    }
}

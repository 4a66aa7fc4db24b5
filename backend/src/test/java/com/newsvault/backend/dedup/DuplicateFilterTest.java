package com.newsvault.backend.dedup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.newsvault.backend.config.PipelineProperties;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class DuplicateFilterTest {

    @Test
    void lookupNeverInserts() {
        DuplicateFilter filter = filter(10, true);

        assertFalse(filter.isDuplicate("https://a.example.com/1"));
        assertFalse(filter.isDuplicate("https://a.example.com/1"));
        assertEquals(0, filter.size());
    }

    @Test
    void admittedUrlIsDuplicate() {
        DuplicateFilter filter = filter(10, true);

        assertTrue(filter.admit("https://a.example.com/1"));
        assertFalse(filter.admit("https://a.example.com/1"));
        assertTrue(filter.isDuplicate("https://a.example.com/1"));
    }

    @Test
    void reservationBlocksSecondClaimUntilReleased() {
        DuplicateFilter filter = filter(10, true);

        assertTrue(filter.tryReserve("https://a.example.com/1", "Yen slides"));
        assertFalse(filter.tryReserve("https://a.example.com/1", "Yen slides"));
        assertFalse(filter.isDuplicate("https://a.example.com/1"));

        filter.release("https://a.example.com/1");
        assertTrue(filter.tryReserve("https://a.example.com/1", "Yen slides"));
    }

    @Test
    void admittedUrlCannotBeReserved() {
        DuplicateFilter filter = filter(10, true);
        assertTrue(filter.tryReserve("https://a.example.com/1", "Yen slides"));
        filter.admit("https://a.example.com/1", "Yen slides");
        filter.release("https://a.example.com/1");

        assertFalse(filter.tryReserve("https://a.example.com/1", "Yen slides"));
        assertFalse(filter.tryReserve("https://b.example.com/copy", "Yen slides!"));
    }

    @Test
    void evictsLeastRecentlyUsedBeyondCapacity() {
        DuplicateFilter filter = filter(2, false);
        filter.admit("u1");
        filter.admit("u2");
        // Re-admitting u1 makes u2 the eldest
        filter.admit("u1");

        filter.admit("u3");

        assertEquals(2, filter.size());
        assertTrue(filter.isDuplicate("u1"));
        assertFalse(filter.isDuplicate("u2"));
        assertTrue(filter.isDuplicate("u3"));
    }

    @Test
    void matchesRepublishedStoryByNormalizedTitle() {
        DuplicateFilter filter = filter(10, true);
        filter.admit("https://a.example.com/1", "BoJ Holds Rates, Signals Patience");

        assertTrue(filter.isDuplicate("https://mirror.example.com/9", "boj holds rates signals  patience!"));
        assertFalse(filter.isDuplicate("https://mirror.example.com/9", "Fed holds rates"));
    }

    @Test
    void titleMatchingCanBeDisabled() {
        DuplicateFilter filter = filter(10, false);
        filter.admit("https://a.example.com/1", "BoJ holds rates");

        assertFalse(filter.isDuplicate("https://mirror.example.com/9", "BoJ holds rates"));
    }

    @Test
    void concurrentAdmissionOfSameUrlSucceedsOnce() throws Exception {
        DuplicateFilter filter = filter(100, false);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return filter.admit("https://a.example.com/same");
                }));
            }
            start.countDown();

            int admitted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) admitted++;
            }
            assertEquals(1, admitted);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void clearForgetsEverything() {
        DuplicateFilter filter = filter(10, true);
        filter.admit("https://a.example.com/1", "Some title");

        filter.clear();

        assertFalse(filter.isDuplicate("https://a.example.com/1", "Some title"));
        assertEquals(10, filter.getCapacity());
    }

    private static DuplicateFilter filter(int capacity, boolean matchTitles) {
        PipelineProperties properties = new PipelineProperties();
        properties.getDedup().setCapacity(capacity);
        properties.getDedup().setMatchTitles(matchTitles);
        return new DuplicateFilter(properties, Clock.systemUTC());
    }
}

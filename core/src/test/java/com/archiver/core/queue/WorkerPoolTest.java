package com.archiver.core.queue;

import com.archiver.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest extends TestBase {

    @Test
    void testResultsKeepSubmissionOrder() {
        WorkerPool pool = new WorkerPool(4, "test-worker");

        // later inputs finish first
        List<Integer> results = pool.runAll(List.of(5, 4, 3, 2, 1), n -> {
            sleep(n * 20L);
            return n * 10;
        }, (n, e) -> -1);

        assertEquals(List.of(50, 40, 30, 20, 10), results);
    }

    @Test
    void testCrashedJobFallsBack() {
        WorkerPool pool = new WorkerPool(2, "test-worker");

        List<String> results = pool.runAll(List.of("a", "boom", "c"), s -> {
            if (s.equals("boom")) throw new IllegalStateException("crash");
            return s.toUpperCase();
        }, (s, e) -> "failed:" + e.getMessage());

        assertEquals(List.of("A", "failed:crash", "C"), results);
    }

    @Test
    void testThreadsAreNamedAndDaemon() {
        WorkerPool pool = new WorkerPool(2, "named");
        Set<String> names = ConcurrentHashMap.newKeySet();

        pool.runAll(List.of(1, 2, 3), n -> {
            names.add(Thread.currentThread().getName());
            assertTrue(Thread.currentThread().isDaemon());
            return n;
        }, (n, e) -> n);

        assertFalse(names.isEmpty());
        assertTrue(names.stream().allMatch(n -> n.startsWith("named-")));
    }

    @Test
    void testEmptyBatchAndInvalidWidth() {
        assertTrue(new WorkerPool(1, "x").runAll(List.<Integer>of(), n -> n, (n, e) -> n).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new WorkerPool(0, "x"));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

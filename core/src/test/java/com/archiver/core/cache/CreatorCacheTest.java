package com.archiver.core.cache;

import com.archiver.common.model.Creator;
import com.archiver.core.error.ArchiveException;
import com.archiver.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CreatorCacheTest extends TestBase {

    private final Map<CreatorKey, AtomicInteger> loads = new ConcurrentHashMap<>();

    private Creator countingLoad(CreatorKey key) {
        loads.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        return new Creator(key.service(), key.creatorId(), "name-" + key.creatorId());
    }

    private int loadsOf(String service, String id) {
        AtomicInteger n = loads.get(new CreatorKey(service, id));
        return n == null ? 0 : n.get();
    }

    @Test
    void testSecondLookupIsServedFromCache() throws Exception {
        CreatorCache cache = new CreatorCache(this::countingLoad);

        Creator first = cache.resolve("patreon", "1");
        Creator second = cache.resolve("patreon", "1");

        assertSame(first, second);
        assertEquals(1, loadsOf("patreon", "1"));
        assertTrue(cache.contains("patreon", "1"));
    }

    @Test
    void testKeyIncludesService() throws Exception {
        CreatorCache cache = new CreatorCache(this::countingLoad);

        Creator a = cache.resolve("patreon", "1");
        Creator b = cache.resolve("fanbox", "1");

        assertNotSame(a, b);
        assertEquals(2, cache.size());
    }

    @Test
    void testConcurrentMissesOnSameKeyLoadOnce() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger loaderCalls = new AtomicInteger();
        CreatorCache cache = new CreatorCache(key -> {
            loaderCalls.incrementAndGet();
            await(release);
            return new Creator(key.service(), key.creatorId(), "Alice");
        });

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Creator>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return cache.resolve("patreon", "42");
                }));
            }
            start.countDown();
            // give every thread time to miss before the single load completes
            Thread.sleep(200);
            release.countDown();

            Creator expected = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<Creator> f : results) {
                assertSame(expected, f.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, loaderCalls.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testDifferentKeysLoadInParallel() throws Exception {
        // Both loads must be in flight at the same time for the latch to open
        CountDownLatch bothStarted = new CountDownLatch(2);
        CreatorCache cache = new CreatorCache(key -> {
            bothStarted.countDown();
            await(bothStarted);
            if (bothStarted.getCount() > 0) {
                throw new ArchiveException("loads of different keys were serialized");
            }
            return new Creator(key.service(), key.creatorId(), key.creatorId());
        });

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Creator> a = executor.submit(() -> cache.resolve("patreon", "a"));
            Future<Creator> b = executor.submit(() -> cache.resolve("patreon", "b"));

            assertEquals("a", a.get(10, TimeUnit.SECONDS).name());
            assertEquals("b", b.get(10, TimeUnit.SECONDS).name());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testFailedLoadIsNotCached() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CreatorCache cache = new CreatorCache(key -> {
            if (calls.incrementAndGet() == 1) throw new ArchiveException("temporarily down");
            return new Creator(key.service(), key.creatorId(), "Bob");
        });

        assertThrows(ArchiveException.class, () -> cache.resolve("patreon", "7"));
        assertFalse(cache.contains("patreon", "7"));

        assertEquals("Bob", cache.resolve("patreon", "7").name());
        assertEquals(2, calls.get());
    }

    @Test
    void testLoaderErrorReleasesTheKey() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CreatorCache cache = new CreatorCache(key -> {
            if (calls.incrementAndGet() == 1) throw new StackOverflowError("loader blew up");
            return new Creator(key.service(), key.creatorId(), "Dana");
        });

        assertThrows(StackOverflowError.class, () -> cache.resolve("patreon", "8"));
        assertEquals(0, cache.size());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Creator> retry = executor.submit(() -> cache.resolve("patreon", "8"));
            assertEquals("Dana", retry.get(5, TimeUnit.SECONDS).name(), "A later lookup must not hang");
        } finally {
            executor.shutdownNow();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

package com.convoviewer.viewer.cache;

import com.convoviewer.viewer.exception.CacheComputeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TieredCacheManagerTest {

    private MutableClock clock;
    private TieredCacheManager cache;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        cache = new TieredCacheManager(2, 10, 10, Duration.ofSeconds(30), new FileFingerprintService(), clock);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    void testConcurrentMissesRunLoaderOnce() throws Exception {
        int callers = 8;
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch ready = new CountDownLatch(callers);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    ready.countDown();
                    return cache.getOrCompute("messages:claude:p:s", CacheTier.HOT, null, () -> {
                        loads.incrementAndGet();
                        release.await(5, TimeUnit.SECONDS);
                        return "parsed";
                    });
                }));
            }
            assertTrue(ready.await(5, TimeUnit.SECONDS));
            Thread.sleep(200);
            release.countDown();

            for (Future<String> result : results) {
                assertEquals("parsed", result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, loads.get());
        assertEquals(0, cache.stats().getInFlightCount());
    }

    @Test
    void testUnchangedBackingFileReturnsSameInstance() throws IOException {
        Path file = Files.writeString(tempDir.resolve("s1.jsonl"), "{\"type\":\"user\"}\n");
        AtomicInteger loads = new AtomicInteger();

        Object first = cache.getOrCompute("messages:claude:p:s1", CacheTier.HOT, null, List.of(file), () -> {
            loads.incrementAndGet();
            return new Object();
        });
        Object second = cache.getOrCompute("messages:claude:p:s1", CacheTier.HOT, null, List.of(file), () -> {
            loads.incrementAndGet();
            return new Object();
        });

        assertSame(first, second);
        assertEquals(1, loads.get());
    }

    @Test
    void testChangedBackingFileIsRecomputed() throws IOException {
        Path file = Files.writeString(tempDir.resolve("s1.jsonl"), "{\"type\":\"user\"}\n");
        AtomicInteger loads = new AtomicInteger();

        Object first = cache.getOrCompute("messages:claude:p:s1", CacheTier.HOT, null, List.of(file), () -> {
            loads.incrementAndGet();
            return new Object();
        });

        Files.writeString(file, "{\"type\":\"user\"}\n{\"type\":\"assistant\"}\n");
        Files.setLastModifiedTime(file, FileTime.fromMillis(Files.getLastModifiedTime(file).toMillis() + 10_000));

        Object second = cache.getOrCompute("messages:claude:p:s1", CacheTier.HOT, null, List.of(file), () -> {
            loads.incrementAndGet();
            return new Object();
        });

        assertNotSame(first, second);
        assertEquals(2, loads.get());
    }

    @Test
    void testLeastRecentlyUsedEntryIsEvicted() {
        AtomicInteger loads = new AtomicInteger();

        cache.getOrCompute("a", CacheTier.HOT, null, () -> loads.incrementAndGet());
        cache.getOrCompute("b", CacheTier.HOT, null, () -> loads.incrementAndGet());
        cache.getOrCompute("a", CacheTier.HOT, null, () -> loads.incrementAndGet());
        cache.getOrCompute("c", CacheTier.HOT, null, () -> loads.incrementAndGet());
        assertEquals(3, loads.get());

        // "a" was touched after "b", so "b" is the one that went
        cache.getOrCompute("a", CacheTier.HOT, null, () -> loads.incrementAndGet());
        assertEquals(3, loads.get());
        cache.getOrCompute("b", CacheTier.HOT, null, () -> loads.incrementAndGet());
        assertEquals(4, loads.get());

        TierStats hot = cache.stats().getTiers().get(CacheTier.HOT);
        assertEquals(2, hot.getEntryCount());
        assertTrue(hot.getEvictionCount() >= 1);
    }

    @Test
    void testWarmEntriesExpireAfterTtl() {
        AtomicInteger loads = new AtomicInteger();

        cache.getOrCompute("projects:claude", CacheTier.WARM, Duration.ofSeconds(10), () -> loads.incrementAndGet());
        clock.advance(Duration.ofSeconds(5));
        cache.getOrCompute("projects:claude", CacheTier.WARM, Duration.ofSeconds(10), () -> loads.incrementAndGet());
        assertEquals(1, loads.get());

        clock.advance(Duration.ofSeconds(6));
        cache.getOrCompute("projects:claude", CacheTier.WARM, Duration.ofSeconds(10), () -> loads.incrementAndGet());
        assertEquals(2, loads.get());
    }

    @Test
    void testWarmTierUsesDefaultTtl() {
        cache.getOrCompute("health", CacheTier.WARM, null, () -> "ok");

        clock.advance(Duration.ofSeconds(31));

        assertEquals(1, cache.sweepExpired());
        assertEquals(0, cache.stats().getEntryCount());
    }

    @Test
    void testHotEntriesDoNotExpire() {
        cache.getOrCompute("messages:qwen:p:s", CacheTier.HOT, null, () -> "parsed");

        clock.advance(Duration.ofDays(7));

        assertEquals(0, cache.sweepExpired());
        assertEquals(1, cache.stats().getEntryCount());
    }

    @Test
    void testFailedComputationIsNotCached() {
        AtomicInteger loads = new AtomicInteger();

        CacheComputeException failure = assertThrows(CacheComputeException.class,
                () -> cache.getOrCompute("sessions:claude:p", CacheTier.WARM, null, () -> {
                    loads.incrementAndGet();
                    throw new IOException("disk went away");
                }));
        assertEquals("sessions:claude:p", failure.getKey());
        assertTrue(failure.getCause() instanceof IOException);

        String value = cache.getOrCompute("sessions:claude:p", CacheTier.WARM, null, () -> {
            loads.incrementAndGet();
            return "listing";
        });

        assertEquals("listing", value);
        assertEquals(2, loads.get());
        assertEquals(1L, cache.stats().getTiers().get(CacheTier.WARM).getLoadFailureCount());
    }

    @Test
    void testRuntimeFailurePropagatesUnwrapped() {
        assertThrows(IllegalStateException.class,
                () -> cache.getOrCompute("k", CacheTier.HOT, null, () -> {
                    throw new IllegalStateException("boom");
                }));
    }

    @Test
    void testInvalidateByPrefix() {
        cache.getOrCompute("messages:claude:p:s1", CacheTier.HOT, null, () -> 1);
        cache.getOrCompute("messages:claude:p:s2", CacheTier.HOT, null, () -> 2);
        cache.getOrCompute("projects:claude", CacheTier.WARM, null, () -> 3);

        assertEquals(2, cache.invalidate("messages:claude:"));
        assertEquals(1, cache.stats().getEntryCount());
    }

    @Test
    void testClearSingleTier() {
        cache.getOrCompute("messages:claude:p:s1", CacheTier.HOT, null, () -> 1);
        cache.getOrCompute("projects:claude", CacheTier.WARM, null, () -> 2);

        cache.clear(CacheTier.HOT);

        CacheStats stats = cache.stats();
        assertEquals(0, stats.getTiers().get(CacheTier.HOT).getEntryCount());
        assertEquals(1, stats.getTiers().get(CacheTier.WARM).getEntryCount());
    }

    @Test
    void testStatsCountHitsAndMisses() {
        cache.getOrCompute("k", CacheTier.WARM, null, () -> "v");
        cache.getOrCompute("k", CacheTier.WARM, null, () -> "v");
        cache.getOrCompute("k", CacheTier.WARM, null, () -> "v");

        CacheStats stats = cache.stats();
        assertEquals(2L, stats.getHitCount());
        assertEquals(1L, stats.getMissCount());
    }

    @Test
    void testNonPositiveCapacityIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new TieredCacheManager(0, 10, 10, Duration.ofSeconds(30), new FileFingerprintService(), clock));
        assertThrows(IllegalArgumentException.class,
                () -> new TieredCacheManager(2, 10, 0, Duration.ofSeconds(30), new FileFingerprintService(), clock));
    }

    @Test
    void testIndexTierIsSeparateFromHot() {
        cache.getOrCompute("messages:claude:p:s1", CacheTier.HOT, null, () -> 1);
        for (int i = 0; i < 5; i++) {
            int value = i;
            cache.getOrCompute("search-text:claude:p:s" + i, CacheTier.INDEX, null, () -> value);
        }

        CacheStats stats = cache.stats();
        assertEquals(1, stats.getTiers().get(CacheTier.HOT).getEntryCount());
        assertEquals(0L, stats.getTiers().get(CacheTier.HOT).getEvictionCount());
        assertEquals(5, stats.getTiers().get(CacheTier.INDEX).getEntryCount());
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

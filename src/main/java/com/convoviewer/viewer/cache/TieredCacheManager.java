package com.convoviewer.viewer.cache;

import com.convoviewer.viewer.exception.CacheComputeException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tiered cache in front of the source adapters and the normalizer.
 *
 * Lifecycle: one instance is created at startup and handed to every consumer;
 * {@link #close()} clears it and stops the optional sweeper at shutdown.
 *
 * Guarantees:
 * - Entries with backing files are re-stat'ed before reuse; a changed fingerprint is a miss.
 * - At most one computation per key is in flight; concurrent callers await its result.
 * - A failing computation is delivered to its waiting callers and never cached.
 */
@Slf4j
public class TieredCacheManager implements AutoCloseable {

    private final Map<CacheTier, TierStore> tiers = new EnumMap<>(CacheTier.class);
    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();
    private final FileFingerprintService fingerprintService;
    private final Duration defaultWarmTtl;
    private final Clock clock;

    private ScheduledExecutorService sweeper;

    public TieredCacheManager(int hotCapacity,
                              int warmCapacity,
                              int indexCapacity,
                              Duration defaultWarmTtl,
                              FileFingerprintService fingerprintService,
                              Clock clock) {
        if (hotCapacity <= 0 || warmCapacity <= 0 || indexCapacity <= 0) {
            throw new IllegalArgumentException("Cache capacities must be positive");
        }
        this.tiers.put(CacheTier.HOT, new TierStore(hotCapacity));
        this.tiers.put(CacheTier.WARM, new TierStore(warmCapacity));
        this.tiers.put(CacheTier.INDEX, new TierStore(indexCapacity));
        this.defaultWarmTtl = defaultWarmTtl;
        this.fingerprintService = fingerprintService;
        this.clock = clock;
    }

    /**
     * Return the cached value for a key without backing files, computing it on a miss.
     */
    public <T> T getOrCompute(String key, CacheTier tier, Duration ttl, CacheLoader<T> loader) {
        return getOrCompute(key, tier, ttl, Collections.emptyList(), loader);
    }

    /**
     * Return the cached value for a key, computing it on a miss.
     *
     * @param key - Derived cache key, see {@link CacheKeys}
     * @param tier - Tier holding the entry
     * @param ttl - Time to live; null means the tier default (none for HOT and INDEX)
     * @param backingFiles - Files whose mtime/size must be unchanged for the entry to be reused
     * @param loader - Computation run on a miss, at most once concurrently per key
     * @return Cached or freshly computed value
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(String key,
                              CacheTier tier,
                              Duration ttl,
                              List<Path> backingFiles,
                              CacheLoader<T> loader) {
        TierStore store = tiers.get(tier);

        CacheEntry entry = lookupValid(store, key, backingFiles);
        if (entry != null) {
            store.hits.incrementAndGet();
            return (T) entry.getValue();
        }
        store.misses.incrementAndGet();

        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            log.debug("Awaiting in-flight computation for {}", key);
            return (T) await(key, running);
        }

        try {
            // Another caller may have stored the entry between our lookup and winning the in-flight slot
            CacheEntry fresh = lookupValid(store, key, backingFiles);
            if (fresh != null) {
                mine.complete(fresh.getValue());
                return (T) fresh.getValue();
            }

            // Fingerprint before loading, so a write during the load is seen as a change next time
            FileFingerprint fingerprint = backingFiles.isEmpty()
                    ? null
                    : fingerprintService.fingerprint(backingFiles);

            store.loads.incrementAndGet();
            T value = loader.load();

            Instant now = clock.instant();
            Duration effectiveTtl = ttl != null ? ttl : (tier == CacheTier.WARM ? defaultWarmTtl : null);
            Instant expiresAt = effectiveTtl != null ? now.plus(effectiveTtl) : null;
            store.put(new CacheEntry(key, value, now, expiresAt, fingerprint));

            mine.complete(value);
            return value;
        } catch (Exception e) {
            store.loadFailures.incrementAndGet();
            RuntimeException failure = e instanceof RuntimeException
                    ? (RuntimeException) e
                    : new CacheComputeException(key, e);
            log.warn("Computation for cache key {} failed: {}", key, e.getMessage());
            mine.completeExceptionally(failure);
            throw failure;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /**
     * Remove an exact key, or every key starting with the given prefix, from every tier.
     *
     * @return Number of removed entries
     */
    public int invalidate(String keyOrPrefix) {
        int removed = 0;
        for (TierStore store : tiers.values()) {
            removed += store.removeByPrefix(keyOrPrefix);
        }
        log.debug("Invalidated {} cache entries for '{}'", removed, keyOrPrefix);
        return removed;
    }

    public void clear(CacheTier tier) {
        tiers.get(tier).clear();
        log.info("Cleared {} cache tier", tier);
    }

    public void clearAll() {
        tiers.values().forEach(TierStore::clear);
        log.info("Cleared all cache tiers");
    }

    /**
     * Drop expired entries from every tier.
     *
     * @return Number of removed entries
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (TierStore store : tiers.values()) {
            removed += store.removeExpired(now);
        }
        if (removed > 0) {
            log.debug("Swept {} expired cache entries", removed);
        }
        return removed;
    }

    public CacheStats stats() {
        Map<CacheTier, TierStats> perTier = new EnumMap<>(CacheTier.class);
        long hits = 0;
        long misses = 0;
        int entries = 0;
        for (Map.Entry<CacheTier, TierStore> e : tiers.entrySet()) {
            TierStats tierStats = e.getValue().stats();
            perTier.put(e.getKey(), tierStats);
            hits += tierStats.getHitCount();
            misses += tierStats.getMissCount();
            entries += tierStats.getEntryCount();
        }
        return CacheStats.builder()
                .hitCount(hits)
                .missCount(misses)
                .entryCount(entries)
                .inFlightCount(inFlight.size())
                .tiers(perTier)
                .build();
    }

    /**
     * Start a background sweep of expired entries. Optional; expiry is also applied on access.
     */
    public synchronized void startSweeper(Duration interval) {
        if (sweeper != null || interval == null || interval.isZero() || interval.isNegative()) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-sweeper");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        sweeper.scheduleAtFixedRate(this::sweepExpired, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Cache sweeper started, interval {}ms", millis);
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
        clearAll();
    }

    private CacheEntry lookupValid(TierStore store, String key, List<Path> backingFiles) {
        CacheEntry entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            store.evict(key, entry);
            return null;
        }
        if (entry.getFingerprint() != null
                && !entry.getFingerprint().equals(fingerprintService.fingerprint(backingFiles))) {
            log.debug("Backing files changed for {}, recomputing", key);
            store.evict(key, entry);
            return null;
        }
        return entry;
    }

    private Object await(String key, CompletableFuture<Object> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new CacheComputeException(key, cause);
        }
    }

    /**
     * One tier: an access-ordered map bounded by entry count. All access goes through
     * the store's own monitor; critical sections never perform I/O.
     */
    private static final class TierStore {

        private final int capacity;
        private final AtomicLong hits = new AtomicLong();
        private final AtomicLong misses = new AtomicLong();
        private final AtomicLong loads = new AtomicLong();
        private final AtomicLong loadFailures = new AtomicLong();
        private final AtomicLong evictions = new AtomicLong();
        private final LinkedHashMap<String, CacheEntry> entries;

        TierStore(int capacity) {
            this.capacity = capacity;
            this.entries = new LinkedHashMap<>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                    if (size() > TierStore.this.capacity) {
                        evictions.incrementAndGet();
                        return true;
                    }
                    return false;
                }
            };
        }

        synchronized CacheEntry get(String key) {
            return entries.get(key);
        }

        synchronized void put(CacheEntry entry) {
            entries.put(entry.getKey(), entry);
        }

        synchronized void evict(String key, CacheEntry expected) {
            // Only drop the exact entry we judged stale; a concurrent refresh may have replaced it
            if (entries.remove(key, expected)) {
                evictions.incrementAndGet();
            }
        }

        synchronized int removeByPrefix(String prefix) {
            int removed = 0;
            Iterator<String> it = entries.keySet().iterator();
            while (it.hasNext()) {
                if (it.next().startsWith(prefix)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        }

        synchronized int removeExpired(Instant now) {
            int removed = 0;
            Iterator<CacheEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            evictions.addAndGet(removed);
            return removed;
        }

        synchronized void clear() {
            entries.clear();
        }

        synchronized TierStats stats() {
            return TierStats.builder()
                    .hitCount(hits.get())
                    .missCount(misses.get())
                    .loadCount(loads.get())
                    .loadFailureCount(loadFailures.get())
                    .evictionCount(evictions.get())
                    .entryCount(entries.size())
                    .capacity(capacity)
                    .build();
        }
    }
}

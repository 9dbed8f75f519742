package com.deepansh.trader.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-wide TTL cache in front of every rate-limited external fetch.
 *
 * Expiry is checked lazily on every read, so correctness never depends on
 * the sweeper. The sweeper only bounds memory.
 *
 * One coarse lock guards the map: reads and writes come from the web threads,
 * the background cycle worker and the sweeper at the same time, and every
 * operation is a few map calls. Loaders in {@link #getOrLoad} run outside the lock.
 */
@Component
@Slf4j
public class EphemeralCache {

    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    private long hits;
    private long misses;
    private long puts;
    private long evictions;

    public EphemeralCache(Clock clock) {
        this.clock = clock;
    }

    public void put(String key, Object value, Duration ttl) {
        if (key == null || value == null) return;
        Instant now = clock.instant();
        lock.lock();
        try {
            entries.put(key, new CacheEntry(key, value, now, now.plus(ttl)));
            puts++;
        } finally {
            lock.unlock();
        }
        log.debug("Cached [{}] for {}s", key, ttl.toSeconds());
    }

    public Optional<Object> get(String key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (!entry.isVisibleAt(now)) {
                entries.remove(key);
                evictions++;
                misses++;
                return Optional.empty();
            }
            hits++;
            return Optional.of(entry.payload());
        } finally {
            lock.unlock();
        }
    }

    /** Typed read. An entry of another type counts as absent. */
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    /**
     * Returns the cached value or loads and caches it.
     * A null from the loader is returned as-is and not cached,
     * so a failed fetch is retried on the next call.
     */
    public <T> T getOrLoad(String key, Class<T> type, Duration ttl, Supplier<T> loader) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            log.debug("Cache hit [{}]", key);
            return cached.get();
        }
        T loaded = loader.get();
        if (loaded != null) {
            put(key, loaded, ttl);
        }
        return loaded;
    }

    public boolean clear(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public void clearAll() {
        lock.lock();
        try {
            int size = entries.size();
            entries.clear();
            log.info("Cache cleared [{} entries]", size);
        } finally {
            lock.unlock();
        }
    }

    @Scheduled(fixedRateString = "${agent.cache.sweep-interval-ms:60000}")
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        lock.lock();
        try {
            Iterator<CacheEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (!it.next().isVisibleAt(now)) {
                    it.remove();
                    removed++;
                }
            }
            evictions += removed;
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.debug("Cache sweep evicted {} expired entries", removed);
        }
        return removed;
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(entries.size(), hits, misses, puts, evictions);
        } finally {
            lock.unlock();
        }
    }
}

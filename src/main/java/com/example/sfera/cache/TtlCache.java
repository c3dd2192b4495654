package com.example.sfera.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Capacity-bounded, time-expiring key/value store for API responses.
 *
 * <p>Eviction is oldest-write-first, not LRU: when the store is full the entry with the
 * smallest stored timestamp goes. A read never refreshes an entry. The expected
 * cardinality is a few dozen keys, so eviction does a plain scan.</p>
 *
 * <p>All read-modify-write sequences (expire-on-read, evict-then-insert) run under a
 * single lock.</p>
 */
@Slf4j
public class TtlCache<V> {

    private final String name;
    private final long ttlMs;
    private final int capacity;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry<V>> store = new HashMap<>();
    private long hits;
    private long misses;

    public TtlCache(String name, Duration ttl, int capacity, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        }
        this.ttlMs = ttl.toMillis();
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public TtlCache(String name, Duration ttl, int capacity) {
        this(name, ttl, capacity, Clock.systemUTC());
    }

    public String name() {
        return name;
    }

    /**
     * Returns the cached value while it is fresh. A stale entry is removed and reported
     * as a miss.
     */
    public Optional<V> get(String key) {
        long now = clock.millis();
        lock.lock();
        try {
            CacheEntry<V> entry = store.get(key);
            if (entry != null) {
                if (entry.isFresh(now, ttlMs)) {
                    hits++;
                    log.debug("[cache:{}] HIT {} (hit rate {})", name, abbreviate(key), hitRateLocked());
                    return Optional.of(entry.value);
                }
                store.remove(key);
            }
            misses++;
            log.debug("[cache:{}] MISS {}", name, abbreviate(key));
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores {@code value}, replacing any existing entry and resetting its timestamp.
     * A new key on a full store first evicts the oldest entry.
     */
    public void set(String key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long now = clock.millis();
        lock.lock();
        try {
            if (!store.containsKey(key) && store.size() >= capacity) {
                evictOldestLocked();
            }
            store.put(key, new CacheEntry<>(value, now));
            log.debug("[cache:{}] SET {} (size {}/{})", name, abbreviate(key), store.size(), capacity);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cache-aside helper: returns the fresh cached value or computes, stores and returns
     * a new one. A {@code null} result is returned as-is and not cached. Exceptions from
     * {@code loader} propagate and leave the cache untouched.
     */
    public V getOrCompute(String key, Supplier<? extends V> loader) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V value = loader.get();
        if (value != null) {
            set(key, value);
        }
        return value;
    }

    public void clear() {
        lock.lock();
        try {
            store.clear();
            hits = 0L;
            misses = 0L;
        } finally {
            lock.unlock();
        }
        log.info("[cache:{}] cleared", name);
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(name, store.size(), capacity, hits, misses, hitRateLocked(), Duration.ofMillis(ttlMs));
        } finally {
            lock.unlock();
        }
    }

    private void evictOldestLocked() {
        String oldestKey = null;
        long oldestAt = Long.MAX_VALUE;
        Iterator<Map.Entry<String, CacheEntry<V>>> it = store.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, CacheEntry<V>> e = it.next();
            if (e.getValue().storedAtMs < oldestAt) {
                oldestAt = e.getValue().storedAtMs;
                oldestKey = e.getKey();
            }
        }
        if (oldestKey != null) {
            store.remove(oldestKey);
            log.debug("[cache:{}] full, evicted oldest {}", name, abbreviate(oldestKey));
        }
    }

    private double hitRateLocked() {
        long total = hits + misses;
        return total == 0L ? 0.0d : (double) hits / total;
    }

    private static String abbreviate(String key) {
        if (key == null) return "null";
        return key.length() <= 20 ? key : key.substring(0, 20) + "...";
    }
}

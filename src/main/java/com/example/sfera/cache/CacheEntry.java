package com.example.sfera.cache;

/**
 * Value stored by {@link TtlCache} together with the time it was written.
 * Never handed out to callers.
 */
final class CacheEntry<V> {

    final V value;
    final long storedAtMs;

    CacheEntry(V value, long storedAtMs) {
        this.value = value;
        this.storedAtMs = storedAtMs;
    }

    boolean isFresh(long nowMs, long ttlMs) {
        return nowMs - storedAtMs < ttlMs;
    }
}

package com.example.sfera.cache;

import java.time.Duration;

/**
 * Point-in-time snapshot of a {@link TtlCache}.
 */
public record CacheStats(
        String name,
        int size,
        int capacity,
        long hits,
        long misses,
        double hitRate,
        Duration ttl) {
}

package com.example.sfera.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-identity sliding-window limiter with a temporary block once the threshold is exceeded.
 *
 * <p>Two states per identity. While <b>blocked</b> every request is rejected and not
 * recorded; the block record is dropped by the first request that arrives at or after
 * {@code blockedUntil}. While <b>open</b> each request is appended to the identity's
 * window and admitted unless the trailing-minute count exceeds the threshold.</p>
 *
 * <p>The window keeps at most {@code windowCapacity} timestamps per identity, so counts
 * above that bound are approximate. The capacity must exceed the threshold.</p>
 *
 * <p>At most once per {@link #WINDOW}, a request sweeps out identities with no timestamp
 * inside the trailing minute and no active block, so idle users do not accumulate.</p>
 */
@Slf4j
public class RateLimiter {

    static final Duration WINDOW = Duration.ofMinutes(1);

    private final int maxRequestsPerMinute;
    private final Duration blockDuration;
    private final int windowCapacity;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Deque<Long>> windows = new HashMap<>();
    private final Map<String, Long> blockedUntil = new HashMap<>();
    private long lastSweepMs;

    public RateLimiter(int maxRequestsPerMinute, Duration blockDuration, int windowCapacity, Clock clock) {
        if (maxRequestsPerMinute < 1) {
            throw new IllegalArgumentException("maxRequestsPerMinute must be >= 1: " + maxRequestsPerMinute);
        }
        if (windowCapacity <= maxRequestsPerMinute) {
            throw new IllegalArgumentException("windowCapacity (" + windowCapacity
                    + ") must exceed maxRequestsPerMinute (" + maxRequestsPerMinute + ")");
        }
        this.maxRequestsPerMinute = maxRequestsPerMinute;
        this.blockDuration = Objects.requireNonNull(blockDuration, "blockDuration");
        this.windowCapacity = windowCapacity;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastSweepMs = clock.millis();
    }

    public boolean isAllowed(String identity) {
        long now = clock.millis();
        lock.lock();
        try {
            if (now - lastSweepMs >= WINDOW.toMillis()) {
                sweepIdleLocked(now);
            }
            Long until = blockedUntil.get(identity);
            if (until != null) {
                if (now < until) {
                    log.warn("[rate-limit] {} blocked until {}", identity, Instant.ofEpochMilli(until));
                    return false;
                }
                blockedUntil.remove(identity);
                log.info("[rate-limit] block lifted for {}", identity);
            }

            Deque<Long> window = windows.computeIfAbsent(identity, k -> new ArrayDeque<>(windowCapacity));
            window.addLast(now);
            while (window.size() > windowCapacity) {
                window.pollFirst();
            }

            if (countSince(window, now - WINDOW.toMillis()) > maxRequestsPerMinute) {
                long newUntil = now + blockDuration.toMillis();
                blockedUntil.put(identity, newUntil);
                log.warn("[rate-limit] {} exceeded {} req/min, blocked for {}", identity, maxRequestsPerMinute, blockDuration);
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Administrative override: forgets the identity's window and any block. */
    public void reset(String identity) {
        lock.lock();
        try {
            windows.remove(identity);
            blockedUntil.remove(identity);
        } finally {
            lock.unlock();
        }
        log.info("[rate-limit] limits reset for {}", identity);
    }

    public RateLimitStatus status(String identity) {
        long now = clock.millis();
        lock.lock();
        try {
            Long until = blockedUntil.get(identity);
            if (until != null) {
                // whole seconds, rounded down; an expired block reports 0
                return RateLimitStatus.blocked(Instant.ofEpochMilli(until), Math.floorDiv(until - now, 1000L));
            }
            Deque<Long> window = windows.get(identity);
            int recent = window == null ? 0 : countSince(window, now - WINDOW.toMillis());
            return RateLimitStatus.open(recent, maxRequestsPerMinute - recent);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            windows.clear();
            blockedUntil.clear();
        } finally {
            lock.unlock();
        }
    }

    int trackedIdentities() {
        lock.lock();
        try {
            return windows.size();
        } finally {
            lock.unlock();
        }
    }

    private void sweepIdleLocked(long now) {
        long cutoff = now - WINDOW.toMillis();
        blockedUntil.values().removeIf(until -> now >= until);
        int before = windows.size();
        windows.entrySet().removeIf(e -> !blockedUntil.containsKey(e.getKey())
                && (e.getValue().isEmpty() || e.getValue().peekLast() <= cutoff));
        lastSweepMs = now;
        if (before != windows.size()) {
            log.debug("[rate-limit] dropped {} idle identities, {} tracked", before - windows.size(), windows.size());
        }
    }

    private static int countSince(Deque<Long> window, long cutoffExclusive) {
        int n = 0;
        for (Long ts : window) {
            if (ts > cutoffExclusive) {
                n++;
            }
        }
        return n;
    }
}

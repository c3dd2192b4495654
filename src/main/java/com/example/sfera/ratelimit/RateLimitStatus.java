package com.example.sfera.ratelimit;

import java.time.Instant;
import java.util.Optional;

/**
 * Read-only view of one identity's limiter state.
 *
 * @param blocked           whether the identity is serving a penalty
 * @param blockedUntil      end of the penalty, empty when open
 * @param remainingSeconds  seconds left on the penalty, never negative; 0 when open
 * @param requestsLastMinute requests seen in the trailing minute; 0 when blocked
 * @param remainingRequests quota left in the trailing minute; 0 when blocked
 */
public record RateLimitStatus(
        boolean blocked,
        Optional<Instant> blockedUntil,
        long remainingSeconds,
        int requestsLastMinute,
        int remainingRequests) {

    static RateLimitStatus blocked(Instant until, long remainingSeconds) {
        return new RateLimitStatus(true, Optional.of(until), Math.max(0L, remainingSeconds), 0, 0);
    }

    static RateLimitStatus open(int requestsLastMinute, int remainingRequests) {
        return new RateLimitStatus(false, Optional.empty(), 0L, requestsLastMinute, Math.max(0, remainingRequests));
    }
}

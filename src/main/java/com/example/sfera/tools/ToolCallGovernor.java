package com.example.sfera.tools;

import com.example.sfera.cache.ApiResponseCaches;
import com.example.sfera.cache.TtlCache;
import com.example.sfera.ratelimit.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Front door for paid or rate-limited tool calls (web search, crypto price, weather,
 * knowledge base).
 *
 * <p>A fresh cached answer is returned without touching the limiter. Otherwise the
 * user's limiter must admit the request before {@code remoteCall} runs. Successful
 * answers are cached; failures come back as fail-soft text and are not cached.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ToolCallGovernor {

    public static final String RATE_LIMITED_RESPONSE =
            "Too many requests. Please wait a few minutes before trying again.";

    private final ApiResponseCaches caches;
    private final RateLimiter rateLimiter;

    public String invoke(String userId, String toolName, String cacheName, String cacheKey, Supplier<String> remoteCall) {
        TtlCache<String> cache = caches.cache(cacheName);
        Optional<String> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            log.info("[tool:{}] cache hit for user {}", toolName, userId);
            return cached.get();
        }

        if (!rateLimiter.isAllowed(userId)) {
            log.warn("[tool:{}] rejected by rate limiter for user {}", toolName, userId);
            return RATE_LIMITED_RESPONSE;
        }

        try {
            String result = remoteCall.get();
            if (result != null) {
                cache.set(cacheKey, result);
                if (log.isDebugEnabled()) {
                    log.debug("[tool:{}] {}", toolName, cache.stats());
                }
            }
            return result;
        } catch (RuntimeException e) {
            return ToolFailSoft.onFailure(toolName, e, ToolFailSoft.DEFAULT_RESPONSE, true);
        }
    }
}

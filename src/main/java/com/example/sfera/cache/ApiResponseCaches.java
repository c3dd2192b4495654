package com.example.sfera.cache;

import com.example.sfera.config.SferaCacheProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The process-wide set of named response caches, one per external API family.
 */
@Slf4j
public class ApiResponseCaches {

    public static final String WEB_SEARCH = "web-search";
    public static final String KNOWLEDGE_BASE = "knowledge-base";
    public static final String CRYPTO_PRICE = "crypto-price";
    public static final String WEATHER = "weather";

    private final Map<String, TtlCache<String>> caches;

    public ApiResponseCaches(Map<String, SferaCacheProperties.Spec> specs, Clock clock) {
        Map<String, TtlCache<String>> m = new LinkedHashMap<>();
        specs.forEach((name, spec) -> {
            m.put(name, new TtlCache<>(name, spec.getTtl(), spec.getMaxSize(), clock));
            log.info("[cache] '{}' ttl={} maxSize={}", name, spec.getTtl(), spec.getMaxSize());
        });
        this.caches = Collections.unmodifiableMap(m);
    }

    /**
     * @throws IllegalArgumentException for a name that is not configured
     */
    public TtlCache<String> cache(String name) {
        TtlCache<String> c = caches.get(name);
        if (c == null) {
            throw new IllegalArgumentException("Unknown cache: " + name + " (configured: " + caches.keySet() + ")");
        }
        return c;
    }

    public Set<String> names() {
        return caches.keySet();
    }

    public List<CacheStats> stats() {
        List<CacheStats> out = new ArrayList<>(caches.size());
        for (TtlCache<String> c : caches.values()) {
            out.add(c.stats());
        }
        return out;
    }

    public void clearAll() {
        caches.values().forEach(TtlCache::clear);
    }
}

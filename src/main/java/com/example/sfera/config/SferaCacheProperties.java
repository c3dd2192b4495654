package com.example.sfera.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named API-response caches, keyed by cache name ({@code web-search}, {@code crypto-price}, ...).
 */
@Validated
@ConfigurationProperties(prefix = "sfera.cache")
public class SferaCacheProperties {

    @Valid
    private Map<String, Spec> caches = defaults();

    public Map<String, Spec> getCaches() {
        return caches;
    }

    public void setCaches(Map<String, Spec> caches) {
        this.caches = caches;
    }

    public static class Spec {

        /** How long a response stays visible. */
        @NotNull
        private Duration ttl = Duration.ofMinutes(5);

        /** Maximum number of stored responses before the oldest is evicted. */
        @Min(1)
        private int maxSize = 100;

        public Spec() {
        }

        public Spec(Duration ttl, int maxSize) {
            this.ttl = ttl;
            this.maxSize = maxSize;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }
    }

    private static Map<String, Spec> defaults() {
        Map<String, Spec> m = new LinkedHashMap<>();
        m.put("web-search", new Spec(Duration.ofMinutes(10), 50));
        m.put("knowledge-base", new Spec(Duration.ofMinutes(30), 100));
        m.put("crypto-price", new Spec(Duration.ofSeconds(30), 100));
        m.put("weather", new Spec(Duration.ofMinutes(10), 50));
        return m;
    }
}

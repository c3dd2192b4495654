package com.example.sfera.autoconfig;

import com.example.sfera.cache.ApiResponseCaches;
import com.example.sfera.config.SferaCacheProperties;
import com.example.sfera.config.SferaRateLimitProperties;
import com.example.sfera.ratelimit.RateLimiter;
import com.example.sfera.session.SessionRegistry;
import com.example.sfera.tools.ToolCallGovernor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * One cache set, one limiter and one session registry per process, shared by every
 * conversation handler through injection.
 */
@AutoConfiguration
@EnableConfigurationProperties({ SferaCacheProperties.class, SferaRateLimitProperties.class })
public class SferaGovernanceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock sferaClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ApiResponseCaches apiResponseCaches(SferaCacheProperties props, Clock clock) {
        return new ApiResponseCaches(props.getCaches(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimiter rateLimiter(SferaRateLimitProperties props, Clock clock) {
        return new RateLimiter(
                props.getMaxRequestsPerMinute(),
                props.getBlockDuration(),
                props.getWindowCapacity(),
                clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionRegistry sessionRegistry() {
        return new SessionRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolCallGovernor toolCallGovernor(ApiResponseCaches caches, RateLimiter rateLimiter) {
        return new ToolCallGovernor(caches, rateLimiter);
    }
}

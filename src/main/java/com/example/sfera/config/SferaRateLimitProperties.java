package com.example.sfera.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "sfera.rate-limit")
public class SferaRateLimitProperties {

    /** Requests admitted per trailing minute. The next one triggers a block. */
    @Min(1)
    private int maxRequestsPerMinute = 10;

    /** Penalty applied once the threshold is exceeded. */
    @NotNull
    private Duration blockDuration = Duration.ofMinutes(5);

    /** Timestamps remembered per identity; older ones are dropped. Must exceed the threshold. */
    @Min(1)
    private int windowCapacity = 20;

    public int getMaxRequestsPerMinute() {
        return maxRequestsPerMinute;
    }

    public void setMaxRequestsPerMinute(int maxRequestsPerMinute) {
        this.maxRequestsPerMinute = maxRequestsPerMinute;
    }

    public Duration getBlockDuration() {
        return blockDuration;
    }

    public void setBlockDuration(Duration blockDuration) {
        this.blockDuration = blockDuration;
    }

    public int getWindowCapacity() {
        return windowCapacity;
    }

    public void setWindowCapacity(int windowCapacity) {
        this.windowCapacity = windowCapacity;
    }
}

package com.example.sfera.tools;

import org.junit.jupiter.api.Test;

import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class ToolFailSoftTest {

    @Test
    void passesResultThrough() {
        assertThat(ToolFailSoft.call("price", () -> "42")).isEqualTo("42");
    }

    @Test
    void failureBecomesDefaultResponseWithDetails() {
        String out = ToolFailSoft.call("price", () -> {
            throw new IllegalStateException("exchange timeout");
        });

        assertThat(out).isEqualTo(ToolFailSoft.DEFAULT_RESPONSE + " Details: exchange timeout");
    }

    @Test
    void customDefaultResponse() {
        String out = ToolFailSoft.call("weather", () -> {
            throw new IllegalArgumentException("unknown city");
        }, "Weather is unavailable.", false);

        assertThat(out).isEqualTo("Weather is unavailable. Details: unknown city");
    }

    @Test
    void silentReturnsFallbackOnFailure() {
        Integer out = ToolFailSoft.silent("count", () -> {
            throw new IllegalStateException("boom");
        }, -1);

        assertThat(out).isEqualTo(-1);
        assertThat(ToolFailSoft.silent("count", () -> 7, -1)).isEqualTo(7);
    }

    @Test
    void silentlyWrapsLazily() {
        int[] calls = {0};
        Supplier<String> wrapped = ToolFailSoft.silently("kb", () -> {
            calls[0]++;
            throw new IllegalStateException("boom");
        }, "");

        assertThat(calls[0]).isZero();
        assertThat(wrapped.get()).isEmpty();
        assertThat(calls[0]).isEqualTo(1);
    }
}

package com.example.sfera.tools;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Fail-soft wrappers for tool calls made on behalf of the agent. A tool failure must
 * not end the conversation, so the error is logged and the agent gets a fallback.
 */
@Slf4j
public final class ToolFailSoft {

    public static final String DEFAULT_RESPONSE = "An error occurred while performing the operation.";

    private ToolFailSoft() {
    }

    public static String call(String toolName, Supplier<String> body) {
        return call(toolName, body, DEFAULT_RESPONSE, true);
    }

    /**
     * Runs {@code body}; on failure returns {@code defaultResponse} followed by the error
     * message so the agent can tell the user what went wrong.
     */
    public static String call(String toolName, Supplier<String> body, String defaultResponse, boolean logStackTrace) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            return onFailure(toolName, e, defaultResponse, logStackTrace);
        }
    }

    /**
     * Logs {@code error} and builds the text handed back to the agent in place of a result.
     */
    public static String onFailure(String toolName, RuntimeException error, String defaultResponse, boolean logStackTrace) {
        if (logStackTrace) {
            log.error("Error in tool '{}': {}", toolName, error.getMessage(), error);
        } else {
            log.error("Error in tool '{}': {}", toolName, error.getMessage());
        }
        return defaultResponse + " Details: " + error.getMessage();
    }

    /**
     * For optional work: on failure logs a warning and returns {@code fallback}.
     */
    public static <T> T silent(String toolName, Supplier<T> body, T fallback) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            log.warn("Silently handled error in '{}': {}", toolName, e.getMessage());
            return fallback;
        }
    }

    /** {@link #silent} as a reusable supplier. */
    public static <T> Supplier<T> silently(String toolName, Supplier<T> body, T fallback) {
        return () -> silent(toolName, body, fallback);
    }
}

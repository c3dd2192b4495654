package com.example.sfera.memory;

/**
 * One of the memory sources failed while bootstrapping a session. The caller decides
 * whether to continue with an empty context or abort.
 */
public class MemoryLoadException extends RuntimeException {

    private final String userId;

    public MemoryLoadException(String userId, Throwable cause) {
        super("could not load memory for user " + userId + ": " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}

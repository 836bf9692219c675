package com.surveillance.baseline.service;

/**
 * Thrown when a baseline row kept changing under every optimistic write attempt.
 * The caller's transaction should be treated as failed; nothing was written for that row.
 */
public class BaselineUpdateConflictException extends RuntimeException {

    private final String store;
    private final String key;
    private final int attempts;

    public BaselineUpdateConflictException(String store, String key, int attempts) {
        this(store, key, attempts, null);
    }

    public BaselineUpdateConflictException(String store, String key, int attempts, Throwable cause) {
        super(String.format("Gave up updating %s baseline %s after %d concurrent-write conflicts",
                store, key, attempts), cause);
        this.store = store;
        this.key = key;
        this.attempts = attempts;
    }

    public String getStore() {
        return store;
    }

    public String getKey() {
        return key;
    }

    public int getAttempts() {
        return attempts;
    }
}

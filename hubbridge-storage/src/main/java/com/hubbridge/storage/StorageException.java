package com.hubbridge.storage;

/**
 * Thrown when a persisted store cannot be read, written or reached.
 * Carries the store and context so callers can report which identity or registry was affected.
 */
public class StorageException extends RuntimeException {

    private final String store;
    private final String context;

    public StorageException(String store, String context, String message, Throwable cause) {
        super(message, cause);
        this.store = store;
        this.context = context;
    }

    public StorageException(String store, String context, String message) {
        this(store, context, message, null);
    }

    public String getStore() {
        return store;
    }

    /** Context name, or null when the failure concerns the whole store. */
    public String getContext() {
        return context;
    }
}

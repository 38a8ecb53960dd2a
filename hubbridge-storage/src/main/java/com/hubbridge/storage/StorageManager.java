package com.hubbridge.storage;

import java.util.List;

/**
 * A persisted store holding named {@link StorageContext}s.
 * Implementations: {@link JsonFileStorageManager} (single file), {@link DirectoryStorageManager}
 * (one file per context) and {@link RedisStorageManager}.
 */
public interface StorageManager extends AutoCloseable {

    /** Returns the context with this name, creating it empty when it does not exist yet. */
    StorageContext createContext(String name);

    /** Names of the contexts currently persisted. */
    List<String> contextNames();

    /** Human readable location, used in logs. */
    String describe();

    boolean isClosed();

    /** Releases the connection or file handles. Contexts handed out before become unusable. */
    @Override
    void close();

    /**
     * Deletes every persisted context. Works on a closed manager too, since reset and factory reset
     * run after the stores are closed.
     */
    void destroy();
}

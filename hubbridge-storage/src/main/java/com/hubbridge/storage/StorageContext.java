package com.hubbridge.storage;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.Set;

/**
 * Named key-value context inside a {@link StorageManager}. Values are stored as JSON.
 * Every write goes straight to the backing store.
 */
public interface StorageContext {

    String getName();

    /** Returns the stored value converted to {@code type}, or {@code defaultValue} when the key is absent. */
    <T> T get(String key, Class<T> type, T defaultValue);

    <T> T get(String key, TypeReference<T> type, T defaultValue);

    void set(String key, Object value);

    boolean has(String key);

    void remove(String key);

    /** Removes every key of this context. */
    void clearAll();

    Set<String> keys();
}

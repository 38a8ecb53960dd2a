package com.hubbridge.config;

import java.util.Locale;

/** Backend for the identity store and node storage. */
public enum StorageBackendType {
    /** JSON files under the bridge home directory. */
    JSON,
    /** Redis hashes (HUBBRIDGE_CACHE_HOST / HUBBRIDGE_CACHE_PORT). */
    REDIS;

    public static StorageBackendType fromValue(String value) {
        if (value == null || value.isBlank()) return JSON;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

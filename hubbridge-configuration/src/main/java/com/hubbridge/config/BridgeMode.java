package com.hubbridge.config;

import java.util.Locale;

/**
 * Topology policy for the whole process lifetime. Set once at startup.
 */
public enum BridgeMode {
    /** One shared commissioning identity and aggregator exposes every plugin's devices. */
    BRIDGE("bridge"),
    /** Each plugin (or accessory) gets its own commissioning identity. */
    CHILDBRIDGE("childbridge"),
    /** No plugin is loaded; only the protocol engine runs with a controller context. */
    CONTROLLER("controller");

    private final String value;

    BridgeMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** Parses {@code bridge}, {@code childbridge} or {@code controller} (case-insensitive). */
    public static BridgeMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Bridge mode is blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (BridgeMode mode : values()) {
            if (mode.value.equals(normalized)) return mode;
        }
        throw new IllegalArgumentException("Unknown bridge mode: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}

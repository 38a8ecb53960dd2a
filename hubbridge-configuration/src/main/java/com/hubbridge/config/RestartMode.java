package com.hubbridge.config;

import java.util.Locale;

/**
 * How the process is supervised. With {@link #SERVICE} or {@link #DOCKER} an update exits the
 * process so the supervisor can restart the updated package; with {@link #NONE} it restarts in place.
 */
public enum RestartMode {
    NONE(""),
    SERVICE("service"),
    DOCKER("docker");

    private final String value;

    RestartMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static RestartMode fromValue(String value) {
        if (value == null || value.isBlank()) return NONE;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RestartMode mode : values()) {
            if (mode.value.equals(normalized)) return mode;
        }
        throw new IllegalArgumentException("Unknown restart mode: " + value);
    }
}

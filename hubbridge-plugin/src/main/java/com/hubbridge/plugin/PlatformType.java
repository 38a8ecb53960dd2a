package com.hubbridge.plugin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declared kind of a platform. Decides the childbridge topology: an accessory platform exposes
 * exactly one device as its own identity, a dynamic platform exposes many behind an aggregator.
 */
public enum PlatformType {
    ACCESSORY("AccessoryPlatform"),
    DYNAMIC("DynamicPlatform");

    private final String value;

    PlatformType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PlatformType fromValue(String value) {
        if (value == null) return null;
        for (PlatformType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) return type;
        }
        throw new IllegalArgumentException("Unknown platform type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.hubbridge.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * JSON configuration of one plugin ({@code <plugin>.config.json}). Always carries {@code name}, {@code type},
 * {@code debug} and {@code unregisterOnShutdown}; every other field is plugin-defined.
 * Platforms may change fields at runtime; the bridge writes the live config back after a successful configure.
 */
public final class PlatformConfig {

    public static final String NAME = "name";
    public static final String TYPE = "type";
    public static final String DEBUG = "debug";
    public static final String UNREGISTER_ON_SHUTDOWN = "unregisterOnShutdown";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectNode json;

    private PlatformConfig(ObjectNode json) {
        this.json = json;
    }

    /** Default configuration for a plugin that has no file yet. */
    public static PlatformConfig defaults(String name, PlatformType type) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(NAME, Objects.requireNonNull(name, "name"));
        node.put(TYPE, type != null ? type.getValue() : null);
        node.put(DEBUG, false);
        node.put(UNREGISTER_ON_SHUTDOWN, false);
        return new PlatformConfig(node);
    }

    /**
     * Wraps a stored document, forcing {@code name} and {@code type} to the plugin's identity and filling the
     * two mandatory booleans when absent.
     */
    public static PlatformConfig of(JsonNode stored, String name, PlatformType type) {
        ObjectNode node = stored instanceof ObjectNode o ? o.deepCopy() : MAPPER.createObjectNode();
        node.put(NAME, Objects.requireNonNull(name, "name"));
        if (type != null) {
            node.put(TYPE, type.getValue());
        }
        if (!node.has(DEBUG)) node.put(DEBUG, false);
        if (!node.has(UNREGISTER_ON_SHUTDOWN)) node.put(UNREGISTER_ON_SHUTDOWN, false);
        return new PlatformConfig(node);
    }

    public String getName() {
        return json.path(NAME).asText(null);
    }

    public String getType() {
        return json.path(TYPE).asText(null);
    }

    public boolean isDebug() {
        return json.path(DEBUG).asBoolean(false);
    }

    public boolean isUnregisterOnShutdown() {
        return json.path(UNREGISTER_ON_SHUTDOWN).asBoolean(false);
    }

    /** Raw value of a plugin-defined field, or a missing node. */
    public JsonNode get(String field) {
        return json.path(field);
    }

    public String getString(String field, String defaultValue) {
        JsonNode node = json.get(field);
        return node != null && !node.isNull() ? node.asText() : defaultValue;
    }

    public int getInt(String field, int defaultValue) {
        JsonNode node = json.get(field);
        return node != null && node.canConvertToInt() ? node.asInt() : defaultValue;
    }

    public boolean getBoolean(String field, boolean defaultValue) {
        JsonNode node = json.get(field);
        return node != null && node.isBoolean() ? node.asBoolean() : defaultValue;
    }

    public void set(String field, Object value) {
        if (NAME.equals(field)) {
            throw new IllegalArgumentException("The plugin name cannot be changed");
        }
        json.set(field, MAPPER.valueToTree(value));
    }

    /** Copy of the whole document. */
    public ObjectNode toJson() {
        return json.deepCopy();
    }

    @Override
    public String toString() {
        return json.toString();
    }
}

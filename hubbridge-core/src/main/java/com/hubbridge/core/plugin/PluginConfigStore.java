package com.hubbridge.core.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hubbridge.plugin.PlatformConfig;
import com.hubbridge.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Per-plugin configuration ({@code <home>/<plugin>.config.json}) and schema ({@code <plugin>.schema.json} next to
 * the manifest, or a default schema).
 */
public final class PluginConfigStore {

    private static final Logger log = LoggerFactory.getLogger(PluginConfigStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path directory;

    public PluginConfigStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path configFile(RegisteredPlugin plugin) {
        return directory.resolve(plugin.getName() + ".config.json");
    }

    /**
     * Reads the plugin's configuration, creating the file with defaults the first time.
     * {@code name} and {@code type} are always forced to the plugin's identity.
     */
    public PlatformConfig load(RegisteredPlugin plugin) {
        Path file = configFile(plugin);
        try {
            PlatformConfig config;
            if (Files.isRegularFile(file)) {
                config = PlatformConfig.of(MAPPER.readTree(file.toFile()), plugin.getName(), plugin.getType());
                log.debug("Loaded config file {} for plugin {}", file, plugin.getName());
            } else {
                config = PlatformConfig.defaults(plugin.getName(), plugin.getType());
                write(file, config.toJson());
                log.debug("Created config file {} for plugin {}", file, plugin.getName());
            }
            plugin.setConfigJson(config.toJson());
            return config;
        } catch (IOException e) {
            throw new StorageException(file.toString(), plugin.getName(), "Cannot read plugin config", e);
        }
    }

    public void save(RegisteredPlugin plugin, PlatformConfig config) {
        Path file = configFile(plugin);
        try {
            write(file, config.toJson());
            plugin.setConfigJson(config.toJson());
            log.debug("Saved config file {} for plugin {}", file, plugin.getName());
        } catch (IOException e) {
            throw new StorageException(file.toString(), plugin.getName(), "Cannot write plugin config", e);
        }
    }

    /**
     * Saves a configuration received from the administration surface.
     *
     * @throws IllegalArgumentException if {@code name} or {@code type} is missing or the name does not match
     */
    public void saveFromJson(RegisteredPlugin plugin, JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("Config for plugin " + plugin.getName() + " is not a JSON object");
        }
        if (!json.hasNonNull(PlatformConfig.NAME) || !json.hasNonNull(PlatformConfig.TYPE)) {
            throw new IllegalArgumentException("Config for plugin " + plugin.getName() + " has no name or type");
        }
        if (!plugin.getName().equals(json.get(PlatformConfig.NAME).asText())) {
            throw new IllegalArgumentException("Config name " + json.get(PlatformConfig.NAME).asText()
                    + " does not match plugin " + plugin.getName());
        }
        save(plugin, PlatformConfig.of(json, plugin.getName(), plugin.getType()));
    }

    /** Reads the plugin's schema next to its manifest, falling back to the default schema. */
    public JsonNode loadSchema(RegisteredPlugin plugin) {
        JsonNode schema = null;
        if (plugin.getPath() != null) {
            Path manifestDir = Path.of(plugin.getPath()).getParent();
            Path file = manifestDir != null ? manifestDir.resolve(plugin.getName() + ".schema.json") : null;
            if (file != null && Files.isRegularFile(file)) {
                try {
                    schema = MAPPER.readTree(file.toFile());
                } catch (IOException e) {
                    log.warn("Cannot read schema {} for plugin {}: {}", file, plugin.getName(), e.getMessage());
                }
            }
        }
        if (schema == null) {
            schema = defaultSchema(plugin);
        }
        plugin.setSchemaJson(schema);
        return schema;
    }

    static ObjectNode defaultSchema(RegisteredPlugin plugin) {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("title", plugin.getDescription() != null ? plugin.getDescription() : plugin.getName());
        schema.put("description", plugin.getName() + " by " + (plugin.getAuthor() != null ? plugin.getAuthor() : "unknown"));
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        properties.putObject(PlatformConfig.NAME).put("description", "Plugin name").put("type", "string").put("readOnly", true);
        properties.putObject(PlatformConfig.TYPE).put("description", "Plugin type").put("type", "string").put("readOnly", true);
        properties.putObject(PlatformConfig.DEBUG).put("description", "Enable the debug for the plugin")
                .put("type", "boolean").put("default", false);
        properties.putObject(PlatformConfig.UNREGISTER_ON_SHUTDOWN)
                .put("description", "Unregister all devices on shutdown")
                .put("type", "boolean").put("default", false);
        return schema;
    }

    private static void write(Path file, JsonNode json) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        MAPPER.writeValue(file.toFile(), json);
    }
}

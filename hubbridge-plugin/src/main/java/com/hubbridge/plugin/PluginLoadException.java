package com.hubbridge.plugin;

/**
 * Thrown when a plugin's manifest cannot be resolved or read, or its entry point cannot be instantiated.
 */
public class PluginLoadException extends RuntimeException {

    private final String plugin;

    public PluginLoadException(String plugin, String message, Throwable cause) {
        super(message, cause);
        this.plugin = plugin;
    }

    public PluginLoadException(String plugin, String message) {
        this(plugin, message, null);
    }

    /** Plugin name or path the failure refers to. */
    public String getPlugin() {
        return plugin;
    }
}

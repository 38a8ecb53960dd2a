package com.hubbridge.core.topology;

/**
 * The requested device operation does not fit the plugin's topology, e.g. a second device for an accessory
 * platform in childbridge mode.
 */
public class UnsupportedTopologyException extends RuntimeException {

    private final String pluginName;

    public UnsupportedTopologyException(String pluginName, String message) {
        super(message);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}

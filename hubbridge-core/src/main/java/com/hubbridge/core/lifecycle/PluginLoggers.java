package com.hubbridge.core.lifecycle;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loggers handed to plugins, named {@code hubbridge.plugin.<name>}. With Logback as the binding the level is
 * switched to DEBUG when the plugin's config asks for it; other bindings keep their own configuration.
 */
public final class PluginLoggers {

    public static final String PREFIX = "hubbridge.plugin.";

    private PluginLoggers() {
    }

    public static Logger forPlugin(String pluginName, boolean debug) {
        Logger logger = LoggerFactory.getLogger(PREFIX + pluginName);
        if (logger instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(debug ? Level.DEBUG : null);
        }
        return logger;
    }
}

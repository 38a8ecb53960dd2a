package com.hubbridge.app;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runtime log level changes on the Logback binding.
 */
final class LogLevels {

    static final String BRIDGE_LOGGER = "com.hubbridge";

    private LogLevels() {
    }

    /** Switches the bridge loggers to DEBUG; plugin loggers follow their own {@code debug} config. */
    static void enableDebug() {
        if (LoggerFactory.getLogger(BRIDGE_LOGGER) instanceof Logger logback) {
            logback.setLevel(Level.DEBUG);
            logback.debug("Debug logging enabled");
        }
    }
}

package com.hubbridge.plugin;

import org.slf4j.Logger;

/**
 * Entry point of a plugin. Named by the {@code main} field of {@code plugin.json}, or discovered via
 * {@link java.util.ServiceLoader} ({@code META-INF/services/com.hubbridge.plugin.PlatformFactory}).
 * Implementations need a public no-argument constructor.
 */
public interface PlatformFactory {

    /**
     * Creates the platform instance.
     *
     * @param bridge handle to register devices and subscribe to events
     * @param log    logger scoped to the plugin
     * @param config the plugin's persisted configuration
     */
    BridgePlatform create(BridgeHandle bridge, Logger log, PlatformConfig config);
}

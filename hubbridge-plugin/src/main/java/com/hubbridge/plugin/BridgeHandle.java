package com.hubbridge.plugin;

import com.hubbridge.config.BridgeMode;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.plugin.event.BridgeEventBus;

import java.nio.file.Path;

/**
 * What a platform sees of the bridge. Device registration goes through the topology rules of the
 * current {@link BridgeMode}.
 */
public interface BridgeHandle {

    BridgeMode getBridgeMode();

    String getBridgeVersion();

    Path getHomeDirectory();

    BridgeEventBus getEventBus();

    /**
     * Exposes a device for the plugin.
     *
     * @throws RuntimeException {@code UnsupportedTopologyException} when the plugin cannot expose another device
     */
    void addBridgedDevice(String pluginName, BridgedDevice device);

    void removeBridgedDevice(String pluginName, BridgedDevice device);

    void removeAllBridgedDevices(String pluginName);
}

package com.hubbridge.core.device;

import com.hubbridge.device.BridgedDevice;

import java.util.Objects;

/** A device exposed for a plugin. The device itself belongs to the plugin. */
public record RegisteredDevice(String pluginName, BridgedDevice device) {

    public RegisteredDevice {
        Objects.requireNonNull(pluginName, "pluginName");
        Objects.requireNonNull(device, "device");
    }
}

package com.hubbridge.plugin.event;

import com.hubbridge.device.BridgedDevice;

import java.util.Objects;

/**
 * Closed set of events exchanged between the bridge, its platforms and the process lifecycle.
 */
public sealed interface BridgeEvent
        permits BridgeEvent.Shutdown, BridgeEvent.Restart, BridgeEvent.Update,
        BridgeEvent.StartDynamicPlatform, BridgeEvent.RegisterDevice {

    /** Cleanup finished and the process should exit. */
    record Shutdown(String reason) implements BridgeEvent {
    }

    /** Cleanup finished and a fresh bridge instance should be built in this process. */
    record Restart(String reason) implements BridgeEvent {
    }

    /** Cleanup finished after an update of the bridge package. */
    record Update(String reason) implements BridgeEvent {
    }

    /** A dynamic platform completed its start hook. */
    record StartDynamicPlatform(String pluginName) implements BridgeEvent {
        public StartDynamicPlatform {
            Objects.requireNonNull(pluginName, "pluginName");
        }
    }

    /** A platform registered a device with the bridge. */
    record RegisterDevice(String pluginName, BridgedDevice device) implements BridgeEvent {
        public RegisterDevice {
            Objects.requireNonNull(pluginName, "pluginName");
            Objects.requireNonNull(device, "device");
        }
    }
}

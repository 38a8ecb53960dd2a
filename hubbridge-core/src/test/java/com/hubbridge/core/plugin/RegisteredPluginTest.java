package com.hubbridge.core.plugin;

import com.hubbridge.config.BridgeMode;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.plugin.BridgeHandle;
import com.hubbridge.plugin.DynamicPlatform;
import com.hubbridge.plugin.PlatformConfig;
import com.hubbridge.plugin.PlatformType;
import com.hubbridge.plugin.event.BridgeEventBus;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegisteredPluginTest {

    private static DynamicPlatform platform(String name) {
        BridgeHandle handle = new BridgeHandle() {
            private final BridgeEventBus bus = new BridgeEventBus();

            @Override
            public BridgeMode getBridgeMode() {
                return BridgeMode.BRIDGE;
            }

            @Override
            public String getBridgeVersion() {
                return "1.0.0";
            }

            @Override
            public Path getHomeDirectory() {
                return Path.of(".");
            }

            @Override
            public BridgeEventBus getEventBus() {
                return bus;
            }

            @Override
            public void addBridgedDevice(String pluginName, BridgedDevice device) {
            }

            @Override
            public void removeBridgedDevice(String pluginName, BridgedDevice device) {
            }

            @Override
            public void removeAllBridgedDevices(String pluginName) {
            }
        };
        return new DynamicPlatform(handle, LoggerFactory.getLogger(name), PlatformConfig.defaults(name, PlatformType.DYNAMIC)) {
        };
    }

    @Test
    void markStarted_requiresLoaded() {
        RegisteredPlugin plugin = new RegisteredPlugin("lights", null);

        assertThrows(IllegalStateException.class, plugin::markStarted);
        assertThrows(IllegalStateException.class, plugin::markConfigured);
    }

    @Test
    void markLoaded_resetsCountersAndType() {
        RegisteredPlugin plugin = new RegisteredPlugin("lights", null);
        assertNull(plugin.getRegisteredDevices());

        plugin.markLoaded(platform("lights"), null);

        assertTrue(plugin.isLoaded());
        assertEquals(PlatformType.DYNAMIC, plugin.getType());
        assertEquals(0, plugin.getRegisteredDevices());
        assertEquals(0, plugin.getAddedDevices());
    }

    @Test
    void lock_succeedsOnce() {
        RegisteredPlugin plugin = new RegisteredPlugin("lights", null);

        assertTrue(plugin.lock());
        assertFalse(plugin.lock());
        assertTrue(plugin.isLocked());
    }

    @Test
    void resetRunState_refusesWhileDevicesAreAttached() {
        RegisteredPlugin plugin = new RegisteredPlugin("lights", null);
        plugin.markLoaded(platform("lights"), null);
        plugin.deviceRegistered();
        plugin.deviceAdded();

        assertThrows(IllegalStateException.class, plugin::resetRunState);

        plugin.deviceRemoved();
        plugin.resetRunState();
        assertFalse(plugin.isLoaded());
        assertNull(plugin.getPlatform());
        assertNull(plugin.getAddedDevices());
    }

    @Test
    void fromSummary_keepsOnlyIdentityAndEnabled() {
        RegisteredPlugin plugin = new RegisteredPlugin("lights", "/plugins/lights/plugin.json");
        plugin.markLoaded(platform("lights"), null);
        plugin.markStarted();
        plugin.setEnabled(false);

        RegisteredPlugin restored = RegisteredPlugin.fromSummary(plugin.toSummary());

        assertEquals("lights", restored.getName());
        assertEquals("/plugins/lights/plugin.json", restored.getPath());
        assertEquals(PlatformType.DYNAMIC, restored.getType());
        assertFalse(restored.isEnabled());
        assertFalse(restored.isLoaded());
        assertFalse(restored.isStarted());
    }
}

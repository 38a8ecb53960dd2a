package com.hubbridge.core.device;

import com.hubbridge.device.BasicInformation;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.device.DeviceTypes;
import com.hubbridge.device.SerializedDevice;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeviceRegistryTest {

    private static BridgedDevice device(String name) {
        return new BridgedDevice(name, DeviceTypes.ON_OFF_PLUG_IN_UNIT,
                BasicInformation.of(name, "SN-" + name, 0xfff2, "Test vendor", 0x0003, "Plug"));
    }

    @Test
    void add_rejectsTheSameInstanceTwice() {
        DeviceRegistry registry = new DeviceRegistry();
        BridgedDevice plug = device("plug");
        registry.add("plugs", plug);

        assertThrows(IllegalArgumentException.class, () -> registry.add("other", plug));
        registry.add("plugs", device("plug"));
        assertEquals(2, registry.size());
    }

    @Test
    void remove_needsTheOwningPlugin() {
        DeviceRegistry registry = new DeviceRegistry();
        BridgedDevice plug = device("plug");
        registry.add("plugs", plug);

        assertFalse(registry.remove("other", plug));
        assertTrue(registry.remove("plugs", plug));
        assertFalse(registry.contains(plug));
    }

    @Test
    void removeAll_returnsDevicesInRegistrationOrder() {
        DeviceRegistry registry = new DeviceRegistry();
        BridgedDevice first = device("first");
        BridgedDevice second = device("second");
        BridgedDevice foreign = device("foreign");
        registry.add("plugs", first);
        registry.add("lights", foreign);
        registry.add("plugs", second);

        assertEquals(List.of(first, second), registry.removeAll("plugs"));
        assertEquals(List.of(foreign), registry.devicesOf("lights"));
    }

    @Test
    void findByEndpoint_matchesPluginAndNumber() {
        DeviceRegistry registry = new DeviceRegistry();
        BridgedDevice plug = device("plug");
        plug.setEndpointNumber(3);
        registry.add("plugs", plug);

        assertSame(plug, registry.findByEndpoint("plugs", 3).orElseThrow());
        assertTrue(registry.findByEndpoint("plugs", 4).isEmpty());
        assertTrue(registry.findByEndpoint("lights", 3).isEmpty());
    }

    @Test
    void serialize_tagsDevicesWithTheirPlugin() {
        DeviceRegistry registry = new DeviceRegistry();
        registry.add("plugs", device("plug"));

        SerializedDevice serialized = registry.serialize().get(0);

        assertEquals("plugs", serialized.pluginName());
        assertEquals("plug", serialized.deviceName());
        assertEquals("SN-plug", serialized.serialNumber());
    }
}

package com.hubbridge.plugin.example;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hubbridge.config.BridgeMode;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.device.DeviceTypes;
import com.hubbridge.plugin.BridgePlatform;
import com.hubbridge.plugin.PlatformConfig;
import com.hubbridge.plugin.PlatformFactory;
import com.hubbridge.plugin.PlatformType;
import com.hubbridge.plugin.event.BridgeEvent;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceLoader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExampleLightsPlatformTest {

    private final RecordingBridgeHandle bridge = new RecordingBridgeHandle(BridgeMode.BRIDGE);

    private ExampleLightsPlatform platform(ObjectNode config) {
        return (ExampleLightsPlatform) new ExampleLightsFactory().create(bridge,
                LoggerFactory.getLogger("hubbridge.plugin.lights"),
                PlatformConfig.of(config, "lights", PlatformType.DYNAMIC));
    }

    @Test
    void start_registersTheConfiguredLights() {
        List<BridgeEvent.RegisterDevice> announced = new ArrayList<>();
        bridge.eventBus.subscribe(BridgeEvent.RegisterDevice.class, announced::add);
        ExampleLightsPlatform lights = platform(new ObjectMapper().createObjectNode().put("lights", 3));

        lights.onStart("test").toCompletableFuture().join();

        assertEquals(PlatformType.DYNAMIC, lights.getType());
        assertEquals(3, bridge.devices.size());
        assertEquals(3, announced.size());
        BridgedDevice first = bridge.devices.get(0);
        assertEquals("Light 1", first.getDeviceName());
        assertEquals("EX-lights-001", first.getSerialNumber());
        assertEquals(DeviceTypes.DIMMABLE_LIGHT, first.getDeviceType());
        assertEquals(List.of(BridgedDevice.BASIC_INFORMATION_CLUSTER, ExampleDevices.ON_OFF, ExampleDevices.LEVEL_CONTROL),
                first.getClusterServerNames());
    }

    @Test
    void start_withoutDimmingUsesOnOffLights() {
        ExampleLightsPlatform lights = platform(new ObjectMapper().createObjectNode().put("dimmable", false));

        lights.onStart("test").toCompletableFuture().join();

        assertEquals(ExampleLightsPlatform.DEFAULT_LIGHTS, bridge.devices.size());
        assertEquals(DeviceTypes.ON_OFF_LIGHT, bridge.devices.get(0).getDeviceType());
        assertEquals(List.of(BridgedDevice.BASIC_INFORMATION_CLUSTER, ExampleDevices.ON_OFF),
                bridge.devices.get(0).getClusterServerNames());
    }

    @Test
    void start_rejectsNegativeCount() {
        ExampleLightsPlatform lights = platform(new ObjectMapper().createObjectNode().put("lights", -1));

        assertThrows(IllegalArgumentException.class, () -> lights.onStart("test"));
        assertTrue(bridge.devices.isEmpty());
    }

    @Test
    void configure_appliesStartOn() {
        ExampleLightsPlatform lights = platform(new ObjectMapper().createObjectNode().put("startOn", true));
        lights.onStart("test").toCompletableFuture().join();

        lights.onConfigure().toCompletableFuture().join();

        for (BridgedDevice light : bridge.devices) {
            assertEquals(true, light.getAttribute("OnOff", "onOff"));
            assertEquals(ExampleDevices.MAX_LEVEL, light.getAttribute("LevelControl", "currentLevel"));
        }
    }

    @Test
    void setOn_offResetsTheLevel() {
        ExampleLightsPlatform lights = platform(new ObjectMapper().createObjectNode());
        lights.onStart("test").toCompletableFuture().join();
        BridgedDevice light = lights.getRegisteredDevices().get(1);

        lights.setOn(light, true);
        lights.setOn(light, false);

        assertFalse((Boolean) light.getAttribute("OnOff", "onOff"));
        assertEquals(0, light.getAttribute("LevelControl", "currentLevel"));
    }

    @Test
    void serviceRegistration_findsTheLightsFactory() {
        Iterator<PlatformFactory> factories = ServiceLoader.load(PlatformFactory.class).iterator();

        assertTrue(factories.hasNext());
        BridgePlatform platform = factories.next().create(bridge, LoggerFactory.getLogger("test"),
                PlatformConfig.defaults("lights", PlatformType.DYNAMIC));
        assertInstanceOf(ExampleLightsPlatform.class, platform);
    }
}

package com.hubbridge.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hubbridge.config.BridgeMode;
import com.hubbridge.core.admin.AdminCommand;
import com.hubbridge.core.admin.AdminCommandDispatcher;
import com.hubbridge.core.admin.AdminQueries;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.device.SerializedDevice;
import com.hubbridge.plugin.event.BridgeEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdminSurfaceTest {

    @TempDir
    Path home;

    private BridgeFixture fx;
    private HubBridge bridge;

    @BeforeEach
    void setUp() {
        TestPlatforms.reset();
        fx = new BridgeFixture(home);
        Path lights = fx.writePlugin("lights", TestPlatforms.DynamicFactory.class, Map.of("devices", 2));
        bridge = fx.start(BridgeMode.BRIDGE, lights);
        fx.poll();
    }

    @Test
    void command_verbsAreCaseInsensitive() {
        assertEquals(AdminCommand.FACTORY_RESET, AdminCommand.fromVerb(" FactoryReset "));
        assertTrue(AdminCommand.ADD_PLUGIN.requiresParameter());
        assertFalse(AdminCommand.RESTART.requiresParameter());
        assertThrows(IllegalArgumentException.class, () -> AdminCommand.fromVerb("reboot"));
    }

    @Test
    void dispatch_rejectsUnknownVerbAndMissingParameter() {
        AdminCommandDispatcher dispatcher = new AdminCommandDispatcher(bridge);

        CompletableFuture<Void> unknown = dispatcher.dispatch("reboot", null, null);
        CompletableFuture<Void> missing = dispatcher.dispatch("disableplugin", " ", null);

        CompletionException e = assertThrows(CompletionException.class, unknown::join);
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertThrows(CompletionException.class, missing::join);
        assertTrue(bridge.getPluginRegistry().get("lights").orElseThrow().isEnabled());
    }

    @Test
    void dispatch_disablePluginRunsTheOperation() {
        AdminCommandDispatcher dispatcher = new AdminCommandDispatcher(bridge);

        dispatcher.dispatch("disableplugin", "lights", null).join();

        assertFalse(bridge.getPluginRegistry().get("lights").orElseThrow().isEnabled());
    }

    @Test
    void dispatch_saveConfigFailureCompletesExceptionally() {
        AdminCommandDispatcher dispatcher = new AdminCommandDispatcher(bridge);
        ObjectNode noType = new ObjectMapper().createObjectNode().put("name", "lights");

        CompletableFuture<Void> result = dispatcher.dispatch(AdminCommand.SAVE_CONFIG, "lights", noType);

        assertTrue(result.isCompletedExceptionally());
    }

    @Test
    void dispatch_restartCompletesAfterCleanup() {
        AdminCommandDispatcher dispatcher = new AdminCommandDispatcher(bridge);

        CompletableFuture<Void> result = dispatcher.dispatch("restart", null, null);
        assertFalse(result.isDone());
        fx.runCleanup();

        assertTrue(result.isDone());
        assertEquals(List.of(new BridgeEvent.Restart("restarting...")), fx.completionEvents);
    }

    @Test
    void dispatch_unregisterRemovesDevicesThenShutsDown() {
        AdminCommandDispatcher dispatcher = new AdminCommandDispatcher(bridge);
        assertEquals(2, bridge.getDeviceRegistry().devicesOf("lights").size());

        CompletableFuture<Void> result = dispatcher.dispatch("unregister", null, null);
        assertTrue(bridge.getDeviceRegistry().devicesOf("lights").isEmpty());
        fx.runCleanup();

        assertTrue(result.isDone());
        assertEquals(List.of(new BridgeEvent.Shutdown("unregistered all devices and shutting down...")),
                fx.completionEvents);
    }

    @Test
    void dispatch_installPluginWithoutInstallerLogsAndKeepsRegistry() {
        AdminCommandDispatcher dispatcher = new AdminCommandDispatcher(bridge);

        dispatcher.dispatch(AdminCommand.INSTALL_PLUGIN, "heating", null).join();

        assertTrue(bridge.getPluginRegistry().get("heating").isEmpty());
        assertTrue(bridge.getPluginRegistry().get("lights").isPresent());
    }

    @Test
    void settings_reportSharedPairingCodesAndMode() {
        AdminQueries.BridgeSettings settings = new AdminQueries(bridge).settings();

        assertEquals("bridge", settings.bridgeMode());
        assertEquals(5540, settings.port());
        assertNotNull(settings.qrPairingCode());
        assertTrue(settings.qrPairingCode().startsWith("MT:"));
        assertFalse(settings.paired());
        assertNotNull(settings.systemInformation());
    }

    @Test
    void plugins_includeConfigAndSchema() {
        List<ObjectNode> plugins = new AdminQueries(bridge).plugins();

        assertEquals(1, plugins.size());
        ObjectNode lights = plugins.get(0);
        assertEquals("lights", lights.path("name").asText());
        assertTrue(lights.path("started").asBoolean());
        assertEquals(2, lights.path("addedDevices").asInt());
        assertEquals(2, lights.path("configJson").path("devices").asInt());
        assertEquals("object", lights.path("schemaJson").path("type").asText());
    }

    @Test
    void devicesAndClusters_byPluginAndEndpoint() {
        AdminQueries queries = new AdminQueries(bridge);

        List<SerializedDevice> devices = queries.devices("lights");
        assertEquals(2, devices.size());
        assertTrue(queries.devices("other").isEmpty());
        assertEquals(2, queries.devices(null).size());

        List<AdminQueries.ClusterAttribute> attributes = queries.deviceClusters("lights", 2);
        assertTrue(attributes.stream().anyMatch(a -> a.clusterName().equals(BridgedDevice.BASIC_INFORMATION_CLUSTER)
                && a.attributeName().equals("serialNumber") && a.attributeValue().equals("SN-lights-1")));
        assertTrue(queries.deviceClusters("lights", 99).isEmpty());
    }
}

package com.hubbridge.core;

import com.hubbridge.config.BridgeMode;
import com.hubbridge.core.lifecycle.StartupSupervisor;
import com.hubbridge.core.plugin.RegisteredPlugin;
import com.hubbridge.core.shutdown.ProcessSignals;
import com.hubbridge.core.topology.CommissioningNode;
import com.hubbridge.plugin.PlatformType;
import com.hubbridge.plugin.event.BridgeEvent;
import com.hubbridge.protocol.FabricInfo;
import com.hubbridge.protocol.SessionInfo;
import com.hubbridge.protocol.local.LocalCommissioningServer;
import com.hubbridge.protocol.local.LocalProtocolEngine;
import com.hubbridge.storage.JsonFileStorageManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HubBridgeStartupTest {

    @TempDir
    Path home;

    private BridgeFixture fx;

    @BeforeEach
    void setUp() {
        TestPlatforms.reset();
        fx = new BridgeFixture(home);
    }

    private static RegisteredPlugin plugin(HubBridge bridge, String name) {
        return bridge.getPluginRegistry().get(name).orElseThrow();
    }

    private static void connectController(LocalCommissioningServer server) {
        server.commission(new FabricInfo(1, 0x1234L, 1L, 2L, 0x1349, "Home"));
        server.openSession(new SessionInfo("session-1", 2L, 1, true, true, 1));
    }

    @Test
    void bridgeMode_exposesDevicesAndConfiguresOnceControllerConnects() {
        Path lights = fx.writePlugin("lights", TestPlatforms.DynamicFactory.class, Map.of("devices", 3));

        HubBridge bridge = fx.start(BridgeMode.BRIDGE, lights);
        RegisteredPlugin plugin = plugin(bridge, "lights");

        assertTrue(plugin.isLoaded());
        assertTrue(plugin.isStarted());
        assertEquals(PlatformType.DYNAMIC, plugin.getType());
        assertEquals(3, plugin.getRegisteredDevices());
        assertEquals(3, plugin.getAddedDevices());
        assertEquals(3, bridge.getTopology().getSharedNode().getAggregator().getBridgedDevices().size());
        assertFalse(bridge.isNetworkStarted());

        fx.poll();
        assertEquals(StartupSupervisor.Outcome.READY, bridge.getSupervisor().getOutcome());
        assertTrue(bridge.isNetworkStarted());
        LocalCommissioningServer server = (LocalCommissioningServer) bridge.getTopology().getSharedNode().getServer();
        assertTrue(server.isStarted());
        assertEquals(5540, server.getPort());
        assertFalse(plugin.isConfigured());

        connectController(server);
        assertTrue(bridge.getMonitor().isPaired());
        assertTrue(bridge.getMonitor().isConnected());
        assertFalse(plugin.isConfigured());

        fx.scheduler.advance(BridgeFixture.CONFIGURE_DELAY);
        assertTrue(plugin.isConfigured());
        assertEquals(3, plugin.getRegisteredDevices());
        assertEquals(3, plugin.getAddedDevices());
        assertTrue(plugin.getConfigJson().path("configuredOnce").asBoolean());
        assertEquals(List.of("lights:start", "lights:configure"), TestPlatforms.CALLS);
    }

    @Test
    void bridgeMode_pluginLoadFailureKeepsNetworkDown() {
        Path good = fx.writePlugin("good", TestPlatforms.DynamicFactory.class, Map.of("devices", 1));
        Path broken = fx.writePlugin("broken", TestPlatforms.FailingFactory.class, null);

        HubBridge bridge = fx.start(BridgeMode.BRIDGE, good, broken);

        assertTrue(plugin(bridge, "broken").isError());
        assertFalse(plugin(bridge, "broken").isLoaded());
        assertTrue(plugin(bridge, "good").isStarted());

        fx.poll();
        assertEquals(StartupSupervisor.Outcome.PLUGIN_ERROR, bridge.getSupervisor().getOutcome());
        assertFalse(bridge.isNetworkStarted());
        assertFalse(((LocalProtocolEngine) bridge.getEngine()).isStarted());

        fx.scheduler.advance(BridgeFixture.POLL.multipliedBy(10));
        assertFalse(bridge.isNetworkStarted());
    }

    @Test
    void startupSupervisor_givesUpAfterMaxAttempts() {
        Path slow = fx.writePlugin("slow", TestPlatforms.DynamicFactory.class, Map.of("holdStart", true));

        HubBridge bridge = fx.start(BridgeMode.BRIDGE, slow);
        for (int i = 0; i < BridgeFixture.MAX_ATTEMPTS; i++) {
            fx.poll();
        }
        assertEquals(StartupSupervisor.Outcome.RUNNING, bridge.getSupervisor().getOutcome());
        assertFalse(plugin(bridge, "slow").isError());

        fx.poll();
        assertEquals(StartupSupervisor.Outcome.RETRY_EXHAUSTED, bridge.getSupervisor().getOutcome());
        assertTrue(plugin(bridge, "slow").isError());
        assertFalse(bridge.isNetworkStarted());
    }

    @Test
    void bridgeMode_startEventForDynamicPlatforms() {
        List<String> started = new ArrayList<>();
        fx.eventBus.subscribe(BridgeEvent.StartDynamicPlatform.class, e -> started.add(e.pluginName()));
        List<String> registered = new ArrayList<>();
        fx.eventBus.subscribe(BridgeEvent.RegisterDevice.class, e -> registered.add(e.device().getDeviceName()));
        Path lights = fx.writePlugin("lights", TestPlatforms.DynamicFactory.class, Map.of("devices", 2));

        fx.start(BridgeMode.BRIDGE, lights);

        assertEquals(List.of("lights"), started);
        assertEquals(List.of("lights-1", "lights-2"), registered);
    }

    @Test
    void childbridgeMode_givesEachPluginItsOwnIdentity() {
        Path lights = fx.writePlugin("lights", TestPlatforms.DynamicFactory.class, Map.of("devices", 2));
        Path plugs = fx.writePlugin("plugs", TestPlatforms.DynamicFactory.class, Map.of("devices", 1));

        HubBridge bridge = fx.start(BridgeMode.CHILDBRIDGE, lights, plugs);
        RegisteredPlugin lightsPlugin = plugin(bridge, "lights");
        RegisteredPlugin plugsPlugin = plugin(bridge, "plugs");

        assertNull(bridge.getTopology().getSharedNode());
        assertTrue(lightsPlugin.isLocked());
        assertTrue(plugsPlugin.isLocked());
        CommissioningNode lightsNode = lightsPlugin.getNode();
        CommissioningNode plugsNode = plugsPlugin.getNode();
        assertEquals(5540, lightsNode.getServer().getPort());
        assertEquals(5541, plugsNode.getServer().getPort());
        assertEquals(2, lightsNode.getAggregator().getBridgedDevices().size());
        assertEquals(1, plugsNode.getAggregator().getBridgedDevices().size());
        assertNotNull(lightsPlugin.getQrPairingCode());
        assertNotEquals(lightsPlugin.getManualPairingCode(), plugsPlugin.getManualPairingCode());

        fx.poll();
        assertTrue(bridge.isNetworkStarted());
        assertTrue(lightsNode.getServer().isStarted());
        assertTrue(plugsNode.getServer().isStarted());

        connectController((LocalCommissioningServer) lightsNode.getServer());
        fx.scheduler.advance(BridgeFixture.CONFIGURE_DELAY);

        assertTrue(lightsPlugin.isConfigured());
        assertTrue(lightsPlugin.isConnected());
        assertFalse(plugsPlugin.isConfigured());
        assertFalse(bridge.getMonitor().isConnected());
    }

    @Test
    void childbridgeMode_accessoryRefusesSecondDevice() {
        Path sensor = fx.writePlugin("sensor", TestPlatforms.AccessoryFactory.class, Map.of("devices", 2));

        HubBridge bridge = fx.start(BridgeMode.CHILDBRIDGE, sensor);
        RegisteredPlugin plugin = plugin(bridge, "sensor");

        assertEquals(PlatformType.ACCESSORY, plugin.getType());
        assertTrue(plugin.isError());
        assertEquals(1, plugin.getRegisteredDevices());
        assertEquals(1, plugin.getAddedDevices());
        assertEquals(1, bridge.getDeviceRegistry().size());
        CommissioningNode node = plugin.getNode();
        assertNull(node.getAggregator());
        assertEquals("sensor-1", node.getDevice().getDeviceName());
        assertEquals("SN-sensor-1", node.getIdentity().serialNumber());
    }

    @Test
    void childbridgeMode_accessoryDeviceReattachesAfterRemoveAll() {
        Path sensor = fx.writePlugin("sensor", TestPlatforms.AccessoryFactory.class, Map.of("devices", 1));
        HubBridge bridge = fx.start(BridgeMode.CHILDBRIDGE, sensor);
        RegisteredPlugin plugin = plugin(bridge, "sensor");
        CommissioningNode node = plugin.getNode();

        bridge.removeAllBridgedDevices("sensor");
        assertNull(node.getDevice());
        assertEquals(0, plugin.getAddedDevices());

        bridge.addBridgedDevice("sensor", TestPlatforms.device("sensor-again"));
        assertSame(node, plugin.getNode());
        assertEquals("sensor-again", node.getDevice().getDeviceName());
        assertEquals(1, plugin.getAddedDevices());
    }

    @Test
    void networkStart_marksNodesReachableAfterDelay() {
        Path lights = fx.writePlugin("lights", TestPlatforms.DynamicFactory.class, Map.of("devices", 1));
        HubBridge bridge = fx.start(BridgeMode.BRIDGE, lights);
        fx.poll();
        CommissioningNode shared = bridge.getTopology().getSharedNode();
        shared.getServer().setReachability(false);

        fx.scheduler.advance(bridge.getConfig().getReachabilityDelay());

        assertTrue(((LocalCommissioningServer) shared.getServer()).isReachable());
        assertTrue(shared.getAggregator().isReachable());
    }

    @Test
    void controllerMode_startsControllerWithoutPlugins() {
        Path lights = fx.writePlugin("lights", TestPlatforms.DynamicFactory.class, Map.of("devices", 1));

        HubBridge bridge = fx.start(BridgeMode.CONTROLLER, lights);

        assertEquals(HubBridge.CONTROLLER_CONTEXT, ((LocalProtocolEngine) bridge.getEngine()).getControllerContext());
        assertFalse(plugin(bridge, "lights").isLoaded());
        assertTrue(TestPlatforms.CALLS.isEmpty());
    }

    @Test
    void identityStoreFailure_shutsDown() {
        HubBridge bridge = HubBridge.builder(fx.config(BridgeMode.BRIDGE).build())
                .scheduler(fx.scheduler)
                .eventBus(fx.eventBus)
                .identityStore(config -> {
                    JsonFileStorageManager store = new JsonFileStorageManager(config.getIdentityStoreFile());
                    store.close();
                    return store;
                })
                .build();
        assertTrue(bridge.initialize());

        bridge.start();
        fx.runCleanup();

        assertEquals(List.of(new BridgeEvent.Shutdown("persistence failure, shutting down...")), fx.completionEvents);
        assertTrue(bridge.isReleased());
    }

    @Test
    void processSignal_startsCleanupOnce() {
        List<Consumer<String>> handlers = new ArrayList<>();
        int[] detached = {0};
        HubBridge bridge = HubBridge.builder(fx.config(BridgeMode.BRIDGE).build())
                .scheduler(fx.scheduler)
                .eventBus(fx.eventBus)
                .signals(new ProcessSignals() {
                    @Override
                    public void attach(Consumer<String> handler) {
                        handlers.add(handler);
                    }

                    @Override
                    public void detach() {
                        detached[0]++;
                    }
                })
                .build();
        bridge.initialize();
        bridge.start();

        handlers.get(0).accept("SIGINT");
        handlers.get(0).accept("SIGTERM");
        fx.runCleanup();

        assertEquals(1, detached[0]);
        assertEquals(List.of(new BridgeEvent.Shutdown("received SIGINT, shutting down...")), fx.completionEvents);
    }
}

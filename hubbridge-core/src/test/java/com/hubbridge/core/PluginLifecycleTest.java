package com.hubbridge.core;

import com.hubbridge.config.BridgeMode;
import com.hubbridge.core.lifecycle.LoadResult;
import com.hubbridge.core.lifecycle.PluginLifecycleOrchestrator;
import com.hubbridge.core.plugin.RegisteredPlugin;
import com.hubbridge.protocol.FabricInfo;
import com.hubbridge.protocol.SessionInfo;
import com.hubbridge.protocol.local.LocalCommissioningServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginLifecycleTest {

    @TempDir
    Path home;

    private BridgeFixture fx;

    @BeforeEach
    void setUp() {
        TestPlatforms.reset();
        fx = new BridgeFixture(home);
    }

    @Test
    void start_isIgnoredWhileHookIsPending() {
        Path slow = fx.writePlugin("slow", TestPlatforms.DynamicFactory.class, Map.of("holdStart", true));
        HubBridge bridge = fx.start(BridgeMode.BRIDGE, slow);
        RegisteredPlugin plugin = bridge.getPluginRegistry().get("slow").orElseThrow();
        PluginLifecycleOrchestrator orchestrator = bridge.getOrchestrator();

        CompletableFuture<Void> again = orchestrator.start(plugin, "again");
        assertTrue(again.isDone());
        assertEquals(List.of("slow:start"), TestPlatforms.CALLS);
        assertFalse(plugin.isStarted());

        TestPlatforms.HELD_STARTS.get("slow").complete(null);
        assertTrue(plugin.isStarted());

        orchestrator.start(plugin, "once more");
        assertEquals(List.of("slow:start"), TestPlatforms.CALLS);
    }

    @Test
    void hookCompletion_afterRemovalIsIgnored() {
        Path slow = fx.writePlugin("slow", TestPlatforms.DynamicFactory.class, Map.of("holdStart", true));
        HubBridge bridge = fx.start(BridgeMode.BRIDGE, slow);
        RegisteredPlugin plugin = bridge.getPluginRegistry().get("slow").orElseThrow();

        bridge.removePlugin("slow").join();
        TestPlatforms.HELD_STARTS.get("slow").completeExceptionally(new IllegalStateException("late failure"));

        assertFalse(plugin.isStarted());
        assertFalse(plugin.isError());
        assertTrue(bridge.getPluginRegistry().get("slow").isEmpty());
    }

    @Test
    void start_throwingHookPutsPluginInError() {
        Path broken = fx.writePlugin("broken", TestPlatforms.DynamicFactory.class, Map.of("failStart", true));

        HubBridge bridge = fx.start(BridgeMode.BRIDGE, broken);

        RegisteredPlugin plugin = bridge.getPluginRegistry().get("broken").orElseThrow();
        assertTrue(plugin.isLoaded());
        assertFalse(plugin.isStarted());
        assertTrue(plugin.isError());
    }

    @Test
    void configure_failedHookPutsPluginInError() {
        Path lights = fx.writePlugin("lights", TestPlatforms.DynamicFactory.class,
                Map.of("devices", 1, "failConfigure", true));
        HubBridge bridge = fx.start(BridgeMode.BRIDGE, lights);
        fx.poll();
        LocalCommissioningServer server = (LocalCommissioningServer) bridge.getTopology().getSharedNode().getServer();
        server.commission(new FabricInfo(1, 1L, 1L, 2L, 0x1349, "Home"));
        server.openSession(new SessionInfo("session-1", 2L, 1, true, true, 1));

        fx.scheduler.advance(BridgeFixture.CONFIGURE_DELAY);

        RegisteredPlugin plugin = bridge.getPluginRegistry().get("lights").orElseThrow();
        assertFalse(plugin.isConfigured());
        assertTrue(plugin.isError());
    }

    @Test
    void configure_runsOnlyOnce() {
        Path lights = fx.writePlugin("lights", TestPlatforms.DynamicFactory.class, Map.of("devices", 1));
        HubBridge bridge = fx.start(BridgeMode.BRIDGE, lights);
        RegisteredPlugin plugin = bridge.getPluginRegistry().get("lights").orElseThrow();

        bridge.getOrchestrator().configure(plugin).join();
        bridge.getOrchestrator().configure(plugin).join();

        assertTrue(plugin.isConfigured());
        assertEquals(List.of("lights:start", "lights:configure"), TestPlatforms.CALLS);
    }

    @Test
    void load_reportsNotEnabledAndAlreadyLoaded() {
        Path lights = fx.writePlugin("lights", TestPlatforms.DynamicFactory.class, Map.of("devices", 1));
        HubBridge bridge = fx.start(BridgeMode.BRIDGE, lights);
        RegisteredPlugin plugin = bridge.getPluginRegistry().get("lights").orElseThrow();

        LoadResult again = bridge.getOrchestrator().load(plugin);
        assertEquals(LoadResult.Status.ALREADY_LOADED, again.status());
        assertSame(plugin.getPlatform(), again.platform());

        RegisteredPlugin disabled = new RegisteredPlugin("disabled", lights.resolve("plugin.json").toString());
        disabled.setEnabled(false);
        assertEquals(LoadResult.Status.NOT_ENABLED, bridge.getOrchestrator().load(disabled).status());
    }

    @Test
    void prepare_disablesPluginWhoseManifestIsGone() {
        HubBridge bridge = fx.build(BridgeMode.BRIDGE);
        bridge.initialize();
        RegisteredPlugin ghost = new RegisteredPlugin("ghost", home.resolve("plugins/ghost/plugin.json").toString());

        assertFalse(bridge.getOrchestrator().prepare(ghost));
        assertFalse(ghost.isEnabled());
        assertTrue(ghost.isError());
    }

    @Test
    void prepare_readsConfigAndDefaultSchema() {
        Path lights = fx.writePlugin("lights", TestPlatforms.DynamicFactory.class, null);
        HubBridge bridge = fx.build(BridgeMode.BRIDGE);
        bridge.initialize();
        RegisteredPlugin plugin = bridge.addPlugin(lights.toString()).join();

        assertTrue(bridge.getOrchestrator().prepare(plugin));

        assertEquals("lights", plugin.getConfigJson().path("name").asText());
        assertFalse(plugin.getConfigJson().path("debug").asBoolean());
        assertEquals("object", plugin.getSchemaJson().path("type").asText());
        assertEquals("Test plugin lights", plugin.getDescription());
        assertTrue(bridge.getConfigStore().configFile(plugin).toFile().isFile());
    }
}

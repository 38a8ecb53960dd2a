package com.hubbridge.core.update;

import com.hubbridge.core.plugin.PluginRegistry;
import com.hubbridge.core.plugin.RegisteredPlugin;
import com.hubbridge.core.schedule.ManualScheduler;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UpdateCheckerTest {

    private final ManualScheduler scheduler = new ManualScheduler();
    private final List<String> asked = new ArrayList<>();

    private VersionSource source(Map<String, String> latest) {
        return artifact -> {
            asked.add(artifact);
            if ("com.example:broken".equals(artifact)) {
                return CompletableFuture.failedFuture(new IllegalStateException("search unavailable"));
            }
            return CompletableFuture.completedFuture(Optional.ofNullable(latest.get(artifact)));
        };
    }

    private static RegisteredPlugin plugin(PluginRegistry registry, String name, String artifact, String version) {
        RegisteredPlugin plugin = new RegisteredPlugin(name, null);
        plugin.setArtifact(artifact);
        plugin.setVersion(version);
        registry.add(plugin);
        return plugin;
    }

    @Test
    void check_recordsLatestVersionsOfBridgeAndPlugins() {
        PluginRegistry registry = new PluginRegistry();
        RegisteredPlugin lights = plugin(registry, "lights", "com.example:lights", "1.0.0");
        RegisteredPlugin local = plugin(registry, "local", null, "0.1.0");
        UpdateChecker checker = new UpdateChecker(source(Map.of(
                UpdateChecker.BRIDGE_ARTIFACT, "1.1.0",
                "com.example:lights", "1.2.0")), registry, scheduler, "1.0.0");

        CompletableFuture<Void> done = checker.check();

        assertTrue(done.isDone());
        assertEquals("1.1.0", checker.getLatestBridgeVersion());
        assertEquals("1.2.0", lights.getLatestVersion());
        assertNull(local.getLatestVersion());
        assertEquals(List.of(UpdateChecker.BRIDGE_ARTIFACT, "com.example:lights"), asked);
    }

    @Test
    void check_failedLookupLeavesOthersApplied() {
        PluginRegistry registry = new PluginRegistry();
        RegisteredPlugin broken = plugin(registry, "broken", "com.example:broken", "1.0.0");
        RegisteredPlugin unknown = plugin(registry, "unknown", "com.example:unknown", "1.0.0");
        UpdateChecker checker = new UpdateChecker(source(Map.of(UpdateChecker.BRIDGE_ARTIFACT, "1.0.0")),
                registry, scheduler, "1.0.0");

        CompletableFuture<Void> done = checker.check();

        assertTrue(done.isDone());
        assertFalse(done.isCompletedExceptionally());
        assertEquals("1.0.0", checker.getLatestBridgeVersion());
        assertNull(broken.getLatestVersion());
        assertNull(unknown.getLatestVersion());
    }

    @Test
    void schedule_checksNowAndThenPeriodically() {
        UpdateChecker checker = new UpdateChecker(source(Map.of(UpdateChecker.BRIDGE_ARTIFACT, "2.0.0")),
                new PluginRegistry(), scheduler, "1.0.0");

        checker.schedule(Duration.ofHours(24));
        scheduler.advance(Duration.ZERO);
        assertEquals(1, asked.size());

        scheduler.advance(Duration.ofHours(24));
        assertEquals(2, asked.size());
        assertEquals("2.0.0", checker.getLatestBridgeVersion());
    }
}

package com.hubbridge.core.plugin;

import com.hubbridge.plugin.PlatformType;
import com.hubbridge.storage.JsonFileStorageManager;
import com.hubbridge.storage.StorageContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginRegistryTest {

    @TempDir
    Path dir;

    @Test
    void persistAndLoad_keepOrderAndIdentity() {
        StorageContext context = new JsonFileStorageManager(dir.resolve("node.json")).createContext("bridge");
        PluginRegistry registry = new PluginRegistry();
        registry.attachStorage(context);
        RegisteredPlugin lights = new RegisteredPlugin("lights", "/plugins/lights/plugin.json");
        lights.setType(PlatformType.DYNAMIC);
        lights.setVersion("1.2.0");
        RegisteredPlugin sensor = new RegisteredPlugin("sensor", "/plugins/sensor/plugin.json");
        sensor.setEnabled(false);
        sensor.markError();
        registry.add(lights);
        registry.add(sensor);
        registry.persist();

        PluginRegistry reloaded = new PluginRegistry();
        reloaded.attachStorage(context);
        assertEquals(2, reloaded.load());

        List<RegisteredPlugin> all = reloaded.all();
        assertEquals("lights", all.get(0).getName());
        assertEquals(PlatformType.DYNAMIC, all.get(0).getType());
        assertEquals("1.2.0", all.get(0).getVersion());
        assertTrue(all.get(0).isEnabled());
        assertEquals("sensor", all.get(1).getName());
        assertFalse(all.get(1).isEnabled());
        assertFalse(all.get(1).isError());
    }

    @Test
    void add_rejectsDuplicateName() {
        PluginRegistry registry = new PluginRegistry();
        registry.add(new RegisteredPlugin("lights", "/a/plugin.json"));

        assertThrows(IllegalArgumentException.class,
                () -> registry.add(new RegisteredPlugin("lights", "/b/plugin.json")));
        assertEquals(1, registry.size());
    }

    @Test
    void lookups_byNameAndPath() {
        PluginRegistry registry = new PluginRegistry();
        RegisteredPlugin lights = new RegisteredPlugin("lights", "/a/plugin.json");
        registry.add(lights);

        assertEquals(lights, registry.get("lights").orElseThrow());
        assertEquals(lights, registry.getByPath("/a/plugin.json").orElseThrow());
        assertTrue(registry.get(null).isEmpty());
        assertTrue(registry.getByPath("/b/plugin.json").isEmpty());
    }

    @Test
    void healthy_skipsDisabledAndErrored() {
        PluginRegistry registry = new PluginRegistry();
        RegisteredPlugin ok = new RegisteredPlugin("ok", null);
        RegisteredPlugin disabled = new RegisteredPlugin("disabled", null);
        disabled.setEnabled(false);
        RegisteredPlugin broken = new RegisteredPlugin("broken", null);
        broken.markError();
        registry.add(ok);
        registry.add(disabled);
        registry.add(broken);

        assertEquals(List.of(ok), registry.healthy());
        assertEquals(List.of(ok, broken), registry.enabled());
    }

    @Test
    void persist_withoutStorageIsIgnored() {
        PluginRegistry registry = new PluginRegistry();
        registry.add(new RegisteredPlugin("lights", null));

        registry.persist();

        assertThrows(IllegalStateException.class, registry::load);
    }

    @Test
    void snapshot_omitsCountersOfUnloadedPlugins() {
        PluginRegistry registry = new PluginRegistry();
        registry.add(new RegisteredPlugin("lights", null));

        PluginSummary summary = registry.snapshot().get(0);

        assertNull(summary.registeredDevices());
        assertNull(summary.addedDevices());
    }
}

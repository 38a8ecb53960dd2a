package com.hubbridge.plugin;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlatformConfigTest {

    @Test
    void defaults_containMandatoryFields() {
        PlatformConfig config = PlatformConfig.defaults("plugin-a", PlatformType.DYNAMIC);

        assertEquals("plugin-a", config.getName());
        assertEquals("DynamicPlatform", config.getType());
        assertFalse(config.isDebug());
        assertFalse(config.isUnregisterOnShutdown());
    }

    @Test
    void of_forcesIdentityAndKeepsPluginFields() throws Exception {
        var stored = new ObjectMapper().readTree("""
                {"name":"other","type":"AccessoryPlatform","debug":true,"host":"10.0.0.2"}
                """);

        PlatformConfig config = PlatformConfig.of(stored, "plugin-a", PlatformType.DYNAMIC);

        assertEquals("plugin-a", config.getName());
        assertEquals("DynamicPlatform", config.getType());
        assertTrue(config.isDebug());
        assertFalse(config.isUnregisterOnShutdown());
        assertEquals("10.0.0.2", config.getString("host", null));
    }

    @Test
    void set_refusesRename() {
        PlatformConfig config = PlatformConfig.defaults("plugin-a", PlatformType.DYNAMIC);

        config.set("pollInterval", 30);

        assertEquals(30, config.getInt("pollInterval", 0));
        assertThrows(IllegalArgumentException.class, () -> config.set("name", "x"));
    }

    @Test
    void platformType_readsJsonValue() {
        assertEquals(PlatformType.ACCESSORY, PlatformType.fromValue("AccessoryPlatform"));
        assertThrows(IllegalArgumentException.class, () -> PlatformType.fromValue("Other"));
    }
}

package com.hubbridge.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BridgeConfigTest {

    @Test
    void fromEnvironment_appliesDefaultsWhenNothingIsSet() {
        BridgeConfig config = BridgeConfig.fromEnvironment(Map.of("HUBBRIDGE_HOME", "/tmp/hb"));

        assertEquals(BridgeMode.BRIDGE, config.getMode());
        assertEquals(RestartMode.NONE, config.getRestartMode());
        assertEquals(5540, config.getPort());
        assertNull(config.getPasscode());
        assertEquals(StorageBackendType.JSON, config.getStorageBackend());
        assertEquals(Duration.ofSeconds(1), config.getStartupPollInterval());
        assertEquals(30, config.getStartupMaxAttempts());
        assertEquals(Duration.ofSeconds(3), config.getProtocolFlushDelay());
        assertEquals(Duration.ofSeconds(2), config.getStoreFlushDelay());
        assertEquals(Duration.ofMinutes(60), config.getUpdateCheckInterval());
        assertFalse(config.isDebug());
    }

    @Test
    void fromEnvironment_readsModeTimingAndStorage() {
        BridgeConfig config = BridgeConfig.fromEnvironment(Map.of(
                "HUBBRIDGE_HOME", "/tmp/hb",
                "HUBBRIDGE_MODE", "ChildBridge",
                "HUBBRIDGE_PORT", "5600",
                "HUBBRIDGE_PASSCODE", "20242025",
                "HUBBRIDGE_STORAGE", "redis",
                "HUBBRIDGE_STARTUP_MAX_ATTEMPTS", "5",
                "HUBBRIDGE_PROTOCOL_FLUSH_MS", "10",
                "HUBBRIDGE_DEBUG", "1"));

        assertEquals(BridgeMode.CHILDBRIDGE, config.getMode());
        assertEquals(5600, config.getPort());
        assertEquals(20242025, config.getPasscode());
        assertEquals(StorageBackendType.REDIS, config.getStorageBackend());
        assertEquals(5, config.getStartupMaxAttempts());
        assertEquals(Duration.ofMillis(10), config.getProtocolFlushDelay());
        assertTrue(config.isDebug());
    }

    @Test
    void homeDirectory_derivesStoragePaths() {
        BridgeConfig config = BridgeConfig.builder().homeDirectory(Path.of("/data/hb")).build();

        assertEquals(Path.of("/data/hb/storage"), config.getNodeStorageDirectory());
        assertEquals(Path.of("/data/hb/hubbridge.json"), config.getIdentityStoreFile());
        assertEquals(Path.of("/data/hb/plugins"), config.getPluginsDirectory());
    }

    @Test
    void toBuilder_overridesSingleValue() {
        BridgeConfig base = BridgeConfig.builder().homeDirectory(Path.of("/data/hb")).port(6000).build();
        BridgeConfig overridden = base.toBuilder().mode(BridgeMode.CONTROLLER).build();

        assertEquals(BridgeMode.CONTROLLER, overridden.getMode());
        assertEquals(6000, overridden.getPort());
        assertEquals(base.getPluginsDirectory(), overridden.getPluginsDirectory());
    }

    @Test
    void bridgeMode_rejectsUnknownValue() {
        assertThrows(IllegalArgumentException.class, () -> BridgeMode.fromValue("hub"));
    }

    @Test
    void build_rejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> BridgeConfig.builder().startupMaxAttempts(0).build());
    }
}

package com.hubbridge.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the HubBridge process.
 * <p>
 * Mode: HUBBRIDGE_MODE ({@code bridge}, {@code childbridge}, {@code controller}). Home directory:
 * HUBBRIDGE_HOME (default {@code ~/.hubbridge}); the identity store, node storage, plugin
 * configuration files and installed plugins all live below it.
 * <p>
 * Network: HUBBRIDGE_PORT (first commissioning server port, incremented per childbridge identity),
 * HUBBRIDGE_PASSCODE, HUBBRIDGE_DISCRIMINATOR, HUBBRIDGE_MDNS_INTERFACE. Storage: HUBBRIDGE_STORAGE
 * ({@code json} or {@code redis}), HUBBRIDGE_CACHE_HOST, HUBBRIDGE_CACHE_PORT.
 * <p>
 * Timing: HUBBRIDGE_STARTUP_POLL_MS, HUBBRIDGE_STARTUP_MAX_ATTEMPTS, HUBBRIDGE_PROTOCOL_FLUSH_MS,
 * HUBBRIDGE_STORE_FLUSH_MS, HUBBRIDGE_CONFIGURE_DELAY_MS, HUBBRIDGE_REACHABILITY_DELAY_MS,
 * HUBBRIDGE_UPDATE_CHECK_MINUTES.
 * Command-line options override the environment through {@link #toBuilder()}.
 */
public final class BridgeConfig {

    private static final String ENV_MODE = "HUBBRIDGE_MODE";
    private static final String ENV_RESTART_MODE = "HUBBRIDGE_RESTART_MODE";
    private static final String ENV_HOME = "HUBBRIDGE_HOME";
    private static final String ENV_PLUGINS_DIR = "HUBBRIDGE_PLUGINS_DIR";
    private static final String ENV_PORT = "HUBBRIDGE_PORT";
    private static final String ENV_PASSCODE = "HUBBRIDGE_PASSCODE";
    private static final String ENV_DISCRIMINATOR = "HUBBRIDGE_DISCRIMINATOR";
    private static final String ENV_MDNS_INTERFACE = "HUBBRIDGE_MDNS_INTERFACE";
    private static final String ENV_FRONTEND_PORT = "HUBBRIDGE_FRONTEND_PORT";
    private static final String ENV_DEBUG = "HUBBRIDGE_DEBUG";
    private static final String ENV_STORAGE = "HUBBRIDGE_STORAGE";
    private static final String ENV_CACHE_HOST = "HUBBRIDGE_CACHE_HOST";
    private static final String ENV_CACHE_PORT = "HUBBRIDGE_CACHE_PORT";
    private static final String ENV_STARTUP_POLL_MS = "HUBBRIDGE_STARTUP_POLL_MS";
    private static final String ENV_STARTUP_MAX_ATTEMPTS = "HUBBRIDGE_STARTUP_MAX_ATTEMPTS";
    private static final String ENV_PROTOCOL_FLUSH_MS = "HUBBRIDGE_PROTOCOL_FLUSH_MS";
    private static final String ENV_STORE_FLUSH_MS = "HUBBRIDGE_STORE_FLUSH_MS";
    private static final String ENV_CONFIGURE_DELAY_MS = "HUBBRIDGE_CONFIGURE_DELAY_MS";
    private static final String ENV_REACHABILITY_DELAY_MS = "HUBBRIDGE_REACHABILITY_DELAY_MS";
    private static final String ENV_UPDATE_CHECK_MINUTES = "HUBBRIDGE_UPDATE_CHECK_MINUTES";
    private static final String ENV_VERSION = "HUBBRIDGE_VERSION";

    public static final int DEFAULT_PORT = 5540;
    public static final int DEFAULT_FRONTEND_PORT = 8283;
    public static final String DEFAULT_VERSION = "1.0.0";
    private static final String DEFAULT_HOME_DIR_NAME = ".hubbridge";
    private static final long DEFAULT_STARTUP_POLL_MS = 1000;
    private static final int DEFAULT_STARTUP_MAX_ATTEMPTS = 30;
    private static final long DEFAULT_PROTOCOL_FLUSH_MS = 3000;
    private static final long DEFAULT_STORE_FLUSH_MS = 2000;
    private static final long DEFAULT_CONFIGURE_DELAY_MS = 2000;
    private static final long DEFAULT_REACHABILITY_DELAY_MS = 60_000;
    private static final int DEFAULT_UPDATE_CHECK_MINUTES = 60;

    private final BridgeMode mode;
    private final RestartMode restartMode;
    private final Path homeDirectory;
    private final Path pluginsDirectory;
    private final int port;
    private final Integer passcode;
    private final Integer discriminator;
    private final String mdnsInterface;
    private final int frontendPort;
    private final boolean debug;
    private final StorageBackendType storageBackend;
    private final String cacheHost;
    private final int cachePort;
    private final Duration startupPollInterval;
    private final int startupMaxAttempts;
    private final Duration protocolFlushDelay;
    private final Duration storeFlushDelay;
    private final Duration configureDelay;
    private final Duration reachabilityDelay;
    private final Duration updateCheckInterval;
    private final String bridgeVersion;

    private BridgeConfig(Builder b) {
        this.mode = b.mode;
        this.restartMode = b.restartMode;
        this.homeDirectory = b.homeDirectory;
        this.pluginsDirectory = b.pluginsDirectory != null ? b.pluginsDirectory : b.homeDirectory.resolve("plugins");
        this.port = b.port;
        this.passcode = b.passcode;
        this.discriminator = b.discriminator;
        this.mdnsInterface = b.mdnsInterface;
        this.frontendPort = b.frontendPort;
        this.debug = b.debug;
        this.storageBackend = b.storageBackend;
        this.cacheHost = b.cacheHost;
        this.cachePort = b.cachePort;
        this.startupPollInterval = b.startupPollInterval;
        this.startupMaxAttempts = b.startupMaxAttempts;
        this.protocolFlushDelay = b.protocolFlushDelay;
        this.storeFlushDelay = b.storeFlushDelay;
        this.configureDelay = b.configureDelay;
        this.reachabilityDelay = b.reachabilityDelay;
        this.updateCheckInterval = b.updateCheckInterval;
        this.bridgeVersion = b.bridgeVersion;
    }

    public BridgeMode getMode() {
        return mode;
    }

    public RestartMode getRestartMode() {
        return restartMode;
    }

    /** Root of everything the bridge persists. */
    public Path getHomeDirectory() {
        return homeDirectory;
    }

    /** Directory holding the node storage contexts (plugin registry, device snapshot, plugin contexts). */
    public Path getNodeStorageDirectory() {
        return homeDirectory.resolve("storage");
    }

    /** Identity store file; deleted on commissioning reset. */
    public Path getIdentityStoreFile() {
        return homeDirectory.resolve("hubbridge.json");
    }

    /** Installed plugins, one directory per plugin holding its {@code plugin.json}. */
    public Path getPluginsDirectory() {
        return pluginsDirectory;
    }

    public int getPort() {
        return port;
    }

    /** Commissioning passcode, or null to let the protocol engine pick one. */
    public Integer getPasscode() {
        return passcode;
    }

    public Integer getDiscriminator() {
        return discriminator;
    }

    public String getMdnsInterface() {
        return mdnsInterface;
    }

    public int getFrontendPort() {
        return frontendPort;
    }

    public boolean isDebug() {
        return debug;
    }

    public StorageBackendType getStorageBackend() {
        return storageBackend;
    }

    public String getCacheHost() {
        return cacheHost;
    }

    public int getCachePort() {
        return cachePort;
    }

    /** Interval between two startup supervisor checks. Default 1 s. */
    public Duration getStartupPollInterval() {
        return startupPollInterval;
    }

    /** Checks allowed before a plugin that is not yet started is turned into an error. Default 30. */
    public int getStartupMaxAttempts() {
        return startupMaxAttempts;
    }

    /** Delay between draining plugins and closing the protocol engine. Default 3 s. */
    public Duration getProtocolFlushDelay() {
        return protocolFlushDelay;
    }

    /** Delay between closing the stores and the final destructive action and event. Default 2 s. */
    public Duration getStoreFlushDelay() {
        return storeFlushDelay;
    }

    /** Delay between a controller session becoming active and configuring plugins. Default 2 s. */
    public Duration getConfigureDelay() {
        return configureDelay;
    }

    /** Delay between network start and marking every endpoint reachable. Default 60 s. */
    public Duration getReachabilityDelay() {
        return reachabilityDelay;
    }

    /** Interval of the latest-version check. Default 60 min. */
    public Duration getUpdateCheckInterval() {
        return updateCheckInterval;
    }

    public String getBridgeVersion() {
        return bridgeVersion;
    }

    public Builder toBuilder() {
        return builder()
                .mode(mode)
                .restartMode(restartMode)
                .homeDirectory(homeDirectory)
                .pluginsDirectory(pluginsDirectory)
                .port(port)
                .passcode(passcode)
                .discriminator(discriminator)
                .mdnsInterface(mdnsInterface)
                .frontendPort(frontendPort)
                .debug(debug)
                .storageBackend(storageBackend)
                .cacheHost(cacheHost)
                .cachePort(cachePort)
                .startupPollInterval(startupPollInterval)
                .startupMaxAttempts(startupMaxAttempts)
                .protocolFlushDelay(protocolFlushDelay)
                .storeFlushDelay(storeFlushDelay)
                .configureDelay(configureDelay)
                .reachabilityDelay(reachabilityDelay)
                .updateCheckInterval(updateCheckInterval)
                .bridgeVersion(bridgeVersion);
    }

    public static BridgeConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static BridgeConfig fromEnvironment(Map<String, String> env) {
        Path home = getEnv(env, ENV_HOME, null) != null
                ? Path.of(getEnv(env, ENV_HOME, null))
                : Path.of(System.getProperty("user.home"), DEFAULT_HOME_DIR_NAME);
        String pluginsDir = getEnv(env, ENV_PLUGINS_DIR, null);
        String modeValue = getEnv(env, ENV_MODE, null);

        return builder()
                .mode(modeValue != null ? BridgeMode.fromValue(modeValue) : BridgeMode.BRIDGE)
                .restartMode(RestartMode.fromValue(getEnv(env, ENV_RESTART_MODE, "")))
                .homeDirectory(home)
                .pluginsDirectory(pluginsDir != null ? Path.of(pluginsDir) : null)
                .port(parseInt(env.get(ENV_PORT), DEFAULT_PORT))
                .passcode(parseInteger(env.get(ENV_PASSCODE)))
                .discriminator(parseInteger(env.get(ENV_DISCRIMINATOR)))
                .mdnsInterface(getEnv(env, ENV_MDNS_INTERFACE, null))
                .frontendPort(parseInt(env.get(ENV_FRONTEND_PORT), DEFAULT_FRONTEND_PORT))
                .debug(parseBoolean(env.get(ENV_DEBUG), false))
                .storageBackend(StorageBackendType.fromValue(getEnv(env, ENV_STORAGE, null)))
                .cacheHost(getEnv(env, ENV_CACHE_HOST, "localhost"))
                .cachePort(parseInt(env.get(ENV_CACHE_PORT), 6379))
                .startupPollInterval(Duration.ofMillis(parseLong(env.get(ENV_STARTUP_POLL_MS), DEFAULT_STARTUP_POLL_MS)))
                .startupMaxAttempts(parseInt(env.get(ENV_STARTUP_MAX_ATTEMPTS), DEFAULT_STARTUP_MAX_ATTEMPTS))
                .protocolFlushDelay(Duration.ofMillis(parseLong(env.get(ENV_PROTOCOL_FLUSH_MS), DEFAULT_PROTOCOL_FLUSH_MS)))
                .storeFlushDelay(Duration.ofMillis(parseLong(env.get(ENV_STORE_FLUSH_MS), DEFAULT_STORE_FLUSH_MS)))
                .configureDelay(Duration.ofMillis(parseLong(env.get(ENV_CONFIGURE_DELAY_MS), DEFAULT_CONFIGURE_DELAY_MS)))
                .reachabilityDelay(Duration.ofMillis(parseLong(env.get(ENV_REACHABILITY_DELAY_MS), DEFAULT_REACHABILITY_DELAY_MS)))
                .updateCheckInterval(Duration.ofMinutes(parseInt(env.get(ENV_UPDATE_CHECK_MINUTES), DEFAULT_UPDATE_CHECK_MINUTES)))
                .bridgeVersion(getEnv(env, ENV_VERSION, packageVersion()))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String packageVersion() {
        String v = BridgeConfig.class.getPackage().getImplementationVersion();
        return v != null ? v : DEFAULT_VERSION;
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        Integer parsed = parseInteger(value);
        return parsed != null ? parsed : defaultValue;
    }

    private static Integer parseInteger(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private BridgeMode mode = BridgeMode.BRIDGE;
        private RestartMode restartMode = RestartMode.NONE;
        private Path homeDirectory = Path.of(System.getProperty("user.home"), DEFAULT_HOME_DIR_NAME);
        private Path pluginsDirectory;
        private int port = DEFAULT_PORT;
        private Integer passcode;
        private Integer discriminator;
        private String mdnsInterface;
        private int frontendPort = DEFAULT_FRONTEND_PORT;
        private boolean debug;
        private StorageBackendType storageBackend = StorageBackendType.JSON;
        private String cacheHost = "localhost";
        private int cachePort = 6379;
        private Duration startupPollInterval = Duration.ofMillis(DEFAULT_STARTUP_POLL_MS);
        private int startupMaxAttempts = DEFAULT_STARTUP_MAX_ATTEMPTS;
        private Duration protocolFlushDelay = Duration.ofMillis(DEFAULT_PROTOCOL_FLUSH_MS);
        private Duration storeFlushDelay = Duration.ofMillis(DEFAULT_STORE_FLUSH_MS);
        private Duration configureDelay = Duration.ofMillis(DEFAULT_CONFIGURE_DELAY_MS);
        private Duration reachabilityDelay = Duration.ofMillis(DEFAULT_REACHABILITY_DELAY_MS);
        private Duration updateCheckInterval = Duration.ofMinutes(DEFAULT_UPDATE_CHECK_MINUTES);
        private String bridgeVersion = DEFAULT_VERSION;

        public Builder mode(BridgeMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder restartMode(RestartMode restartMode) {
            this.restartMode = restartMode != null ? restartMode : RestartMode.NONE;
            return this;
        }

        public Builder homeDirectory(Path homeDirectory) {
            this.homeDirectory = Objects.requireNonNull(homeDirectory, "homeDirectory");
            return this;
        }

        public Builder pluginsDirectory(Path pluginsDirectory) {
            this.pluginsDirectory = pluginsDirectory;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder passcode(Integer passcode) {
            this.passcode = passcode;
            return this;
        }

        public Builder discriminator(Integer discriminator) {
            this.discriminator = discriminator;
            return this;
        }

        public Builder mdnsInterface(String mdnsInterface) {
            this.mdnsInterface = mdnsInterface;
            return this;
        }

        public Builder frontendPort(int frontendPort) {
            this.frontendPort = frontendPort;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder storageBackend(StorageBackendType storageBackend) {
            this.storageBackend = storageBackend != null ? storageBackend : StorageBackendType.JSON;
            return this;
        }

        public Builder cacheHost(String cacheHost) {
            this.cacheHost = cacheHost;
            return this;
        }

        public Builder cachePort(int cachePort) {
            this.cachePort = cachePort;
            return this;
        }

        public Builder startupPollInterval(Duration startupPollInterval) {
            this.startupPollInterval = Objects.requireNonNull(startupPollInterval, "startupPollInterval");
            return this;
        }

        public Builder startupMaxAttempts(int startupMaxAttempts) {
            this.startupMaxAttempts = startupMaxAttempts;
            return this;
        }

        public Builder protocolFlushDelay(Duration protocolFlushDelay) {
            this.protocolFlushDelay = Objects.requireNonNull(protocolFlushDelay, "protocolFlushDelay");
            return this;
        }

        public Builder storeFlushDelay(Duration storeFlushDelay) {
            this.storeFlushDelay = Objects.requireNonNull(storeFlushDelay, "storeFlushDelay");
            return this;
        }

        public Builder configureDelay(Duration configureDelay) {
            this.configureDelay = Objects.requireNonNull(configureDelay, "configureDelay");
            return this;
        }

        public Builder reachabilityDelay(Duration reachabilityDelay) {
            this.reachabilityDelay = Objects.requireNonNull(reachabilityDelay, "reachabilityDelay");
            return this;
        }

        public Builder updateCheckInterval(Duration updateCheckInterval) {
            this.updateCheckInterval = Objects.requireNonNull(updateCheckInterval, "updateCheckInterval");
            return this;
        }

        public Builder bridgeVersion(String bridgeVersion) {
            this.bridgeVersion = bridgeVersion != null ? bridgeVersion : DEFAULT_VERSION;
            return this;
        }

        public BridgeConfig build() {
            if (startupMaxAttempts < 1) {
                throw new IllegalArgumentException("startupMaxAttempts must be at least 1: " + startupMaxAttempts);
            }
            return new BridgeConfig(this);
        }
    }
}

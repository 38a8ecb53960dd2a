package com.hubbridge.core.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.hubbridge.core.topology.CommissioningNode;
import com.hubbridge.plugin.BridgePlatform;
import com.hubbridge.plugin.PlatformConfig;
import com.hubbridge.plugin.PlatformType;
import com.hubbridge.storage.StorageContext;

import java.util.List;
import java.util.Objects;

/**
 * A plugin known to the bridge with its lifecycle flags.
 * <p>
 * Flag rules: {@code started} requires {@code loaded}, {@code configured} requires {@code started};
 * {@code locked} goes false→true once and is only cleared by {@link #resetRunState()} when no device is attached.
 * Device counters are null while the plugin is not loaded and move together.
 * Mutated only on the bridge thread.
 */
public final class RegisteredPlugin {

    private final String name;
    private String path;
    private PlatformType type;
    private String version;
    private String description;
    private String author;
    private String latestVersion;

    private boolean enabled = true;
    private boolean error;
    private boolean locked;
    private boolean loaded;
    private boolean started;
    private boolean configured;
    private boolean paired;
    private boolean connected;
    private Integer registeredDevices;
    private Integer addedDevices;

    private String qrPairingCode;
    private String manualPairingCode;
    private List<FabricSummary> fabricInformations;
    private List<SessionSummary> sessionInformations;

    private JsonNode configJson;
    private JsonNode schemaJson;
    private String artifact;

    private BridgePlatform platform;
    private PlatformConfig platformConfig;
    private StorageContext nodeContext;
    private CommissioningNode node;

    public RegisteredPlugin(String name, String path) {
        this.name = Objects.requireNonNull(name, "name");
        this.path = path;
    }

    /** Rebuilds a plugin from its persisted registry entry. Only identity and {@code enabled} survive a restart. */
    public static RegisteredPlugin fromSummary(PluginSummary summary) {
        RegisteredPlugin plugin = new RegisteredPlugin(summary.name(), summary.path());
        plugin.type = summary.type();
        plugin.version = summary.version();
        plugin.description = summary.description();
        plugin.author = summary.author();
        plugin.latestVersion = summary.latestVersion();
        plugin.enabled = summary.enabled();
        plugin.qrPairingCode = summary.qrPairingCode();
        plugin.manualPairingCode = summary.manualPairingCode();
        plugin.paired = summary.paired();
        return plugin;
    }

    public PluginSummary toSummary() {
        return new PluginSummary(path, type, name, version, description, author, latestVersion,
                enabled, error, locked, loaded, started, configured, paired, connected,
                registeredDevices, addedDevices, qrPairingCode, manualPairingCode,
                fabricInformations, sessionInformations);
    }

    // ---- lifecycle transitions ----

    /** Records a successful load: keeps the platform and resets both device counters to zero. */
    public void markLoaded(BridgePlatform platform, PlatformConfig config) {
        this.platform = Objects.requireNonNull(platform, "platform");
        this.platformConfig = config;
        this.type = platform.getType();
        this.loaded = true;
        this.registeredDevices = 0;
        this.addedDevices = 0;
    }

    public void markStarted() {
        if (!loaded) {
            throw new IllegalStateException("Plugin " + name + " cannot be started before it is loaded");
        }
        this.started = true;
    }

    public void markConfigured() {
        if (!started) {
            throw new IllegalStateException("Plugin " + name + " cannot be configured before it is started");
        }
        this.configured = true;
    }

    public void markError() {
        this.error = true;
    }

    /**
     * Sets {@code locked} before the plugin's identity is created.
     *
     * @return false when the plugin was already locked
     */
    public boolean lock() {
        if (locked) return false;
        locked = true;
        return true;
    }

    /**
     * Clears the run state (flags, platform, counters) on disable, enable or removal.
     * The commissioning node is kept so a re-enabled plugin reuses its identity in this run.
     *
     * @throws IllegalStateException while devices are still attached
     */
    public void resetRunState() {
        if (addedDevices != null && addedDevices > 0) {
            throw new IllegalStateException("Plugin " + name + " still has " + addedDevices + " attached device(s)");
        }
        locked = false;
        error = false;
        loaded = false;
        started = false;
        configured = false;
        connected = false;
        platform = null;
        platformConfig = null;
        registeredDevices = null;
        addedDevices = null;
    }

    /** Clears run flags at process start; persisted identity and {@code enabled} stay. */
    public void resetForStartup() {
        locked = false;
        error = false;
        loaded = false;
        started = false;
        configured = false;
        connected = false;
        registeredDevices = null;
        addedDevices = null;
        fabricInformations = null;
        sessionInformations = null;
    }

    public void deviceRegistered() {
        registeredDevices = (registeredDevices != null ? registeredDevices : 0) + 1;
    }

    public void deviceAdded() {
        addedDevices = (addedDevices != null ? addedDevices : 0) + 1;
    }

    public void deviceRemoved() {
        if (registeredDevices != null && registeredDevices > 0) registeredDevices--;
        if (addedDevices != null && addedDevices > 0) addedDevices--;
    }

    // ---- accessors ----

    public String getName() {
        return name;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public PlatformType getType() {
        return type;
    }

    public void setType(PlatformType type) {
        this.type = type;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getLatestVersion() {
        return latestVersion;
    }

    public void setLatestVersion(String latestVersion) {
        this.latestVersion = latestVersion;
    }

    public String getArtifact() {
        return artifact;
    }

    public void setArtifact(String artifact) {
        this.artifact = artifact;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isError() {
        return error;
    }

    public boolean isLocked() {
        return locked;
    }

    public boolean isLoaded() {
        return loaded;
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isConfigured() {
        return configured;
    }

    public boolean isPaired() {
        return paired;
    }

    public void setPaired(boolean paired) {
        this.paired = paired;
    }

    public boolean isConnected() {
        return connected;
    }

    public void setConnected(boolean connected) {
        this.connected = connected;
    }

    public Integer getRegisteredDevices() {
        return registeredDevices;
    }

    public Integer getAddedDevices() {
        return addedDevices;
    }

    public String getQrPairingCode() {
        return qrPairingCode;
    }

    public String getManualPairingCode() {
        return manualPairingCode;
    }

    public void setPairingCodes(String qrPairingCode, String manualPairingCode) {
        this.qrPairingCode = qrPairingCode;
        this.manualPairingCode = manualPairingCode;
    }

    public List<FabricSummary> getFabricInformations() {
        return fabricInformations;
    }

    public void setFabricInformations(List<FabricSummary> fabricInformations) {
        this.fabricInformations = fabricInformations;
    }

    public List<SessionSummary> getSessionInformations() {
        return sessionInformations;
    }

    public void setSessionInformations(List<SessionSummary> sessionInformations) {
        this.sessionInformations = sessionInformations;
    }

    public JsonNode getConfigJson() {
        return configJson;
    }

    public void setConfigJson(JsonNode configJson) {
        this.configJson = configJson;
    }

    public JsonNode getSchemaJson() {
        return schemaJson;
    }

    public void setSchemaJson(JsonNode schemaJson) {
        this.schemaJson = schemaJson;
    }

    public BridgePlatform getPlatform() {
        return platform;
    }

    public PlatformConfig getPlatformConfig() {
        return platformConfig;
    }

    public StorageContext getNodeContext() {
        return nodeContext;
    }

    public void setNodeContext(StorageContext nodeContext) {
        this.nodeContext = nodeContext;
    }

    public CommissioningNode getNode() {
        return node;
    }

    public void setNode(CommissioningNode node) {
        this.node = node;
    }

    @Override
    public String toString() {
        return name + (version != null ? " v" + version : "");
    }
}

package com.hubbridge.core.admin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hubbridge.config.BridgeConfig;
import com.hubbridge.core.HubBridge;
import com.hubbridge.core.device.RegisteredDevice;
import com.hubbridge.core.plugin.FabricSummary;
import com.hubbridge.core.plugin.RegisteredPlugin;
import com.hubbridge.core.plugin.SessionSummary;
import com.hubbridge.core.topology.CommissioningNode;
import com.hubbridge.core.update.UpdateChecker;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.device.SerializedDevice;
import com.hubbridge.protocol.PairingCodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only queries of the administration surface.
 */
public final class AdminQueries {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HubBridge bridge;

    public AdminQueries(HubBridge bridge) {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
    }

    /** Bridge-level settings: pairing state of the shared identity, mode, versions and host information. */
    public BridgeSettings settings() {
        BridgeConfig config = bridge.getConfig();
        String qr = null;
        String manual = null;
        CommissioningNode shared = bridge.getTopology() != null ? bridge.getTopology().getSharedNode() : null;
        if (shared != null) {
            PairingCodes codes = shared.getServer().getPairingCodes();
            qr = codes.qrPairingCode();
            manual = codes.manualPairingCode();
        }
        UpdateChecker checker = bridge.getUpdateChecker();
        return new BridgeSettings(
                config.getMode().getValue(),
                config.getRestartMode().getValue(),
                config.getBridgeVersion(),
                checker != null ? checker.getLatestBridgeVersion() : null,
                config.getHomeDirectory().toString(),
                config.getPort(),
                config.getFrontendPort(),
                config.isDebug(),
                qr,
                manual,
                bridge.getMonitor().isPaired(),
                bridge.getMonitor().isConnected(),
                bridge.getMonitor().getFabricInformations(),
                bridge.getMonitor().getSessionInformations(),
                SystemInformation.collect());
    }

    /** Registry snapshot, each entry with its {@code configJson} and {@code schemaJson}. */
    public List<ObjectNode> plugins() {
        List<ObjectNode> out = new ArrayList<>();
        for (RegisteredPlugin plugin : bridge.getPluginRegistry().all()) {
            ObjectNode node = MAPPER.valueToTree(plugin.toSummary());
            if (plugin.getConfigJson() != null) node.set("configJson", plugin.getConfigJson());
            if (plugin.getSchemaJson() != null) node.set("schemaJson", plugin.getSchemaJson());
            out.add(node);
        }
        return out;
    }

    /** Exposed devices, optionally of one plugin. */
    public List<SerializedDevice> devices(String pluginName) {
        List<SerializedDevice> out = new ArrayList<>();
        for (RegisteredDevice device : bridge.getDeviceRegistry().all()) {
            if (pluginName == null || pluginName.equals(device.pluginName())) {
                out.add(device.device().serialize(device.pluginName()));
            }
        }
        return out;
    }

    /** Cluster attributes of the device at an endpoint of a plugin; empty when there is no such device. */
    public List<ClusterAttribute> deviceClusters(String pluginName, int endpoint) {
        List<ClusterAttribute> out = new ArrayList<>();
        BridgedDevice device = bridge.getDeviceRegistry().findByEndpoint(pluginName, endpoint).orElse(null);
        if (device == null) {
            return out;
        }
        for (String cluster : device.getClusterServerNames()) {
            for (Map.Entry<String, Object> attribute : device.getClusterAttributes(cluster).entrySet()) {
                out.add(new ClusterAttribute(endpoint, cluster, attribute.getKey(), String.valueOf(attribute.getValue())));
            }
        }
        return out;
    }

    public record BridgeSettings(
            String bridgeMode,
            String restartMode,
            String version,
            String latestVersion,
            String homeDirectory,
            int port,
            int frontendPort,
            boolean debug,
            String qrPairingCode,
            String manualPairingCode,
            boolean paired,
            boolean connected,
            List<FabricSummary> fabricInformations,
            List<SessionSummary> sessionInformations,
            SystemInformation systemInformation) {
    }

    public record ClusterAttribute(int endpoint, String clusterName, String attributeName, String attributeValue) {
    }
}

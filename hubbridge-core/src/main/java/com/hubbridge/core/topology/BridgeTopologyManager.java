package com.hubbridge.core.topology;

import com.hubbridge.config.BridgeMode;
import com.hubbridge.core.commissioning.AggregatorIdentity;
import com.hubbridge.core.commissioning.CommissioningContextManager;
import com.hubbridge.core.commissioning.CommissioningIdentity;
import com.hubbridge.core.commissioning.DeclaredAttributes;
import com.hubbridge.core.commissioning.PersistenceFatalException;
import com.hubbridge.core.device.DeviceRegistry;
import com.hubbridge.core.plugin.PluginRegistry;
import com.hubbridge.core.plugin.RegisteredPlugin;
import com.hubbridge.device.BasicInformation;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.device.DeviceTypes;
import com.hubbridge.plugin.PlatformType;
import com.hubbridge.protocol.Aggregator;
import com.hubbridge.protocol.CommissioningListener;
import com.hubbridge.protocol.CommissioningServer;
import com.hubbridge.protocol.CommissioningServerOptions;
import com.hubbridge.protocol.PairingCodes;
import com.hubbridge.protocol.ProtocolEngine;
import com.hubbridge.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Decides where a plugin's device attaches and creates commissioning nodes on demand.
 * <ul>
 *   <li>bridge mode: every device goes to the shared {@code root} aggregator</li>
 *   <li>childbridge, dynamic platform: the first device creates the plugin's own identity and aggregator</li>
 *   <li>childbridge, accessory platform: the first device becomes the plugin's identity; a second one is refused</li>
 * </ul>
 * {@code locked} is set on the plugin before the node is created; a plugin's node survives
 * {@link #removeAllDevices(String)} and is reused when the plugin adds devices again in the same run.
 */
public final class BridgeTopologyManager {

    private static final Logger log = LoggerFactory.getLogger(BridgeTopologyManager.class);

    public static final String BRIDGE_NAME = "HubBridge";
    public static final int BRIDGE_VENDOR_ID = 0xfff1;
    public static final int BRIDGE_PRODUCT_ID = 0x8000;

    private final BridgeMode mode;
    private final PluginRegistry plugins;
    private final DeviceRegistry devices;
    private final CommissioningContextManager identities;
    private final ProtocolEngine engine;
    private final CommissioningListener commissioningListener;
    private final Consumer<PersistenceFatalException> fatalHandler;

    private int nextPort;
    private Integer nextPasscode;
    private Integer nextDiscriminator;
    private CommissioningNode sharedNode;

    public BridgeTopologyManager(BridgeMode mode, int port, Integer passcode, Integer discriminator,
                                 PluginRegistry plugins, DeviceRegistry devices,
                                 CommissioningContextManager identities, ProtocolEngine engine,
                                 CommissioningListener commissioningListener,
                                 Consumer<PersistenceFatalException> fatalHandler) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.nextPort = port;
        this.nextPasscode = passcode;
        this.nextDiscriminator = discriminator;
        this.plugins = Objects.requireNonNull(plugins, "plugins");
        this.devices = Objects.requireNonNull(devices, "devices");
        this.identities = Objects.requireNonNull(identities, "identities");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.commissioningListener = commissioningListener;
        this.fatalHandler = fatalHandler != null ? fatalHandler : e -> { };
    }

    public BridgeMode getMode() {
        return mode;
    }

    /**
     * Creates the shared identity, its server and aggregator (bridge mode). Idempotent.
     *
     * @throws PersistenceFatalException when the identity store cannot be used
     */
    public CommissioningNode createSharedNode() {
        if (mode != BridgeMode.BRIDGE) {
            throw new IllegalStateException("The shared identity only exists in bridge mode");
        }
        if (sharedNode == null) {
            sharedNode = createAggregatorNode(CommissioningContextManager.ROOT_KEY, BRIDGE_NAME + " aggregator");
            log.info("Created shared commissioning server {} on port {}", BRIDGE_NAME, sharedNode.getServer().getPort());
        }
        return sharedNode;
    }

    public CommissioningNode getSharedNode() {
        return sharedNode;
    }

    /** Shared node (bridge mode) or every plugin node (childbridge mode), in registry order. */
    public List<CommissioningNode> allNodes() {
        List<CommissioningNode> nodes = new ArrayList<>();
        if (sharedNode != null) nodes.add(sharedNode);
        for (RegisteredPlugin plugin : plugins.all()) {
            if (plugin.getNode() != null) nodes.add(plugin.getNode());
        }
        return nodes;
    }

    /**
     * Exposes a device for a plugin according to the bridge mode and the plugin type.
     *
     * @throws UnsupportedTopologyException when an accessory platform adds a second device in childbridge mode
     * @throws PersistenceFatalException    when the plugin's identity cannot be created
     */
    public void addDevice(String pluginName, BridgedDevice device) {
        Objects.requireNonNull(device, "device");
        RegisteredPlugin plugin = plugins.get(pluginName).orElse(null);
        if (plugin == null) {
            log.error("Error adding device {}: plugin {} not found", device.getDeviceName(), pluginName);
            return;
        }
        if (devices.contains(device)) {
            log.warn("Device {} is already registered, ignoring", device.getDeviceName());
            return;
        }
        switch (mode) {
            case BRIDGE -> {
                if (sharedNode == null) {
                    log.error("Error adding device {} for plugin {}: no shared aggregator", device.getDeviceName(), pluginName);
                    return;
                }
                sharedNode.getAggregator().addBridgedDevice(device);
            }
            case CHILDBRIDGE -> {
                if (plugin.getType() == PlatformType.ACCESSORY) {
                    attachAccessory(plugin, device);
                } else {
                    attachToPluginAggregator(plugin, device);
                }
            }
            default -> {
                log.error("Error adding device {} for plugin {}: no devices in {} mode", device.getDeviceName(), pluginName, mode);
                return;
            }
        }
        devices.add(pluginName, device);
        plugin.deviceRegistered();
        plugin.deviceAdded();
        plugins.persist();
        log.info("Added device {} for plugin {} ({}/{})", device.getDeviceName(), pluginName,
                plugin.getRegisteredDevices(), plugin.getAddedDevices());
    }

    private void attachToPluginAggregator(RegisteredPlugin plugin, BridgedDevice device) {
        CommissioningNode node = plugin.getNode();
        if (node == null) {
            if (!plugin.lock()) {
                throw new UnsupportedTopologyException(plugin.getName(),
                        "Commissioning identity of plugin " + plugin.getName() + " is not available");
            }
            String productName = plugin.getDescription() != null ? plugin.getDescription() : plugin.getName();
            node = createGuarded(plugin, () -> createAggregatorNode(plugin.getName(), productName));
            plugin.setNode(node);
            publishPairingCodes(plugin, node);
        } else {
            plugin.lock();
        }
        node.getAggregator().addBridgedDevice(device);
    }

    private void attachAccessory(RegisteredPlugin plugin, BridgedDevice device) {
        CommissioningNode node = plugin.getNode();
        if (node == null) {
            if (!plugin.lock()) {
                throw new UnsupportedTopologyException(plugin.getName(),
                        "Accessory platform " + plugin.getName() + " supports only one device");
            }
            CommissioningNode created = createGuarded(plugin, () -> createAccessoryNode(plugin.getName(), device));
            plugin.setNode(created);
            publishPairingCodes(plugin, created);
            return;
        }
        if (node.getDevice() != null) {
            throw new UnsupportedTopologyException(plugin.getName(),
                    "Accessory platform " + plugin.getName() + " supports only one device");
        }
        plugin.lock();
        node.getServer().addEndpoint(device);
        node.setDevice(device);
    }

    private CommissioningNode createGuarded(RegisteredPlugin plugin, NodeFactory factory) {
        try {
            return factory.create();
        } catch (PersistenceFatalException e) {
            log.error("Cannot create commissioning identity for plugin {}: {}", plugin.getName(), e.getMessage());
            fatalHandler.accept(e);
            throw e;
        }
    }

    /**
     * Removes one device: marks it unreachable, detaches it and decrements the plugin's counters. An accessory
     * platform in childbridge mode keeps its commissioning node, logically empty, as with {@link #removeAllDevices}.
     */
    public void removeDevice(String pluginName, BridgedDevice device) {
        RegisteredPlugin plugin = plugins.get(pluginName).orElse(null);
        if (plugin == null) {
            log.error("Error removing device {}: plugin {} not found", device.getDeviceName(), pluginName);
            return;
        }
        if (!isAccessoryNode(plugin) && aggregatorOf(plugin) == null) {
            log.error("Error removing device {} for plugin {}: no aggregator", device.getDeviceName(), pluginName);
            return;
        }
        if (!devices.contains(device)) {
            log.warn("Device {} of plugin {} is not registered", device.getDeviceName(), pluginName);
            return;
        }
        device.setReachable(false);
        detach(plugin, device);
        if (devices.remove(pluginName, device)) {
            plugin.deviceRemoved();
        }
        plugins.persist();
        log.info("Removed device {} for plugin {} ({}/{})", device.getDeviceName(), pluginName,
                plugin.getRegisteredDevices(), plugin.getAddedDevices());
    }

    /**
     * Removes every device of a plugin. The plugin's node stays in place, logically empty.
     */
    public void removeAllDevices(String pluginName) {
        RegisteredPlugin plugin = plugins.get(pluginName).orElse(null);
        if (plugin == null) {
            log.error("Error removing devices: plugin {} not found", pluginName);
            return;
        }
        List<BridgedDevice> owned = devices.devicesOf(pluginName);
        if (owned.isEmpty()) {
            return;
        }
        for (BridgedDevice device : owned) {
            device.setReachable(false);
            detach(plugin, device);
            devices.remove(pluginName, device);
            plugin.deviceRemoved();
        }
        plugins.persist();
        log.info("Removed all {} device(s) for plugin {}", owned.size(), pluginName);
    }

    private boolean isAccessoryNode(RegisteredPlugin plugin) {
        return mode == BridgeMode.CHILDBRIDGE && plugin.getType() == PlatformType.ACCESSORY;
    }

    private void detach(RegisteredPlugin plugin, BridgedDevice device) {
        CommissioningNode node = plugin.getNode();
        if (isAccessoryNode(plugin)) {
            if (node != null && node.getDevice() == device) {
                node.getServer().removeEndpoint(device);
                node.setDevice(null);
            }
            return;
        }
        Aggregator aggregator = aggregatorOf(plugin);
        if (aggregator != null) {
            aggregator.removeBridgedDevice(device);
        }
    }

    private Aggregator aggregatorOf(RegisteredPlugin plugin) {
        if (mode == BridgeMode.BRIDGE) {
            return sharedNode != null ? sharedNode.getAggregator() : null;
        }
        return plugin.getNode() != null ? plugin.getNode().getAggregator() : null;
    }

    private CommissioningNode createAggregatorNode(String key, String productName) {
        CommissioningIdentity identity = identities.create(key, new DeclaredAttributes(
                BRIDGE_NAME, DeviceTypes.AGGREGATOR, BRIDGE_VENDOR_ID, BRIDGE_NAME, BRIDGE_PRODUCT_ID, productName));
        CommissioningServer server = createServer(identity, DeviceTypes.AGGREGATOR);
        AggregatorIdentity aggregatorIdentity = identities.ensureAggregatorIdentity(key);
        BasicInformation info = identity.toBasicInformation()
                .withSerialNumber(aggregatorIdentity.serialNumber(), aggregatorIdentity.uniqueId());
        Aggregator aggregator = engine.createAggregator(productName, info);
        server.addEndpoint(aggregator);
        return new CommissioningNode(key, identity, server, aggregator, null);
    }

    private CommissioningNode createAccessoryNode(String key, BridgedDevice device) {
        CommissioningIdentity identity = identities.importFrom(key, device);
        CommissioningServer server = createServer(identity, device.getDeviceType());
        server.addEndpoint(device);
        return new CommissioningNode(key, identity, server, null, device);
    }

    private CommissioningServer createServer(CommissioningIdentity identity, int deviceType) {
        CommissioningServer server = engine.createCommissioningServer(new CommissioningServerOptions(
                identity.key(), nextPort, nextPasscode, nextDiscriminator, deviceType, identity.toBasicInformation()));
        nextPort++;
        if (nextPasscode != null) nextPasscode++;
        if (nextDiscriminator != null) nextDiscriminator++;
        if (commissioningListener != null) {
            server.setCommissioningListener(commissioningListener);
        }
        identities.savePairingCodes(identity.key(), server.getPairingCodes());
        return server;
    }

    private void publishPairingCodes(RegisteredPlugin plugin, CommissioningNode node) {
        PairingCodes codes = node.getServer().getPairingCodes();
        plugin.setPairingCodes(codes.qrPairingCode(), codes.manualPairingCode());
        if (plugin.getNodeContext() != null) {
            try {
                plugin.getNodeContext().set("qrPairingCode", codes.qrPairingCode());
                plugin.getNodeContext().set("manualPairingCode", codes.manualPairingCode());
            } catch (StorageException e) {
                log.warn("Cannot save pairing codes of plugin {}: {}", plugin.getName(), e.getMessage());
            }
        }
    }

    /** Finds the plugin owning a commissioning server (childbridge mode). */
    public RegisteredPlugin pluginOf(CommissioningServer server) {
        for (RegisteredPlugin plugin : plugins.all()) {
            if (plugin.getNode() != null && plugin.getNode().getServer() == server) return plugin;
        }
        return null;
    }

    @FunctionalInterface
    private interface NodeFactory {
        CommissioningNode create();
    }
}

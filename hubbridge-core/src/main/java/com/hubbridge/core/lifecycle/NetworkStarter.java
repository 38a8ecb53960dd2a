package com.hubbridge.core.lifecycle;

import com.hubbridge.config.BridgeMode;
import com.hubbridge.core.commissioning.CommissioningContextManager;
import com.hubbridge.core.plugin.FabricSummary;
import com.hubbridge.core.plugin.PluginRegistry;
import com.hubbridge.core.plugin.RegisteredPlugin;
import com.hubbridge.core.schedule.BridgeScheduler;
import com.hubbridge.core.topology.BridgeTopologyManager;
import com.hubbridge.core.topology.CommissioningNode;
import com.hubbridge.protocol.CommissioningServer;
import com.hubbridge.protocol.FabricInfo;
import com.hubbridge.protocol.PairingCodes;
import com.hubbridge.protocol.ProtocolEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Brings the network up once startup is clean: starts the protocol engine, shows pairing codes of identities
 * not yet commissioned (fabrics of the others) and marks every node reachable after a delay.
 */
public final class NetworkStarter {

    private static final Logger log = LoggerFactory.getLogger(NetworkStarter.class);

    private final BridgeMode mode;
    private final ProtocolEngine engine;
    private final BridgeTopologyManager topology;
    private final PluginRegistry plugins;
    private final CommissioningContextManager identities;
    private final BridgeScheduler scheduler;
    private final Duration reachabilityDelay;
    private final CommissioningMonitor monitor;

    private volatile boolean networkStarted;

    public NetworkStarter(BridgeMode mode, ProtocolEngine engine, BridgeTopologyManager topology, PluginRegistry plugins,
                          CommissioningContextManager identities, CommissioningMonitor monitor,
                          BridgeScheduler scheduler, Duration reachabilityDelay) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.topology = Objects.requireNonNull(topology, "topology");
        this.plugins = Objects.requireNonNull(plugins, "plugins");
        this.identities = Objects.requireNonNull(identities, "identities");
        this.monitor = monitor;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.reachabilityDelay = Objects.requireNonNull(reachabilityDelay, "reachabilityDelay");
    }

    /**
     * Starts the engine and schedules the reachability update.
     *
     * @return handle of the reachability timer
     */
    public BridgeScheduler.Cancellable start() {
        if (mode == BridgeMode.CHILDBRIDGE) {
            for (RegisteredPlugin plugin : plugins.healthy()) {
                if (plugin.getNode() == null) {
                    log.error("Plugin {} did not add any device: it has no commissioning server", plugin.getName());
                }
            }
        }
        log.info("Starting the protocol engine in {} mode", mode.getValue());
        engine.start();
        networkStarted = true;
        for (CommissioningNode node : topology.allNodes()) {
            showCommissioningState(node);
        }
        plugins.persist();
        return scheduler.schedule(reachabilityDelay, this::markReachable);
    }

    public boolean isNetworkStarted() {
        return networkStarted;
    }

    private void showCommissioningState(CommissioningNode node) {
        CommissioningServer server = node.getServer();
        RegisteredPlugin owner = topology.pluginOf(server);
        if (!server.isCommissioned()) {
            PairingCodes codes = server.getPairingCodes();
            identities.savePairingCodes(node.getKey(), codes);
            if (owner != null) {
                owner.setPairingCodes(codes.qrPairingCode(), codes.manualPairingCode());
                owner.setPaired(false);
            } else if (monitor != null) {
                monitor.sharedCommissioned(List.of());
            }
            log.info("The commissioning server {} is not commissioned. Pair it with the QR code or the manual pairing code.",
                    server.getName());
            log.info("QR pairing code: {}", codes.qrPairingCode());
            log.info("Manual pairing code: {}", codes.manualPairingCode());
            return;
        }
        List<FabricSummary> fabrics = new ArrayList<>();
        for (FabricInfo fabric : server.getCommissionedFabrics()) {
            FabricSummary summary = FabricSummary.of(fabric);
            fabrics.add(summary);
            log.info("The commissioning server {} is commissioned on fabric {} by vendor {} {} (label {})",
                    server.getName(), summary.fabricIndex(), summary.rootVendorId(), summary.rootVendorName(), summary.label());
        }
        if (owner != null) {
            owner.setPaired(true);
            owner.setFabricInformations(fabrics);
        } else if (monitor != null) {
            monitor.sharedCommissioned(fabrics);
        }
    }

    private void markReachable() {
        for (CommissioningNode node : topology.allNodes()) {
            node.getServer().setReachability(true);
            if (node.getAggregator() != null) {
                node.getAggregator().setReachable(true);
            }
            log.info("Set reachability of {} to true", node.getServer().getName());
        }
    }
}

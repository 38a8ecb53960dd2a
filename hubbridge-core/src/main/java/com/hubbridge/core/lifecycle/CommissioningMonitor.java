package com.hubbridge.core.lifecycle;

import com.hubbridge.config.BridgeMode;
import com.hubbridge.core.commissioning.CommissioningContextManager;
import com.hubbridge.core.commissioning.PersistenceFatalException;
import com.hubbridge.core.plugin.FabricSummary;
import com.hubbridge.core.plugin.PluginRegistry;
import com.hubbridge.core.plugin.RegisteredPlugin;
import com.hubbridge.core.plugin.SessionSummary;
import com.hubbridge.core.plugin.VendorNames;
import com.hubbridge.core.schedule.BridgeScheduler;
import com.hubbridge.protocol.CommissioningListener;
import com.hubbridge.protocol.CommissioningServer;
import com.hubbridge.protocol.FabricInfo;
import com.hubbridge.protocol.SessionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Reacts to controller activity on the commissioning servers.
 * <p>
 * A connected controller marks the identity paired and connected and, after {@code configureDelay}, configures
 * the plugins behind it (every healthy plugin in bridge mode, the owning plugin in childbridge mode).
 * Removal of the last fabric factory-resets the server, clears the identity and tells the owning plugin.
 * Callbacks may arrive on protocol threads; the work runs on the bridge scheduler.
 */
public final class CommissioningMonitor implements CommissioningListener {

    private static final Logger log = LoggerFactory.getLogger(CommissioningMonitor.class);

    static final String COMMISSIONING_REMOVED = "Commissioning removed by the controller";

    private final BridgeMode mode;
    private final PluginRegistry plugins;
    private final PluginLifecycleOrchestrator orchestrator;
    private final CommissioningContextManager identities;
    private final BridgeScheduler scheduler;
    private final Duration configureDelay;
    private final Consumer<PersistenceFatalException> fatalHandler;

    // pairing state of the shared identity (bridge mode)
    private volatile boolean paired;
    private volatile boolean connected;
    private volatile List<FabricSummary> fabricInformations = List.of();
    private volatile List<SessionSummary> sessionInformations = List.of();

    public CommissioningMonitor(BridgeMode mode, PluginRegistry plugins, PluginLifecycleOrchestrator orchestrator,
                                CommissioningContextManager identities, BridgeScheduler scheduler,
                                Duration configureDelay, Consumer<PersistenceFatalException> fatalHandler) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.plugins = Objects.requireNonNull(plugins, "plugins");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.identities = Objects.requireNonNull(identities, "identities");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.configureDelay = Objects.requireNonNull(configureDelay, "configureDelay");
        this.fatalHandler = fatalHandler != null ? fatalHandler : e -> { };
    }

    @Override
    public void onActiveSessionsChanged(CommissioningServer server, int fabricIndex, List<SessionInfo> sessions) {
        scheduler.execute(() -> sessionsChanged(server, fabricIndex, sessions));
    }

    @Override
    public void onCommissioningChanged(CommissioningServer server, int fabricIndex) {
        scheduler.execute(() -> commissioningChanged(server, fabricIndex));
    }

    private void sessionsChanged(CommissioningServer server, int fabricIndex, List<SessionInfo> sessions) {
        boolean controllerConnected = false;
        for (SessionInfo session : sessions) {
            log.debug("Active session {} changed on fabric {} for {}", session.name(), fabricIndex, server.getName());
            if (session.isControllerConnected()) {
                log.info("Controller connected to {} on session {} (fabric {})", server.getName(), session.name(), fabricIndex);
                controllerConnected = true;
            }
        }
        if (!controllerConnected) {
            return;
        }
        List<SessionSummary> summaries = sessions.stream().map(SessionSummary::of).toList();
        RegisteredPlugin owner = ownerOf(server);
        if (owner == null) {
            paired = true;
            connected = true;
            sessionInformations = summaries;
        } else {
            owner.setPaired(true);
            owner.setConnected(true);
            owner.setSessionInformations(summaries);
        }
        plugins.persist();
        scheduler.schedule(configureDelay, () -> configureAfterConnect(owner));
    }

    private void configureAfterConnect(RegisteredPlugin owner) {
        if (mode == BridgeMode.BRIDGE) {
            for (RegisteredPlugin plugin : plugins.healthy()) {
                if (plugin.isLoaded() && plugin.isStarted()) {
                    orchestrator.configure(plugin);
                }
            }
        } else if (owner != null && owner.isLoaded() && owner.isStarted() && !owner.isConfigured()) {
            orchestrator.configure(owner);
        }
    }

    private void commissioningChanged(CommissioningServer server, int fabricIndex) {
        List<FabricInfo> fabrics = server.getCommissionedFabrics();
        RegisteredPlugin owner = ownerOf(server);
        if (!fabrics.isEmpty()) {
            List<FabricSummary> summaries = fabrics.stream().map(FabricSummary::of).toList();
            for (FabricSummary fabric : summaries) {
                log.info("Commissioning server {} commissioned on fabric {} by {} {}", server.getName(),
                        fabric.fabricIndex(), fabric.rootVendorId(), VendorNames.of(fabric.rootVendorId()));
            }
            if (owner == null) {
                paired = true;
                fabricInformations = summaries;
            } else {
                owner.setPaired(true);
                owner.setFabricInformations(summaries);
            }
            plugins.persist();
            return;
        }
        log.warn("Commissioning removed from fabric {} for {}. Resetting the commissioning server.", fabricIndex, server.getName());
        server.factoryReset();
        try {
            identities.reset(server.getName());
        } catch (PersistenceFatalException e) {
            log.error("Cannot clear commissioning identity {}: {}", server.getName(), e.getMessage());
            fatalHandler.accept(e);
            return;
        }
        if (owner == null) {
            paired = false;
            connected = false;
            fabricInformations = List.of();
            sessionInformations = List.of();
        } else {
            orchestrator.shutdown(owner, COMMISSIONING_REMOVED, false);
            owner.setPaired(false);
            owner.setConnected(false);
            owner.setFabricInformations(List.of());
            owner.setSessionInformations(List.of());
        }
        plugins.persist();
        log.warn("Restart to activate the pairing of {}", server.getName());
    }

    private RegisteredPlugin ownerOf(CommissioningServer server) {
        if (mode != BridgeMode.CHILDBRIDGE || CommissioningContextManager.ROOT_KEY.equals(server.getName())) {
            return null;
        }
        return plugins.get(server.getName()).orElse(null);
    }

    public boolean isPaired() {
        return paired;
    }

    public boolean isConnected() {
        return connected;
    }

    public List<FabricSummary> getFabricInformations() {
        return fabricInformations;
    }

    public List<SessionSummary> getSessionInformations() {
        return sessionInformations;
    }

    /** Seeds the shared identity's pairing state when the network starts. */
    void sharedCommissioned(List<FabricSummary> fabrics) {
        paired = !fabrics.isEmpty();
        fabricInformations = List.copyOf(fabrics);
    }
}

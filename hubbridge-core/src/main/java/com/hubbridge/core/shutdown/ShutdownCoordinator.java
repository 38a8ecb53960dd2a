package com.hubbridge.core.shutdown;

import com.hubbridge.core.admin.AdminListener;
import com.hubbridge.core.device.DeviceRegistry;
import com.hubbridge.core.lifecycle.PluginLifecycleOrchestrator;
import com.hubbridge.core.plugin.PluginRegistry;
import com.hubbridge.core.plugin.RegisteredPlugin;
import com.hubbridge.core.schedule.BridgeScheduler;
import com.hubbridge.plugin.PlatformConfig;
import com.hubbridge.plugin.event.BridgeEvent;
import com.hubbridge.plugin.event.BridgeEventBus;
import com.hubbridge.protocol.ProtocolEngine;
import com.hubbridge.storage.StorageContext;
import com.hubbridge.storage.StorageManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Ordered, de-duplicated teardown of a bridge instance.
 * <p>
 * {@code IDLE → DRAINING → FLUSHING_PROTOCOL → FLUSHING_STORE → FINALIZING → IDLE}:
 * <ol>
 *   <li>detach process signals, cancel timers, call every healthy plugin's shutdown hook in registry order,
 *       close the admin listeners</li>
 *   <li>after {@code protocolFlushDelay}: close the protocol engine and the identity store, write the device
 *       registry and the plugin registry to node storage, close it, clear both registries</li>
 *   <li>after {@code storeFlushDelay}: destroy stores as the action requires, publish exactly one of
 *       {@code Update}, {@code Restart}, {@code Shutdown} and release the instance</li>
 * </ol>
 * A second request while cleanup runs returns the running cleanup's future. Failures of a step are logged and
 * the next step runs.
 */
public final class ShutdownCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

    public static final String REASON_PREFIX = "HubBridge is closing: ";

    private final BridgeScheduler scheduler;
    private final PluginRegistry plugins;
    private final DeviceRegistry devices;
    private final PluginLifecycleOrchestrator orchestrator;
    private final BridgeEventBus eventBus;
    private final Supplier<ProtocolEngine> engine;
    private final Supplier<StorageManager> identityStore;
    private final Supplier<StorageManager> nodeStorage;
    private final String nodeContextName;
    private final Supplier<List<AdminListener>> adminListeners;
    private final ProcessSignals signals;
    private final Runnable cancelTimers;
    private final Runnable releaseInstance;
    private final Duration protocolFlushDelay;
    private final Duration storeFlushDelay;

    private final AtomicBoolean inProgress = new AtomicBoolean();
    private volatile ShutdownPhase phase = ShutdownPhase.IDLE;
    private volatile CompletableFuture<Void> current;

    private ShutdownCoordinator(Builder b) {
        this.scheduler = Objects.requireNonNull(b.scheduler, "scheduler");
        this.plugins = Objects.requireNonNull(b.plugins, "plugins");
        this.devices = Objects.requireNonNull(b.devices, "devices");
        this.orchestrator = b.orchestrator;
        this.eventBus = Objects.requireNonNull(b.eventBus, "eventBus");
        this.engine = b.engine != null ? b.engine : () -> null;
        this.identityStore = b.identityStore != null ? b.identityStore : () -> null;
        this.nodeStorage = b.nodeStorage != null ? b.nodeStorage : () -> null;
        this.nodeContextName = b.nodeContextName;
        this.adminListeners = b.adminListeners != null ? b.adminListeners : List::of;
        this.signals = b.signals != null ? b.signals : ProcessSignals.NONE;
        this.cancelTimers = b.cancelTimers != null ? b.cancelTimers : () -> { };
        this.releaseInstance = b.releaseInstance != null ? b.releaseInstance : () -> { };
        this.protocolFlushDelay = Objects.requireNonNull(b.protocolFlushDelay, "protocolFlushDelay");
        this.storeFlushDelay = Objects.requireNonNull(b.storeFlushDelay, "storeFlushDelay");
    }

    public ShutdownPhase getPhase() {
        return phase;
    }

    public boolean isInProgress() {
        return inProgress.get();
    }

    public CompletableFuture<Void> shutdown(ShutdownAction action) {
        return shutdown(ShutdownRequest.of(action));
    }

    /**
     * Starts cleanup. The returned future completes after the completion event was published.
     */
    public CompletableFuture<Void> shutdown(ShutdownRequest request) {
        Objects.requireNonNull(request, "request");
        if (!inProgress.compareAndSet(false, true)) {
            log.debug("Cleanup already in progress, ignoring {}", request.action());
            CompletableFuture<Void> running = current;
            return running != null ? running : CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        current = done;
        log.info("Cleanup: {}", request.reason());
        scheduler.execute(() -> drain(request, done));
        return done;
    }

    private void drain(ShutdownRequest request, CompletableFuture<Void> done) {
        phase = ShutdownPhase.DRAINING;
        step("detach process signals", signals::detach);
        step("cancel timers", cancelTimers);

        String reason = REASON_PREFIX + request.reason();
        CompletableFuture<Void> hooks = CompletableFuture.completedFuture(null);
        if (orchestrator != null) {
            for (RegisteredPlugin plugin : plugins.healthy()) {
                PlatformConfig config = plugin.getPlatformConfig();
                boolean unregister = config != null && config.isUnregisterOnShutdown();
                hooks = hooks.thenCompose(v -> orchestrator.shutdown(plugin, reason, unregister));
            }
        }
        hooks.exceptionally(e -> {
            log.error("Plugin shutdown failed: {}", e.getMessage(), e);
            return null;
        }).thenRunAsync(() -> {
            for (AdminListener listener : adminListeners.get()) {
                step("close admin listener " + listener.getName(), listener::close);
            }
            phase = ShutdownPhase.FLUSHING_PROTOCOL;
            log.debug("Waiting {} ms for the protocol engine to flush", protocolFlushDelay.toMillis());
            scheduler.schedule(protocolFlushDelay, () -> flushProtocol(request, done));
        }, scheduler);
    }

    private void flushProtocol(ShutdownRequest request, CompletableFuture<Void> done) {
        ProtocolEngine protocolEngine = engine.get();
        if (protocolEngine != null) {
            step("close protocol engine", protocolEngine::close);
        }
        StorageManager identities = identityStore.get();
        if (identities != null) {
            step("close identity store", identities::close);
        }
        StorageManager node = nodeStorage.get();
        if (node != null && !node.isClosed()) {
            step("save devices", () -> {
                StorageContext context = node.createContext(nodeContextName);
                context.set(DeviceRegistry.DEVICES_KEY, devices.serialize());
                log.info("Saved {} device(s) to {}", devices.size(), node.describe());
            });
            step("save plugins", plugins::persist);
            plugins.detachStorage();
            step("close node storage", node::close);
        }
        plugins.clear();
        devices.clear();

        phase = ShutdownPhase.FLUSHING_STORE;
        log.debug("Waiting {} ms for the stores to flush", storeFlushDelay.toMillis());
        scheduler.schedule(storeFlushDelay, () -> finish(request, done));
    }

    private void finish(ShutdownRequest request, CompletableFuture<Void> done) {
        phase = ShutdownPhase.FINALIZING;
        try {
            ShutdownAction action = request.action();
            if (action.destroysIdentityStore()) {
                StorageManager identities = identityStore.get();
                if (identities != null) {
                    step("destroy identity store", identities::destroy);
                    log.info("Identity store {} deleted", identities.describe());
                }
            }
            if (action.destroysNodeStorage()) {
                StorageManager node = nodeStorage.get();
                if (node != null) {
                    step("destroy node storage", node::destroy);
                    log.info("Node storage {} deleted", node.describe());
                }
            }
            BridgeEvent event = action.completionEvent(request.reason());
            log.info("Cleanup completed: {}", request.reason());
            eventBus.publish(event);
            step("release instance", releaseInstance);
        } finally {
            phase = ShutdownPhase.IDLE;
            inProgress.set(false);
            done.complete(null);
        }
    }

    private static void step(String name, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Cleanup step '{}' failed: {}", name, e.getMessage(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BridgeScheduler scheduler;
        private PluginRegistry plugins;
        private DeviceRegistry devices;
        private PluginLifecycleOrchestrator orchestrator;
        private BridgeEventBus eventBus;
        private Supplier<ProtocolEngine> engine;
        private Supplier<StorageManager> identityStore;
        private Supplier<StorageManager> nodeStorage;
        private String nodeContextName = "hubbridge";
        private Supplier<List<AdminListener>> adminListeners;
        private ProcessSignals signals;
        private Runnable cancelTimers;
        private Runnable releaseInstance;
        private Duration protocolFlushDelay = Duration.ofSeconds(3);
        private Duration storeFlushDelay = Duration.ofSeconds(2);

        private Builder() {
        }

        public Builder scheduler(BridgeScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder plugins(PluginRegistry plugins) {
            this.plugins = plugins;
            return this;
        }

        public Builder devices(DeviceRegistry devices) {
            this.devices = devices;
            return this;
        }

        public Builder orchestrator(PluginLifecycleOrchestrator orchestrator) {
            this.orchestrator = orchestrator;
            return this;
        }

        public Builder eventBus(BridgeEventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder engine(Supplier<ProtocolEngine> engine) {
            this.engine = engine;
            return this;
        }

        public Builder identityStore(Supplier<StorageManager> identityStore) {
            this.identityStore = identityStore;
            return this;
        }

        public Builder nodeStorage(Supplier<StorageManager> nodeStorage) {
            this.nodeStorage = nodeStorage;
            return this;
        }

        public Builder nodeContextName(String nodeContextName) {
            this.nodeContextName = nodeContextName;
            return this;
        }

        public Builder adminListeners(Supplier<List<AdminListener>> adminListeners) {
            this.adminListeners = adminListeners;
            return this;
        }

        public Builder signals(ProcessSignals signals) {
            this.signals = signals;
            return this;
        }

        public Builder cancelTimers(Runnable cancelTimers) {
            this.cancelTimers = cancelTimers;
            return this;
        }

        public Builder releaseInstance(Runnable releaseInstance) {
            this.releaseInstance = releaseInstance;
            return this;
        }

        public Builder protocolFlushDelay(Duration protocolFlushDelay) {
            this.protocolFlushDelay = protocolFlushDelay;
            return this;
        }

        public Builder storeFlushDelay(Duration storeFlushDelay) {
            this.storeFlushDelay = storeFlushDelay;
            return this;
        }

        public ShutdownCoordinator build() {
            return new ShutdownCoordinator(this);
        }
    }
}

package com.hubbridge.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.hubbridge.config.BridgeConfig;
import com.hubbridge.config.BridgeMode;
import com.hubbridge.config.StorageBackendType;
import com.hubbridge.core.admin.AdminListener;
import com.hubbridge.core.admin.PackageInstaller;
import com.hubbridge.core.commissioning.CommissioningContextManager;
import com.hubbridge.core.commissioning.PersistenceFatalException;
import com.hubbridge.core.device.DeviceRegistry;
import com.hubbridge.core.lifecycle.CommissioningMonitor;
import com.hubbridge.core.lifecycle.LoadResult;
import com.hubbridge.core.lifecycle.NetworkStarter;
import com.hubbridge.core.lifecycle.PluginLifecycleOrchestrator;
import com.hubbridge.core.lifecycle.StartupSupervisor;
import com.hubbridge.core.plugin.PluginConfigStore;
import com.hubbridge.core.plugin.PluginRegistry;
import com.hubbridge.core.plugin.RegisteredPlugin;
import com.hubbridge.core.schedule.BridgeScheduler;
import com.hubbridge.core.schedule.SingleThreadBridgeScheduler;
import com.hubbridge.core.shutdown.ProcessSignals;
import com.hubbridge.core.shutdown.ShutdownAction;
import com.hubbridge.core.shutdown.ShutdownCoordinator;
import com.hubbridge.core.shutdown.ShutdownRequest;
import com.hubbridge.core.topology.BridgeTopologyManager;
import com.hubbridge.core.update.UpdateChecker;
import com.hubbridge.core.update.VersionSource;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.device.SerializedDevice;
import com.hubbridge.plugin.BridgeHandle;
import com.hubbridge.plugin.PluginLoadException;
import com.hubbridge.plugin.PluginLoader;
import com.hubbridge.plugin.event.BridgeEventBus;
import com.hubbridge.protocol.ProtocolEngine;
import com.hubbridge.protocol.local.LocalProtocolEngine;
import com.hubbridge.storage.DirectoryStorageManager;
import com.hubbridge.storage.JsonFileStorageManager;
import com.hubbridge.storage.RedisStorageManager;
import com.hubbridge.storage.StorageContext;
import com.hubbridge.storage.StorageException;
import com.hubbridge.storage.StorageManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One bridge instance: the explicit context built at process entry and passed to every component.
 * <p>
 * {@link #initialize()} opens the stores, reads the plugin registry and creates the protocol engine;
 * {@link #start()} runs the mode's startup (shared identity, plugin load and start, startup supervisor, network).
 * The instance ends with exactly one {@code Shutdown}, {@code Restart} or {@code Update} event on its bus;
 * a restart builds a fresh instance.
 */
public final class HubBridge implements BridgeHandle {

    private static final Logger log = LoggerFactory.getLogger(HubBridge.class);

    /** Node storage context holding the plugin registry and the serialized devices. */
    public static final String NODE_CONTEXT = "hubbridge";
    public static final String CONTROLLER_CONTEXT = "hubbridge-controller";

    private static final TypeReference<List<SerializedDevice>> DEVICE_LIST = new TypeReference<>() {
    };

    private final BridgeConfig config;
    private final BridgeScheduler scheduler;
    private final BridgeEventBus eventBus;
    private final Function<BridgeConfig, StorageManager> nodeStorageFactory;
    private final Function<BridgeConfig, StorageManager> identityStoreFactory;
    private final Supplier<ProtocolEngine> engineFactory;
    private final ProcessSignals signals;
    private final PackageInstaller packageInstaller;
    private final VersionSource versionSource;
    private final Runnable onRelease;

    private final PluginRegistry plugins = new PluginRegistry();
    private final DeviceRegistry devices = new DeviceRegistry();
    private final PluginLoader loader;
    private final PluginConfigStore configStore;
    private final CommissioningContextManager identities;
    private final PluginLifecycleOrchestrator orchestrator;
    private final CommissioningMonitor monitor;
    private final ShutdownCoordinator coordinator;
    private final List<AdminListener> adminListeners = new CopyOnWriteArrayList<>();
    private final List<BridgeScheduler.Cancellable> timers = new CopyOnWriteArrayList<>();

    private volatile StorageManager nodeStorage;
    private volatile StorageContext nodeContext;
    private volatile StorageManager identityStore;
    private volatile ProtocolEngine engine;
    private volatile BridgeTopologyManager topology;
    private volatile NetworkStarter networkStarter;
    private volatile StartupSupervisor supervisor;
    private volatile UpdateChecker updateChecker;
    private volatile boolean initialized;
    private volatile boolean started;
    private volatile boolean released;

    private HubBridge(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config");
        this.scheduler = b.scheduler != null ? b.scheduler : new SingleThreadBridgeScheduler();
        this.eventBus = b.eventBus != null ? b.eventBus : new BridgeEventBus();
        this.nodeStorageFactory = b.nodeStorageFactory != null ? b.nodeStorageFactory : HubBridge::defaultNodeStorage;
        this.identityStoreFactory = b.identityStoreFactory != null ? b.identityStoreFactory : HubBridge::defaultIdentityStore;
        this.engineFactory = b.engineFactory != null ? b.engineFactory : LocalProtocolEngine::new;
        this.signals = b.signals != null ? b.signals : ProcessSignals.NONE;
        this.packageInstaller = b.packageInstaller != null ? b.packageInstaller : PackageInstaller.NONE;
        this.versionSource = b.versionSource;
        this.onRelease = b.onRelease != null ? b.onRelease : () -> { };

        this.loader = new PluginLoader(config.getPluginsDirectory());
        this.configStore = new PluginConfigStore(config.getHomeDirectory());
        this.identities = new CommissioningContextManager(() -> identityStore, config.getBridgeVersion());
        this.orchestrator = new PluginLifecycleOrchestrator(this, plugins, loader, configStore, scheduler);
        this.monitor = new CommissioningMonitor(config.getMode(), plugins, orchestrator, identities, scheduler,
                config.getConfigureDelay(), this::onPersistenceFatal);
        this.coordinator = ShutdownCoordinator.builder()
                .scheduler(scheduler)
                .plugins(plugins)
                .devices(devices)
                .orchestrator(orchestrator)
                .eventBus(eventBus)
                .engine(() -> engine)
                .identityStore(() -> identityStore)
                .nodeStorage(() -> nodeStorage)
                .nodeContextName(NODE_CONTEXT)
                .adminListeners(() -> new ArrayList<>(adminListeners))
                .signals(signals)
                .cancelTimers(this::cancelTimers)
                .releaseInstance(this::release)
                .protocolFlushDelay(config.getProtocolFlushDelay())
                .storeFlushDelay(config.getStoreFlushDelay())
                .build();
    }

    public static Builder builder(BridgeConfig config) {
        return new Builder(config);
    }

    // ---- initialization and startup ----

    /**
     * Opens node storage and the identity store, reads the plugin registry and creates the protocol engine.
     *
     * @return false when a store or the engine is unavailable; a coordinated shutdown is then under way
     */
    public synchronized boolean initialize() {
        if (initialized) {
            throw new IllegalStateException("HubBridge already initialized");
        }
        log.info("HubBridge {} initializing in {} mode, home {}", config.getBridgeVersion(), config.getMode(),
                config.getHomeDirectory());
        signals.attach(signal -> shutdown(new ShutdownRequest("received " + signal + ", shutting down...",
                ShutdownAction.SHUTDOWN)));
        try {
            nodeStorage = nodeStorageFactory.apply(config);
            nodeContext = nodeStorage.createContext(NODE_CONTEXT);
            plugins.attachStorage(nodeContext);
            int count = plugins.load();
            log.info("Node storage {} opened with {} plugin(s)", nodeStorage.describe(), count);
            identityStore = identityStoreFactory.apply(config);
            if (identityStore instanceof JsonFileStorageManager json) {
                json.backup();
            }
            log.info("Identity store {} opened", identityStore.describe());
        } catch (RuntimeException e) {
            log.error("Fatal error opening storage: {}", e.getMessage(), e);
            shutdown(new ShutdownRequest("storage unavailable, shutting down...", ShutdownAction.SHUTDOWN));
            return false;
        }
        try {
            engine = Objects.requireNonNull(engineFactory.get(), "protocol engine");
        } catch (RuntimeException e) {
            log.error("Fatal error creating the protocol engine: {}", e.getMessage(), e);
            shutdown(new ShutdownRequest("protocol engine unavailable, shutting down...", ShutdownAction.SHUTDOWN));
            return false;
        }
        topology = new BridgeTopologyManager(config.getMode(), config.getPort(), config.getPasscode(),
                config.getDiscriminator(), plugins, devices, identities, engine, monitor, this::onPersistenceFatal);
        networkStarter = new NetworkStarter(config.getMode(), engine, topology, plugins, identities, monitor,
                scheduler, config.getReachabilityDelay());
        initialized = true;
        return true;
    }

    /** Runs the startup of the configured mode on the bridge scheduler. */
    public void start() {
        requireInitialized();
        scheduler.execute(this::startOnBridgeThread);
    }

    private void startOnBridgeThread() {
        if (started) {
            log.warn("HubBridge already started");
            return;
        }
        started = true;
        if (config.getMode() == BridgeMode.CONTROLLER) {
            engine.startController(CONTROLLER_CONTEXT);
            log.info("HubBridge started as controller");
            return;
        }
        if (config.getMode() == BridgeMode.BRIDGE) {
            try {
                topology.createSharedNode();
            } catch (PersistenceFatalException e) {
                onPersistenceFatal(e);
                return;
            }
        }
        for (RegisteredPlugin plugin : plugins.all()) {
            orchestrator.prepare(plugin);
            if (plugin.isEnabled()) {
                openPluginContext(plugin);
            }
        }
        plugins.persist();
        for (RegisteredPlugin plugin : plugins.enabled()) {
            LoadResult result = orchestrator.load(plugin);
            if (result.status() == LoadResult.Status.LOADED) {
                orchestrator.start(plugin, "HubBridge is starting");
            }
        }
        supervisor = new StartupSupervisor(plugins, scheduler, config.getStartupPollInterval(),
                config.getStartupMaxAttempts());
        supervisor.start(this::startNetwork);
        if (versionSource != null) {
            updateChecker = new UpdateChecker(versionSource, plugins, scheduler, config.getBridgeVersion());
            timers.add(updateChecker.schedule(config.getUpdateCheckInterval()));
        }
    }

    private void startNetwork() {
        try {
            timers.add(networkStarter.start());
            log.info("HubBridge started in {} mode", config.getMode());
        } catch (RuntimeException e) {
            log.error("Failed to start the network: {}", e.getMessage(), e);
        }
    }

    private void openPluginContext(RegisteredPlugin plugin) {
        try {
            StorageContext context = nodeStorage.createContext(plugin.getName());
            context.set("name", plugin.getName());
            if (plugin.getType() != null) context.set("type", plugin.getType());
            if (plugin.getPath() != null) context.set("path", plugin.getPath());
            if (plugin.getVersion() != null) context.set("version", plugin.getVersion());
            if (plugin.getDescription() != null) context.set("description", plugin.getDescription());
            if (plugin.getAuthor() != null) context.set("author", plugin.getAuthor());
            if (config.getMode() == BridgeMode.CHILDBRIDGE) {
                String qr = context.get("qrPairingCode", String.class, null);
                String manual = context.get("manualPairingCode", String.class, null);
                if (qr != null && manual != null) {
                    plugin.setPairingCodes(qr, manual);
                }
            }
            plugin.setNodeContext(context);
        } catch (StorageException e) {
            log.warn("Cannot open storage context of plugin {}: {}", plugin.getName(), e.getMessage());
        }
    }

    private void onPersistenceFatal(PersistenceFatalException e) {
        log.error("Persistence failure for {}: {}. Shutting down.", e.getIdentityKey(), e.getMessage());
        shutdown(new ShutdownRequest("persistence failure, shutting down...", ShutdownAction.SHUTDOWN));
    }

    private void cancelTimers() {
        StartupSupervisor s = supervisor;
        if (s != null) s.cancel();
        for (BridgeScheduler.Cancellable timer : timers) {
            timer.cancel();
        }
        timers.clear();
    }

    private void release() {
        released = true;
        loader.close();
        onRelease.run();
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("HubBridge is not initialized");
        }
    }

    // ---- BridgeHandle ----

    @Override
    public BridgeMode getBridgeMode() {
        return config.getMode();
    }

    @Override
    public String getBridgeVersion() {
        return config.getBridgeVersion();
    }

    @Override
    public Path getHomeDirectory() {
        return config.getHomeDirectory();
    }

    @Override
    public BridgeEventBus getEventBus() {
        return eventBus;
    }

    @Override
    public void addBridgedDevice(String pluginName, BridgedDevice device) {
        BridgeTopologyManager t = topology;
        if (t == null) {
            log.error("Cannot add device {} for plugin {}: HubBridge is not initialized", device.getDeviceName(), pluginName);
            return;
        }
        t.addDevice(pluginName, device);
    }

    @Override
    public void removeBridgedDevice(String pluginName, BridgedDevice device) {
        BridgeTopologyManager t = topology;
        if (t != null) t.removeDevice(pluginName, device);
    }

    @Override
    public void removeAllBridgedDevices(String pluginName) {
        BridgeTopologyManager t = topology;
        if (t != null) t.removeAllDevices(pluginName);
    }

    // ---- plugin administration ----
    // Every operation runs on the bridge thread; failures complete the returned future exceptionally.

    /**
     * Registers a plugin. When the bridge is running the plugin is also loaded and started, and configured if the
     * network is already up. The future fails with {@link PluginLoadException} when no plugin manifest is found and
     * with {@link IllegalArgumentException} when the plugin is already registered.
     */
    public CompletableFuture<RegisteredPlugin> addPlugin(String pathOrName) {
        return onBridgeThread(() -> {
            RegisteredPlugin plugin = orchestrator.register(pathOrName);
            if (!started || config.getMode() == BridgeMode.CONTROLLER) {
                return CompletableFuture.completedFuture(plugin);
            }
            orchestrator.prepare(plugin);
            openPluginContext(plugin);
            return loadStartConfigure(plugin, "The plugin has been added").thenApply(v -> plugin);
        });
    }

    private CompletableFuture<Void> loadStartConfigure(RegisteredPlugin plugin, String reason) {
        if (orchestrator.load(plugin).status() != LoadResult.Status.LOADED) {
            return CompletableFuture.completedFuture(null);
        }
        return orchestrator.start(plugin, reason).thenCompose(v -> isNetworkStarted()
                ? orchestrator.configure(plugin) : CompletableFuture.completedFuture(null));
    }

    /** Calls the plugin's shutdown hook, removes its devices and drops it from the registry. */
    public CompletableFuture<Void> removePlugin(String name) {
        return onBridgeThread(() -> {
            Optional<RegisteredPlugin> found = plugins.get(name);
            if (found.isEmpty()) {
                log.warn("Plugin {} not registered", name);
                return CompletableFuture.completedFuture(null);
            }
            RegisteredPlugin plugin = found.get();
            return orchestrator.shutdown(plugin, "The plugin has been removed.", true).thenRunAsync(() -> {
                plugin.resetRunState();
                plugins.remove(plugin);
                plugins.persist();
                log.info("Removed plugin {}", name);
            }, scheduler);
        });
    }

    /** Enables a plugin; in bridge mode a running bridge loads and starts it right away. */
    public CompletableFuture<Void> enablePlugin(String name) {
        return onBridgeThread(() -> {
            Optional<RegisteredPlugin> found = plugins.get(name);
            if (found.isEmpty()) {
                log.warn("Plugin {} not registered", name);
                return CompletableFuture.completedFuture(null);
            }
            RegisteredPlugin plugin = found.get();
            if (plugin.getPlatform() != null) {
                log.info("Plugin {} already enabled", name);
                return CompletableFuture.completedFuture(null);
            }
            plugin.resetRunState();
            plugin.setEnabled(true);
            plugins.persist();
            log.info("Enabled plugin {}", name);
            if (!started || config.getMode() != BridgeMode.BRIDGE) {
                return CompletableFuture.completedFuture(null);
            }
            orchestrator.prepare(plugin);
            openPluginContext(plugin);
            return loadStartConfigure(plugin, "The plugin has been enabled");
        });
    }

    /** Calls the plugin's shutdown hook, removes its devices and disables it. */
    public CompletableFuture<Void> disablePlugin(String name) {
        return onBridgeThread(() -> {
            Optional<RegisteredPlugin> found = plugins.get(name);
            if (found.isEmpty()) {
                log.warn("Plugin {} not registered", name);
                return CompletableFuture.completedFuture(null);
            }
            RegisteredPlugin plugin = found.get();
            return orchestrator.shutdown(plugin, "The plugin has been disabled.", true).thenRunAsync(() -> {
                plugin.resetRunState();
                plugin.setEnabled(false);
                plugins.persist();
                log.info("Disabled plugin {}", name);
            }, scheduler);
        });
    }

    /**
     * Saves a configuration received from the administration surface. Takes effect on the next load.
     * The future fails with {@link IllegalArgumentException} when the plugin is unknown or the document is invalid.
     */
    public CompletableFuture<Void> savePluginConfig(String name, JsonNode json) {
        return onBridgeThread(() -> {
            RegisteredPlugin plugin = plugins.get(name)
                    .orElseThrow(() -> new IllegalArgumentException("Plugin " + name + " not registered"));
            configStore.saveFromJson(plugin, json);
            log.info("Saved config of plugin {}", name);
            return CompletableFuture.completedFuture(null);
        });
    }

    /** Installs a plugin package, then adds it. */
    public CompletableFuture<Void> installPlugin(String packageName) {
        log.info("Installing plugin {}", packageName);
        return packageInstaller.installPlugin(packageName)
                .thenComposeAsync(v -> {
                    log.info("Plugin {} installed", packageName);
                    if (plugins.get(packageName).isPresent()) {
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    return addPlugin(packageName).thenApply(p -> (Void) null);
                }, scheduler)
                .exceptionally(e -> {
                    log.error("Error installing plugin {}: {}", packageName, rootMessage(e));
                    return null;
                });
    }

    /** Forgets the commissioning identity of one plugin (childbridge mode). */
    public CompletableFuture<Void> resetPluginIdentity(String name) {
        return onBridgeThread(() -> {
            identities.reset(name);
            plugins.get(name).ifPresent(p -> p.setPairingCodes(null, null));
            log.info("Reset commissioning identity of plugin {}", name);
            return CompletableFuture.completedFuture(null);
        });
    }

    private <T> CompletableFuture<T> onBridgeThread(Supplier<CompletableFuture<T>> operation) {
        return CompletableFuture.supplyAsync(operation, scheduler).thenCompose(Function.identity());
    }

    // ---- process operations ----

    public CompletableFuture<Void> shutdown() {
        return shutdown(ShutdownRequest.of(ShutdownAction.SHUTDOWN));
    }

    public CompletableFuture<Void> shutdown(ShutdownRequest request) {
        return coordinator.shutdown(request);
    }

    public CompletableFuture<Void> restart() {
        return shutdown(ShutdownRequest.of(ShutdownAction.RESTART));
    }

    /** Installs the latest bridge package, then shuts down with an {@code Update} event. */
    public CompletableFuture<Void> update() {
        log.info("Updating HubBridge");
        return packageInstaller.updateBridge()
                .handle((v, e) -> e)
                .thenCompose(error -> {
                    if (error != null) {
                        log.error("Error updating HubBridge: {}", rootMessage(error));
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    log.info("HubBridge has been updated");
                    return shutdown(ShutdownRequest.of(ShutdownAction.UPDATE));
                });
    }

    /** Shuts down and deletes the identity store. */
    public CompletableFuture<Void> reset() {
        return shutdown(ShutdownRequest.of(ShutdownAction.RESET));
    }

    /** Shuts down and deletes the identity store and node storage. */
    public CompletableFuture<Void> factoryReset() {
        return shutdown(ShutdownRequest.of(ShutdownAction.FACTORY_RESET));
    }

    /** Removes every device of every healthy plugin, then shuts down. */
    public CompletableFuture<Void> unregisterAndShutdown() {
        CompletableFuture<Void> removed = onBridgeThread(() -> {
            try {
                for (RegisteredPlugin plugin : plugins.healthy()) {
                    removeAllBridgedDevices(plugin.getName());
                }
            } catch (RuntimeException e) {
                log.error("Error unregistering devices: {}", e.getMessage(), e);
            }
            return CompletableFuture.completedFuture(null);
        });
        return removed.thenCompose(v -> shutdown(
                new ShutdownRequest("unregistered all devices and shutting down...", ShutdownAction.SHUTDOWN)));
    }

    // ---- queries ----

    /** Devices persisted by the previous run (node storage {@code devices} key). */
    public List<SerializedDevice> storedDevices() {
        StorageContext context = nodeContext;
        if (context == null) return List.of();
        return context.get(DeviceRegistry.DEVICES_KEY, DEVICE_LIST, List.of());
    }

    public boolean isNetworkStarted() {
        NetworkStarter n = networkStarter;
        return n != null && n.isNetworkStarted();
    }

    public void addAdminListener(AdminListener listener) {
        adminListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeAdminListener(AdminListener listener) {
        adminListeners.remove(listener);
    }

    public BridgeConfig getConfig() {
        return config;
    }

    public BridgeScheduler getScheduler() {
        return scheduler;
    }

    public PluginRegistry getPluginRegistry() {
        return plugins;
    }

    public DeviceRegistry getDeviceRegistry() {
        return devices;
    }

    public PluginConfigStore getConfigStore() {
        return configStore;
    }

    public PluginLifecycleOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public CommissioningContextManager getIdentities() {
        return identities;
    }

    public CommissioningMonitor getMonitor() {
        return monitor;
    }

    public ShutdownCoordinator getCoordinator() {
        return coordinator;
    }

    public BridgeTopologyManager getTopology() {
        return topology;
    }

    public ProtocolEngine getEngine() {
        return engine;
    }

    public StorageManager getNodeStorage() {
        return nodeStorage;
    }

    public StorageManager getIdentityStore() {
        return identityStore;
    }

    public StartupSupervisor getSupervisor() {
        return supervisor;
    }

    public UpdateChecker getUpdateChecker() {
        return updateChecker;
    }

    /** True once shutdown completed; the instance must not be used afterwards. */
    public boolean isReleased() {
        return released;
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage();
    }

    static StorageManager defaultNodeStorage(BridgeConfig config) {
        if (config.getStorageBackend() == StorageBackendType.REDIS) {
            return new RedisStorageManager(config.getCacheHost(), config.getCachePort(), "hubbridge:storage");
        }
        return new DirectoryStorageManager(config.getNodeStorageDirectory());
    }

    static StorageManager defaultIdentityStore(BridgeConfig config) {
        if (config.getStorageBackend() == StorageBackendType.REDIS) {
            return new RedisStorageManager(config.getCacheHost(), config.getCachePort(), "hubbridge:identity");
        }
        return new JsonFileStorageManager(config.getIdentityStoreFile());
    }

    /**
     * Builder for {@link HubBridge}. Only the configuration is required; tests replace the scheduler, the stores
     * and the protocol engine.
     */
    public static final class Builder {
        private final BridgeConfig config;
        private BridgeScheduler scheduler;
        private BridgeEventBus eventBus;
        private Function<BridgeConfig, StorageManager> nodeStorageFactory;
        private Function<BridgeConfig, StorageManager> identityStoreFactory;
        private Supplier<ProtocolEngine> engineFactory;
        private ProcessSignals signals;
        private PackageInstaller packageInstaller;
        private VersionSource versionSource;
        private Runnable onRelease;

        private Builder(BridgeConfig config) {
            this.config = config;
        }

        public Builder scheduler(BridgeScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder eventBus(BridgeEventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder nodeStorage(Function<BridgeConfig, StorageManager> factory) {
            this.nodeStorageFactory = factory;
            return this;
        }

        public Builder identityStore(Function<BridgeConfig, StorageManager> factory) {
            this.identityStoreFactory = factory;
            return this;
        }

        public Builder engine(Supplier<ProtocolEngine> factory) {
            this.engineFactory = factory;
            return this;
        }

        public Builder signals(ProcessSignals signals) {
            this.signals = signals;
            return this;
        }

        public Builder packageInstaller(PackageInstaller packageInstaller) {
            this.packageInstaller = packageInstaller;
            return this;
        }

        /** Enables the periodic update check. */
        public Builder versionSource(VersionSource versionSource) {
            this.versionSource = versionSource;
            return this;
        }

        /** Runs when the instance is released after shutdown. */
        public Builder onRelease(Runnable onRelease) {
            this.onRelease = onRelease;
            return this;
        }

        public HubBridge build() {
            return new HubBridge(this);
        }
    }
}

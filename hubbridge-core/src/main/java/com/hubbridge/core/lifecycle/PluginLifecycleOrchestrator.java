package com.hubbridge.core.lifecycle;

import com.hubbridge.core.plugin.PluginConfigStore;
import com.hubbridge.core.plugin.PluginRegistry;
import com.hubbridge.core.plugin.RegisteredPlugin;
import com.hubbridge.core.schedule.BridgeScheduler;
import com.hubbridge.plugin.BridgeHandle;
import com.hubbridge.plugin.BridgePlatform;
import com.hubbridge.plugin.PlatformConfig;
import com.hubbridge.plugin.PlatformFactory;
import com.hubbridge.plugin.PlatformType;
import com.hubbridge.plugin.PluginLoadException;
import com.hubbridge.plugin.PluginLoader;
import com.hubbridge.plugin.PluginManifest;
import com.hubbridge.plugin.event.BridgeEvent;
import com.hubbridge.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Drives plugins through {@code registered → loaded → started → configured}.
 * <p>
 * {@link #start} and {@link #configure} return immediately with a future that completes once the hook finished
 * and the flags were updated on the bridge scheduler. The futures never complete exceptionally: a hook that
 * throws or fails marks the plugin {@code error} and is logged. A hook completion for a plugin that was removed
 * or reloaded in the meantime is ignored.
 */
public final class PluginLifecycleOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PluginLifecycleOrchestrator.class);

    public static final String MDC_PLUGIN = "plugin";

    private final BridgeHandle bridge;
    private final PluginRegistry registry;
    private final PluginLoader loader;
    private final PluginConfigStore configStore;
    private final BridgeScheduler scheduler;

    private final Set<String> starting = ConcurrentHashMap.newKeySet();
    private final Set<String> configuring = ConcurrentHashMap.newKeySet();

    public PluginLifecycleOrchestrator(BridgeHandle bridge, PluginRegistry registry, PluginLoader loader,
                                       PluginConfigStore configStore, BridgeScheduler scheduler) {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.configStore = Objects.requireNonNull(configStore, "configStore");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Registers a plugin from a manifest path, plugin directory or plugin name.
     *
     * @throws PluginLoadException      when no manifest is found or it cannot be read
     * @throws IllegalArgumentException when a plugin with the same name or path is already registered
     */
    public RegisteredPlugin register(String pathOrName) {
        Path manifestFile = loader.resolveManifest(pathOrName)
                .orElseThrow(() -> new PluginLoadException(pathOrName, "No plugin found at " + pathOrName));
        PluginManifest manifest = loader.readManifest(manifestFile);
        if (registry.getByPath(manifestFile.toString()).isPresent() || registry.get(manifest.name()).isPresent()) {
            throw new IllegalArgumentException("Plugin " + manifest.name() + " is already registered");
        }
        RegisteredPlugin plugin = new RegisteredPlugin(manifest.name(), manifestFile.toString());
        applyManifest(plugin, manifest);
        registry.add(plugin);
        registry.persist();
        log.info("Added plugin {} from {}", plugin.getName(), manifestFile);
        return plugin;
    }

    /**
     * Prepares a persisted plugin at process start: reads its config and schema, checks that its manifest still
     * resolves and clears the run flags.
     *
     * @return false when the manifest is gone; the plugin is then disabled and in error
     */
    public boolean prepare(RegisteredPlugin plugin) {
        plugin.resetForStartup();
        Optional<Path> manifestFile = loader.resolveManifest(plugin.getPath());
        if (manifestFile.isEmpty()) {
            log.error("Plugin {} not found at {}, disabling it", plugin.getName(), plugin.getPath());
            plugin.setEnabled(false);
            plugin.markError();
            return false;
        }
        try {
            applyManifest(plugin, loader.readManifest(manifestFile.get()));
            configStore.load(plugin);
        } catch (PluginLoadException | StorageException e) {
            log.warn("Cannot read manifest or config of plugin {}: {}", plugin.getName(), e.getMessage());
        }
        configStore.loadSchema(plugin);
        return true;
    }

    /**
     * Loads the plugin's platform. Never throws: a failure marks the plugin {@code error}.
     */
    public LoadResult load(RegisteredPlugin plugin) {
        if (!plugin.isEnabled()) {
            log.debug("Plugin {} not enabled", plugin.getName());
            return LoadResult.notEnabled();
        }
        if (plugin.getPlatform() != null) {
            log.debug("Plugin {} already loaded", plugin.getName());
            return LoadResult.alreadyLoaded(plugin.getPlatform());
        }
        log.info("Loading plugin {} type {}", plugin.getName(), plugin.getType() != null ? plugin.getType() : "unknown");
        MDC.put(MDC_PLUGIN, plugin.getName());
        try {
            Path manifestFile = loader.resolveManifest(plugin.getPath())
                    .orElseThrow(() -> new PluginLoadException(plugin.getName(), "Plugin not found at " + plugin.getPath()));
            PluginManifest manifest = loader.readManifest(manifestFile);
            applyManifest(plugin, manifest);
            PlatformFactory factory = loader.loadFactory(manifestFile, manifest);
            PlatformConfig config = configStore.load(plugin);
            Logger pluginLog = PluginLoggers.forPlugin(plugin.getName(), config.isDebug());
            BridgePlatform platform = factory.create(bridge, pluginLog, config);
            if (platform == null) {
                throw new PluginLoadException(plugin.getName(), "Factory of plugin " + plugin.getName() + " returned no platform");
            }
            plugin.markLoaded(platform, config);
            if (config.getType() == null && platform.getType() != null) {
                config.set(PlatformConfig.TYPE, platform.getType().getValue());
            }
            registry.persist();
            log.info("Loaded plugin {} type {} version {}", plugin.getName(), platform.getType(), plugin.getVersion());
            return LoadResult.loaded(platform);
        } catch (RuntimeException | LinkageError e) {
            plugin.markError();
            registry.persist();
            log.error("Failed to load plugin {}: {}", plugin.getName(), e.getMessage(), e);
            return LoadResult.failed();
        } finally {
            MDC.remove(MDC_PLUGIN);
        }
    }

    /**
     * Invokes the start hook. No-op when the plugin is not loaded, already started or a start is in flight.
     */
    public CompletableFuture<Void> start(RegisteredPlugin plugin, String reason) {
        BridgePlatform platform = plugin.getPlatform();
        if (!plugin.isLoaded() || platform == null) {
            log.debug("Plugin {} not loaded, not starting", plugin.getName());
            return CompletableFuture.completedFuture(null);
        }
        if (plugin.isStarted() || !starting.add(plugin.getName())) {
            log.debug("Plugin {} already started", plugin.getName());
            return CompletableFuture.completedFuture(null);
        }
        log.info("Starting plugin {} ({})", plugin.getName(), reason);
        return invoke(plugin, platform, "start", () -> platform.onStart(reason), () -> {
            plugin.markStarted();
            registry.persist();
            log.info("Started plugin {}", plugin.getName());
            if (platform.getType() == PlatformType.DYNAMIC) {
                bridge.getEventBus().publish(new BridgeEvent.StartDynamicPlatform(plugin.getName()));
            }
        }).whenComplete((v, e) -> starting.remove(plugin.getName()));
    }

    /**
     * Invokes the configure hook and writes the platform's live config back on success. No-op unless the plugin
     * is loaded and started and not yet configured.
     */
    public CompletableFuture<Void> configure(RegisteredPlugin plugin) {
        BridgePlatform platform = plugin.getPlatform();
        if (!plugin.isLoaded() || !plugin.isStarted() || platform == null) {
            log.debug("Plugin {} not loaded or not started, not configuring", plugin.getName());
            return CompletableFuture.completedFuture(null);
        }
        if (plugin.isConfigured() || !configuring.add(plugin.getName())) {
            log.debug("Plugin {} already configured", plugin.getName());
            return CompletableFuture.completedFuture(null);
        }
        log.info("Configuring plugin {}", plugin.getName());
        return invoke(plugin, platform, "configure", platform::onConfigure, () -> {
            plugin.markConfigured();
            try {
                configStore.save(plugin, platform.getConfig());
            } catch (StorageException e) {
                log.warn("Cannot save config of plugin {}: {}", plugin.getName(), e.getMessage());
            }
            registry.persist();
            log.info("Configured plugin {}", plugin.getName());
        }).whenComplete((v, e) -> configuring.remove(plugin.getName()));
    }

    /**
     * Invokes the shutdown hook, then removes the plugin's devices when asked to. Failures are logged; the
     * future always completes normally.
     */
    public CompletableFuture<Void> shutdown(RegisteredPlugin plugin, String reason, boolean removeDevices) {
        BridgePlatform platform = plugin.getPlatform();
        if (platform == null) {
            log.debug("Plugin {} not loaded, no shutdown hook to call", plugin.getName());
            if (removeDevices) {
                bridge.removeAllBridgedDevices(plugin.getName());
            }
            return CompletableFuture.completedFuture(null);
        }
        log.info("Shutting down plugin {}: {}", plugin.getName(), reason);
        return invoke(plugin, platform, "shutdown", () -> platform.onShutdown(reason),
                () -> log.info("Shut down plugin {}", plugin.getName()))
                .thenRun(() -> {
                    if (removeDevices) {
                        bridge.removeAllBridgedDevices(plugin.getName());
                    }
                });
    }

    private CompletableFuture<Void> invoke(RegisteredPlugin plugin, BridgePlatform platform, String hook,
                                           Supplier<CompletionStage<Void>> call, Runnable onSuccess) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        CompletionStage<Void> stage;
        MDC.put(MDC_PLUGIN, plugin.getName());
        try {
            stage = call.get();
            if (stage == null) {
                stage = CompletableFuture.completedFuture(null);
            }
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        } finally {
            MDC.remove(MDC_PLUGIN);
        }
        stage.whenCompleteAsync((v, error) -> {
            try {
                if (!isCurrent(plugin, platform)) {
                    log.debug("Ignoring {} completion of plugin {}: no longer registered", hook, plugin.getName());
                } else if (error != null) {
                    plugin.markError();
                    registry.persist();
                    Throwable cause = error instanceof java.util.concurrent.CompletionException && error.getCause() != null
                            ? error.getCause() : error;
                    log.error("Failed to {} plugin {}: {}", hook, plugin.getName(), cause.getMessage(), cause);
                } else {
                    onSuccess.run();
                }
            } catch (RuntimeException e) {
                log.error("Error handling {} completion of plugin {}: {}", hook, plugin.getName(), e.getMessage(), e);
            } finally {
                done.complete(null);
            }
        }, scheduler);
        return done;
    }

    private boolean isCurrent(RegisteredPlugin plugin, BridgePlatform platform) {
        return registry.get(plugin.getName()).orElse(null) == plugin && plugin.getPlatform() == platform;
    }

    private static void applyManifest(RegisteredPlugin plugin, PluginManifest manifest) {
        if (manifest.version() != null) plugin.setVersion(manifest.version());
        if (manifest.description() != null) plugin.setDescription(manifest.description());
        if (manifest.author() != null) plugin.setAuthor(manifest.author());
        if (manifest.artifact() != null) plugin.setArtifact(manifest.artifact());
    }
}

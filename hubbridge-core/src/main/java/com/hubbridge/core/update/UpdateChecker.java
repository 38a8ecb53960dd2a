package com.hubbridge.core.update;

import com.hubbridge.core.plugin.PluginRegistry;
import com.hubbridge.core.plugin.RegisteredPlugin;
import com.hubbridge.core.schedule.BridgeScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Periodically looks up the latest bridge and plugin versions and records them as {@code latestVersion}.
 * Lookups run off the bridge thread; results are applied on it. A failed lookup is logged at debug level.
 */
public final class UpdateChecker {

    private static final Logger log = LoggerFactory.getLogger(UpdateChecker.class);

    public static final String BRIDGE_ARTIFACT = "com.hubbridge:hubbridge-app";

    private final VersionSource source;
    private final PluginRegistry plugins;
    private final BridgeScheduler scheduler;
    private final String bridgeVersion;
    private volatile String latestBridgeVersion;

    public UpdateChecker(VersionSource source, PluginRegistry plugins, BridgeScheduler scheduler, String bridgeVersion) {
        this.source = Objects.requireNonNull(source, "source");
        this.plugins = Objects.requireNonNull(plugins, "plugins");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.bridgeVersion = bridgeVersion;
    }

    /** Checks now, then every {@code interval}. */
    public BridgeScheduler.Cancellable schedule(Duration interval) {
        return scheduler.scheduleAtFixedRate(Duration.ZERO, interval, this::check);
    }

    /** Starts one round of lookups; the returned future completes when every result was applied. */
    public CompletableFuture<Void> check() {
        List<CompletableFuture<Void>> lookups = new ArrayList<>();
        lookups.add(lookup(BRIDGE_ARTIFACT, latest -> {
            latestBridgeVersion = latest;
            if (!latest.equals(bridgeVersion)) {
                log.info("HubBridge {} is available (running {})", latest, bridgeVersion);
            } else {
                log.debug("HubBridge {} is the latest version", bridgeVersion);
            }
        }));
        for (RegisteredPlugin plugin : plugins.all()) {
            if (plugin.getArtifact() == null) continue;
            lookups.add(lookup(plugin.getArtifact(), latest -> {
                plugin.setLatestVersion(latest);
                if (!latest.equals(plugin.getVersion())) {
                    log.info("Plugin {} {} is available (installed {})", plugin.getName(), latest, plugin.getVersion());
                }
            }));
        }
        return CompletableFuture.allOf(lookups.toArray(CompletableFuture[]::new))
                .thenRunAsync(plugins::persist, scheduler);
    }

    private CompletableFuture<Void> lookup(String artifact, Consumer<String> apply) {
        CompletableFuture<Optional<String>> request;
        try {
            request = source.latestVersion(artifact);
        } catch (RuntimeException e) {
            request = CompletableFuture.failedFuture(e);
        }
        return request.handleAsync((latest, error) -> {
            if (error != null) {
                log.debug("Cannot get the latest version of {}: {}", artifact, error.getMessage());
            } else if (latest.isPresent()) {
                apply.accept(latest.get());
            }
            return null;
        }, scheduler);
    }

    public String getLatestBridgeVersion() {
        return latestBridgeVersion;
    }
}

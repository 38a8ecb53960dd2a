package com.hubbridge.core.lifecycle;

import com.hubbridge.core.plugin.PluginRegistry;
import com.hubbridge.core.plugin.RegisteredPlugin;
import com.hubbridge.core.schedule.BridgeScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bounded polling loop deciding when the network may start.
 * <p>
 * Every {@code pollInterval} it checks the enabled plugins: any plugin in error aborts startup; when every one is
 * loaded and started the loop stops and {@code onReady} runs. After {@code maxAttempts} unsuccessful checks the
 * plugins still pending are put in error, the registry is persisted and startup aborts. After an abort
 * {@code onReady} is never called. Used only on the bridge thread.
 */
public final class StartupSupervisor {

    private static final Logger log = LoggerFactory.getLogger(StartupSupervisor.class);

    public enum Outcome {
        RUNNING,
        READY,
        PLUGIN_ERROR,
        RETRY_EXHAUSTED,
        CANCELLED
    }

    private final PluginRegistry registry;
    private final BridgeScheduler scheduler;
    private final Duration pollInterval;
    private final int maxAttempts;

    private BridgeScheduler.Cancellable timer;
    private int attempts;
    private Outcome outcome = Outcome.RUNNING;

    public StartupSupervisor(PluginRegistry registry, BridgeScheduler scheduler, Duration pollInterval, int maxAttempts) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
    }

    /** Starts polling. {@code onReady} runs on the scheduler once every enabled plugin is loaded and started. */
    public void start(Runnable onReady) {
        Objects.requireNonNull(onReady, "onReady");
        if (timer != null) {
            throw new IllegalStateException("Startup supervisor already started");
        }
        attempts = 0;
        timer = scheduler.scheduleAtFixedRate(pollInterval, pollInterval, () -> poll(onReady));
    }

    private void poll(Runnable onReady) {
        if (outcome != Outcome.RUNNING) return;
        List<RegisteredPlugin> pending = new ArrayList<>();
        for (RegisteredPlugin plugin : registry.enabled()) {
            if (plugin.isError()) {
                log.error("The plugin {} is in error state. The network will not start while it is enabled.", plugin.getName());
                finish(Outcome.PLUGIN_ERROR);
                return;
            }
            if (!plugin.isLoaded() || !plugin.isStarted()) {
                pending.add(plugin);
            }
        }
        if (pending.isEmpty()) {
            log.debug("All enabled plugins loaded and started after {} check(s)", attempts + 1);
            finish(Outcome.READY);
            onReady.run();
            return;
        }
        attempts++;
        if (attempts > maxAttempts) {
            for (RegisteredPlugin plugin : pending) {
                log.error("The plugin {} did not load and start in time, setting it in error state", plugin.getName());
                plugin.markError();
            }
            registry.persist();
            finish(Outcome.RETRY_EXHAUSTED);
            return;
        }
        for (RegisteredPlugin plugin : pending) {
            log.debug("Waiting (attempt {}/{}) for plugin {} to load ({}) and start ({})",
                    attempts, maxAttempts, plugin.getName(), plugin.isLoaded(), plugin.isStarted());
        }
    }

    private void finish(Outcome result) {
        outcome = result;
        if (timer != null) {
            timer.cancel();
        }
    }

    /** Stops polling; {@code onReady} will not run. */
    public void cancel() {
        if (outcome == Outcome.RUNNING) {
            finish(Outcome.CANCELLED);
        }
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public int getAttempts() {
        return attempts;
    }
}

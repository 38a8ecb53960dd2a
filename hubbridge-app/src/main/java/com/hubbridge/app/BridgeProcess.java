package com.hubbridge.app;

import com.hubbridge.config.BridgeConfig;
import com.hubbridge.config.RestartMode;
import com.hubbridge.core.HubBridge;
import com.hubbridge.core.schedule.SingleThreadBridgeScheduler;
import com.hubbridge.core.update.MavenCentralVersionSource;
import com.hubbridge.plugin.event.BridgeEvent;
import com.hubbridge.plugin.event.BridgeEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Process lifecycle around {@link HubBridge}: builds an instance, runs it until its completion event and acts on
 * that event. {@code Shutdown} ends the process with 0; {@code Restart} builds a fresh instance in the same JVM;
 * {@code Update} ends the process in {@code service} and {@code docker} restart mode (the supervisor restarts the
 * updated package) and restarts in place otherwise.
 */
public final class BridgeProcess {

    private static final Logger log = LoggerFactory.getLogger(BridgeProcess.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;

    private final BridgeConfig config;
    private final ShutdownHookSignals signals;
    private final Function<BridgeConfig, HubBridge.Builder> builders;
    private final PrintWriter out;
    private Consumer<HubBridge> onStarted = bridge -> { };
    private int instances;

    public BridgeProcess(BridgeConfig config, ShutdownHookSignals signals, PrintWriter out) {
        this(config, signals, c -> HubBridge.builder(c).versionSource(new MavenCentralVersionSource()), out);
    }

    BridgeProcess(BridgeConfig config, ShutdownHookSignals signals, Function<BridgeConfig, HubBridge.Builder> builders,
                  PrintWriter out) {
        this.config = config;
        this.signals = signals;
        this.builders = builders;
        this.out = out;
    }

    /** Called with every instance after {@link HubBridge#start()}. */
    BridgeProcess onStarted(Consumer<HubBridge> onStarted) {
        this.onStarted = onStarted;
        return this;
    }

    int getInstances() {
        return instances;
    }

    /**
     * Runs the bridge, or the maintenance task when one is given.
     *
     * @param task one-shot operation, or null to run the bridge until it shuts down
     * @return the process exit code
     */
    public int run(MaintenanceTask task) {
        while (true) {
            SingleThreadBridgeScheduler scheduler = new SingleThreadBridgeScheduler();
            BridgeEventBus eventBus = new BridgeEventBus();
            CompletableFuture<BridgeEvent> completion = new CompletableFuture<>();
            eventBus.subscribe(BridgeEvent.Shutdown.class, completion::complete);
            eventBus.subscribe(BridgeEvent.Restart.class, completion::complete);
            eventBus.subscribe(BridgeEvent.Update.class, completion::complete);

            HubBridge bridge = builders.apply(config)
                    .scheduler(scheduler)
                    .eventBus(eventBus)
                    .signals(signals)
                    .onRelease(signals::released)
                    .build();
            instances++;
            BridgeEvent event;
            try {
                if (!bridge.initialize()) {
                    await(completion);
                    return EXIT_FATAL;
                }
                if (task != null) {
                    log.info("Running {}", task.kind());
                    await(new MaintenanceRunner(bridge, out).run(task));
                    return EXIT_OK;
                }
                bridge.start();
                onStarted.accept(bridge);
                event = await(completion);
            } finally {
                scheduler.shutdown();
            }
            if (event == null || event instanceof BridgeEvent.Shutdown) {
                return EXIT_OK;
            }
            if (event instanceof BridgeEvent.Update && config.getRestartMode() != RestartMode.NONE) {
                log.info("Updated in {} mode, exiting so the supervisor restarts HubBridge", config.getRestartMode().getValue());
                return EXIT_OK;
            }
            log.info("Restarting HubBridge ({})", event);
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for HubBridge");
            return null;
        } catch (ExecutionException e) {
            log.error("HubBridge failed: {}", e.getCause().getMessage(), e.getCause());
            return null;
        }
    }
}

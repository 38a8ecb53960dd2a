package com.hubbridge.core.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link BridgeScheduler} backed by a single-threaded {@link ScheduledExecutorService} named {@code hubbridge-main}.
 * A task that throws is logged; periodic tasks keep running.
 */
public final class SingleThreadBridgeScheduler implements BridgeScheduler {

    private static final Logger log = LoggerFactory.getLogger(SingleThreadBridgeScheduler.class);

    private final ScheduledExecutorService executor;

    public SingleThreadBridgeScheduler() {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "hubbridge-main");
            t.setDaemon(false);
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(guarded(task));
    }

    @Override
    public Cancellable schedule(Duration delay, Runnable task) {
        return new FutureCancellable(executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public Cancellable scheduleAtFixedRate(Duration initialDelay, Duration period, Runnable task) {
        return new FutureCancellable(executor.scheduleAtFixedRate(guarded(task),
                initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public void shutdown() {
        executor.shutdown();
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Bridge task failed: {}", e.getMessage(), e);
            }
        };
    }

    private record FutureCancellable(ScheduledFuture<?> future) implements Cancellable {
        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}

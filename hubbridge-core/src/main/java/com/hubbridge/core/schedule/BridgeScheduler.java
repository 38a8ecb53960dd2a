package com.hubbridge.core.schedule;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * The bridge's single logical thread. Every registry and flag mutation runs on it; delayed and periodic
 * work (startup supervisor, shutdown delays, configure and reachability timers) is scheduled through it
 * so tests can substitute virtual time.
 */
public interface BridgeScheduler extends Executor {

    @Override
    void execute(Runnable task);

    Cancellable schedule(Duration delay, Runnable task);

    Cancellable scheduleAtFixedRate(Duration initialDelay, Duration period, Runnable task);

    /** Stops accepting work. Already running tasks complete. */
    void shutdown();

    /** Handle of a scheduled task. */
    interface Cancellable {
        void cancel();

        boolean isCancelled();
    }
}

package com.hubbridge.app;

import com.hubbridge.core.shutdown.ProcessSignals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Routes JVM termination (SIGINT, SIGTERM) to the running bridge through a shutdown hook. The hook starts the
 * bridge's cleanup and keeps the JVM alive until the instance is released or the grace period runs out.
 * One instance serves every bridge the process builds; each {@link #attach} registers a fresh hook.
 */
public final class ShutdownHookSignals implements ProcessSignals {

    private static final Logger log = LoggerFactory.getLogger(ShutdownHookSignals.class);

    private final Duration grace;
    private final Object lock = new Object();
    private Thread hook;
    private CountDownLatch released = new CountDownLatch(0);
    private volatile boolean fired;

    public ShutdownHookSignals(Duration grace) {
        this.grace = grace;
    }

    @Override
    public void attach(Consumer<String> handler) {
        synchronized (lock) {
            if (hook != null) {
                log.warn("Shutdown hook already attached, replacing it");
                detach();
            }
            CountDownLatch latch = new CountDownLatch(1);
            released = latch;
            hook = new Thread(() -> {
                fired = true;
                log.info("Termination signal received");
                handler.accept("SIGTERM");
                awaitRelease(latch);
            }, "hubbridge-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
        }
    }

    @Override
    public void detach() {
        synchronized (lock) {
            if (hook == null) return;
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // the JVM is already exiting: the hook is the caller
                log.debug("Shutdown hook not removed: {}", e.getMessage());
            }
            hook = null;
        }
    }

    /** Called once the bridge instance is released; lets a running hook return. */
    public void released() {
        synchronized (lock) {
            released.countDown();
        }
    }

    /** True when the JVM is exiting because of a signal; {@code System.exit} must not be called then. */
    public boolean isFired() {
        return fired;
    }

    private void awaitRelease(CountDownLatch latch) {
        try {
            if (!latch.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Cleanup did not finish within {} ms, exiting anyway", grace.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for cleanup");
        }
    }
}

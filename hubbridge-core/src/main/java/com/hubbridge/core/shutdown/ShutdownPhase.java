package com.hubbridge.core.shutdown;

/** States of {@link ShutdownCoordinator}, in order. */
public enum ShutdownPhase {
    IDLE,
    /** Signals detached, timers cancelled, plugin shutdown hooks running, admin listeners closing. */
    DRAINING,
    /** Waiting for in-flight protocol messages before the engine and stores close. */
    FLUSHING_PROTOCOL,
    /** Waiting for store writes before destructive actions and the completion event. */
    FLUSHING_STORE,
    FINALIZING
}

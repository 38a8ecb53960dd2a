package com.hubbridge.core.shutdown;

import java.util.function.Consumer;

/**
 * Process-level termination signals (SIGINT/SIGTERM and the like). Implemented by the process entry point.
 */
public interface ProcessSignals {

    /** Routes a termination signal to {@code handler}, with the signal name. */
    void attach(Consumer<String> handler);

    /** Stops routing signals so a second one cannot start cleanup again. */
    void detach();

    ProcessSignals NONE = new ProcessSignals() {
        @Override
        public void attach(Consumer<String> handler) {
        }

        @Override
        public void detach() {
        }
    };
}

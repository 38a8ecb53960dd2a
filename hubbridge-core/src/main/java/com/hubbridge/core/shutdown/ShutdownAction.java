package com.hubbridge.core.shutdown;

import com.hubbridge.plugin.event.BridgeEvent;

/**
 * What happens after cleanup: which stores are destroyed and which event ends the run.
 */
public enum ShutdownAction {
    SHUTDOWN("shutting down..."),
    RESTART("restarting..."),
    UPDATE("updating..."),
    /** Deletes the identity store: every commissioning identity is paired again from scratch. */
    RESET("shutting down with reset..."),
    /** Deletes the identity store and the node storage. */
    FACTORY_RESET("shutting down with factory reset...");

    private final String defaultMessage;

    ShutdownAction(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public boolean destroysIdentityStore() {
        return this == RESET || this == FACTORY_RESET;
    }

    public boolean destroysNodeStorage() {
        return this == FACTORY_RESET;
    }

    BridgeEvent completionEvent(String reason) {
        return switch (this) {
            case UPDATE -> new BridgeEvent.Update(reason);
            case RESTART -> new BridgeEvent.Restart(reason);
            default -> new BridgeEvent.Shutdown(reason);
        };
    }
}

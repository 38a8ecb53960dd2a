package com.hubbridge.app;

import java.util.Objects;

/**
 * One-shot command-line operation run against an initialized but not started bridge, followed by a shutdown.
 *
 * @param kind     what to do
 * @param argument plugin path or name; null for the kinds that take none
 */
public record MaintenanceTask(Kind kind, String argument) {

    public enum Kind {
        LIST,
        LOG_STORAGE,
        LOG_INTERFACES,
        ADD,
        REMOVE,
        ENABLE,
        DISABLE,
        RESET,
        RESET_PLUGIN,
        FACTORY_RESET;

        boolean requiresArgument() {
            return this == ADD || this == REMOVE || this == ENABLE || this == DISABLE || this == RESET_PLUGIN;
        }
    }

    public MaintenanceTask {
        Objects.requireNonNull(kind, "kind");
        if (kind.requiresArgument() && (argument == null || argument.isBlank())) {
            throw new IllegalArgumentException(kind + " needs a plugin path or name");
        }
    }

    public static MaintenanceTask of(Kind kind) {
        return new MaintenanceTask(kind, null);
    }
}

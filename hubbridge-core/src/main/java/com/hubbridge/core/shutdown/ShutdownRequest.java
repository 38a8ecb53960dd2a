package com.hubbridge.core.shutdown;

import java.util.Objects;

/** A reason message and the action to perform once cleanup finished. */
public record ShutdownRequest(String reason, ShutdownAction action) {

    public ShutdownRequest {
        Objects.requireNonNull(action, "action");
        if (reason == null || reason.isBlank()) {
            reason = action.getDefaultMessage();
        }
    }

    public static ShutdownRequest of(ShutdownAction action) {
        return new ShutdownRequest(null, action);
    }
}

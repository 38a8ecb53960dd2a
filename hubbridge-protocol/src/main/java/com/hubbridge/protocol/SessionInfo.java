package com.hubbridge.protocol;

/**
 * A session a controller holds with a commissioning server.
 * The server counts as connected to a controller when a session is active, secure and has at least one subscription.
 */
public record SessionInfo(
        String name,
        long nodeId,
        Integer fabricIndex,
        boolean secure,
        boolean active,
        int numberOfActiveSubscriptions) {

    public boolean isControllerConnected() {
        return active && secure && numberOfActiveSubscriptions >= 1;
    }
}

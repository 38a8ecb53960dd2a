package com.hubbridge.core.plugin;

import com.hubbridge.protocol.SessionInfo;

/** Session information safe to persist and show. */
public record SessionSummary(
        String name,
        String nodeId,
        Integer fabricIndex,
        boolean secure,
        boolean active,
        int numberOfActiveSubscriptions) {

    public static SessionSummary of(SessionInfo session) {
        return new SessionSummary(session.name(), Long.toUnsignedString(session.nodeId()), session.fabricIndex(),
                session.secure(), session.active(), session.numberOfActiveSubscriptions());
    }
}

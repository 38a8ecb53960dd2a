package com.hubbridge.protocol;

import java.util.List;

/**
 * Callbacks from a commissioning server about controller activity.
 */
public interface CommissioningListener {

    /** The set of sessions of one fabric changed. */
    void onActiveSessionsChanged(CommissioningServer server, int fabricIndex, List<SessionInfo> sessions);

    /** A fabric was added to or removed from the server. */
    void onCommissioningChanged(CommissioningServer server, int fabricIndex);
}

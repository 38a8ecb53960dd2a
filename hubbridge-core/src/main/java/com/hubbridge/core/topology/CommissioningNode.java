package com.hubbridge.core.topology;

import com.hubbridge.core.commissioning.CommissioningIdentity;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.protocol.Aggregator;
import com.hubbridge.protocol.CommissioningServer;

import java.util.Objects;

/**
 * A commissioning identity with its server and what is attached to it: an aggregator (shared root, dynamic
 * platforms) or a single device (accessory platforms in childbridge mode).
 */
public final class CommissioningNode {

    private final String key;
    private final CommissioningIdentity identity;
    private final CommissioningServer server;
    private final Aggregator aggregator;
    private BridgedDevice device;

    CommissioningNode(String key, CommissioningIdentity identity, CommissioningServer server,
                      Aggregator aggregator, BridgedDevice device) {
        this.key = Objects.requireNonNull(key, "key");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.server = Objects.requireNonNull(server, "server");
        this.aggregator = aggregator;
        this.device = device;
    }

    /** Identity key: plugin name or {@code root}. */
    public String getKey() {
        return key;
    }

    public CommissioningIdentity getIdentity() {
        return identity;
    }

    public CommissioningServer getServer() {
        return server;
    }

    /** Null for an accessory node. */
    public Aggregator getAggregator() {
        return aggregator;
    }

    /** The single device of an accessory node, null when detached or for aggregator nodes. */
    public BridgedDevice getDevice() {
        return device;
    }

    void setDevice(BridgedDevice device) {
        this.device = device;
    }
}

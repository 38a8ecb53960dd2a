package com.hubbridge.protocol;

import com.hubbridge.device.BasicInformation;

import java.util.List;

/**
 * Boundary to the engine implementing commissioning, sessions and cluster encoding.
 * Servers created before {@link #start()} start with the engine; servers created afterwards start immediately.
 */
public interface ProtocolEngine {

    CommissioningServer createCommissioningServer(CommissioningServerOptions options);

    Aggregator createAggregator(String name, BasicInformation basicInformation);

    List<CommissioningServer> getCommissioningServers();

    /** Starts the engine in controller role under the given context name instead of exposing servers. */
    void startController(String contextName);

    void start();

    boolean isStarted();

    /** Closes every commissioning server and the controller. */
    void close();
}

package com.hubbridge.protocol;

import com.hubbridge.device.Endpoint;

import java.util.List;

/**
 * One commissionable network identity. Endpoints (an aggregator or a single device) attach to it.
 */
public interface CommissioningServer {

    String getName();

    int getPort();

    void addEndpoint(Endpoint endpoint);

    void removeEndpoint(Endpoint endpoint);

    List<Endpoint> getEndpoints();

    boolean isCommissioned();

    PairingCodes getPairingCodes();

    List<FabricInfo> getCommissionedFabrics();

    List<SessionInfo> getActiveSessions();

    /** Marks the server and every attached endpoint reachable or unreachable. */
    void setReachability(boolean reachable);

    /** Drops every fabric and session so the identity can be commissioned again. */
    void factoryReset();

    void setCommissioningListener(CommissioningListener listener);

    boolean isStarted();

    void close();
}

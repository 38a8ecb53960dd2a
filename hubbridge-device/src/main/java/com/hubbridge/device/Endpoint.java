package com.hubbridge.device;

/**
 * Anything a commissioning server exposes as an endpoint: a bridged device or an aggregator.
 */
public interface Endpoint {

    /** Endpoint number assigned when attached, or null while detached. */
    Integer getEndpointNumber();

    void setEndpointNumber(Integer number);

    String getEndpointName();

    boolean isReachable();

    void setReachable(boolean reachable);
}

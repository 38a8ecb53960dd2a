package com.hubbridge.device;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A device a plugin exposes through the bridge. Owned by the plugin that created it; the bridge
 * only keeps references. Cluster servers are kept as attribute maps so the administration queries
 * can list them.
 */
public class BridgedDevice implements Endpoint {

    public static final String BASIC_INFORMATION_CLUSTER = "BridgedDeviceBasicInformation";
    private static final String REACHABLE_ATTRIBUTE = "reachable";

    private final String deviceName;
    private final int deviceType;
    private final BasicInformation basicInformation;
    private final Map<String, Map<String, Object>> clusterServers = new LinkedHashMap<>();
    private Integer endpointNumber;
    private boolean reachable = true;

    public BridgedDevice(String deviceName, int deviceType, BasicInformation basicInformation) {
        this.deviceName = Objects.requireNonNull(deviceName, "deviceName");
        this.deviceType = deviceType;
        this.basicInformation = Objects.requireNonNull(basicInformation, "basicInformation");
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("nodeLabel", basicInformation.nodeLabel());
        info.put("vendorId", basicInformation.vendorId());
        info.put("vendorName", basicInformation.vendorName());
        info.put("productName", basicInformation.productName());
        info.put("serialNumber", basicInformation.serialNumber());
        info.put("uniqueId", basicInformation.uniqueId());
        info.put(REACHABLE_ATTRIBUTE, true);
        clusterServers.put(BASIC_INFORMATION_CLUSTER, info);
    }

    public String getDeviceName() {
        return deviceName;
    }

    public int getDeviceType() {
        return deviceType;
    }

    public BasicInformation getBasicInformation() {
        return basicInformation;
    }

    public String getSerialNumber() {
        return basicInformation.serialNumber();
    }

    public String getUniqueId() {
        return basicInformation.uniqueId();
    }

    /** Adds (or replaces) a cluster server with its initial attribute values. */
    public synchronized BridgedDevice addClusterServer(String cluster, Map<String, Object> attributes) {
        Objects.requireNonNull(cluster, "cluster");
        clusterServers.put(cluster, new LinkedHashMap<>(attributes != null ? attributes : Map.of()));
        return this;
    }

    public synchronized void setAttribute(String cluster, String attribute, Object value) {
        Map<String, Object> attributes = clusterServers.get(cluster);
        if (attributes == null) {
            throw new IllegalArgumentException("Device " + deviceName + " has no cluster server " + cluster);
        }
        attributes.put(attribute, value);
    }

    public synchronized Object getAttribute(String cluster, String attribute) {
        Map<String, Object> attributes = clusterServers.get(cluster);
        return attributes != null ? attributes.get(attribute) : null;
    }

    public synchronized List<String> getClusterServerNames() {
        return Collections.unmodifiableList(new ArrayList<>(clusterServers.keySet()));
    }

    /** Copy of the attributes of one cluster server; empty when the device does not have it. */
    public synchronized Map<String, Object> getClusterAttributes(String cluster) {
        Map<String, Object> attributes = clusterServers.get(cluster);
        return attributes != null ? new LinkedHashMap<>(attributes) : Map.of();
    }

    @Override
    public synchronized Integer getEndpointNumber() {
        return endpointNumber;
    }

    @Override
    public synchronized void setEndpointNumber(Integer number) {
        this.endpointNumber = number;
    }

    @Override
    public String getEndpointName() {
        return deviceName;
    }

    @Override
    public synchronized boolean isReachable() {
        return reachable;
    }

    @Override
    public synchronized void setReachable(boolean reachable) {
        this.reachable = reachable;
        clusterServers.get(BASIC_INFORMATION_CLUSTER).put(REACHABLE_ATTRIBUTE, reachable);
    }

    public SerializedDevice serialize(String pluginName) {
        return new SerializedDevice(pluginName, deviceName, getSerialNumber(), getUniqueId(), deviceType,
                getEndpointNumber(), getEndpointName(), getClusterServerNames());
    }

    @Override
    public String toString() {
        return deviceName + " (" + DeviceTypes.name(deviceType) + ", serial " + getSerialNumber() + ")";
    }
}

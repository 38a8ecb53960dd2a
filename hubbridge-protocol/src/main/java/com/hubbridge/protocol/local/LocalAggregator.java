package com.hubbridge.protocol.local;

import com.hubbridge.device.BasicInformation;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.protocol.Aggregator;
import com.hubbridge.protocol.ProtocolException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process aggregator. Bridged devices get endpoint numbers after the aggregator's own one.
 */
final class LocalAggregator implements Aggregator {

    private final String name;
    private final BasicInformation basicInformation;
    private final List<BridgedDevice> devices = new CopyOnWriteArrayList<>();
    private Integer endpointNumber;
    private int nextDeviceEndpoint = 2;
    private volatile boolean reachable;

    LocalAggregator(String name, BasicInformation basicInformation) {
        this.name = Objects.requireNonNull(name, "name");
        this.basicInformation = Objects.requireNonNull(basicInformation, "basicInformation");
    }

    @Override
    public BasicInformation getBasicInformation() {
        return basicInformation;
    }

    @Override
    public synchronized void addBridgedDevice(BridgedDevice device) {
        Objects.requireNonNull(device, "device");
        if (devices.contains(device)) {
            throw new ProtocolException("Device " + device.getDeviceName() + " is already attached to " + name);
        }
        device.setEndpointNumber(nextDeviceEndpoint++);
        devices.add(device);
    }

    @Override
    public synchronized void removeBridgedDevice(BridgedDevice device) {
        if (devices.remove(device)) {
            device.setEndpointNumber(null);
        }
    }

    @Override
    public List<BridgedDevice> getBridgedDevices() {
        return new ArrayList<>(devices);
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
        return name;
    }

    @Override
    public boolean isReachable() {
        return reachable;
    }

    @Override
    public void setReachable(boolean reachable) {
        this.reachable = reachable;
        for (BridgedDevice device : devices) {
            device.setReachable(reachable);
        }
    }
}

package com.hubbridge.protocol;

import com.hubbridge.device.BasicInformation;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.device.Endpoint;

import java.util.List;

/**
 * Container endpoint grouping many bridged devices under one commissioning identity.
 */
public interface Aggregator extends Endpoint {

    BasicInformation getBasicInformation();

    void addBridgedDevice(BridgedDevice device);

    void removeBridgedDevice(BridgedDevice device);

    List<BridgedDevice> getBridgedDevices();
}

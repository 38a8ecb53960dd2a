package com.hubbridge.plugin.example;

import com.hubbridge.config.BridgeMode;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.plugin.BridgeHandle;
import com.hubbridge.plugin.event.BridgeEventBus;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Bridge handle keeping the devices a platform exposes. */
final class RecordingBridgeHandle implements BridgeHandle {

    final List<BridgedDevice> devices = new ArrayList<>();
    final BridgeEventBus eventBus = new BridgeEventBus();
    private final BridgeMode mode;

    RecordingBridgeHandle(BridgeMode mode) {
        this.mode = mode;
    }

    @Override
    public BridgeMode getBridgeMode() {
        return mode;
    }

    @Override
    public String getBridgeVersion() {
        return "1.0.0";
    }

    @Override
    public Path getHomeDirectory() {
        return Path.of("/tmp/hubbridge");
    }

    @Override
    public BridgeEventBus getEventBus() {
        return eventBus;
    }

    @Override
    public void addBridgedDevice(String pluginName, BridgedDevice device) {
        devices.add(device);
    }

    @Override
    public void removeBridgedDevice(String pluginName, BridgedDevice device) {
        devices.remove(device);
    }

    @Override
    public void removeAllBridgedDevices(String pluginName) {
        devices.clear();
    }
}

package com.hubbridge.plugin;

import com.hubbridge.device.BridgedDevice;
import com.hubbridge.plugin.event.BridgeEvent;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Base class of every platform a plugin contributes.
 * <p>
 * The bridge drives three hooks: {@link #onStart(String)} after loading, {@link #onConfigure()} once a
 * controller is connected, and {@link #onShutdown(String)} on disable, removal or process shutdown.
 * Hooks may complete asynchronously; a hook that throws or completes exceptionally puts the plugin in error.
 * Hooks are called on the bridge thread and must not block it.
 */
public abstract class BridgePlatform {

    private final BridgeHandle bridge;
    private final Logger log;
    private final PlatformConfig config;
    private final List<BridgedDevice> devices = new CopyOnWriteArrayList<>();

    protected BridgePlatform(BridgeHandle bridge, Logger log, PlatformConfig config) {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.log = Objects.requireNonNull(log, "log");
        this.config = Objects.requireNonNull(config, "config");
    }

    public abstract PlatformType getType();

    public String getName() {
        return config.getName();
    }

    public PlatformConfig getConfig() {
        return config;
    }

    protected BridgeHandle bridge() {
        return bridge;
    }

    protected Logger log() {
        return log;
    }

    public CompletionStage<Void> onStart(String reason) {
        return done();
    }

    public CompletionStage<Void> onConfigure() {
        return done();
    }

    public CompletionStage<Void> onShutdown(String reason) {
        return done();
    }

    /** Exposes a device through the bridge and announces it with {@link BridgeEvent.RegisterDevice}. */
    protected void registerDevice(BridgedDevice device) {
        bridge.addBridgedDevice(getName(), device);
        devices.add(device);
        bridge.getEventBus().publish(new BridgeEvent.RegisterDevice(getName(), device));
    }

    protected void unregisterDevice(BridgedDevice device) {
        bridge.removeBridgedDevice(getName(), device);
        devices.remove(device);
    }

    protected void unregisterAllDevices() {
        bridge.removeAllBridgedDevices(getName());
        devices.clear();
    }

    /** Devices this platform registered and has not unregistered. */
    public List<BridgedDevice> getRegisteredDevices() {
        return new ArrayList<>(devices);
    }

    protected static CompletionStage<Void> done() {
        return CompletableFuture.completedFuture(null);
    }
}

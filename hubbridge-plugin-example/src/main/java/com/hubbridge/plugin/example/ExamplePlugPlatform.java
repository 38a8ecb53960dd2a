package com.hubbridge.plugin.example;

import com.hubbridge.device.BridgedDevice;
import com.hubbridge.plugin.AccessoryPlatform;
import com.hubbridge.plugin.BridgeHandle;
import com.hubbridge.plugin.PlatformConfig;
import org.slf4j.Logger;

import java.util.concurrent.CompletionStage;

/**
 * Accessory platform exposing a single plug. Config fields: {@code deviceName} (default {@code Example plug})
 * and {@code startOn}.
 */
public class ExamplePlugPlatform extends AccessoryPlatform {

    public static final String DEVICE_NAME = "deviceName";
    public static final String START_ON = "startOn";

    private BridgedDevice plug;

    public ExamplePlugPlatform(BridgeHandle bridge, Logger log, PlatformConfig config) {
        super(bridge, log, config);
    }

    @Override
    public CompletionStage<Void> onStart(String reason) {
        plug = ExampleDevices.plug(getName(), getConfig().getString(DEVICE_NAME, "Example plug"));
        log().info("Starting {} ({}) with {}", getName(), reason, plug.getDeviceName());
        registerDevice(plug);
        return done();
    }

    @Override
    public CompletionStage<Void> onConfigure() {
        if (plug != null) {
            plug.setAttribute(ExampleDevices.ON_OFF, ExampleDevices.ON_OFF_ATTRIBUTE,
                    getConfig().getBoolean(START_ON, false));
        }
        return done();
    }

    @Override
    public CompletionStage<Void> onShutdown(String reason) {
        log().info("Stopping {}: {}", getName(), reason);
        plug = null;
        return done();
    }
}

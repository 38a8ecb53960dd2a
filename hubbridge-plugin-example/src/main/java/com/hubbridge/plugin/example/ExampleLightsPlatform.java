package com.hubbridge.plugin.example;

import com.hubbridge.device.BridgedDevice;
import com.hubbridge.plugin.BridgeHandle;
import com.hubbridge.plugin.DynamicPlatform;
import com.hubbridge.plugin.PlatformConfig;
import org.slf4j.Logger;

import java.util.concurrent.CompletionStage;

/**
 * Dynamic platform exposing a configurable number of lights.
 * <p>
 * Config fields: {@code lights} (count, default 2), {@code dimmable} (default true) and {@code startOn}
 * (state applied once a controller is connected, default false).
 */
public class ExampleLightsPlatform extends DynamicPlatform {

    public static final String LIGHTS = "lights";
    public static final String DIMMABLE = "dimmable";
    public static final String START_ON = "startOn";

    static final int DEFAULT_LIGHTS = 2;

    public ExampleLightsPlatform(BridgeHandle bridge, Logger log, PlatformConfig config) {
        super(bridge, log, config);
    }

    @Override
    public CompletionStage<Void> onStart(String reason) {
        int count = getConfig().getInt(LIGHTS, DEFAULT_LIGHTS);
        if (count < 0) {
            throw new IllegalArgumentException("lights must not be negative: " + count);
        }
        boolean dimmable = getConfig().getBoolean(DIMMABLE, true);
        log().info("Starting {} ({}): {} {} light(s)", getName(), reason, count, dimmable ? "dimmable" : "on/off");
        for (int i = 1; i <= count; i++) {
            registerDevice(ExampleDevices.light(getName(), i, dimmable));
        }
        return done();
    }

    @Override
    public CompletionStage<Void> onConfigure() {
        boolean on = getConfig().getBoolean(START_ON, false);
        for (BridgedDevice light : getRegisteredDevices()) {
            setOn(light, on);
        }
        log().info("Configured {} light(s) of {}, all {}", getRegisteredDevices().size(), getName(), on ? "on" : "off");
        return done();
    }

    @Override
    public CompletionStage<Void> onShutdown(String reason) {
        log().info("Stopping {}: {}", getName(), reason);
        return done();
    }

    /** Switches a light; a dimmable one goes to full level when on and 0 when off. */
    public void setOn(BridgedDevice light, boolean on) {
        light.setAttribute(ExampleDevices.ON_OFF, ExampleDevices.ON_OFF_ATTRIBUTE, on);
        if (light.getClusterServerNames().contains(ExampleDevices.LEVEL_CONTROL)) {
            light.setAttribute(ExampleDevices.LEVEL_CONTROL, ExampleDevices.CURRENT_LEVEL, on ? ExampleDevices.MAX_LEVEL : 0);
        }
        log().debug("{} {}", light.getDeviceName(), on ? "on" : "off");
    }
}

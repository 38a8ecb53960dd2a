package com.hubbridge.plugin.example;

import com.hubbridge.plugin.BridgeHandle;
import com.hubbridge.plugin.BridgePlatform;
import com.hubbridge.plugin.PlatformConfig;
import com.hubbridge.plugin.PlatformFactory;
import org.slf4j.Logger;

/**
 * Factory of {@link ExampleLightsPlatform}. Registered as the jar's {@link PlatformFactory} service.
 */
public final class ExampleLightsFactory implements PlatformFactory {

    @Override
    public BridgePlatform create(BridgeHandle bridge, Logger log, PlatformConfig config) {
        return new ExampleLightsPlatform(bridge, log, config);
    }
}

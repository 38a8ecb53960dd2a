package com.hubbridge.plugin.example;

import com.hubbridge.plugin.BridgeHandle;
import com.hubbridge.plugin.BridgePlatform;
import com.hubbridge.plugin.PlatformConfig;
import com.hubbridge.plugin.PlatformFactory;
import org.slf4j.Logger;

/**
 * Factory of {@link ExamplePlugPlatform}; name it in the {@code main} field of {@code plugin.json}.
 */
public final class ExamplePlugFactory implements PlatformFactory {

    @Override
    public BridgePlatform create(BridgeHandle bridge, Logger log, PlatformConfig config) {
        return new ExamplePlugPlatform(bridge, log, config);
    }
}

package com.hubbridge.plugin;

import org.slf4j.Logger;

/**
 * Platform exposing any number of devices. In childbridge mode they share one aggregator on the
 * plugin's own commissioning identity.
 */
public abstract class DynamicPlatform extends BridgePlatform {

    protected DynamicPlatform(BridgeHandle bridge, Logger log, PlatformConfig config) {
        super(bridge, log, config);
    }

    @Override
    public final PlatformType getType() {
        return PlatformType.DYNAMIC;
    }
}

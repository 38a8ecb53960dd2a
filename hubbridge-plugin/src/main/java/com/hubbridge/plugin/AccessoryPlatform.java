package com.hubbridge.plugin;

import org.slf4j.Logger;

/**
 * Platform exposing a single accessory. In childbridge mode the device itself becomes the
 * commissioning identity, built from its own basic information; a second device is refused.
 */
public abstract class AccessoryPlatform extends BridgePlatform {

    protected AccessoryPlatform(BridgeHandle bridge, Logger log, PlatformConfig config) {
        super(bridge, log, config);
    }

    @Override
    public final PlatformType getType() {
        return PlatformType.ACCESSORY;
    }
}

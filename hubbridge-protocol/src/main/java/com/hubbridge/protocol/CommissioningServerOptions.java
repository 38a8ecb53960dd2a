package com.hubbridge.protocol;

import com.hubbridge.device.BasicInformation;

import java.util.Objects;

/**
 * Parameters for a new commissioning server. A null passcode or discriminator lets the engine pick one.
 */
public record CommissioningServerOptions(
        String name,
        int port,
        Integer passcode,
        Integer discriminator,
        int deviceType,
        BasicInformation basicInformation) {

    public CommissioningServerOptions {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(basicInformation, "basicInformation");
    }
}

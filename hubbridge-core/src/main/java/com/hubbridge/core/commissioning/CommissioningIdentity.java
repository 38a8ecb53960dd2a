package com.hubbridge.core.commissioning;

import com.hubbridge.device.BasicInformation;

/**
 * A persisted commissioning identity. {@code serialNumber} and {@code uniqueId} never change once stored;
 * the version fields are refreshed every run.
 */
public record CommissioningIdentity(
        String key,
        String deviceName,
        int deviceType,
        int vendorId,
        String vendorName,
        int productId,
        String productName,
        String serialNumber,
        String uniqueId,
        int softwareVersion,
        String softwareVersionString,
        int hardwareVersion,
        String hardwareVersionString) {

    public BasicInformation toBasicInformation() {
        return new BasicInformation(productName, vendorId, vendorName, productId, productName, serialNumber, uniqueId,
                softwareVersion, softwareVersionString, hardwareVersion, hardwareVersionString);
    }
}

package com.hubbridge.device;

/**
 * Identity attributes a device (or a commissioning identity) declares to controllers.
 * Text attributes longer than {@link #MAX_TEXT_LENGTH} are truncated.
 */
public record BasicInformation(
        String nodeLabel,
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

    public static final int MAX_TEXT_LENGTH = 32;

    public BasicInformation {
        nodeLabel = truncate(nodeLabel);
        vendorName = truncate(vendorName);
        productName = truncate(productName);
        serialNumber = truncate(serialNumber);
        uniqueId = truncate(uniqueId);
    }

    public static String truncate(String value) {
        if (value == null || value.length() <= MAX_TEXT_LENGTH) return value;
        return value.substring(0, MAX_TEXT_LENGTH);
    }

    /** Convenience for bridged devices that only declare name, serial and vendor. */
    public static BasicInformation of(String name, String serialNumber, int vendorId, String vendorName,
                                      int productId, String productName) {
        return new BasicInformation(name, vendorId, vendorName, productId, productName,
                serialNumber, serialNumber, 1, "1.0.0", 1, "1.0.0");
    }

    public BasicInformation withSerialNumber(String serial, String unique) {
        return new BasicInformation(nodeLabel, vendorId, vendorName, productId, productName, serial, unique,
                softwareVersion, softwareVersionString, hardwareVersion, hardwareVersionString);
    }
}

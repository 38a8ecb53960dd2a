package com.hubbridge.core.commissioning;

/** Attributes the bridge declares for an identity it owns (shared root or per-plugin aggregator). */
public record DeclaredAttributes(
        String deviceName,
        int deviceType,
        int vendorId,
        String vendorName,
        int productId,
        String productName) {
}

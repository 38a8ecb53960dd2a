package com.hubbridge.protocol;

/**
 * A fabric (administrative pairing domain) a commissioning server belongs to.
 */
public record FabricInfo(
        int fabricIndex,
        long fabricId,
        long nodeId,
        long rootNodeId,
        int rootVendorId,
        String label) {
}

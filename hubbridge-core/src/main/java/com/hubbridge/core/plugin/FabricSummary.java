package com.hubbridge.core.plugin;

import com.hubbridge.protocol.FabricInfo;

/**
 * Fabric information safe to persist and show: identifiers as strings, vendor name resolved.
 */
public record FabricSummary(
        int fabricIndex,
        String fabricId,
        String nodeId,
        String rootNodeId,
        int rootVendorId,
        String rootVendorName,
        String label) {

    public static FabricSummary of(FabricInfo fabric) {
        return new FabricSummary(fabric.fabricIndex(),
                Long.toUnsignedString(fabric.fabricId()),
                Long.toUnsignedString(fabric.nodeId()),
                Long.toUnsignedString(fabric.rootNodeId()),
                fabric.rootVendorId(),
                VendorNames.of(fabric.rootVendorId()),
                fabric.label());
    }
}

package com.hubbridge.device;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Snapshot of a registered device written to the node storage on shutdown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SerializedDevice(
        String pluginName,
        String deviceName,
        String serialNumber,
        String uniqueId,
        int deviceType,
        Integer endpoint,
        String endpointName,
        List<String> clusterServerNames) {

    public SerializedDevice {
        clusterServerNames = clusterServerNames != null ? List.copyOf(clusterServerNames) : List.of();
    }
}

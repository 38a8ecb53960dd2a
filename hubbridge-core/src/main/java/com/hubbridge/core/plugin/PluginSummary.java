package com.hubbridge.core.plugin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.hubbridge.plugin.PlatformType;

import java.util.List;

/**
 * One entry of the persisted plugin registry, also returned by the plugins query.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PluginSummary(
        String path,
        PlatformType type,
        String name,
        String version,
        String description,
        String author,
        String latestVersion,
        boolean enabled,
        boolean error,
        boolean locked,
        boolean loaded,
        boolean started,
        boolean configured,
        boolean paired,
        boolean connected,
        Integer registeredDevices,
        Integer addedDevices,
        String qrPairingCode,
        String manualPairingCode,
        List<FabricSummary> fabricInformations,
        List<SessionSummary> sessionInformations) {

    public PluginSummary {
        fabricInformations = fabricInformations != null ? List.copyOf(fabricInformations) : null;
        sessionInformations = sessionInformations != null ? List.copyOf(sessionInformations) : null;
    }
}

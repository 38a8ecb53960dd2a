package com.hubbridge.core.lifecycle;

import com.hubbridge.plugin.BridgePlatform;

/**
 * Outcome of {@link PluginLifecycleOrchestrator#load}. {@code platform} is set for {@link Status#LOADED} and
 * {@link Status#ALREADY_LOADED}.
 */
public record LoadResult(Status status, BridgePlatform platform) {

    public enum Status {
        LOADED,
        NOT_ENABLED,
        ALREADY_LOADED,
        FAILED
    }

    static LoadResult loaded(BridgePlatform platform) {
        return new LoadResult(Status.LOADED, platform);
    }

    static LoadResult alreadyLoaded(BridgePlatform platform) {
        return new LoadResult(Status.ALREADY_LOADED, platform);
    }

    static LoadResult notEnabled() {
        return new LoadResult(Status.NOT_ENABLED, null);
    }

    static LoadResult failed() {
        return new LoadResult(Status.FAILED, null);
    }

    public boolean hasPlatform() {
        return platform != null;
    }
}

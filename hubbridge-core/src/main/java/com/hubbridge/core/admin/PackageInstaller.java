package com.hubbridge.core.admin;

import java.util.concurrent.CompletableFuture;

/**
 * External package manager used by {@code installplugin} and {@code update}.
 */
public interface PackageInstaller {

    /** Installs or upgrades a plugin package into the plugins directory. */
    CompletableFuture<Void> installPlugin(String packageName);

    /** Installs the latest bridge package. */
    CompletableFuture<Void> updateBridge();

    /** Installer used when none is configured: every request fails. */
    PackageInstaller NONE = new PackageInstaller() {
        @Override
        public CompletableFuture<Void> installPlugin(String packageName) {
            return CompletableFuture.failedFuture(new UnsupportedOperationException("no package installer configured"));
        }

        @Override
        public CompletableFuture<Void> updateBridge() {
            return CompletableFuture.failedFuture(new UnsupportedOperationException("no package installer configured"));
        }
    };
}

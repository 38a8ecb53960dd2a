package com.hubbridge.core.update;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Where the latest released version of an artifact comes from.
 */
public interface VersionSource {

    /**
     * @param artifact {@code groupId:artifactId}
     * @return the latest version, or empty when the artifact is unknown
     */
    CompletableFuture<Optional<String>> latestVersion(String artifact);
}

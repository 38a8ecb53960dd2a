package com.hubbridge.core.update;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asks the Maven Central search API for the latest version of an artifact.
 * Uses {@code GET <baseUrl>/solrsearch/select?q=g:"<groupId>" AND a:"<artifactId>"&rows=1&wt=json} and reads
 * {@code response.docs[0].latestVersion}.
 */
public final class MavenCentralVersionSource implements VersionSource {

    public static final String DEFAULT_BASE_URL = "https://search.maven.org";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final HttpClient httpClient;

    public MavenCentralVersionSource(String baseUrl) {
        this.baseUrl = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public MavenCentralVersionSource() {
        this(DEFAULT_BASE_URL);
    }

    @Override
    public CompletableFuture<Optional<String>> latestVersion(String artifact) {
        String[] parts = artifact != null ? artifact.split(":") : new String[0];
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Artifact must be groupId:artifactId, got " + artifact));
        }
        String query = URLEncoder.encode("g:\"" + parts[0] + "\" AND a:\"" + parts[1] + "\"", StandardCharsets.UTF_8);
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/solrsearch/select?q=" + query + "&rows=1&wt=json"))
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(30))
                .GET()
                .build();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .thenApply(response -> {
                    if (response.statusCode() != 200) {
                        throw new IllegalStateException("Maven Central search error: " + response.statusCode());
                    }
                    return parseLatestVersion(response.body());
                });
    }

    static Optional<String> parseLatestVersion(String body) {
        try {
            JsonNode doc = MAPPER.readTree(body).path("response").path("docs").path(0);
            String version = doc.path("latestVersion").asText(null);
            return Optional.ofNullable(version != null && !version.isBlank() ? version : null);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid Maven Central search response", e);
        }
    }
}

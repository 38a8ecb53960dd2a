package com.hubbridge.plugin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contents of a plugin's {@code plugin.json}.
 * {@code main} names the {@link PlatformFactory} class; {@code artifact} ({@code groupId:artifactId}) is used
 * for the latest-version check.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PluginManifest(
        String name,
        String version,
        String description,
        String author,
        String main,
        String artifact) {

    public static final String FILE_NAME = "plugin.json";

    @JsonCreator
    public PluginManifest(@JsonProperty("name") String name,
                          @JsonProperty("version") String version,
                          @JsonProperty("description") String description,
                          @JsonProperty("author") String author,
                          @JsonProperty("main") String main,
                          @JsonProperty("artifact") String artifact) {
        this.name = name;
        this.version = version;
        this.description = description;
        this.author = author;
        this.main = main;
        this.artifact = artifact;
    }
}

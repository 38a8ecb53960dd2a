package com.hubbridge.plugin;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Resolves plugin manifests and loads their {@link PlatformFactory}.
 * <p>
 * A plugin is a directory holding {@code plugin.json} and its jars (directly or under {@code lib/}).
 * It is found by manifest path, by directory, or by name below the plugins directory
 * (e.g. {@code ~/.hubbridge/plugins/<name>/plugin.json}). Each plugin gets its own {@link URLClassLoader}
 * whose parent is the bridge's class loader; a plugin without jars is loaded from the bridge classpath.
 */
public final class PluginLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path pluginsDirectory;
    private final ClassLoader parent;
    // keep references so loaded plugin classes stay reachable until close
    private final List<URLClassLoader> loaders = new CopyOnWriteArrayList<>();

    public PluginLoader(Path pluginsDirectory) {
        this(pluginsDirectory, PluginLoader.class.getClassLoader());
    }

    public PluginLoader(Path pluginsDirectory, ClassLoader parent) {
        this.pluginsDirectory = pluginsDirectory;
        this.parent = parent;
    }

    public Path getPluginsDirectory() {
        return pluginsDirectory;
    }

    /**
     * Finds the manifest for a path (manifest file or plugin directory) or a plugin name.
     *
     * @return absolute, normalized manifest path; empty when nothing matches
     */
    public Optional<Path> resolveManifest(String pathOrName) {
        if (pathOrName == null || pathOrName.isBlank()) {
            return Optional.empty();
        }
        String value = pathOrName.trim();
        try {
            Optional<Path> direct = manifestAt(Path.of(value));
            if (direct.isPresent()) {
                return direct;
            }
            if (pluginsDirectory != null) {
                return manifestAt(pluginsDirectory.resolve(value));
            }
        } catch (InvalidPathException e) {
            log.debug("Not a valid plugin path: {}", value);
        }
        return Optional.empty();
    }

    private static Optional<Path> manifestAt(Path path) {
        if (Files.isRegularFile(path) && PluginManifest.FILE_NAME.equals(String.valueOf(path.getFileName()))) {
            return Optional.of(path.toAbsolutePath().normalize());
        }
        Path inDirectory = path.resolve(PluginManifest.FILE_NAME);
        if (Files.isDirectory(path) && Files.isRegularFile(inDirectory)) {
            return Optional.of(inDirectory.toAbsolutePath().normalize());
        }
        return Optional.empty();
    }

    public PluginManifest readManifest(Path manifestFile) {
        try {
            PluginManifest manifest = MAPPER.readValue(manifestFile.toFile(), PluginManifest.class);
            if (manifest.name() == null || manifest.name().isBlank()) {
                throw new PluginLoadException(manifestFile.toString(), "Manifest has no name: " + manifestFile);
            }
            return manifest;
        } catch (IOException e) {
            throw new PluginLoadException(manifestFile.toString(), "Cannot read manifest " + manifestFile, e);
        }
    }

    /**
     * Instantiates the plugin's factory: the {@code main} class when the manifest names one, otherwise the first
     * {@link PlatformFactory} found through {@link ServiceLoader} in the plugin's jars.
     */
    public PlatformFactory loadFactory(Path manifestFile, PluginManifest manifest) {
        ClassLoader loader = classLoaderFor(manifestFile, manifest.name());
        if (manifest.main() != null && !manifest.main().isBlank()) {
            try {
                Class<?> type = Class.forName(manifest.main().trim(), true, loader);
                if (!PlatformFactory.class.isAssignableFrom(type)) {
                    throw new PluginLoadException(manifest.name(),
                            manifest.main() + " does not implement " + PlatformFactory.class.getName());
                }
                return (PlatformFactory) type.getDeclaredConstructor().newInstance();
            } catch (PluginLoadException e) {
                throw e;
            } catch (ReflectiveOperationException | LinkageError e) {
                throw new PluginLoadException(manifest.name(), "Cannot instantiate " + manifest.main(), e);
            }
        }
        try {
            Iterator<PlatformFactory> it = ServiceLoader.load(PlatformFactory.class, loader).iterator();
            if (it.hasNext()) {
                return it.next();
            }
        } catch (java.util.ServiceConfigurationError e) {
            throw new PluginLoadException(manifest.name(), "Invalid PlatformFactory service registration", e);
        }
        throw new PluginLoadException(manifest.name(), "No PlatformFactory found for plugin " + manifest.name());
    }

    private ClassLoader classLoaderFor(Path manifestFile, String pluginName) {
        Path pluginDir = manifestFile.getParent();
        List<URL> jars = new ArrayList<>();
        collectJars(pluginDir, jars);
        collectJars(pluginDir.resolve("lib"), jars);
        if (jars.isEmpty()) {
            return parent;
        }
        URLClassLoader loader = new URLClassLoader("plugin-" + pluginName, jars.toArray(URL[]::new), parent);
        loaders.add(loader);
        log.debug("Class loader for plugin {} with {} jar(s)", pluginName, jars.size());
        return loader;
    }

    private static void collectJars(Path dir, List<URL> out) {
        if (dir == null || !Files.isDirectory(dir)) return;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.jar")) {
            for (Path jar : stream) {
                out.add(jar.toUri().toURL());
            }
        } catch (IOException e) {
            log.warn("Failed to list plugin jars in {}: {}", dir, e.getMessage());
        }
    }

    /** Closes every plugin class loader. Failures are logged; closing continues with the next loader. */
    @Override
    public void close() {
        for (URLClassLoader loader : loaders) {
            try {
                loader.close();
            } catch (IOException e) {
                log.warn("Failed to close plugin class loader {}: {}", loader.getName(), e.getMessage());
            }
        }
        loaders.clear();
    }
}

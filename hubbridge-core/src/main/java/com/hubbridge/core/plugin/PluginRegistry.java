package com.hubbridge.core.plugin;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hubbridge.storage.StorageContext;
import com.hubbridge.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered registry of plugins, persisted as a list of {@link PluginSummary} under the {@code plugins} key of the
 * bridge's node storage context. Registry order is load order.
 */
public final class PluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    public static final String PLUGINS_KEY = "plugins";
    private static final TypeReference<List<PluginSummary>> SUMMARY_LIST = new TypeReference<>() {
    };

    private final List<RegisteredPlugin> plugins = new CopyOnWriteArrayList<>();
    private volatile StorageContext storage;

    /** Context the snapshot is written to; null disables persistence. */
    public void attachStorage(StorageContext storage) {
        this.storage = storage;
    }

    public void detachStorage() {
        this.storage = null;
    }

    /**
     * Replaces the in-memory registry with the persisted snapshot.
     *
     * @return number of plugins read
     */
    public int load() {
        StorageContext context = requireStorage();
        List<PluginSummary> summaries = context.get(PLUGINS_KEY, SUMMARY_LIST, List.of());
        plugins.clear();
        for (PluginSummary summary : summaries) {
            if (summary.name() == null) {
                log.warn("Skipping persisted plugin entry without name (path {})", summary.path());
                continue;
            }
            plugins.add(RegisteredPlugin.fromSummary(summary));
        }
        log.debug("Loaded {} plugin(s) from storage", plugins.size());
        return plugins.size();
    }

    /**
     * Writes the current snapshot. Failures are logged; the in-memory registry stays authoritative.
     */
    public void persist() {
        StorageContext context = storage;
        if (context == null) return;
        try {
            context.set(PLUGINS_KEY, snapshot());
            log.debug("Saved {} plugin(s) to storage", plugins.size());
        } catch (StorageException e) {
            log.error("Failed to save plugin registry: {}", e.getMessage(), e);
        }
    }

    private StorageContext requireStorage() {
        StorageContext context = storage;
        if (context == null) {
            throw new IllegalStateException("Plugin registry has no storage attached");
        }
        return context;
    }

    public List<PluginSummary> snapshot() {
        List<PluginSummary> out = new ArrayList<>(plugins.size());
        for (RegisteredPlugin plugin : plugins) {
            out.add(plugin.toSummary());
        }
        return out;
    }

    /**
     * Adds a plugin at the end of the registry.
     *
     * @throws IllegalArgumentException if a plugin with the same name is already registered
     */
    public void add(RegisteredPlugin plugin) {
        Objects.requireNonNull(plugin, "plugin");
        if (get(plugin.getName()).isPresent()) {
            throw new IllegalArgumentException("Plugin already registered: " + plugin.getName());
        }
        plugins.add(plugin);
    }

    public boolean remove(RegisteredPlugin plugin) {
        return plugins.remove(plugin);
    }

    public Optional<RegisteredPlugin> get(String name) {
        if (name == null) return Optional.empty();
        for (RegisteredPlugin plugin : plugins) {
            if (plugin.getName().equals(name)) return Optional.of(plugin);
        }
        return Optional.empty();
    }

    /** Plugin registered at this manifest path. */
    public Optional<RegisteredPlugin> getByPath(String path) {
        if (path == null) return Optional.empty();
        for (RegisteredPlugin plugin : plugins) {
            if (path.equals(plugin.getPath())) return Optional.of(plugin);
        }
        return Optional.empty();
    }

    public List<RegisteredPlugin> all() {
        return new ArrayList<>(plugins);
    }

    public List<RegisteredPlugin> enabled() {
        List<RegisteredPlugin> out = new ArrayList<>();
        for (RegisteredPlugin plugin : plugins) {
            if (plugin.isEnabled()) out.add(plugin);
        }
        return out;
    }

    /** Enabled plugins that are not in error. */
    public List<RegisteredPlugin> healthy() {
        List<RegisteredPlugin> out = new ArrayList<>();
        for (RegisteredPlugin plugin : plugins) {
            if (plugin.isEnabled() && !plugin.isError()) out.add(plugin);
        }
        return out;
    }

    public int size() {
        return plugins.size();
    }

    /** Clears the in-memory registry (shutdown, tests). The persisted snapshot is untouched. */
    public void clear() {
        plugins.clear();
    }
}

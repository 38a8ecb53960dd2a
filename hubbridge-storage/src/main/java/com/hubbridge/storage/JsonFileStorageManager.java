package com.hubbridge.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Store kept in a single JSON file: one top-level object per context.
 * Used for the identity store. {@link #backup()} copies the file next to itself
 * ({@code hubbridge.json} → {@code hubbridge.backup.json}); when the main file cannot be parsed
 * the backup is loaded instead.
 */
public final class JsonFileStorageManager implements StorageManager {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStorageManager.class);

    private final Path file;
    private final ObjectNode root;
    private final Map<String, FileStorageContext> contexts = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public JsonFileStorageManager(Path file) {
        this.file = Objects.requireNonNull(file, "file");
        this.root = load(file, backupFile(file));
        log.debug("Identity store opened at {} with {} context(s)", file, root.size());
    }

    private static ObjectNode load(Path file, Path backup) {
        try {
            return JsonFiles.readObject(file);
        } catch (IOException e) {
            log.warn("Cannot parse {} ({}); trying backup {}", file, e.getMessage(), backup);
            try {
                return JsonFiles.readObject(backup);
            } catch (IOException backupError) {
                throw new StorageException(file.toString(), null, "Cannot read store or its backup", backupError);
            }
        }
    }

    static Path backupFile(Path file) {
        String name = file.getFileName().toString();
        String stem = name.endsWith(".json") ? name.substring(0, name.length() - 5) : name;
        return file.resolveSibling(stem + ".backup.json");
    }

    public Path getFile() {
        return file;
    }

    @Override
    public StorageContext createContext(String name) {
        Objects.requireNonNull(name, "name");
        ensureOpen(name);
        return contexts.computeIfAbsent(name, n -> {
            ObjectNode content;
            synchronized (root) {
                JsonNode existing = root.get(n);
                if (existing instanceof ObjectNode node) {
                    content = node;
                } else {
                    content = root.putObject(n);
                }
            }
            return new FileStorageContext(describe(), n, content, JsonFiles.MAPPER, c -> flush(), this::ensureOpen);
        });
    }

    @Override
    public List<String> contextNames() {
        List<String> names = new ArrayList<>();
        synchronized (root) {
            for (Iterator<String> it = root.fieldNames(); it.hasNext(); ) {
                names.add(it.next());
            }
        }
        return names;
    }

    /** Copies the current file to the backup location. Does nothing when the store was never written. */
    public void backup() {
        if (!Files.isRegularFile(file)) return;
        Path backup = backupFile(file);
        try {
            Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Identity store backed up to {}", backup);
        } catch (IOException e) {
            throw new StorageException(describe(), null, "Cannot back up store to " + backup, e);
        }
    }

    private void flush() {
        try {
            synchronized (root) {
                JsonFiles.writeObject(file, root);
            }
        } catch (IOException e) {
            throw new StorageException(describe(), null, "Cannot write store", e);
        }
    }

    private void ensureOpen(String context) {
        if (closed) {
            throw new StorageException(describe(), context, "Store is closed");
        }
    }

    @Override
    public String describe() {
        return file.toString();
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        contexts.clear();
    }

    @Override
    public void destroy() {
        try {
            Files.deleteIfExists(file);
            Files.deleteIfExists(backupFile(file));
            synchronized (root) {
                root.removeAll();
            }
            log.info("Identity store {} deleted", file);
        } catch (IOException e) {
            throw new StorageException(describe(), null, "Cannot delete store", e);
        }
    }
}

package com.hubbridge.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Store kept in a directory with one {@code <context>.json} file per context.
 * Used for the node storage (plugin registry, device snapshot, per-plugin contexts).
 */
public final class DirectoryStorageManager implements StorageManager {

    private static final Logger log = LoggerFactory.getLogger(DirectoryStorageManager.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final Map<String, FileStorageContext> contexts = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public DirectoryStorageManager(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException(directory.toString(), null, "Cannot create storage directory", e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public StorageContext createContext(String name) {
        Objects.requireNonNull(name, "name");
        ensureOpen(name);
        return contexts.computeIfAbsent(name, n -> {
            Path file = fileFor(n);
            ObjectNode content;
            try {
                content = JsonFiles.readObject(file);
            } catch (IOException e) {
                throw new StorageException(describe(), n, "Cannot read context file " + file, e);
            }
            return new FileStorageContext(describe(), n, content, JsonFiles.MAPPER, this::flush, this::ensureOpen);
        });
    }

    @Override
    public List<String> contextNames() {
        if (!Files.isDirectory(directory)) return List.of();
        List<String> names = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(SUFFIX))
                    .map(n -> n.substring(0, n.length() - SUFFIX.length()))
                    .sorted()
                    .forEach(names::add);
        } catch (IOException e) {
            throw new StorageException(describe(), null, "Cannot list storage directory", e);
        }
        return names;
    }

    private Path fileFor(String context) {
        String safe = context.replaceAll("[^A-Za-z0-9._@-]", "_");
        return directory.resolve(safe + SUFFIX);
    }

    private void flush(FileStorageContext context) {
        try {
            synchronized (context.content()) {
                JsonFiles.writeObject(fileFor(context.getName()), context.content());
            }
        } catch (IOException e) {
            throw new StorageException(describe(), context.getName(), "Cannot write context file", e);
        }
    }

    private void ensureOpen(String context) {
        if (closed) {
            throw new StorageException(describe(), context, "Store is closed");
        }
    }

    @Override
    public String describe() {
        return directory.toString();
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
            JsonFiles.deleteRecursively(directory);
            log.info("Node storage {} deleted", directory);
        } catch (IOException e) {
            throw new StorageException(describe(), null, "Cannot delete storage directory", e);
        }
    }
}

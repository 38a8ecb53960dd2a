package com.hubbridge.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Context held in memory as an {@link ObjectNode} and written through by its owning file manager.
 */
final class FileStorageContext extends AbstractStorageContext {

    private final ObjectNode content;
    private final Consumer<FileStorageContext> flush;
    private final FileStorageGuard guard;

    FileStorageContext(String store, String name, ObjectNode content, ObjectMapper mapper,
                       Consumer<FileStorageContext> flush, FileStorageGuard guard) {
        super(store, name, mapper);
        this.content = content;
        this.flush = flush;
        this.guard = guard;
    }

    ObjectNode content() {
        return content;
    }

    @Override
    protected JsonNode read(String key) {
        guard.ensureOpen(getName());
        synchronized (content) {
            return content.get(key);
        }
    }

    @Override
    protected void write(String key, JsonNode value) {
        guard.ensureOpen(getName());
        synchronized (content) {
            content.set(key, value);
        }
        flush.accept(this);
    }

    @Override
    public void remove(String key) {
        guard.ensureOpen(getName());
        synchronized (content) {
            content.remove(key);
        }
        flush.accept(this);
    }

    @Override
    public void clearAll() {
        guard.ensureOpen(getName());
        synchronized (content) {
            content.removeAll();
        }
        flush.accept(this);
    }

    @Override
    public Set<String> keys() {
        guard.ensureOpen(getName());
        Set<String> keys = new LinkedHashSet<>();
        synchronized (content) {
            for (Iterator<String> it = content.fieldNames(); it.hasNext(); ) {
                keys.add(it.next());
            }
        }
        return keys;
    }

    /** Open/closed state shared between a file manager and its contexts. */
    interface FileStorageGuard {
        void ensureOpen(String context);
    }
}

package com.hubbridge.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * Converts between typed values and the JSON nodes a backend stores.
 */
abstract class AbstractStorageContext implements StorageContext {

    private final String store;
    private final String name;
    private final ObjectMapper mapper;

    AbstractStorageContext(String store, String name, ObjectMapper mapper) {
        this.store = Objects.requireNonNull(store, "store");
        this.name = Objects.requireNonNull(name, "name");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public String getName() {
        return name;
    }

    protected abstract JsonNode read(String key);

    protected abstract void write(String key, JsonNode value);

    @Override
    public <T> T get(String key, Class<T> type, T defaultValue) {
        JsonNode node = read(Objects.requireNonNull(key, "key"));
        if (node == null || node.isMissingNode()) return defaultValue;
        try {
            return mapper.treeToValue(node, type);
        } catch (Exception e) {
            throw new StorageException(store, name, "Cannot read key " + key + " as " + type.getSimpleName(), e);
        }
    }

    @Override
    public <T> T get(String key, TypeReference<T> type, T defaultValue) {
        JsonNode node = read(Objects.requireNonNull(key, "key"));
        if (node == null || node.isMissingNode()) return defaultValue;
        try {
            return mapper.readerFor(type).readValue(node);
        } catch (Exception e) {
            throw new StorageException(store, name, "Cannot read key " + key, e);
        }
    }

    @Override
    public void set(String key, Object value) {
        Objects.requireNonNull(key, "key");
        write(key, mapper.valueToTree(value));
    }

    @Override
    public boolean has(String key) {
        JsonNode node = read(key);
        return node != null && !node.isMissingNode();
    }

    protected String store() {
        return store;
    }

    protected ObjectMapper mapper() {
        return mapper;
    }
}

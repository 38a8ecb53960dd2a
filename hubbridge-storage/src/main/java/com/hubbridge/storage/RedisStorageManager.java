package com.hubbridge.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Store kept in Redis: each context is a hash at {@code <prefix>:<context>} whose fields hold JSON values.
 * The set of contexts is tracked in {@code <prefix>:contexts}.
 */
public final class RedisStorageManager implements StorageManager {

    private static final Logger log = LoggerFactory.getLogger(RedisStorageManager.class);

    private final String host;
    private final int port;
    private final String prefix;
    private final JedisPool pool;
    private volatile boolean closed;

    public RedisStorageManager(String host, int port, String prefix) {
        this(host, port, prefix, new JedisPoolConfig());
    }

    public RedisStorageManager(String host, int port, String prefix, JedisPoolConfig poolConfig) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.pool = new JedisPool(poolConfig, host, port);
        log.info("Redis store {} connected to {}:{}", prefix, host, port);
    }

    private String contextsKey() {
        return prefix + ":contexts";
    }

    private String hashKey(String context) {
        return prefix + ":" + context;
    }

    <T> T withJedis(String context, Function<Jedis, T> action) {
        if (closed) {
            throw new StorageException(describe(), context, "Store is closed");
        }
        try (var jedis = pool.getResource()) {
            return action.apply(jedis);
        } catch (JedisException e) {
            throw new StorageException(describe(), context, "Redis operation failed", e);
        }
    }

    @Override
    public StorageContext createContext(String name) {
        Objects.requireNonNull(name, "name");
        withJedis(name, jedis -> jedis.sadd(contextsKey(), name));
        return new RedisStorageContext(name);
    }

    @Override
    public List<String> contextNames() {
        List<String> names = new ArrayList<>(withJedis(null, jedis -> jedis.smembers(contextsKey())));
        names.sort(String::compareTo);
        return names;
    }

    @Override
    public String describe() {
        return "redis://" + host + ":" + port + "/" + prefix;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        pool.close();
    }

    @Override
    public void destroy() {
        try (var jedis = new Jedis(host, port)) {
            Set<String> names = jedis.smembers(contextsKey());
            for (String name : names) {
                jedis.del(hashKey(name));
            }
            jedis.del(contextsKey());
            log.info("Redis store {} deleted ({} context(s))", prefix, names.size());
        } catch (JedisException e) {
            throw new StorageException(describe(), null, "Cannot delete store", e);
        }
    }

    private final class RedisStorageContext extends AbstractStorageContext {

        RedisStorageContext(String name) {
            super(describe(), name, new ObjectMapper());
        }

        @Override
        protected JsonNode read(String key) {
            String raw = withJedis(getName(), jedis -> jedis.hget(hashKey(getName()), key));
            if (raw == null) return null;
            try {
                return mapper().readTree(raw);
            } catch (Exception e) {
                throw new StorageException(store(), getName(), "Corrupt value at key " + key, e);
            }
        }

        @Override
        protected void write(String key, JsonNode value) {
            String raw = value.toString();
            withJedis(getName(), jedis -> jedis.hset(hashKey(getName()), key, raw));
        }

        @Override
        public void remove(String key) {
            withJedis(getName(), jedis -> jedis.hdel(hashKey(getName()), key));
        }

        @Override
        public void clearAll() {
            withJedis(getName(), jedis -> jedis.del(hashKey(getName())));
        }

        @Override
        public Set<String> keys() {
            return new LinkedHashSet<>(withJedis(getName(), jedis -> jedis.hkeys(hashKey(getName()))));
        }
    }
}

package io.tether.redis.cache;

import io.tether.core.cache.CacheEntryOptions;
import io.tether.core.cache.CacheStore;
import io.tether.core.cache.ResilientCacheStore;
import io.tether.core.stats.CacheStats;
import io.tether.redis.connection.RedisConnectionManager;
import io.tether.redis.connection.RedisStoreConfig;
import io.tether.redis.serializer.CacheValueSerializer;
import io.tether.redis.serializer.CacheValueSerializer.SerializationException;
import io.tether.redis.serializer.TypedJsonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Redis-backed {@link CacheStore}, sharing cached invocation results between
 * processes.
 *
 * <p>Entries are written with {@code PSETEX}, so Redis enforces the absolute
 * expiration. Priority and size from {@link CacheEntryOptions} are not
 * forwarded: eviction under memory pressure is governed by the server's
 * {@code maxmemory-policy}.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CacheStore store = RedisCacheStore.builder()
 *     .config(RedisStoreConfig.builder().host("cache.internal").build())
 *     .keyPrefix("quotes-service:")
 *     .allowedTypePrefixes("com.acme.quotes.")
 *     .buildResilient();
 *
 * Tether.invoker(QuoteClient.class, QuoteClient::new)
 *     .addCache(Duration.ofMinutes(5), store)
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public class RedisCacheStore implements CacheStore, CacheStats, Closeable {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheStore.class);

    private final String name;
    private final RedisConnectionManager connectionManager;
    private final CacheValueSerializer valueSerializer;
    private final String keyPrefix;
    private final boolean manageConnection;

    // Statistics
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    private RedisCacheStore(Builder builder) {
        this.name = builder.name;
        this.keyPrefix = builder.keyPrefix;
        this.valueSerializer = builder.valueSerializer != null
                ? builder.valueSerializer
                : new TypedJsonSerializer(builder.allowedTypePrefixes);

        if (builder.connectionManager != null) {
            this.connectionManager = builder.connectionManager;
            this.manageConnection = false;
        } else {
            this.connectionManager = new RedisConnectionManager(builder.config);
            this.manageConnection = true;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<Object> get(String key) {
        byte[] keyBytes = serializeKey(key);

        byte[] valueBytes = connectionManager.execute(commands -> commands.get(keyBytes));

        if (valueBytes == null) {
            misses.increment();
            return Optional.empty();
        }

        hits.increment();
        return Optional.ofNullable(valueSerializer.deserialize(valueBytes));
    }

    @Override
    public boolean contains(String key) {
        byte[] keyBytes = serializeKey(key);
        Long count = connectionManager.execute(commands -> commands.exists(keyBytes));
        return count != null && count > 0;
    }

    @Override
    public void set(String key, Object value, CacheEntryOptions options) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(options, "options must not be null");

        if (!valueSerializer.accepts(value.getClass())) {
            throw new SerializationException("Store " + name + " cannot hold " + value.getClass().getName()
                    + " results (key " + key + "); allow its package on the serializer");
        }

        byte[] keyBytes = serializeKey(key);
        byte[] valueBytes = valueSerializer.serialize(value);
        long ttlMillis = options.expireAfter().toMillis();

        connectionManager.execute(commands -> commands.psetex(keyBytes, ttlMillis, valueBytes));
        log.debug("[TETHER] {} - stored {} for {}ms", name, key, ttlMillis);
    }

    @Override
    public void remove(String key) {
        byte[] keyBytes = serializeKey(key);
        Long deleted = connectionManager.execute(commands -> commands.del(keyBytes));
        if (deleted != null && deleted > 0) {
            evictions.increment();
        }
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Always empty: counting the keys of one prefix needs a keyspace scan.
     */
    @Override
    public OptionalLong entryCount() {
        return OptionalLong.empty();
    }

    public CacheStats stats() {
        return this;
    }

    // CacheStats implementation

    @Override
    public long hitCount() {
        return hits.sum();
    }

    @Override
    public long missCount() {
        return misses.sum();
    }

    @Override
    public long evictionCount() {
        return evictions.sum();
    }

    @Override
    public void reset() {
        hits.reset();
        misses.reset();
        evictions.reset();
    }

    @Override
    public void close() {
        if (manageConnection) {
            connectionManager.close();
        }
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public RedisConnectionManager getConnectionManager() {
        return connectionManager;
    }

    private byte[] serializeKey(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return (keyPrefix + key).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Builder for RedisCacheStore.
     */
    public static class Builder {
        private String name = "redis-cache";
        private RedisStoreConfig config;
        private RedisConnectionManager connectionManager;
        private CacheValueSerializer valueSerializer;
        private final List<String> allowedTypePrefixes = new ArrayList<>();
        private String keyPrefix = "";

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        public Builder config(RedisStoreConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Uses a shared connection manager instead of creating a new one.
         * The store does not close a shared manager.
         */
        public Builder connectionManager(RedisConnectionManager connectionManager) {
            this.connectionManager = connectionManager;
            return this;
        }

        /**
         * Prepended to every key, for namespace isolation between applications.
         */
        public Builder keyPrefix(String prefix) {
            this.keyPrefix = prefix != null ? prefix : "";
            return this;
        }

        /**
         * Adds package prefixes of the value types the default JSON
         * serializer may write and read.
         */
        public Builder allowedTypePrefixes(String... prefixes) {
            allowedTypePrefixes.addAll(Arrays.asList(prefixes));
            return this;
        }

        /**
         * Replaces the default {@link TypedJsonSerializer}.
         */
        public Builder valueSerializer(CacheValueSerializer serializer) {
            this.valueSerializer = serializer;
            return this;
        }

        public RedisCacheStore build() {
            if (config == null && connectionManager == null) {
                throw new IllegalStateException("Either config or connectionManager must be provided");
            }
            return new RedisCacheStore(this);
        }

        /**
         * Builds the store wrapped in a {@link ResilientCacheStore}, so a
         * Redis outage degrades to cache misses.
         */
        public ResilientCacheStore buildResilient() {
            return new ResilientCacheStore(build());
        }
    }
}

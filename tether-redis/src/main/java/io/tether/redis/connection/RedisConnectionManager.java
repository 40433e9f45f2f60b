package io.tether.redis.connection;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import io.lettuce.core.support.ConnectionPoolSupport;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pooled Redis connections for cache stores.
 *
 * <p>Uses the Lettuce client with commons-pool2. Connections are borrowed for
 * the duration of one callback and validated on borrow.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (RedisConnectionManager manager = new RedisConnectionManager(config)) {
 *     byte[] value = manager.execute(commands -> commands.get(key));
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class RedisConnectionManager implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(RedisConnectionManager.class);

    private final RedisStoreConfig config;
    private final ClientResources clientResources;
    private final RedisClient redisClient;
    private final GenericObjectPool<StatefulRedisConnection<byte[], byte[]>> connectionPool;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a connection manager. No connection is opened until the first
     * command runs.
     *
     * @param config the Redis configuration
     */
    public RedisConnectionManager(RedisStoreConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clientResources = DefaultClientResources.builder()
                .ioThreadPoolSize(4)
                .computationThreadPoolSize(4)
                .build();
        this.redisClient = createClient();
        this.connectionPool = createConnectionPool();
        log.info("[TETHER] Redis connection manager created for {}", config.describe());
    }

    private RedisClient createClient() {
        RedisURI.Builder uriBuilder;

        if (config.isSentinel()) {
            uriBuilder = RedisURI.builder()
                    .withSentinelMasterId(config.getSentinelMasterId());

            for (String node : config.getSentinelNodes()) {
                int separator = node.lastIndexOf(':');
                uriBuilder.withSentinel(node.substring(0, separator), Integer.parseInt(node.substring(separator + 1)));
            }
        } else {
            uriBuilder = RedisURI.builder()
                    .withHost(config.getHost())
                    .withPort(config.getPort());
        }

        if (config.getPassword() != null && !config.getPassword().isEmpty()) {
            uriBuilder.withPassword(config.getPassword().toCharArray());
        }

        uriBuilder.withDatabase(config.getDatabase())
                .withSsl(config.isSsl())
                .withTimeout(config.getCommandTimeout());

        RedisClient client = RedisClient.create(clientResources, uriBuilder.build());
        client.setOptions(ClientOptions.builder()
                .socketOptions(SocketOptions.builder()
                        .connectTimeout(config.getConnectionTimeout())
                        .build())
                .build());
        return client;
    }

    private GenericObjectPool<StatefulRedisConnection<byte[], byte[]>> createConnectionPool() {
        GenericObjectPoolConfig<StatefulRedisConnection<byte[], byte[]>> poolConfig =
                new GenericObjectPoolConfig<>();
        poolConfig.setMinIdle(config.getPoolMinIdle());
        poolConfig.setMaxIdle(config.getPoolMaxIdle());
        poolConfig.setMaxTotal(config.getPoolMaxTotal());
        poolConfig.setMaxWait(config.getPoolMaxWait());
        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestWhileIdle(true);

        return ConnectionPoolSupport.createGenericObjectPool(
                () -> redisClient.connect(ByteArrayCodec.INSTANCE),
                poolConfig
        );
    }

    /**
     * Executes a command using a pooled connection.
     *
     * @param action the action to execute with Redis commands
     * @param <T> the return type
     * @return the result of the action
     * @throws RedisConnectionException if no connection could be borrowed or the command failed
     */
    public <T> T execute(RedisCallback<T> action) {
        if (closed.get()) {
            throw new IllegalStateException("Connection manager for " + config.describe() + " is closed");
        }
        try (StatefulRedisConnection<byte[], byte[]> connection = connectionPool.borrowObject()) {
            return action.doInRedis(connection.sync());
        } catch (Exception e) {
            throw new RedisConnectionException("Failed to execute Redis command on " + config.describe(), e);
        }
    }

    /**
     * Returns the number of connections currently borrowed.
     */
    public int activeConnections() {
        return connectionPool.getNumActive();
    }

    public RedisStoreConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            connectionPool.close();
            redisClient.shutdown();
            clientResources.shutdown();
            log.info("[TETHER] Redis connection manager for {} closed", config.describe());
        }
    }

    /**
     * Callback interface for Redis operations.
     */
    @FunctionalInterface
    public interface RedisCallback<T> {
        T doInRedis(RedisCommands<byte[], byte[]> commands);
    }

    /**
     * Exception thrown when Redis connection fails.
     */
    public static class RedisConnectionException extends RuntimeException {
        public RedisConnectionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

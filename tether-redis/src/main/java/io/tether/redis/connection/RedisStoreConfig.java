package io.tether.redis.connection;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * Connection settings of a Redis-backed cache store.
 *
 * <p>Supports a single node or a sentinel-managed master.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RedisStoreConfig config = RedisStoreConfig.builder()
 *     .host("cache.internal")
 *     .port(6379)
 *     .password("secret")
 *     .connectionTimeout(Duration.ofSeconds(5))
 *     .commandTimeout(Duration.ofSeconds(2))
 *     .poolSize(10)
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public class RedisStoreConfig {

    private final String host;
    private final int port;
    private final String password;
    private final int database;
    private final boolean ssl;
    private final Duration connectionTimeout;
    private final Duration commandTimeout;
    private final int poolMinIdle;
    private final int poolMaxIdle;
    private final int poolMaxTotal;
    private final Duration poolMaxWait;

    // Sentinel configuration
    private final String sentinelMasterId;
    private final String[] sentinelNodes;

    private RedisStoreConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.password = builder.password;
        this.database = builder.database;
        this.ssl = builder.ssl;
        this.connectionTimeout = builder.connectionTimeout;
        this.commandTimeout = builder.commandTimeout;
        this.poolMinIdle = builder.poolMinIdle;
        this.poolMaxIdle = builder.poolMaxIdle;
        this.poolMaxTotal = builder.poolMaxTotal;
        this.poolMaxWait = builder.poolMaxWait;
        this.sentinelMasterId = builder.sentinelMasterId;
        this.sentinelNodes = builder.sentinelNodes;
    }

    public static Builder builder() {
        return new Builder();
    }

    // Getters

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getPassword() { return password; }
    public int getDatabase() { return database; }
    public boolean isSsl() { return ssl; }
    public Duration getConnectionTimeout() { return connectionTimeout; }
    public Duration getCommandTimeout() { return commandTimeout; }
    public int getPoolMinIdle() { return poolMinIdle; }
    public int getPoolMaxIdle() { return poolMaxIdle; }
    public int getPoolMaxTotal() { return poolMaxTotal; }
    public Duration getPoolMaxWait() { return poolMaxWait; }
    public String getSentinelMasterId() { return sentinelMasterId; }

    public String[] getSentinelNodes() {
        return sentinelNodes == null ? new String[0] : sentinelNodes.clone();
    }

    public boolean isSentinel() {
        return sentinelMasterId != null && sentinelNodes != null && sentinelNodes.length > 0;
    }

    /**
     * Returns a description without the password, for log lines.
     */
    public String describe() {
        if (isSentinel()) {
            return "sentinel:" + sentinelMasterId + Arrays.toString(sentinelNodes) + "/" + database;
        }
        return (ssl ? "rediss://" : "redis://") + host + ":" + port + "/" + database;
    }

    /**
     * Builder for RedisStoreConfig.
     */
    public static class Builder {
        private String host = "localhost";
        private int port = 6379;
        private String password;
        private int database = 0;
        private boolean ssl = false;
        private Duration connectionTimeout = Duration.ofSeconds(10);
        private Duration commandTimeout = Duration.ofSeconds(5);
        private int poolMinIdle = 1;
        private int poolMaxIdle = 8;
        private int poolMaxTotal = 8;
        private Duration poolMaxWait = Duration.ofSeconds(10);
        private String sentinelMasterId;
        private String[] sentinelNodes;

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host must not be null");
            return this;
        }

        public Builder port(int port) {
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("port must be between 1 and 65535");
            }
            this.port = port;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder database(int database) {
            if (database < 0) {
                throw new IllegalArgumentException("database must not be negative");
            }
            this.database = database;
            return this;
        }

        public Builder ssl(boolean ssl) {
            this.ssl = ssl;
            return this;
        }

        public Builder connectionTimeout(Duration timeout) {
            this.connectionTimeout = requirePositive(timeout, "connectionTimeout");
            return this;
        }

        public Builder commandTimeout(Duration timeout) {
            this.commandTimeout = requirePositive(timeout, "commandTimeout");
            return this;
        }

        public Builder poolMinIdle(int minIdle) {
            this.poolMinIdle = minIdle;
            return this;
        }

        public Builder poolMaxIdle(int maxIdle) {
            this.poolMaxIdle = maxIdle;
            return this;
        }

        public Builder poolMaxTotal(int maxTotal) {
            this.poolMaxTotal = maxTotal;
            return this;
        }

        /**
         * Sets poolSize as shorthand for both maxIdle and maxTotal.
         */
        public Builder poolSize(int size) {
            this.poolMaxIdle = size;
            this.poolMaxTotal = size;
            return this;
        }

        /**
         * Sets how long a caller waits for a pooled connection.
         */
        public Builder poolMaxWait(Duration maxWait) {
            this.poolMaxWait = requirePositive(maxWait, "poolMaxWait");
            return this;
        }

        /**
         * Configure Redis Sentinel mode.
         *
         * @param masterId the sentinel master name
         * @param nodes sentinel nodes in format "host:port"
         */
        public Builder sentinel(String masterId, String... nodes) {
            Objects.requireNonNull(masterId, "masterId must not be null");
            for (String node : nodes) {
                if (node.lastIndexOf(':') <= 0) {
                    throw new IllegalArgumentException("Sentinel node must be host:port, got " + node);
                }
            }
            this.sentinelMasterId = masterId;
            this.sentinelNodes = nodes.clone();
            return this;
        }

        public RedisStoreConfig build() {
            if (poolMaxTotal <= 0) {
                throw new IllegalArgumentException("poolMaxTotal must be positive");
            }
            if (poolMinIdle < 0 || poolMinIdle > poolMaxIdle || poolMaxIdle > poolMaxTotal) {
                throw new IllegalArgumentException(
                        "Pool sizes must satisfy 0 <= minIdle <= maxIdle <= maxTotal");
            }
            return new RedisStoreConfig(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}

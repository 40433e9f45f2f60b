package io.tether.core.cache;

import java.util.Optional;

/**
 * Process-wide key-value store backing {@link CachingInvoker}.
 *
 * <p>The store owns eviction; callers only state how long an entry lives and
 * how important it is. Implementations must be thread-safe.</p>
 *
 * @see InMemoryCacheStore
 * @see ResilientCacheStore
 * @since 1.0.0
 */
public interface CacheStore {

    /**
     * Returns the live value stored under {@code key}.
     *
     * @param key the key
     * @return the value, or empty if absent or expired
     */
    Optional<Object> get(String key);

    /**
     * Returns true if a live value is stored under {@code key}.
     */
    boolean contains(String key);

    /**
     * Stores a value, replacing any previous one.
     *
     * @param key the key
     * @param value the value, must not be null
     * @param options expiration, priority and size of the entry
     */
    void set(String key, Object value, CacheEntryOptions options);

    /**
     * Removes the value stored under {@code key}, if any.
     */
    void remove(String key);

    /**
     * Returns the name of this store.
     */
    default String name() {
        return "unnamed";
    }
}

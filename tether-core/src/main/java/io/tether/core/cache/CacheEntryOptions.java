package io.tether.core.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-entry metadata passed to {@link CacheStore#set(String, Object, CacheEntryOptions)}.
 *
 * @param expireAfter absolute expiration, relative to the moment the entry is stored
 * @param priority eviction priority hint
 * @param size size of the entry in the store's size units
 *
 * @since 1.0.0
 */
public record CacheEntryOptions(Duration expireAfter, CachePriority priority, long size) {

    public CacheEntryOptions {
        Objects.requireNonNull(expireAfter, "expireAfter must not be null");
        if (expireAfter.isNegative() || expireAfter.isZero()) {
            throw new IllegalArgumentException("expireAfter must be positive");
        }
        Objects.requireNonNull(priority, "priority must not be null");
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }
    }

    /**
     * Returns options with {@link CachePriority#NORMAL} priority and size 1.
     */
    public static CacheEntryOptions expireAfter(Duration expireAfter) {
        return new CacheEntryOptions(expireAfter, CachePriority.NORMAL, 1);
    }
}

package io.tether.core.cache;

/**
 * Eviction priority of a cache entry. When a store has to make room, entries
 * with a lower priority go first; {@link #NEVER_REMOVE} entries only leave
 * through expiration or explicit removal.
 *
 * @since 1.0.0
 */
public enum CachePriority {
    LOW,
    NORMAL,
    HIGH,
    NEVER_REMOVE
}

package io.tether.core.stats;

import java.util.Locale;
import java.util.OptionalLong;

/**
 * Lookup counters of a named cache store.
 *
 * <p>A caching invoker reads the store once per call, so {@code hits + misses}
 * is the number of cacheable invocations that reached the store. Presence
 * checks through {@code contains} are not lookups.</p>
 *
 * <pre>{@code
 * log.info("[TETHER] {}", store.stats().snapshot());
 * // quotes[lookups=120, hitRatio=87.5%, evictions=3, entries=14]
 * }</pre>
 *
 * @since 1.0.0
 */
public interface CacheStats {

    /**
     * Returns the name of the store these counters belong to.
     */
    String name();

    long hitCount();

    long missCount();

    /**
     * Returns the number of entries dropped before being read again, by
     * expiration, compaction or removal.
     */
    long evictionCount();

    /**
     * Returns the number of entries held, or empty when the store cannot count
     * them without scanning a remote keyspace.
     */
    OptionalLong entryCount();

    /**
     * Resets the hit, miss and eviction counters. Entries are kept.
     */
    void reset();

    /**
     * Returns a point-in-time copy of the counters.
     */
    default Snapshot snapshot() {
        return new Snapshot(name(), hitCount(), missCount(), evictionCount(), entryCount());
    }

    /**
     * Counters of one store at one moment.
     */
    record Snapshot(String store, long hits, long misses, long evictions, OptionalLong entries) {

        public long lookups() {
            return hits + misses;
        }

        /**
         * Returns the share of lookups answered from the store, 0.0 before any lookup.
         */
        public double hitRatio() {
            long lookups = lookups();
            return lookups == 0 ? 0.0 : (double) hits / lookups;
        }

        @Override
        public String toString() {
            return String.format(Locale.ROOT, "%s[lookups=%d, hitRatio=%.1f%%, evictions=%d, entries=%s]",
                    store, lookups(), hitRatio() * 100, evictions,
                    entries.isPresent() ? Long.toString(entries.getAsLong()) : "unknown");
        }
    }
}

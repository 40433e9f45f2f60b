package io.tether.core.cache;

import io.tether.core.lifecycle.ManagedResource;
import io.tether.core.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory {@link CacheStore} with absolute expiration and a
 * size limit.
 *
 * <p>Reads are lock-free; expired entries are dropped lazily when read and in
 * bulk by {@link #releaseExpired()}. Writes that would exceed the size limit
 * trigger a compaction:</p>
 * <ol>
 *   <li>all expired entries are removed</li>
 *   <li>then entries are evicted by priority (lowest first) and earliest
 *       expiration, never touching {@link CachePriority#NEVER_REMOVE}</li>
 * </ol>
 * <p>If there is still no room the new entry is not stored.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * InMemoryCacheStore store = InMemoryCacheStore.builder()
 *     .name("quotes")
 *     .sizeLimit(512)
 *     .build();
 *
 * store.set("eur-usd", quote, CacheEntryOptions.expireAfter(Duration.ofMinutes(5)));
 * Optional<Object> cached = store.get("eur-usd");
 * }</pre>
 *
 * @since 1.0.0
 */
public class InMemoryCacheStore implements CacheStore, CacheStats, ManagedResource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);

    private static volatile InMemoryCacheStore shared;
    private static final Object SHARED_LOCK = new Object();

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();
    private final String name;
    private final long sizeLimit;
    private final Clock clock;

    // guarded by writeLock
    private long usedSize;

    // Statistics
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    private record Entry(Object value, Instant expiresAt, CachePriority priority, long size) {
        boolean isExpiredAt(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    private InMemoryCacheStore(Builder builder) {
        this.name = builder.name;
        this.sizeLimit = builder.sizeLimit;
        this.clock = builder.clock;
    }

    /**
     * Returns the process-wide store used by caching invokers that were not
     * given a store explicitly.
     */
    public static InMemoryCacheStore shared() {
        if (shared == null) {
            synchronized (SHARED_LOCK) {
                if (shared == null) {
                    shared = builder().name("tether-shared").build();
                }
            }
        }
        return shared;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<Object> get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Entry entry = entries.get(key);

        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }

        if (entry.isExpiredAt(clock.instant())) {
            removeEntry(key, entry);
            misses.increment();
            return Optional.empty();
        }

        hits.increment();
        return Optional.of(entry.value());
    }

    @Override
    public boolean contains(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Entry entry = entries.get(key);
        return entry != null && !entry.isExpiredAt(clock.instant());
    }

    @Override
    public void set(String key, Object value, CacheEntryOptions options) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(options, "options must not be null");

        if (options.size() > sizeLimit) {
            log.debug("[TETHER] Entry {} of size {} exceeds the limit of {}, not stored",
                    key, options.size(), sizeLimit);
            return;
        }

        Instant now = clock.instant();
        Entry entry = new Entry(value, now.plus(options.expireAfter()), options.priority(), options.size());

        synchronized (writeLock) {
            Entry previous = entries.remove(key);
            if (previous != null) {
                usedSize -= previous.size();
            }

            long overflow = usedSize + entry.size() - sizeLimit;
            if (overflow > 0) {
                compact(overflow, now);
            }
            if (usedSize + entry.size() > sizeLimit) {
                log.debug("[TETHER] No room for entry {} in store {}", key, name);
                return;
            }

            entries.put(key, entry);
            usedSize += entry.size();
        }
    }

    @Override
    public void remove(String key) {
        Objects.requireNonNull(key, "key must not be null");
        synchronized (writeLock) {
            Entry removed = entries.remove(key);
            if (removed != null) {
                usedSize -= removed.size();
            }
        }
    }

    @Override
    public String name() {
        return name;
    }

    // guarded by writeLock
    private void compact(long needed, Instant now) {
        long freed = 0;
        var iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            Entry entry = iterator.next();
            if (entry.isExpiredAt(now)) {
                iterator.remove();
                usedSize -= entry.size();
                freed += entry.size();
                evictions.increment();
            }
        }
        if (freed >= needed) {
            return;
        }

        List<Map.Entry<String, Entry>> candidates = entries.entrySet().stream()
                .filter(e -> e.getValue().priority() != CachePriority.NEVER_REMOVE)
                .sorted(Comparator.<Map.Entry<String, Entry>, CachePriority>comparing(e -> e.getValue().priority())
                        .thenComparing(e -> e.getValue().expiresAt()))
                .collect(Collectors.toList());

        for (Map.Entry<String, Entry> candidate : candidates) {
            if (freed >= needed) {
                break;
            }
            if (entries.remove(candidate.getKey(), candidate.getValue())) {
                usedSize -= candidate.getValue().size();
                freed += candidate.getValue().size();
                evictions.increment();
            }
        }
        log.debug("[TETHER] Compacted store {}: freed {} of {} needed size units", name, freed, needed);
    }

    private void removeEntry(String key, Entry entry) {
        synchronized (writeLock) {
            if (entries.remove(key, entry)) {
                usedSize -= entry.size();
                evictions.increment();
            }
        }
    }

    /**
     * Returns the sum of the sizes of all stored entries.
     */
    public long usedSize() {
        synchronized (writeLock) {
            return usedSize;
        }
    }

    public long getSizeLimit() {
        return sizeLimit;
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
    public OptionalLong entryCount() {
        return OptionalLong.of(entries.size());
    }

    @Override
    public void reset() {
        hits.reset();
        misses.reset();
        evictions.reset();
    }

    /**
     * Returns the statistics of this store.
     */
    public CacheStats stats() {
        return this;
    }

    // ManagedResource implementation

    @Override
    public long itemCount() {
        return entries.size();
    }

    @Override
    public long releaseAll() {
        synchronized (writeLock) {
            long count = entries.size();
            entries.clear();
            usedSize = 0;
            return count;
        }
    }

    @Override
    public long releaseExpired() {
        Instant now = clock.instant();
        long count = 0;
        synchronized (writeLock) {
            var iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                Entry entry = iterator.next();
                if (entry.isExpiredAt(now)) {
                    iterator.remove();
                    usedSize -= entry.size();
                    evictions.increment();
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Builder for InMemoryCacheStore.
     */
    public static class Builder {
        private String name = "tether-cache";
        private long sizeLimit = 1024;
        private Clock clock = Clock.systemUTC();

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        /**
         * Sets the maximum sum of entry sizes (default 1024).
         */
        public Builder sizeLimit(long sizeLimit) {
            if (sizeLimit <= 0) {
                throw new IllegalArgumentException("Size limit must be positive");
            }
            this.sizeLimit = sizeLimit;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public InMemoryCacheStore build() {
            return new InMemoryCacheStore(this);
        }
    }
}

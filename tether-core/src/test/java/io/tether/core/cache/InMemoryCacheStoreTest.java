package io.tether.core.cache;

import io.tether.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InMemoryCacheStore")
class InMemoryCacheStoreTest {

    private static final Duration TTL = Duration.ofMinutes(1);

    private MutableClock clock;
    private InMemoryCacheStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingNow();
        store = InMemoryCacheStore.builder()
                .name("test-store")
                .sizeLimit(10)
                .clock(clock)
                .build();
    }

    private static CacheEntryOptions options(CachePriority priority, long size) {
        return new CacheEntryOptions(TTL, priority, size);
    }

    // ========================================================================
    // BASIC OPERATIONS
    // ========================================================================

    @Nested
    @DisplayName("Basic Operations")
    class BasicOperations {

        @Test
        @DisplayName("should return a stored value")
        void shouldGetStoredValue() {
            store.set("quote", 42, CacheEntryOptions.expireAfter(TTL));

            assertThat(store.get("quote")).contains(42);
            assertThat(store.contains("quote")).isTrue();
        }

        @Test
        @DisplayName("should return empty for an unknown key")
        void shouldMissUnknownKey() {
            assertThat(store.get("missing")).isEmpty();
            assertThat(store.contains("missing")).isFalse();
        }

        @Test
        @DisplayName("should replace the value of an existing key")
        void shouldReplaceValue() {
            store.set("quote", 1, options(CachePriority.NORMAL, 3));
            store.set("quote", 2, options(CachePriority.NORMAL, 4));

            assertThat(store.get("quote")).contains(2);
            assertThat(store.usedSize()).isEqualTo(4);
        }

        @Test
        @DisplayName("should remove a value")
        void shouldRemoveValue() {
            store.set("quote", 1, CacheEntryOptions.expireAfter(TTL));

            store.remove("quote");

            assertThat(store.get("quote")).isEmpty();
            assertThat(store.usedSize()).isZero();
        }

        @Test
        @DisplayName("should reject null values")
        void shouldRejectNullValue() {
            assertThatNullPointerException()
                    .isThrownBy(() -> store.set("quote", null, CacheEntryOptions.expireAfter(TTL)));
        }
    }

    // ========================================================================
    // EXPIRATION
    // ========================================================================

    @Nested
    @DisplayName("Expiration")
    class Expiration {

        @Test
        @DisplayName("should serve the entry until it expires")
        void shouldServeUntilExpiry() {
            store.set("quote", 42, CacheEntryOptions.expireAfter(TTL));

            clock.advance(TTL.minusSeconds(1));
            assertThat(store.get("quote")).contains(42);

            clock.advance(Duration.ofSeconds(1));
            assertThat(store.get("quote")).isEmpty();
            assertThat(store.entryCount()).hasValue(0);
        }

        @Test
        @DisplayName("should use absolute expiration, reads do not extend it")
        void shouldNotSlide() {
            store.set("quote", 42, CacheEntryOptions.expireAfter(TTL));

            clock.advance(Duration.ofSeconds(30));
            store.get("quote");
            clock.advance(Duration.ofSeconds(30));

            assertThat(store.get("quote")).isEmpty();
        }

        @Test
        @DisplayName("should release only expired entries")
        void shouldReleaseExpired() {
            store.set("short", 1, new CacheEntryOptions(Duration.ofSeconds(5), CachePriority.NORMAL, 1));
            store.set("long", 2, CacheEntryOptions.expireAfter(TTL));
            clock.advance(Duration.ofSeconds(10));

            long released = store.releaseExpired();

            assertThat(released).isEqualTo(1);
            assertThat(store.contains("long")).isTrue();
            assertThat(store.itemCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should release all entries")
        void shouldReleaseAll() {
            store.set("a", 1, CacheEntryOptions.expireAfter(TTL));
            store.set("b", 2, CacheEntryOptions.expireAfter(TTL));

            assertThat(store.releaseAll()).isEqualTo(2);
            assertThat(store.itemCount()).isZero();
            assertThat(store.usedSize()).isZero();
        }
    }

    // ========================================================================
    // COMPACTION
    // ========================================================================

    @Nested
    @DisplayName("Compaction")
    class Compaction {

        @Test
        @DisplayName("should evict expired entries first")
        void shouldEvictExpiredFirst() {
            store.set("stale", 1, new CacheEntryOptions(Duration.ofSeconds(1), CachePriority.HIGH, 5));
            store.set("low", 2, options(CachePriority.LOW, 5));
            clock.advance(Duration.ofSeconds(2));

            store.set("fresh", 3, options(CachePriority.NORMAL, 5));

            assertThat(store.contains("low")).isTrue();
            assertThat(store.contains("fresh")).isTrue();
            assertThat(store.evictionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should evict the lowest priority entries next")
        void shouldEvictLowestPriority() {
            store.set("low", 1, options(CachePriority.LOW, 4));
            store.set("high", 2, options(CachePriority.HIGH, 4));

            store.set("normal", 3, options(CachePriority.NORMAL, 4));

            assertThat(store.contains("low")).isFalse();
            assertThat(store.contains("high")).isTrue();
            assertThat(store.contains("normal")).isTrue();
        }

        @Test
        @DisplayName("should evict the entry expiring first among equal priorities")
        void shouldEvictEarliestExpiry() {
            store.set("soon", 1, new CacheEntryOptions(Duration.ofSeconds(30), CachePriority.NORMAL, 5));
            store.set("later", 2, new CacheEntryOptions(Duration.ofMinutes(5), CachePriority.NORMAL, 5));

            store.set("new", 3, options(CachePriority.NORMAL, 5));

            assertThat(store.contains("soon")).isFalse();
            assertThat(store.contains("later")).isTrue();
        }

        @Test
        @DisplayName("should never evict NEVER_REMOVE entries")
        void shouldKeepNeverRemove() {
            store.set("pinned", 1, options(CachePriority.NEVER_REMOVE, 8));

            store.set("other", 2, options(CachePriority.HIGH, 5));

            assertThat(store.contains("pinned")).isTrue();
            assertThat(store.contains("other")).isFalse();
            assertThat(store.usedSize()).isEqualTo(8);
        }

        @Test
        @DisplayName("should not store an entry larger than the limit")
        void shouldSkipOversizedEntry() {
            store.set("small", 1, options(CachePriority.LOW, 2));

            store.set("huge", 2, options(CachePriority.HIGH, 11));

            assertThat(store.contains("huge")).isFalse();
            assertThat(store.contains("small")).isTrue();
        }
    }

    // ========================================================================
    // STATISTICS
    // ========================================================================

    @Nested
    @DisplayName("Statistics")
    class Statistics {

        @Test
        @DisplayName("should count hits and misses")
        void shouldCountHitsAndMisses() {
            store.set("quote", 42, CacheEntryOptions.expireAfter(TTL));

            store.get("quote");
            store.get("quote");
            store.get("missing");

            assertThat(store.stats().hitCount()).isEqualTo(2);
            assertThat(store.stats().missCount()).isEqualTo(1);
            assertThat(store.snapshot().hitRatio()).isCloseTo(2.0 / 3.0, within(0.001));
        }

        @Test
        @DisplayName("should not count contains() as a lookup")
        void shouldNotCountContains() {
            store.contains("missing");

            assertThat(store.snapshot().lookups()).isZero();
        }

        @Test
        @DisplayName("should reset counters")
        void shouldResetCounters() {
            store.get("missing");

            store.stats().reset();

            assertThat(store.snapshot().lookups()).isZero();
        }

        @Test
        @DisplayName("should describe the store in its snapshot")
        void shouldDescribeSnapshot() {
            store.set("quote", 42, CacheEntryOptions.expireAfter(TTL));
            store.get("quote");
            store.get("quote");
            store.get("quote");
            store.get("missing");

            assertThat(store.snapshot().store()).isEqualTo(store.name());
            assertThat(store.snapshot())
                    .hasToString(store.name() + "[lookups=4, hitRatio=75.0%, evictions=0, entries=1]");
        }
    }

    @Test
    @DisplayName("should return the same shared store every time")
    void shouldShareProcessWideStore() {
        assertThat(InMemoryCacheStore.shared()).isSameAs(InMemoryCacheStore.shared());
        assertThat(InMemoryCacheStore.shared().name()).isEqualTo("tether-shared");
    }

    @Test
    @DisplayName("should stay within its size limit under concurrent writes")
    void shouldRespectLimitConcurrently() throws InterruptedException {
        InMemoryCacheStore bounded = InMemoryCacheStore.builder().sizeLimit(100).build();
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            int thread = t;
            executor.submit(() -> {
                try {
                    for (int i = 0; i < 500; i++) {
                        bounded.set("key-" + thread + "-" + i, i, CacheEntryOptions.expireAfter(TTL));
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(bounded.usedSize()).isLessThanOrEqualTo(100);
        assertThat(bounded.entryCount()).hasValue(bounded.usedSize());
    }

    @Test
    @DisplayName("should reject invalid entry options")
    void shouldValidateOptions() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new CacheEntryOptions(Duration.ZERO, CachePriority.NORMAL, 1));
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new CacheEntryOptions(TTL, CachePriority.NORMAL, 0));
        assertThatNullPointerException()
                .isThrownBy(() -> new CacheEntryOptions(TTL, null, 1));
    }
}

package io.tether.core.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sweeps expired entries out of registered {@link ManagedResource}s.
 *
 * <p>Cache stores expire entries lazily on read. A store holding results for
 * client types that are no longer called would keep them until compaction;
 * this manager releases them on a fixed interval instead.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * TetherResourceManager manager = TetherResourceManager.builder()
 *     .sweepInterval(Duration.ofSeconds(60))
 *     .build();
 *
 * manager.register(InMemoryCacheStore.shared());
 *
 * // On shutdown
 * manager.close();
 * }</pre>
 *
 * @since 1.0.0
 */
public class TetherResourceManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TetherResourceManager.class);

    private final Map<String, ManagedResource> resources = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final ScheduledFuture<?> sweepTask;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong totalReleasedItems = new AtomicLong(0);

    private TetherResourceManager(Builder builder) {
        long sweepIntervalMillis = builder.sweepInterval.toMillis();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tether-resource-manager");
            t.setDaemon(true);
            return t;
        });
        this.sweepTask = scheduler.scheduleAtFixedRate(
                this::periodicSweep,
                sweepIntervalMillis,
                sweepIntervalMillis,
                TimeUnit.MILLISECONDS
        );
        log.info("[TETHER] ResourceManager started - sweepInterval={}ms", sweepIntervalMillis);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers a resource. A resource with the same name is replaced.
     */
    public void register(ManagedResource resource) {
        if (resource == null || resource.name() == null) {
            throw new IllegalArgumentException("resource and its name must not be null");
        }
        resources.put(resource.name(), resource);
        log.debug("[TETHER] Resource registered: {}", resource.name());
    }

    /**
     * Deregisters a resource.
     * @return the removed resource, or null if not found
     */
    public ManagedResource deregister(String name) {
        ManagedResource removed = resources.remove(name);
        if (removed != null) {
            log.debug("[TETHER] Resource deregistered: {}", name);
        }
        return removed;
    }

    /**
     * Returns the number of registered resources.
     */
    public int resourceCount() {
        return resources.size();
    }

    /**
     * Returns the total item count across all resources.
     */
    public long totalItemCount() {
        return resources.values().stream()
                .mapToLong(ManagedResource::itemCount)
                .sum();
    }

    /**
     * Returns the number of items released since this manager started.
     */
    public long totalReleasedItems() {
        return totalReleasedItems.get();
    }

    /**
     * Releases expired entries from all resources.
     * <p>A failing resource is logged and skipped; the others are still swept.</p>
     * @return total items released
     */
    public long releaseExpired() {
        long released = 0;
        for (ManagedResource resource : resources.values()) {
            try {
                long count = resource.releaseExpired();
                released += count;
                if (count > 0) {
                    log.debug("[TETHER] Released {} expired items from {}", count, resource.name());
                }
            } catch (RuntimeException e) {
                log.warn("[TETHER] Error releasing expired from {}: {}", resource.name(), e.getMessage());
            }
        }
        if (released > 0) {
            totalReleasedItems.addAndGet(released);
            log.info("[TETHER] Sweep released {} expired items", released);
        }
        return released;
    }

    /**
     * Releases every entry from all resources.
     * @return total items released
     */
    public long releaseAll() {
        long released = 0;
        for (ManagedResource resource : resources.values()) {
            try {
                long count = resource.releaseAll();
                released += count;
                if (count > 0) {
                    log.info("[TETHER] Released {} items from {} (full cleanup)", count, resource.name());
                }
            } catch (RuntimeException e) {
                log.warn("[TETHER] Error releasing from {}: {}", resource.name(), e.getMessage());
            }
        }
        totalReleasedItems.addAndGet(released);
        return released;
    }

    private void periodicSweep() {
        if (!running.get()) return;
        try {
            releaseExpired();
        } catch (RuntimeException e) {
            log.error("[TETHER] Error in periodic sweep", e);
        }
    }

    /**
     * Returns true until {@link #close()} has been called.
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops sweeping. Registered resources keep their entries.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("[TETHER] ResourceManager shutting down...");
            sweepTask.cancel(false);
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            resources.clear();
            log.info("[TETHER] ResourceManager shutdown complete");
        }
    }

    /**
     * Builder for TetherResourceManager.
     */
    public static class Builder {
        private Duration sweepInterval = Duration.ofSeconds(60);

        /**
         * Sets the interval between two sweeps of expired entries.
         */
        public Builder sweepInterval(Duration sweepInterval) {
            if (sweepInterval == null || sweepInterval.isNegative() || sweepInterval.isZero()) {
                throw new IllegalArgumentException("sweepInterval must be positive");
            }
            this.sweepInterval = sweepInterval;
            return this;
        }

        public TetherResourceManager build() {
            return new TetherResourceManager(this);
        }
    }
}

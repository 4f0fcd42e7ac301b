package io.cachet.core.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background maintenance for caches.
 *
 * <p>Stores purge dead entries lazily, so an entry nobody reads again stays in memory
 * until the store fills up. The janitor calls {@link ManagedResource#releaseExpired()}
 * on every registered resource at a fixed interval, and can optionally release
 * resources that have been idle for too long.</p>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Periodic dead entry purge (default: every 60 seconds)</li>
 *   <li>Optional idle-based full release (disabled by default)</li>
 *   <li>Metrics for monitoring</li>
 *   <li>Thread-safe resource registration/deregistration</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CacheJanitor janitor = CacheJanitor.builder()
 *     .cleanupInterval(Duration.ofSeconds(30))
 *     .build();
 *
 * janitor.register(pageCache);
 *
 * // On shutdown
 * janitor.close();
 * }</pre>
 *
 * @since 1.0.0
 */
public class CacheJanitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CacheJanitor.class);

    private final Map<String, ManagedResource> resources = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final long cleanupIntervalMillis;
    private final long idleTimeoutMillis;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong totalReleasedItems = new AtomicLong(0);
    private final AtomicLong cleanupRuns = new AtomicLong(0);

    private ScheduledFuture<?> cleanupTask;

    private CacheJanitor(Builder builder) {
        this.cleanupIntervalMillis = builder.cleanupInterval.toMillis();
        this.idleTimeoutMillis = builder.idleTimeout != null ? builder.idleTimeout.toMillis() : -1;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cachet-janitor");
            t.setDaemon(true);
            return t;
        });

        startScheduledTasks();
        log.info("[CACHET] Janitor started - cleanupInterval={}ms, idleTimeout={}",
                cleanupIntervalMillis, idleTimeoutMillis < 0 ? "disabled" : idleTimeoutMillis + "ms");
    }

    /**
     * Creates a new builder.
     * @return new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers a resource for maintenance.
     * @param resource the resource to maintain
     */
    public void register(ManagedResource resource) {
        if (resource == null || resource.name() == null) {
            throw new IllegalArgumentException("resource and its name must not be null");
        }
        resources.put(resource.name(), resource);
        log.debug("[CACHET] Resource registered: {}", resource.name());
    }

    /**
     * Deregisters a resource.
     * @param name the resource name
     * @return the removed resource, or null if not found
     */
    public ManagedResource deregister(String name) {
        ManagedResource removed = resources.remove(name);
        if (removed != null) {
            log.debug("[CACHET] Resource deregistered: {}", name);
        }
        return removed;
    }

    /**
     * Returns the total item count across all resources.
     * @return total items
     */
    public long totalItemCount() {
        return resources.values().stream()
                .mapToLong(ManagedResource::itemCount)
                .sum();
    }

    /**
     * Purges dead entries from all resources.
     * @return number of items released
     */
    public long releaseExpired() {
        long released = 0;
        for (ManagedResource resource : resources.values()) {
            try {
                long count = resource.releaseExpired();
                released += count;
                if (count > 0) {
                    log.debug("[CACHET] Released {} dead entries from: {}", count, resource.name());
                }
            } catch (RuntimeException e) {
                log.warn("[CACHET] Error releasing dead entries from {}: {}", resource.name(), e.getMessage());
            }
        }
        totalReleasedItems.addAndGet(released);
        cleanupRuns.incrementAndGet();
        return released;
    }

    /**
     * Releases every resource that has been idle longer than the idle timeout.
     * Does nothing when idle release is disabled.
     * @return number of items released
     */
    public long releaseIdle() {
        if (idleTimeoutMillis < 0) {
            return 0;
        }
        long released = 0;
        for (ManagedResource resource : resources.values()) {
            if (resource.isEmpty() || !resource.isIdleSince(idleTimeoutMillis)) {
                continue;
            }
            try {
                long count = resource.releaseAll();
                released += count;
                log.info("[CACHET] Released {} items from idle resource: {}", count, resource.name());
            } catch (RuntimeException e) {
                log.warn("[CACHET] Error releasing idle resource {}: {}", resource.name(), e.getMessage());
            }
        }
        totalReleasedItems.addAndGet(released);
        return released;
    }

    /**
     * Returns metrics about this janitor.
     * @return metrics snapshot
     */
    public Metrics getMetrics() {
        return new Metrics(
                resources.size(),
                totalItemCount(),
                totalReleasedItems.get(),
                cleanupRuns.get()
        );
    }

    /**
     * Returns a snapshot of all maintained resources.
     * @return list of resource snapshots
     */
    public List<ResourceSnapshot> getResourceSnapshots() {
        List<ResourceSnapshot> snapshots = new ArrayList<>();
        for (ManagedResource resource : resources.values()) {
            snapshots.add(new ResourceSnapshot(
                    resource.name(),
                    resource.itemCount(),
                    resource.lastAccessTimeMillis()
            ));
        }
        return snapshots;
    }

    private void startScheduledTasks() {
        cleanupTask = scheduler.scheduleAtFixedRate(
                this::periodicCleanup,
                cleanupIntervalMillis,
                cleanupIntervalMillis,
                TimeUnit.MILLISECONDS
        );
    }

    private void periodicCleanup() {
        if (!running.get()) return;
        try {
            releaseExpired();
            releaseIdle();
        } catch (Exception e) {
            log.error("[CACHET] Error in periodic cleanup", e);
        }
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            if (cleanupTask != null) {
                cleanupTask.cancel(false);
            }

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
            log.info("[CACHET] Janitor shutdown complete");
        }
    }

    /**
     * Metrics snapshot.
     */
    public record Metrics(
            int resourceCount,
            long totalItems,
            long totalReleasedItems,
            long cleanupRuns
    ) {}

    /**
     * Resource snapshot for monitoring.
     */
    public record ResourceSnapshot(
            String name,
            long itemCount,
            long lastAccessMillis
    ) {}

    /**
     * Builder for CacheJanitor.
     */
    public static class Builder {
        private Duration cleanupInterval = Duration.ofSeconds(60);
        private Duration idleTimeout;

        /**
         * Sets the interval for periodic dead entry cleanup.
         * @param cleanupInterval cleanup interval duration
         * @return this builder
         */
        public Builder cleanupInterval(Duration cleanupInterval) {
            if (cleanupInterval == null || cleanupInterval.isNegative() || cleanupInterval.isZero()) {
                throw new IllegalArgumentException("Cleanup interval must be positive");
            }
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        /**
         * Enables full release of resources idle for longer than {@code idleTimeout}.
         * @param idleTimeout idle timeout duration
         * @return this builder
         */
        public Builder idleTimeout(Duration idleTimeout) {
            if (idleTimeout == null || idleTimeout.isNegative() || idleTimeout.isZero()) {
                throw new IllegalArgumentException("Idle timeout must be positive");
            }
            this.idleTimeout = idleTimeout;
            return this;
        }

        /**
         * Builds the janitor and starts its schedule.
         * @return new janitor instance
         */
        public CacheJanitor build() {
            return new CacheJanitor(this);
        }
    }
}

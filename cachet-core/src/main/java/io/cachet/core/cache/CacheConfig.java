package io.cachet.core.cache;

import io.cachet.core.store.ConcurrentMapStore;
import io.cachet.core.watch.PollingFileWatcher;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration for cache providers.
 *
 * <p>Use the builder pattern for fluent configuration:</p>
 * <pre>{@code
 * CacheConfig config = CacheConfig.builder()
 *     .name("templates")
 *     .maxSize(5_000)
 *     .watchMode(CacheConfig.WatchMode.POLLING)
 *     .pollInterval(Duration.ofSeconds(1))
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public record CacheConfig(
        String name,
        int maxSize,
        WatchMode watchMode,
        Duration pollInterval
) {

    /**
     * How dependency files are observed when no watcher is supplied explicitly.
     */
    public enum WatchMode {
        /** Platform file system events ({@link io.cachet.core.watch.NioFileWatcher}) */
        NATIVE,
        /** Periodic fingerprint comparison ({@link io.cachet.core.watch.PollingFileWatcher}) */
        POLLING
    }

    public CacheConfig {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (watchMode == null) {
            watchMode = WatchMode.NATIVE;
        }
    }

    /**
     * Creates a new builder for CacheConfig.
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a default configuration with the given name.
     * @param name the cache name
     * @return default configuration
     */
    public static CacheConfig defaultConfig(String name) {
        return builder().name(name).build();
    }

    /**
     * Builder for CacheConfig.
     */
    public static class Builder {
        private String name = "cache";
        private int maxSize = ConcurrentMapStore.DEFAULT_MAX_SIZE;
        private WatchMode watchMode = WatchMode.NATIVE;
        private Duration pollInterval = PollingFileWatcher.DEFAULT_POLL_INTERVAL;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder watchMode(WatchMode watchMode) {
            this.watchMode = watchMode;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public CacheConfig build() {
            return new CacheConfig(name, maxSize, watchMode, pollInterval);
        }
    }
}

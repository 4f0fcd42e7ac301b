package io.cachet.core;

import io.cachet.core.cache.CacheConfig;
import io.cachet.core.cache.MemoryCacheProvider;
import io.cachet.core.lifecycle.CacheJanitor;

/**
 * Main entry point for the Cachet caching library.
 *
 * <p>Provides fluent builders for cache providers and their background maintenance.
 * Nothing here is global: every call creates a new instance owned by the caller.</p>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * // Cache with default in-process store and native file watching
 * MemoryCacheProvider cache = Cachet.provider()
 *     .name("pages")
 *     .maxSize(1000)
 *     .build();
 *
 * cache.set("page:home", homePage, 10);
 * cache.set("template:main", template, Path.of("templates/main.html"));
 *
 * // Periodic purge of dead entries
 * CacheJanitor janitor = Cachet.janitor()
 *     .cleanupInterval(Duration.ofSeconds(30))
 *     .build();
 * janitor.register(cache);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Cachet {

    /** Cachet version */
    public static final String VERSION = "1.0.0-SNAPSHOT";

    private Cachet() {
        // Static utility class
    }

    /**
     * Creates a cache provider builder with default configuration.
     *
     * @return provider builder
     */
    public static MemoryCacheProvider.Builder provider() {
        return MemoryCacheProvider.builder();
    }

    /**
     * Creates a cache provider builder from a configuration.
     *
     * @param config the configuration
     * @return provider builder
     */
    public static MemoryCacheProvider.Builder provider(CacheConfig config) {
        return MemoryCacheProvider.builder().config(config);
    }

    /**
     * Creates a janitor builder.
     *
     * @return janitor builder
     */
    public static CacheJanitor.Builder janitor() {
        return CacheJanitor.builder();
    }
}

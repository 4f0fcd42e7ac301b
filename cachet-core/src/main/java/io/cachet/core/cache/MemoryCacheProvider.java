package io.cachet.core.cache;

import io.cachet.core.lifecycle.ManagedResource;
import io.cachet.core.stats.CacheStats;
import io.cachet.core.store.CacheEntry;
import io.cachet.core.store.CacheStore;
import io.cachet.core.store.ConcurrentMapStore;
import io.cachet.core.store.RemovalCause;
import io.cachet.core.store.Retention;
import io.cachet.core.watch.FileWatcher;
import io.cachet.core.watch.NioFileWatcher;
import io.cachet.core.watch.PollingFileWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * {@link CacheProvider} over an in-process {@link CacheStore}.
 *
 * <p>The provider validates every call, turns the caller's retention intent into a
 * {@link Retention} and delegates storage to the store. It adds no lock of its own:
 * the store is thread-safe and each operation touches a single key, except pattern
 * removal, which works on a snapshot of the keys and may miss entries written
 * concurrently.</p>
 *
 * <p>File-dependent entries are bound to a one-shot watch. When the file changes the
 * watcher thread marks the dependency invalidated, which hides the entry from readers
 * immediately, and then removes that exact entry from the store. A replacement stored
 * under the same key in the meantime is not affected.</p>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Absolute expiry and file-dependency invalidation</li>
 *   <li>Typed reads with primitive defaults for missing keys</li>
 *   <li>Regex-based bulk removal</li>
 *   <li>Async variants on a configurable executor</li>
 *   <li>Lock-free statistics with LongAdder</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * MemoryCacheProvider cache = MemoryCacheProvider.builder()
 *     .config(CacheConfig.defaultConfig("settings"))
 *     .asyncExecutor(ioExecutor)
 *     .build();
 *
 * cache.set("settings", parsedSettings, Path.of("conf/settings.yml"));
 * Settings settings = cache.get("settings", Settings.class);
 * }</pre>
 *
 * @since 1.0.0
 */
public class MemoryCacheProvider implements CacheProvider, CacheStats, ManagedResource {

    private static final Logger log = LoggerFactory.getLogger(MemoryCacheProvider.class);

    private static final Duration MAX_TTL = Duration.ofSeconds(Long.MAX_VALUE);

    private final String name;
    private final CacheStore store;
    private final FileWatcher fileWatcher;
    private final boolean ownsFileWatcher;
    private final Executor asyncExecutor;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong lastAccessMillis = new AtomicLong(System.currentTimeMillis());

    // Statistics
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder invalidations = new LongAdder();
    // Every EXPIRED removal reported by the store, invalidated dependencies included
    private final LongAdder purged = new LongAdder();

    private MemoryCacheProvider(Builder builder) {
        CacheConfig config = builder.config;
        this.name = config.name();
        this.clock = builder.clock;
        this.asyncExecutor = builder.asyncExecutor;
        this.store = builder.store != null
                ? builder.store
                : new ConcurrentMapStore(config.maxSize(), clock);

        if (builder.fileWatcher != null) {
            this.fileWatcher = builder.fileWatcher;
            this.ownsFileWatcher = false;
        } else {
            this.fileWatcher = config.watchMode() == CacheConfig.WatchMode.POLLING
                    ? new PollingFileWatcher(config.pollInterval())
                    : new NioFileWatcher("cachet-file-watcher-" + name);
            this.ownsFileWatcher = true;
        }

        store.addRemovalListener(this::onStoreRemoval);
        log.info("[CACHET] Cache '{}' created - store={}, watcher={}",
                name, store.getClass().getSimpleName(), fileWatcher.getClass().getSimpleName());
    }

    /**
     * Creates a new builder for MemoryCacheProvider.
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // READS
    // ========================================================================

    @Override
    public <T> T get(String key, Class<T> type) {
        CacheLookup<T> lookup = lookup(key, type);
        switch (lookup.status()) {
            case FOUND:
                return lookup.value();
            case TYPE_MISMATCH:
                throw new CacheTypeMismatchException(key, type, lookup.actualType());
            default:
                return CacheValues.defaultValue(type);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> CacheLookup<T> lookup(String key, Class<T> type) {
        requireKey(key);
        requireType(type);
        ensureOpen();
        touch();

        Optional<CacheEntry> entry = liveEntry(key);
        if (entry.isEmpty()) {
            misses.increment();
            return CacheLookup.notFound();
        }

        Object value = entry.get().value();
        if (!CacheValues.boxed(type).isInstance(value)) {
            return CacheLookup.typeMismatch(value.getClass());
        }

        hits.increment();
        return CacheLookup.found((T) value);
    }

    @Override
    public boolean isSet(String key) {
        requireKey(key);
        ensureOpen();
        touch();
        return liveEntry(key).isPresent();
    }

    // ========================================================================
    // WRITES
    // ========================================================================

    @Override
    public void set(String key, Object value, long ttlMinutes) {
        if (ttlMinutes < 0) {
            throw new IllegalArgumentException("ttlMinutes must not be negative");
        }
        set(key, value, ttlMinutes > MAX_TTL.toMinutes() ? MAX_TTL : Duration.ofMinutes(ttlMinutes));
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        requireKey(key);
        requireValue(value);
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be null or negative");
        }
        ensureOpen();
        if (!CacheValues.hasData(value)) {
            log.debug("[CACHET] Skipping empty value for key {}", key);
            return;
        }

        Instant now = clock.instant();
        Retention retention = new Retention.AbsoluteExpiry(expiryFor(now, ttl));
        store.insert(key, new CacheEntry(key, value, retention, now));
        touch();
        log.debug("[CACHET] Set {} in '{}' with ttl {}", key, name, ttl);
    }

    @Override
    public void set(String key, Object value, String dependencyFile) {
        requireKey(key);
        requireValue(value);
        set(key, value, toDependencyPath(dependencyFile));
    }

    @Override
    public void set(String key, Object value, Path dependencyFile) {
        requireKey(key);
        requireValue(value);
        Path file = requireDependencyFile(dependencyFile);
        ensureOpen();
        if (!CacheValues.hasData(value)) {
            log.debug("[CACHET] Skipping empty value for key {}", key);
            return;
        }

        Retention.FileDependency dependency = new Retention.FileDependency(file);
        CacheEntry entry = new CacheEntry(key, value, dependency, clock.instant());
        entry.attachWatch(fileWatcher.watch(file, () -> onDependencyChanged(entry, dependency)));
        // A file deleted before the watch took its baseline would never be reported
        if (!Files.isRegularFile(file)) {
            entry.releaseWatch();
            throw new DependencyFileNotFoundException(file);
        }
        store.insert(key, entry);
        touch();
        log.debug("[CACHET] Set {} in '{}' depending on {}", key, name, file);
    }

    // ========================================================================
    // REMOVAL
    // ========================================================================

    @Override
    public void remove(String key) {
        requireKey(key);
        ensureOpen();
        touch();
        if (store.remove(key)) {
            log.debug("[CACHET] Removed {} from '{}'", key, name);
        }
    }

    @Override
    public int removeByPattern(String regex) {
        if (regex == null || regex.isEmpty()) {
            throw new IllegalArgumentException("pattern must not be null or empty");
        }
        return removeByPattern(Pattern.compile(regex));
    }

    @Override
    public int removeByPattern(Pattern pattern) {
        if (pattern == null) {
            throw new IllegalArgumentException("pattern must not be null");
        }
        ensureOpen();
        touch();

        // Key names only: dead entries that are still stored match too
        int removed = 0;
        for (String key : store.keys()) {
            if (pattern.matcher(key).find() && store.remove(key)) {
                removed++;
            }
        }
        log.debug("[CACHET] Removed {} entries matching '{}' from '{}'", removed, pattern.pattern(), name);
        return removed;
    }

    @Override
    public void clear() {
        ensureOpen();
        store.clear();
        touch();
    }

    // ========================================================================
    // ASYNC VARIANTS
    // ========================================================================

    @Override
    public <T> CompletableFuture<T> getAsync(String key, Class<T> type) {
        requireKey(key);
        requireType(type);
        return supply(() -> get(key, type));
    }

    @Override
    public CompletableFuture<Boolean> isSetAsync(String key) {
        requireKey(key);
        return supply(() -> isSet(key));
    }

    @Override
    public CompletableFuture<Void> setAsync(String key, Object value, long ttlMinutes) {
        requireKey(key);
        requireValue(value);
        if (ttlMinutes < 0) {
            throw new IllegalArgumentException("ttlMinutes must not be negative");
        }
        return run(() -> set(key, value, ttlMinutes));
    }

    @Override
    public CompletableFuture<Void> setAsync(String key, Object value, String dependencyFile) {
        requireKey(key);
        requireValue(value);
        return setAsync(key, value, toDependencyPath(dependencyFile));
    }

    @Override
    public CompletableFuture<Void> setAsync(String key, Object value, Path dependencyFile) {
        requireKey(key);
        requireValue(value);
        Path file = requireDependencyFile(dependencyFile);
        return run(() -> set(key, value, file));
    }

    @Override
    public CompletableFuture<Void> removeAsync(String key) {
        requireKey(key);
        return run(() -> remove(key));
    }

    @Override
    public CompletableFuture<Integer> removeByPatternAsync(String regex) {
        if (regex == null || regex.isEmpty()) {
            throw new IllegalArgumentException("pattern must not be null or empty");
        }
        Pattern pattern = Pattern.compile(regex);
        return supply(() -> removeByPattern(pattern));
    }

    // ========================================================================
    // STATISTICS
    // ========================================================================

    @Override
    public long size() {
        return store.size();
    }

    @Override
    public CacheStats stats() {
        return this;
    }

    @Override
    public String name() {
        return name;
    }

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
    public long invalidationCount() {
        return invalidations.sum();
    }

    @Override
    public void reset() {
        hits.reset();
        misses.reset();
        evictions.reset();
        invalidations.reset();
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    @Override
    public long itemCount() {
        return store.size();
    }

    @Override
    public long releaseAll() {
        long count = store.size();
        store.clear();
        return count;
    }

    @Override
    public long releaseExpired() {
        Instant now = clock.instant();
        long purgedBefore = purged.sum();
        long released = 0;
        // Stores may purge dead entries during lookup; those are reported as EXPIRED
        for (String key : store.keys()) {
            Optional<CacheEntry> entry = store.lookup(key);
            if (entry.isPresent() && !entry.get().isLive(now) && store.remove(key, entry.get())) {
                released++;
            }
        }
        store.cleanUp();
        return released + (purged.sum() - purgedBefore);
    }

    @Override
    public long lastAccessTimeMillis() {
        return lastAccessMillis.get();
    }

    /**
     * Returns the file watcher used for dependency entries.
     * @return file watcher
     */
    public FileWatcher getFileWatcher() {
        return fileWatcher;
    }

    /**
     * Returns the underlying store.
     * @return store
     */
    public CacheStore getStore() {
        return store;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            store.close();
            if (ownsFileWatcher) {
                fileWatcher.close();
            }
            log.info("[CACHET] Cache '{}' closed", name);
        }
    }

    // ========================================================================
    // INTERNALS
    // ========================================================================

    private Optional<CacheEntry> liveEntry(String key) {
        Instant now = clock.instant();
        return store.lookup(key).filter(entry -> entry.isLive(now));
    }

    private void onDependencyChanged(CacheEntry entry, Retention.FileDependency dependency) {
        if (!dependency.invalidate()) {
            return;
        }
        invalidations.increment();
        boolean removed = store.remove(entry.key(), entry);
        log.debug("[CACHET] Dependency {} changed, invalidated {} in '{}' (removed={})",
                dependency.file(), entry.key(), name, removed);
    }

    private void onStoreRemoval(String key, CacheEntry entry, RemovalCause cause) {
        if (entry != null) {
            entry.releaseWatch();
        }
        if (cause == RemovalCause.EXPIRED) {
            purged.increment();
        }
        // An invalidated dependency is already counted as an invalidation
        if (cause.wasEvicted() && !isInvalidatedDependency(entry)) {
            evictions.increment();
        }
    }

    private static boolean isInvalidatedDependency(CacheEntry entry) {
        return entry != null
                && entry.retention() instanceof Retention.FileDependency
                && ((Retention.FileDependency) entry.retention()).isInvalidated();
    }

    private <R> CompletableFuture<R> supply(Supplier<R> operation) {
        return CompletableFuture.supplyAsync(operation, asyncExecutor);
    }

    private CompletableFuture<Void> run(Runnable operation) {
        return CompletableFuture.runAsync(operation, asyncExecutor);
    }

    private void touch() {
        lastAccessMillis.set(System.currentTimeMillis());
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Cache '" + name + "' is closed");
        }
    }

    private static Instant expiryFor(Instant now, Duration ttl) {
        try {
            return now.plus(ttl);
        } catch (DateTimeException | ArithmeticException e) {
            return Instant.MAX;
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be null or empty");
        }
    }

    private static void requireType(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
    }

    private static void requireValue(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
    }

    private static Path toDependencyPath(String dependencyFile) {
        if (dependencyFile == null || dependencyFile.isBlank()) {
            throw new IllegalArgumentException("dependencyFile must not be null or empty");
        }
        return Path.of(dependencyFile);
    }

    private static Path requireDependencyFile(Path dependencyFile) {
        if (dependencyFile == null) {
            throw new IllegalArgumentException("dependencyFile must not be null");
        }
        if (!Files.isRegularFile(dependencyFile)) {
            throw new DependencyFileNotFoundException(dependencyFile);
        }
        return dependencyFile;
    }

    /**
     * Builder for MemoryCacheProvider.
     */
    public static class Builder {
        private CacheConfig config = CacheConfig.defaultConfig("cache");
        private CacheStore store;
        private FileWatcher fileWatcher;
        private Executor asyncExecutor = Runnable::run;
        private Clock clock = Clock.systemUTC();

        /**
         * Applies a configuration. Explicit collaborators set on this builder take precedence.
         */
        public Builder config(CacheConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder name(String name) {
            this.config = new CacheConfig(name, config.maxSize(), config.watchMode(), config.pollInterval());
            return this;
        }

        public Builder maxSize(int maxSize) {
            this.config = new CacheConfig(config.name(), maxSize, config.watchMode(), config.pollInterval());
            return this;
        }

        /**
         * Uses the given store instead of a {@link ConcurrentMapStore}. The provider closes it on close.
         */
        public Builder store(CacheStore store) {
            this.store = Objects.requireNonNull(store, "store must not be null");
            return this;
        }

        /**
         * Uses the given watcher. The caller keeps ownership and closes it.
         */
        public Builder fileWatcher(FileWatcher fileWatcher) {
            this.fileWatcher = Objects.requireNonNull(fileWatcher, "fileWatcher must not be null");
            return this;
        }

        /**
         * Executor for the async variants. Defaults to running on the calling thread.
         */
        public Builder asyncExecutor(Executor asyncExecutor) {
            this.asyncExecutor = Objects.requireNonNull(asyncExecutor, "asyncExecutor must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public MemoryCacheProvider build() {
            return new MemoryCacheProvider(this);
        }
    }
}

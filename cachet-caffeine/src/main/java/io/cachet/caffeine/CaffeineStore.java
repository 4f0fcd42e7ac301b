package io.cachet.caffeine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalListener;
import com.github.benmanes.caffeine.cache.Ticker;
import io.cachet.core.store.CacheEntry;
import io.cachet.core.store.CacheStore;
import io.cachet.core.store.RemovalCause;
import io.cachet.core.store.StoreRemovalListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link CacheStore} backed by a Caffeine cache.
 *
 * <p>Each entry expires at its own absolute deadline through a Caffeine {@link Expiry};
 * file-dependent entries never expire by time. Size and memory pressure are handled by
 * Caffeine itself, through a maximum size and, optionally, soft-referenced values.</p>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Per-entry variable expiry</li>
 *   <li>Window TinyLFU size eviction</li>
 *   <li>Optional soft values for memory-pressure eviction</li>
 *   <li>Removal notifications on the calling thread</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CaffeineStore store = CaffeineStore.builder()
 *     .maximumSize(50_000)
 *     .softValues()
 *     .build();
 *
 * CacheProvider cache = Cachet.provider()
 *     .name("documents")
 *     .store(store)
 *     .build();
 * }</pre>
 *
 * <p>Caffeine hides expired entries from its map views, so {@link #keys()} never
 * reports a key past its deadline, even before the entry is purged. Pattern removal
 * over this store only counts live entries and invalidated file dependencies.</p>
 *
 * <p>Soft values only help time-based entries: a file-dependent entry stays strongly
 * reachable from its watch until the watch fires or is released.</p>
 *
 * @since 1.0.0
 */
public class CaffeineStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(CaffeineStore.class);

    /**
     * Default maximum size: 10,000 entries.
     */
    public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    private final Cache<String, CacheEntry> cache;
    private final Clock clock;
    private final long maximumSize;
    private final boolean softValues;
    private final List<StoreRemovalListener> listeners = new CopyOnWriteArrayList<>();

    private CaffeineStore(Builder builder) {
        this.clock = builder.clock;
        this.maximumSize = builder.maximumSize;
        this.softValues = builder.softValues;

        RemovalListener<String, CacheEntry> removalListener = this::onRemoval;
        Caffeine<String, CacheEntry> caffeine = Caffeine.newBuilder()
                .expireAfter(new RetentionExpiry(clock))
                .removalListener(removalListener)
                .executor(Runnable::run)
                .maximumSize(maximumSize);
        if (softValues) {
            caffeine.softValues();
        }
        if (builder.tickFromClock) {
            caffeine.ticker(clockTicker(clock));
        }
        this.cache = caffeine.build();
    }

    /**
     * Creates a new builder for CaffeineStore.
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void insert(String key, CacheEntry entry) {
        cache.put(key, entry);
    }

    @Override
    public Optional<CacheEntry> lookup(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public boolean contains(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        return entry != null && entry.isLive(clock.instant());
    }

    @Override
    public boolean remove(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public boolean remove(String key, CacheEntry expected) {
        return expected != null && cache.asMap().remove(key, expected);
    }

    /**
     * Returns the keys of entries that have not expired by time.
     */
    @Override
    public Set<String> keys() {
        return Set.copyOf(cache.asMap().keySet());
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    @Override
    public void cleanUp() {
        cache.cleanUp();
    }

    @Override
    public void addRemovalListener(StoreRemovalListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    @Override
    public void close() {
        cache.invalidateAll();
        cache.cleanUp();
        listeners.clear();
    }

    /**
     * Returns the configured maximum size.
     * @return maximum size
     */
    public long getMaximumSize() {
        return maximumSize;
    }

    /**
     * Returns whether values are softly referenced.
     * @return true if soft values are enabled
     */
    public boolean isSoftValues() {
        return softValues;
    }

    private void onRemoval(String key, CacheEntry entry, com.github.benmanes.caffeine.cache.RemovalCause cause) {
        RemovalCause mapped = map(cause);
        for (StoreRemovalListener listener : listeners) {
            try {
                listener.onRemoval(key, entry, mapped);
            } catch (RuntimeException e) {
                log.warn("[CACHET] Removal listener failed for key {} ({}): {}", key, mapped, e.getMessage());
            }
        }
    }

    static RemovalCause map(com.github.benmanes.caffeine.cache.RemovalCause cause) {
        switch (cause) {
            case EXPLICIT:
                return RemovalCause.EXPLICIT;
            case REPLACED:
                return RemovalCause.REPLACED;
            case EXPIRED:
                return RemovalCause.EXPIRED;
            default:
                return RemovalCause.EVICTED;
        }
    }

    /**
     * Nanoseconds until an entry's deadline; unbounded for entries without one.
     */
    static long nanosUntilDeadline(CacheEntry entry, Instant now) {
        Optional<Instant> deadline = entry.retention().deadline();
        if (deadline.isEmpty()) {
            return Long.MAX_VALUE;
        }
        if (!now.isBefore(deadline.get())) {
            return 0;
        }
        try {
            return Duration.between(now, deadline.get()).toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        };
    }

    /**
     * Expiry policy that honours each entry's own deadline.
     */
    private static final class RetentionExpiry implements Expiry<String, CacheEntry> {

        private final Clock clock;

        RetentionExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return nanosUntilDeadline(entry, clock.instant());
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return nanosUntilDeadline(entry, clock.instant());
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration; // Reads never extend an absolute deadline
        }
    }

    /**
     * Builder for CaffeineStore.
     */
    public static class Builder {
        private long maximumSize = DEFAULT_MAXIMUM_SIZE;
        private boolean softValues;
        private Clock clock = Clock.systemUTC();
        private boolean tickFromClock;

        public Builder maximumSize(long maximumSize) {
            if (maximumSize <= 0) {
                throw new IllegalArgumentException("Maximum size must be positive");
            }
            this.maximumSize = maximumSize;
            return this;
        }

        /**
         * Lets the garbage collector reclaim values under memory pressure.
         */
        public Builder softValues() {
            this.softValues = true;
            return this;
        }

        /**
         * Uses the given clock for deadlines and as Caffeine's time source.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            this.tickFromClock = true;
            return this;
        }

        public CaffeineStore build() {
            return new CaffeineStore(this);
        }
    }
}

package io.cachet.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default {@link CacheStore} backed by a bounded {@link ConcurrentHashMap}.
 *
 * <p>Dead entries are purged lazily on lookup and eagerly when the store reaches
 * its maximum size. If the store is still full after that purge, the oldest 10% of
 * entries (by creation time) are evicted to make room.</p>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Thread-safe using ConcurrentHashMap</li>
 *   <li>Lazy expiration on access</li>
 *   <li>Bounded size with oldest-first eviction</li>
 *   <li>Removal notifications for every dropped entry</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CacheStore store = new ConcurrentMapStore(5_000, Clock.systemUTC());
 * CacheProvider cache = Cachet.provider().store(store).build();
 * }</pre>
 *
 * @since 1.0.0
 */
public class ConcurrentMapStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentMapStore.class);

    /**
     * Default max size: 10,000 entries.
     */
    public static final int DEFAULT_MAX_SIZE = 10_000;

    private final ConcurrentHashMap<String, CacheEntry> entries;
    private final int maxSize;
    private final Clock clock;
    private final List<StoreRemovalListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Creates a store with {@link #DEFAULT_MAX_SIZE} and the system clock.
     */
    public ConcurrentMapStore() {
        this(DEFAULT_MAX_SIZE, Clock.systemUTC());
    }

    /**
     * Creates a store.
     *
     * @param maxSize maximum number of entries before eviction
     * @param clock clock used to decide liveness
     */
    public ConcurrentMapStore(int maxSize, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Max size must be positive");
        }
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.entries = new ConcurrentHashMap<>(Math.min(maxSize, 256));
    }

    @Override
    public void insert(String key, CacheEntry entry) {
        // Check size limit before adding
        if (entries.size() >= maxSize && !entries.containsKey(key)) {
            purgeExpired();
            // If still at capacity, evict oldest entries
            if (entries.size() >= maxSize) {
                evictOldest(Math.max(1, maxSize / 10));
            }
        }

        CacheEntry previous = entries.put(key, entry);
        if (previous != null && previous != entry) {
            notifyRemoval(key, previous, RemovalCause.REPLACED);
        }
    }

    @Override
    public Optional<CacheEntry> lookup(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }

        if (!entry.isLive(clock.instant())) {
            if (entries.remove(key, entry)) {
                notifyRemoval(key, entry, RemovalCause.EXPIRED);
            }
            return Optional.empty();
        }

        return Optional.of(entry);
    }

    @Override
    public boolean contains(String key) {
        return lookup(key).isPresent();
    }

    @Override
    public boolean remove(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed == null) {
            return false;
        }
        notifyRemoval(key, removed, RemovalCause.EXPLICIT);
        return true;
    }

    @Override
    public boolean remove(String key, CacheEntry expected) {
        if (expected == null || !entries.remove(key, expected)) {
            return false;
        }
        notifyRemoval(key, expected, RemovalCause.EXPLICIT);
        return true;
    }

    @Override
    public Set<String> keys() {
        return Set.copyOf(entries.keySet());
    }

    @Override
    public long size() {
        return entries.size();
    }

    @Override
    public void clear() {
        for (String key : keys()) {
            remove(key);
        }
    }

    @Override
    public void cleanUp() {
        purgeExpired();
    }

    @Override
    public void addRemovalListener(StoreRemovalListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    @Override
    public void close() {
        clear();
        listeners.clear();
    }

    /**
     * Removes all dead entries from the store.
     * @return number of entries purged
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int count = 0;
        for (Map.Entry<String, CacheEntry> mapping : entries.entrySet()) {
            CacheEntry entry = mapping.getValue();
            if (!entry.isLive(now) && entries.remove(mapping.getKey(), entry)) {
                notifyRemoval(mapping.getKey(), entry, RemovalCause.EXPIRED);
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the configured max size.
     * @return max size
     */
    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Evicts the oldest entries to make room for new ones.
     * @param count number of entries to evict
     */
    private void evictOldest(int count) {
        entries.entrySet().stream()
                .sorted(Comparator.comparing(mapping -> mapping.getValue().createdAt()))
                .limit(count)
                .forEach(mapping -> {
                    if (entries.remove(mapping.getKey(), mapping.getValue())) {
                        notifyRemoval(mapping.getKey(), mapping.getValue(), RemovalCause.EVICTED);
                    }
                });
    }

    private void notifyRemoval(String key, CacheEntry entry, RemovalCause cause) {
        for (StoreRemovalListener listener : listeners) {
            try {
                listener.onRemoval(key, entry, cause);
            } catch (RuntimeException e) {
                log.warn("[CACHET] Removal listener failed for key {} ({}): {}", key, cause, e.getMessage());
            }
        }
    }
}

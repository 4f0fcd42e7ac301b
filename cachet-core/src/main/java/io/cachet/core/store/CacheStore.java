package io.cachet.core.store;

import java.util.Optional;
import java.util.Set;

/**
 * In-process associative container that physically holds cache entries.
 *
 * <p>Stores are thread-safe and own their eviction policy. Callers never see
 * eviction as an error; an evicted key simply reads as absent. Every removal is
 * reported to registered {@link StoreRemovalListener}s.</p>
 *
 * @since 1.0.0
 */
public interface CacheStore extends AutoCloseable {

    /**
     * Inserts or replaces the entry for a key.
     *
     * @param key the key
     * @param entry the entry to store
     */
    void insert(String key, CacheEntry entry);

    /**
     * Returns the entry stored under a key. The entry may already be dead; the
     * store is free to purge dead entries lazily.
     *
     * @param key the key
     * @return the entry, or empty
     */
    Optional<CacheEntry> lookup(String key);

    /**
     * Returns whether a live entry is stored under a key.
     * @param key the key
     * @return true if present and live
     */
    boolean contains(String key);

    /**
     * Removes the entry for a key.
     * @param key the key
     * @return true if an entry was removed
     */
    boolean remove(String key);

    /**
     * Removes the entry for a key only if it is still {@code expected}.
     *
     * @param key the key
     * @param expected the entry to remove
     * @return true if it was removed
     */
    boolean remove(String key, CacheEntry expected);

    /**
     * Returns a point-in-time snapshot of the stored keys. Dead entries the store has
     * not purged yet may be included; a store that hides expired entries from its own
     * views leaves them out.
     * @return an unmodifiable set of keys
     */
    Set<String> keys();

    /**
     * Returns the approximate number of stored entries.
     * @return entry count
     */
    long size();

    /**
     * Removes every entry.
     */
    void clear();

    /**
     * Performs pending maintenance such as purging dead entries.
     */
    void cleanUp();

    /**
     * Registers a listener for removals.
     * @param listener the listener
     */
    void addRemovalListener(StoreRemovalListener listener);

    /**
     * Releases the store. Entries are removed and reported first.
     */
    @Override
    void close();
}

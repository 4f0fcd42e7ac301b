package io.cachet.core.store;

/**
 * Callback for entries leaving a {@link CacheStore}.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface StoreRemovalListener {

    /**
     * Called after an entry was removed.
     *
     * @param key the entry key
     * @param entry the removed entry, or null if the store no longer has it (collected values)
     * @param cause why it was removed
     */
    void onRemoval(String key, CacheEntry entry, RemovalCause cause);
}

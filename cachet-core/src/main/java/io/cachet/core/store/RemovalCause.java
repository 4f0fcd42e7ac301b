package io.cachet.core.store;

/**
 * Why a store dropped an entry.
 *
 * @since 1.0.0
 */
public enum RemovalCause {
    /** Removed by a caller, including pattern removal, clear and invalidation */
    EXPLICIT,
    /** Overwritten by a newer entry under the same key */
    REPLACED,
    /** Purged after its retention stopped being live */
    EXPIRED,
    /** Dropped by the store to relieve size or memory pressure */
    EVICTED;

    /**
     * Returns true when the store, not a caller, decided to drop the entry.
     * @return whether the removal was automatic
     */
    public boolean wasEvicted() {
        return this == EXPIRED || this == EVICTED;
    }
}

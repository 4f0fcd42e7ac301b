package io.cachet.core.lifecycle;

/**
 * Interface for resources that can be maintained by a {@link CacheJanitor}.
 *
 * <p>Implementors expose their entry count and two cleanup levels: purging dead
 * entries only, or releasing everything.</p>
 *
 * @since 1.0.0
 */
public interface ManagedResource {

    /**
     * Returns the unique name of this resource.
     * @return resource name
     */
    String name();

    /**
     * Returns the number of items/entries currently held.
     * @return item count
     */
    long itemCount();

    /**
     * Releases all resources and clears all data.
     * @return number of items cleared
     */
    long releaseAll();

    /**
     * Releases expired or invalidated entries only.
     * <p>This is a lighter cleanup that keeps live data.</p>
     * @return number of items released
     */
    long releaseExpired();

    /**
     * Returns the timestamp of the last access (read or write).
     * @return last access time in milliseconds since epoch
     */
    long lastAccessTimeMillis();

    /**
     * Returns true if this resource is currently empty.
     * @return true if empty
     */
    default boolean isEmpty() {
        return itemCount() == 0;
    }

    /**
     * Returns true if this resource has been idle for the given duration.
     * @param idleThresholdMillis idle threshold in milliseconds
     * @return true if idle
     */
    default boolean isIdleSince(long idleThresholdMillis) {
        return System.currentTimeMillis() - lastAccessTimeMillis() > idleThresholdMillis;
    }
}

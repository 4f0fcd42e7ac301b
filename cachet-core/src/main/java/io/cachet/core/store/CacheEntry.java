package io.cachet.core.store;

import io.cachet.core.watch.WatchHandle;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A single cached value together with its retention rule.
 *
 * <p>Entries are compared by identity, so a store can remove "this exact entry"
 * without touching a replacement stored later under the same key.</p>
 *
 * @since 1.0.0
 */
public final class CacheEntry {

    private final String key;
    private final Object value;
    private final Retention retention;
    private final Instant createdAt;
    private final AtomicReference<WatchHandle> watch = new AtomicReference<>();

    public CacheEntry(String key, Object value, Retention retention, Instant createdAt) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public String key() {
        return key;
    }

    public Object value() {
        return value;
    }

    public Retention retention() {
        return retention;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isLive(Instant now) {
        return retention.isLive(now);
    }

    /**
     * Binds the file watch that keeps this entry's dependency observed.
     * @param handle the watch handle
     */
    public void attachWatch(WatchHandle handle) {
        watch.set(handle);
    }

    /**
     * Cancels the attached watch, if any. Safe to call more than once.
     */
    public void releaseWatch() {
        WatchHandle handle = watch.getAndSet(null);
        if (handle != null) {
            handle.close();
        }
    }

    @Override
    public String toString() {
        return "CacheEntry[key=" + key + ", retention=" + retention + ", createdAt=" + createdAt + "]";
    }
}

package io.cachet.core.watch;

import java.nio.file.Path;

/**
 * Signals when a file's content changes, the file is deleted, or it becomes unreadable.
 *
 * <p>Every watch is one-shot: the callback runs at most once, on a thread owned by
 * the watcher, after which the handle is inactive. Implementations are thread-safe.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FileWatcher watcher = new NioFileWatcher();
 * WatchHandle handle = watcher.watch(Path.of("conf/rules.xml"), () -> reload());
 *
 * // no longer interested
 * watcher.unwatch(handle);
 * }</pre>
 *
 * @since 1.0.0
 */
public interface FileWatcher extends AutoCloseable {

    /**
     * Starts watching a file.
     *
     * @param file the file to watch
     * @param onChange callback run once when the file changes
     * @return handle used to cancel the watch
     * @throws io.cachet.core.cache.CacheException if the watch cannot be registered
     */
    WatchHandle watch(Path file, Runnable onChange);

    /**
     * Cancels a watch. Unknown or already-fired handles are ignored.
     *
     * @param handle the handle returned by {@link #watch}
     */
    default void unwatch(WatchHandle handle) {
        if (handle != null) {
            handle.close();
        }
    }

    /**
     * Stops the watcher. Pending watches are cancelled without firing.
     */
    @Override
    void close();
}

package io.cachet.core.watch;

import java.nio.file.Path;

/**
 * Registration returned by {@link FileWatcher#watch}.
 *
 * <p>Closing the handle cancels the watch. Closing is idempotent and never throws.</p>
 *
 * @since 1.0.0
 */
public interface WatchHandle extends AutoCloseable {

    /**
     * Returns the absolute, normalized path being watched.
     * @return watched file
     */
    Path file();

    /**
     * Returns true until the watch has fired or been closed.
     * @return whether the callback may still run
     */
    boolean isActive();

    @Override
    void close();
}

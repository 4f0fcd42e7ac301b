package io.cachet.core.cache;

/**
 * Base class for errors raised by Cachet caches.
 *
 * @since 1.0.0
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}

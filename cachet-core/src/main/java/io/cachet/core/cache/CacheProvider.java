package io.cachet.core.cache;

import io.cachet.core.stats.CacheStats;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Process-local key-value cache with absolute expiry, file-dependency invalidation
 * and pattern removal.
 *
 * <p>All implementations are thread-safe. Keys are non-empty, case-sensitive strings;
 * values are opaque. A missing key is a normal outcome, never an error. Malformed
 * calls fail with {@link IllegalArgumentException} before the cache is touched.</p>
 *
 * <p>Values that carry no data, meaning empty collections, maps, arrays and strings,
 * are not stored: the corresponding {@code set} call returns without doing anything,
 * so computed results can be cached without checking them first. A {@code null}
 * value is rejected.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CacheProvider cache = Cachet.provider()
 *     .name("pages")
 *     .maxSize(1000)
 *     .build();
 *
 * // Expire after 10 minutes
 * cache.set("page:home", renderedHome, 10);
 *
 * // Invalidate when the template changes
 * cache.set("template:main", template, Path.of("templates/main.html"));
 *
 * // Read back
 * Page page = cache.get("page:home", Page.class);
 *
 * // Drop a namespace
 * cache.removeByPattern("^page:");
 * }</pre>
 *
 * <p>The {@code *Async} methods have the same contract as their synchronous form. Argument
 * checks run on the calling thread and throw directly; the operation itself runs on the
 * provider's async executor and reports failures through the returned future.</p>
 *
 * @since 1.0.0
 */
public interface CacheProvider extends AutoCloseable {

    /**
     * Returns the value cached under a key.
     *
     * @param key the key
     * @param type the expected value type; primitive types are allowed
     * @param <T> the expected value type
     * @return the value, or the type's default ({@code 0}, {@code false}, {@code null})
     *         when no live entry exists
     * @throws IllegalArgumentException if key is empty or type is null
     * @throws CacheTypeMismatchException if the cached value is not a {@code type}
     */
    <T> T get(String key, Class<T> type);

    /**
     * Reads a key without throwing on a type mismatch.
     *
     * @param key the key
     * @param type the expected value type
     * @param <T> the expected value type
     * @return found, not found, or type mismatch
     * @throws IllegalArgumentException if key is empty or type is null
     */
    <T> CacheLookup<T> lookup(String key, Class<T> type);

    /**
     * Returns whether a live entry exists for a key.
     *
     * @param key the key
     * @return true if the key is cached and neither expired nor invalidated
     * @throws IllegalArgumentException if key is empty
     */
    boolean isSet(String key);

    /**
     * Caches a value until {@code ttlMinutes} from now.
     *
     * @param key the key
     * @param value the value
     * @param ttlMinutes minutes to keep the value; zero stores an already-expired entry
     * @throws IllegalArgumentException if key is empty, value is null or ttlMinutes is negative
     */
    void set(String key, Object value, long ttlMinutes);

    /**
     * Caches a value until {@code ttl} from now.
     *
     * @param key the key
     * @param value the value
     * @param ttl time to keep the value
     * @throws IllegalArgumentException if key is empty, value is null or ttl is null or negative
     */
    void set(String key, Object value, Duration ttl);

    /**
     * Caches a value until the dependency file changes.
     *
     * @param key the key
     * @param value the value
     * @param dependencyFile path of an existing file
     * @throws IllegalArgumentException if key or path is empty or value is null
     * @throws DependencyFileNotFoundException if the file does not exist
     */
    void set(String key, Object value, String dependencyFile);

    /**
     * Caches a value until the dependency file changes, is deleted or becomes unreadable.
     *
     * @param key the key
     * @param value the value
     * @param dependencyFile an existing file
     * @throws IllegalArgumentException if key is empty or value or path is null
     * @throws DependencyFileNotFoundException if the file does not exist
     */
    void set(String key, Object value, Path dependencyFile);

    /**
     * Removes a key. Removing a missing key is not an error.
     *
     * @param key the key
     * @throws IllegalArgumentException if key is empty
     */
    void remove(String key);

    /**
     * Removes every key in which the regular expression is found.
     *
     * @param regex a regular expression, e.g. {@code ^user:}
     * @return number of entries removed
     * @throws IllegalArgumentException if regex is empty or invalid
     */
    int removeByPattern(String regex);

    /**
     * Removes every key in which the pattern is found.
     *
     * @param pattern a compiled pattern
     * @return number of entries removed
     * @throws IllegalArgumentException if pattern is null
     */
    int removeByPattern(Pattern pattern);

    <T> CompletableFuture<T> getAsync(String key, Class<T> type);

    CompletableFuture<Boolean> isSetAsync(String key);

    CompletableFuture<Void> setAsync(String key, Object value, long ttlMinutes);

    CompletableFuture<Void> setAsync(String key, Object value, String dependencyFile);

    CompletableFuture<Void> setAsync(String key, Object value, Path dependencyFile);

    CompletableFuture<Void> removeAsync(String key);

    CompletableFuture<Integer> removeByPatternAsync(String regex);

    /**
     * Removes all entries from the cache.
     */
    void clear();

    /**
     * Returns the approximate number of stored entries, dead ones included.
     *
     * @return the estimated number of entries
     */
    long size();

    /**
     * Returns statistics for this cache.
     *
     * @return cache statistics
     */
    CacheStats stats();

    /**
     * Returns the name of this cache, if configured.
     *
     * @return cache name, or "unnamed" if not set
     */
    default String name() {
        return "unnamed";
    }

    /**
     * Clears the cache and releases its store and file watches.
     */
    @Override
    void close();
}

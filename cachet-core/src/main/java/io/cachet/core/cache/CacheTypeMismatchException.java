package io.cachet.core.cache;

/**
 * Thrown when a cached value is read back as a type it is not an instance of.
 *
 * @since 1.0.0
 */
public class CacheTypeMismatchException extends CacheException {

    private final String key;
    private final Class<?> expectedType;
    private final Class<?> actualType;

    public CacheTypeMismatchException(String key, Class<?> expectedType, Class<?> actualType) {
        super(String.format("Cached value for key '%s' is a %s, not a %s",
                key, actualType.getName(), expectedType.getName()));
        this.key = key;
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public String getKey() {
        return key;
    }

    public Class<?> getExpectedType() {
        return expectedType;
    }

    public Class<?> getActualType() {
        return actualType;
    }
}

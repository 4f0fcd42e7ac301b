package io.cachet.core.cache;

import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Result of a typed cache read: the value was found, no live entry exists, or the
 * stored value is not of the requested type.
 *
 * <pre>{@code
 * CacheLookup<Page> lookup = cache.lookup("page:home", Page.class);
 * switch (lookup.status()) {
 *     case FOUND -> render(lookup.value());
 *     case NOT_FOUND -> render(loadPage("home"));
 *     case TYPE_MISMATCH -> log.warn("Unexpected {}", lookup.actualType());
 * }
 * }</pre>
 *
 * @param status outcome of the lookup
 * @param value the value, only when found
 * @param actualType the stored value's type, only on a type mismatch
 * @param <T> the requested type
 *
 * @since 1.0.0
 */
public record CacheLookup<T>(Status status, T value, Class<?> actualType) {

    /**
     * Lookup outcomes.
     */
    public enum Status {
        FOUND,
        NOT_FOUND,
        TYPE_MISMATCH
    }

    private static final CacheLookup<?> NOT_FOUND = new CacheLookup<>(Status.NOT_FOUND, null, null);

    public static <T> CacheLookup<T> found(T value) {
        return new CacheLookup<>(Status.FOUND, value, value.getClass());
    }

    @SuppressWarnings("unchecked")
    public static <T> CacheLookup<T> notFound() {
        return (CacheLookup<T>) NOT_FOUND;
    }

    public static <T> CacheLookup<T> typeMismatch(Class<?> actualType) {
        return new CacheLookup<>(Status.TYPE_MISMATCH, null, actualType);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    /**
     * Returns the found value.
     * @return the value
     * @throws NoSuchElementException if the lookup did not find a value
     */
    public T get() {
        if (status != Status.FOUND) {
            throw new NoSuchElementException("No value: " + status);
        }
        return value;
    }

    public T orElse(T other) {
        return status == Status.FOUND ? value : other;
    }

    public Optional<T> toOptional() {
        return status == Status.FOUND ? Optional.of(value) : Optional.empty();
    }
}

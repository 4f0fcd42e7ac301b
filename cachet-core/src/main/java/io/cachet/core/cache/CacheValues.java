package io.cachet.core.cache;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;

/**
 * Value checks shared by cache providers.
 *
 * @since 1.0.0
 */
public final class CacheValues {

    private static final Map<Class<?>, Object> PRIMITIVE_DEFAULTS = Map.of(
            boolean.class, false,
            byte.class, (byte) 0,
            short.class, (short) 0,
            char.class, '\0',
            int.class, 0,
            long.class, 0L,
            float.class, 0f,
            double.class, 0d
    );

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            short.class, Short.class,
            char.class, Character.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class
    );

    private CacheValues() {
        // Static utility class
    }

    /**
     * Returns whether a value is worth caching: not null, and not an empty
     * collection, map, array or character sequence.
     *
     * @param value the candidate value
     * @return true if the value carries data
     */
    public static boolean hasData(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() > 0;
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }

    /**
     * Returns the value a missing entry reads as: zero or false for primitive types,
     * null for everything else.
     *
     * @param type the requested type
     * @param <T> the requested type
     * @return the default value
     */
    @SuppressWarnings("unchecked")
    public static <T> T defaultValue(Class<T> type) {
        return (T) PRIMITIVE_DEFAULTS.get(type);
    }

    /**
     * Maps primitive types to their wrapper; returns other types unchanged.
     *
     * @param type the type
     * @return the boxed type
     */
    public static Class<?> boxed(Class<?> type) {
        return WRAPPERS.getOrDefault(type, type);
    }
}

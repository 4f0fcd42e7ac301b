package io.cachet.core.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CacheValues")
class CacheValuesTest {

    @Test
    @DisplayName("should treat empty containers as carrying no data")
    void shouldDetectEmptyValues() {
        assertThat(CacheValues.hasData(null)).isFalse();
        assertThat(CacheValues.hasData(List.of())).isFalse();
        assertThat(CacheValues.hasData(new HashMap<>())).isFalse();
        assertThat(CacheValues.hasData("")).isFalse();
        assertThat(CacheValues.hasData(new StringBuilder())).isFalse();
        assertThat(CacheValues.hasData(new String[0])).isFalse();
        assertThat(CacheValues.hasData(new long[0])).isFalse();
    }

    @Test
    @DisplayName("should treat scalars and non-empty containers as data")
    void shouldDetectValuesWithData() {
        assertThat(CacheValues.hasData(0)).isTrue();
        assertThat(CacheValues.hasData(false)).isTrue();
        assertThat(CacheValues.hasData(" ")).isTrue();
        assertThat(CacheValues.hasData(Set.of("a"))).isTrue();
        assertThat(CacheValues.hasData(Map.of("a", 1))).isTrue();
        assertThat(CacheValues.hasData(new byte[]{1})).isTrue();
        assertThat(CacheValues.hasData(new Object())).isTrue();
    }

    @Test
    @DisplayName("should return primitive defaults and null otherwise")
    void shouldReturnDefaults() {
        assertThat(CacheValues.defaultValue(int.class)).isEqualTo(0);
        assertThat(CacheValues.defaultValue(long.class)).isEqualTo(0L);
        assertThat(CacheValues.defaultValue(double.class)).isEqualTo(0d);
        assertThat(CacheValues.defaultValue(boolean.class)).isFalse();
        assertThat(CacheValues.defaultValue(char.class)).isEqualTo('\0');
        assertThat(CacheValues.defaultValue(Integer.class)).isNull();
        assertThat(CacheValues.defaultValue(ArrayList.class)).isNull();
    }

    @Test
    @DisplayName("should box primitive types only")
    void shouldBoxPrimitiveTypes() {
        assertThat(CacheValues.boxed(int.class)).isEqualTo(Integer.class);
        assertThat(CacheValues.boxed(boolean.class)).isEqualTo(Boolean.class);
        assertThat(CacheValues.boxed(String.class)).isEqualTo(String.class);
    }
}

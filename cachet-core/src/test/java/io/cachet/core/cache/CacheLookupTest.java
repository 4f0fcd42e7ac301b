package io.cachet.core.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CacheLookup")
class CacheLookupTest {

    @Test
    @DisplayName("should expose found value")
    void shouldExposeFoundValue() {
        CacheLookup<String> lookup = CacheLookup.found("value");

        assertThat(lookup.isFound()).isTrue();
        assertThat(lookup.get()).isEqualTo("value");
        assertThat(lookup.orElse("other")).isEqualTo("value");
        assertThat(lookup.toOptional()).contains("value");
        assertThat(lookup.actualType()).isEqualTo(String.class);
    }

    @Test
    @DisplayName("should fall back when not found")
    void shouldFallBackWhenNotFound() {
        CacheLookup<String> lookup = CacheLookup.notFound();

        assertThat(lookup.isFound()).isFalse();
        assertThat(lookup.orElse("other")).isEqualTo("other");
        assertThat(lookup.toOptional()).isEmpty();
        assertThatThrownBy(lookup::get).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    @DisplayName("should carry actual type on mismatch")
    void shouldCarryActualTypeOnMismatch() {
        CacheLookup<Integer> lookup = CacheLookup.typeMismatch(String.class);

        assertThat(lookup.status()).isEqualTo(CacheLookup.Status.TYPE_MISMATCH);
        assertThat(lookup.actualType()).isEqualTo(String.class);
        assertThat(lookup.orElse(7)).isEqualTo(7);
        assertThatThrownBy(lookup::get)
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("TYPE_MISMATCH");
    }
}

package io.cachet.core.cache;

import io.cachet.core.store.CacheStore;
import io.cachet.core.store.StoreRemovalListener;
import io.cachet.core.watch.FileWatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Verifies that malformed calls are rejected before the store or watcher is touched.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("MemoryCacheProvider argument validation")
class MemoryCacheProviderValidationTest {

    @Mock
    private CacheStore store;

    @Mock
    private FileWatcher fileWatcher;

    private MemoryCacheProvider cache;

    @BeforeEach
    void setUp() {
        cache = MemoryCacheProvider.builder()
                .name("validated")
                .store(store)
                .fileWatcher(fileWatcher)
                .build();
        verify(store).addRemovalListener(any(StoreRemovalListener.class));
    }

    @Test
    @DisplayName("should not touch the store for invalid reads")
    void shouldRejectInvalidReads() {
        assertThatIllegalArgumentException().isThrownBy(() -> cache.get("", String.class));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.get("key", null));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.lookup(null, String.class));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.isSet(null));

        verifyNoMoreInteractions(store);
    }

    @Test
    @DisplayName("should not touch the store for invalid writes")
    void shouldRejectInvalidWrites() {
        assertThatIllegalArgumentException().isThrownBy(() -> cache.set(null, "v", 1));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.set("key", null, 1));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.set("key", "v", -5));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.set("key", "v", (String) null));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.set("key", "v", (Path) null));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.set("key", null, Path.of("pom.xml")));

        verifyNoMoreInteractions(store);
        verifyNoInteractions(fileWatcher);
    }

    @Test
    @DisplayName("should not touch the store for invalid removals")
    void shouldRejectInvalidRemovals() {
        assertThatIllegalArgumentException().isThrownBy(() -> cache.remove(""));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.removeByPattern(""));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.removeByPattern((Pattern) null));

        verifyNoMoreInteractions(store);
    }

    @Test
    @DisplayName("should reject invalid async calls on the calling thread")
    void shouldRejectInvalidAsyncCalls() {
        assertThatIllegalArgumentException().isThrownBy(() -> cache.getAsync("", String.class));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.isSetAsync(null));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.setAsync("key", null, 1));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.setAsync("key", "v", -1));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.setAsync("key", "v", ""));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.removeAsync(null));
        assertThatIllegalArgumentException().isThrownBy(() -> cache.removeByPatternAsync(null));

        verifyNoMoreInteractions(store);
        verifyNoInteractions(fileWatcher);
    }

    @Test
    @DisplayName("should not watch a missing dependency file")
    void shouldNotWatchMissingFile() {
        assertThatThrownBy(() -> cache.set("key", "v", Path.of("does", "not", "exist.txt")))
                .isInstanceOf(DependencyFileNotFoundException.class)
                .hasMessageContaining("exist.txt");
        assertThatThrownBy(() -> cache.setAsync("key", "v", "does-not-exist.txt"))
                .isInstanceOf(DependencyFileNotFoundException.class);

        verifyNoMoreInteractions(store);
        verifyNoInteractions(fileWatcher);
    }

    @Test
    @DisplayName("should close a supplied store but not a supplied watcher")
    void shouldCloseStoreOnly() {
        cache.close();
        cache.close();

        verify(store, times(1)).close();
        verify(fileWatcher, never()).close();
    }
}

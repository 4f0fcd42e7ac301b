package io.cachet.core.cache;

import io.cachet.core.store.ConcurrentMapStore;
import io.cachet.core.watch.NioFileWatcher;
import io.cachet.core.watch.PollingFileWatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CacheConfig")
class CacheConfigTest {

    @Test
    @DisplayName("should apply defaults")
    void shouldApplyDefaults() {
        CacheConfig config = CacheConfig.defaultConfig("pages");

        assertThat(config.name()).isEqualTo("pages");
        assertThat(config.maxSize()).isEqualTo(ConcurrentMapStore.DEFAULT_MAX_SIZE);
        assertThat(config.watchMode()).isEqualTo(CacheConfig.WatchMode.NATIVE);
        assertThat(config.pollInterval()).isEqualTo(PollingFileWatcher.DEFAULT_POLL_INTERVAL);
    }

    @Test
    @DisplayName("should default missing watch mode to native")
    void shouldDefaultWatchMode() {
        CacheConfig config = new CacheConfig("pages", 10, null, Duration.ofSeconds(1));

        assertThat(config.watchMode()).isEqualTo(CacheConfig.WatchMode.NATIVE);
    }

    @Test
    @DisplayName("should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> CacheConfig.builder().name(null).build())
                .isInstanceOf(NullPointerException.class);
        assertThatIllegalArgumentException().isThrownBy(() -> CacheConfig.builder().name(" ").build());
        assertThatIllegalArgumentException().isThrownBy(() -> CacheConfig.builder().maxSize(0).build());
        assertThatIllegalArgumentException().isThrownBy(() -> CacheConfig.builder().pollInterval(Duration.ZERO).build());
        assertThatIllegalArgumentException().isThrownBy(() -> CacheConfig.builder().pollInterval(null).build());
    }

    @Test
    @DisplayName("should select watcher from watch mode")
    void shouldSelectWatcherFromWatchMode() {
        CacheConfig polling = CacheConfig.builder()
                .name("polled")
                .watchMode(CacheConfig.WatchMode.POLLING)
                .pollInterval(Duration.ofMillis(250))
                .build();

        try (MemoryCacheProvider pollingCache = MemoryCacheProvider.builder().config(polling).build();
             MemoryCacheProvider nativeCache = MemoryCacheProvider.builder().name("native").build()) {
            assertThat(pollingCache.getFileWatcher()).isInstanceOf(PollingFileWatcher.class);
            assertThat(((PollingFileWatcher) pollingCache.getFileWatcher()).getPollInterval())
                    .isEqualTo(Duration.ofMillis(250));
            assertThat(pollingCache.name()).isEqualTo("polled");
            assertThat(nativeCache.getFileWatcher()).isInstanceOf(NioFileWatcher.class);
        }
    }
}

package io.cachet.core.watch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@DisplayName("NioFileWatcher")
class NioFileWatcherTest {

    @TempDir
    Path tempDir;

    private NioFileWatcher watcher;
    private Path file;

    @BeforeEach
    void setUp() throws IOException {
        watcher = new NioFileWatcher("test-nio-watcher");
        file = Files.writeString(tempDir.resolve("watched.txt"), "one");
    }

    @AfterEach
    void tearDown() {
        watcher.close();
    }

    @Test
    @DisplayName("should fire when the file is modified")
    void shouldFireOnModification() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        WatchHandle handle = watcher.watch(file, fired::countDown);

        Files.writeString(file, "two");

        assertThat(fired.await(30, TimeUnit.SECONDS)).isTrue();
        assertThat(handle.isActive()).isFalse();
        assertThat(watcher.watchCount()).isZero();
    }

    @Test
    @DisplayName("should fire when the file is deleted")
    void shouldFireOnDeletion() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        watcher.watch(file, fired::countDown);

        Files.delete(file);

        assertThat(fired.await(30, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("should share one directory registration across files")
    void shouldTrackWatchesPerFile() throws IOException {
        Path other = Files.writeString(tempDir.resolve("other.txt"), "x");

        WatchHandle first = watcher.watch(file, () -> { });
        watcher.watch(other, () -> { });
        assertThat(watcher.watchCount()).isEqualTo(2);

        first.close();
        assertThat(watcher.watchCount()).isEqualTo(1);
        assertThat(first.file()).isEqualTo(file.toAbsolutePath().normalize());
    }

    @Test
    @DisplayName("should not fire cancelled watch")
    void shouldNotFireCancelledWatch() throws Exception {
        AtomicInteger cancelledCalls = new AtomicInteger();
        CountDownLatch sentinel = new CountDownLatch(1);
        WatchHandle cancelled = watcher.watch(file, cancelledCalls::incrementAndGet);
        watcher.watch(file, sentinel::countDown);

        watcher.unwatch(cancelled);
        Files.writeString(file, "two");

        assertThat(sentinel.await(30, TimeUnit.SECONDS)).isTrue();
        assertThat(cancelledCalls.get()).isZero();
    }

    @Test
    @DisplayName("should cancel pending watches on close without firing")
    void shouldCancelOnClose() {
        AtomicInteger calls = new AtomicInteger();
        WatchHandle handle = watcher.watch(file, calls::incrementAndGet);

        watcher.close();

        assertThat(handle.isActive()).isFalse();
        assertThat(watcher.watchCount()).isZero();
        assertThat(calls.get()).isZero();
        assertThatIllegalStateException().isThrownBy(() -> watcher.watch(file, () -> { }));
    }

    @Test
    @DisplayName("should fire a watch made through a symbolic link to a watched directory")
    void shouldFireThroughSymbolicLink() throws Exception {
        Path real = Files.createDirectory(tempDir.resolve("real"));
        Path link = symbolicLinkTo(real);
        Files.writeString(real.resolve("a.txt"), "a");
        Files.writeString(real.resolve("b.txt"), "b");
        CountDownLatch fired = new CountDownLatch(1);

        watcher.watch(real.resolve("a.txt"), () -> { });
        watcher.watch(link.resolve("b.txt"), fired::countDown);
        Files.writeString(real.resolve("b.txt"), "changed");

        assertThat(fired.await(30, TimeUnit.SECONDS)).isTrue();
        assertThat(watcher.watchCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should keep a linked directory watched after the other spelling is released")
    void shouldKeepLinkedDirectoryWatched() throws Exception {
        Path real = Files.createDirectory(tempDir.resolve("real"));
        Path link = symbolicLinkTo(real);
        Files.writeString(real.resolve("a.txt"), "a");
        Files.writeString(real.resolve("b.txt"), "b");
        CountDownLatch fired = new CountDownLatch(1);

        watcher.watch(link.resolve("b.txt"), fired::countDown);
        WatchHandle other = watcher.watch(real.resolve("a.txt"), () -> { });
        other.close();
        Files.writeString(real.resolve("b.txt"), "changed");

        assertThat(fired.await(30, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("should register a directory again after its last watch fired")
    void shouldReRegisterAfterLastWatchFired() throws Exception {
        CountDownLatch first = new CountDownLatch(1);
        watcher.watch(file, first::countDown);
        Files.writeString(file, "two");
        assertThat(first.await(30, TimeUnit.SECONDS)).isTrue();

        CountDownLatch second = new CountDownLatch(1);
        AtomicInteger siblingCalls = new AtomicInteger();
        Path sibling = Files.writeString(tempDir.resolve("sibling.txt"), "s");
        watcher.watch(sibling, siblingCalls::incrementAndGet);
        watcher.watch(file, second::countDown);
        Files.writeString(file, "three");

        assertThat(second.await(30, TimeUnit.SECONDS)).isTrue();
        assertThat(siblingCalls.get()).isZero();
    }

    private Path symbolicLinkTo(Path target) {
        Path link = tempDir.resolve("link");
        try {
            return Files.createSymbolicLink(link, target);
        } catch (IOException | UnsupportedOperationException e) {
            assumeTrue(false, "symbolic links not supported: " + e.getMessage());
            return link;
        }
    }
}

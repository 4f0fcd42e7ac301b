package io.cachet.core.watch;

import io.cachet.core.cache.CacheException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * {@link FileWatcher} built on the platform {@link WatchService}.
 *
 * <p>Each watched file's parent directory is registered once. A single daemon thread
 * dispatches events; a create, modify or delete event for the file name fires its
 * watches. An {@code OVERFLOW} event, or the directory key becoming invalid, fires
 * every watch in that directory since individual changes may have been lost.</p>
 *
 * <p>Directories are tracked by {@link WatchKey}, not by path. The watch service hands
 * out one key per directory however it is spelled, so watches made through a symbolic
 * link and through the real path share a key and are dispatched together.</p>
 *
 * <p>The watch service and the dispatcher thread are started on the first call to
 * {@link #watch}.</p>
 *
 * @since 1.0.0
 */
public class NioFileWatcher implements FileWatcher {

    private static final Logger log = LoggerFactory.getLogger(NioFileWatcher.class);

    private final String threadName;
    private final Object lock = new Object();

    // Guarded by lock
    private final Map<WatchKey, Directory> directories = new HashMap<>();
    private WatchService watchService;
    private boolean closed;

    public NioFileWatcher() {
        this("cachet-file-watcher");
    }

    /**
     * @param threadName name of the dispatcher thread
     */
    public NioFileWatcher(String threadName) {
        this.threadName = Objects.requireNonNull(threadName, "threadName must not be null");
    }

    @Override
    public WatchHandle watch(Path file, Runnable onChange) {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(onChange, "onChange must not be null");

        Path target = file.toAbsolutePath().normalize();
        Path dir = target.getParent();
        if (dir == null) {
            throw new IllegalArgumentException("Cannot watch a file without a parent directory: " + file);
        }

        Registration registration = new Registration(target, onChange);
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("File watcher is closed");
            }
            ensureStarted();

            WatchKey key;
            try {
                // Returns the existing key when the directory is already registered
                key = dir.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY);
            } catch (IOException e) {
                log.warn("[CACHET] Unable to watch directory {}: {}", dir, e.getMessage());
                throw new CacheException("Unable to watch " + target, e);
            }
            Directory directory = directories.computeIfAbsent(key, Directory::new);
            directory.registrations.add(registration);
            registration.directory = directory;
        }
        return registration;
    }

    /**
     * Returns the number of active watches.
     * @return watch count
     */
    public int watchCount() {
        synchronized (lock) {
            return directories.values().stream().mapToInt(d -> d.registrations.size()).sum();
        }
    }

    @Override
    public void close() {
        WatchService service;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            for (Directory directory : directories.values()) {
                directory.registrations.forEach(Registration::deactivate);
                directory.key.cancel();
            }
            directories.clear();
            service = watchService;
        }

        if (service != null) {
            try {
                service.close();
            } catch (IOException e) {
                log.warn("[CACHET] Error closing watch service: {}", e.getMessage());
            }
            log.info("[CACHET] File watcher '{}' stopped", threadName);
        }
    }

    private void ensureStarted() {
        if (watchService != null) {
            return;
        }
        try {
            watchService = FileSystems.getDefault().newWatchService();
        } catch (IOException e) {
            throw new CacheException("Unable to create watch service", e);
        }
        Thread dispatcher = new Thread(this::dispatchLoop, threadName);
        dispatcher.setDaemon(true);
        dispatcher.start();
        log.info("[CACHET] File watcher '{}' started", threadName);
    }

    private void dispatchLoop() {
        WatchService service;
        synchronized (lock) {
            service = watchService;
        }

        while (true) {
            WatchKey key;
            try {
                key = service.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            List<Registration> fired = new ArrayList<>();
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == OVERFLOW) {
                    fired.addAll(drain(key, null));
                } else {
                    fired.addAll(drain(key, (Path) event.context()));
                }
            }
            if (!key.reset()) {
                fired.addAll(drain(key, null));
            }

            for (Registration registration : fired) {
                registration.fire();
            }
        }
    }

    /**
     * Removes and returns the registrations of a key for a file name, or all of them
     * when {@code fileName} is null. A key that was already released has none.
     */
    private List<Registration> drain(WatchKey key, Path fileName) {
        List<Registration> drained = new ArrayList<>();
        synchronized (lock) {
            Directory directory = directories.get(key);
            if (directory == null) {
                return drained;
            }
            Iterator<Registration> it = directory.registrations.iterator();
            while (it.hasNext()) {
                Registration registration = it.next();
                if (fileName == null || registration.file.getFileName().equals(fileName)) {
                    it.remove();
                    drained.add(registration);
                }
            }
            releaseIfEmpty(directory);
        }
        return drained;
    }

    private void unregister(Registration registration) {
        synchronized (lock) {
            Directory directory = registration.directory;
            if (directory != null && directory.registrations.remove(registration)) {
                releaseIfEmpty(directory);
            }
        }
    }

    private void releaseIfEmpty(Directory directory) {
        if (directory.registrations.isEmpty() && directories.remove(directory.key, directory)) {
            directory.key.cancel();
        }
    }

    private static final class Directory {
        private final WatchKey key;
        private final List<Registration> registrations = new ArrayList<>();

        Directory(WatchKey key) {
            this.key = key;
        }
    }

    private final class Registration implements WatchHandle {
        private final Path file;
        private final Runnable onChange;
        private final AtomicBoolean active = new AtomicBoolean(true);
        // Guarded by lock
        private Directory directory;

        Registration(Path file, Runnable onChange) {
            this.file = file;
            this.onChange = onChange;
        }

        @Override
        public Path file() {
            return file;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                unregister(this);
            }
        }

        void deactivate() {
            active.set(false);
        }

        void fire() {
            if (!active.compareAndSet(true, false)) {
                return;
            }
            try {
                onChange.run();
            } catch (RuntimeException e) {
                log.warn("[CACHET] Change callback for {} failed: {}", file, e.getMessage(), e);
            }
        }
    }
}

package io.cachet.core.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link FileWatcher} that compares {@link FileFingerprint}s on a fixed interval.
 *
 * <p>Slower to react than {@link NioFileWatcher} but independent of platform event
 * support, and the only watcher that notices a file becoming unreadable. The polling
 * thread is started on the first call to {@link #watch}.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FileWatcher watcher = new PollingFileWatcher(Duration.ofMillis(500));
 * CacheProvider cache = Cachet.provider().fileWatcher(watcher).build();
 * }</pre>
 *
 * @since 1.0.0
 */
public class PollingFileWatcher implements FileWatcher {

    private static final Logger log = LoggerFactory.getLogger(PollingFileWatcher.class);

    /**
     * Default poll interval: 2 seconds.
     */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);

    private final long pollIntervalMillis;
    private final Set<Registration> registrations = ConcurrentHashMap.newKeySet();
    private final Object lock = new Object();

    // Guarded by lock
    private ScheduledExecutorService scheduler;
    private boolean closed;

    public PollingFileWatcher() {
        this(DEFAULT_POLL_INTERVAL);
    }

    /**
     * @param pollInterval time between two fingerprint checks
     */
    public PollingFileWatcher(Duration pollInterval) {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        this.pollIntervalMillis = pollInterval.toMillis();
    }

    @Override
    public WatchHandle watch(Path file, Runnable onChange) {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(onChange, "onChange must not be null");

        Path target = file.toAbsolutePath().normalize();
        Registration registration = new Registration(target, FileFingerprint.of(target), onChange);
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("File watcher is closed");
            }
            ensureStarted();
            registrations.add(registration);
        }
        return registration;
    }

    /**
     * Checks every watched file once and fires the watches whose fingerprint changed.
     * Runs on the polling thread; callable directly as well.
     *
     * @return number of watches fired
     */
    public int poll() {
        int fired = 0;
        for (Registration registration : registrations) {
            if (!registration.baseline.equals(FileFingerprint.of(registration.file))
                    && registrations.remove(registration)) {
                registration.fire();
                fired++;
            }
        }
        return fired;
    }

    /**
     * Returns the number of active watches.
     * @return watch count
     */
    public int watchCount() {
        return registrations.size();
    }

    /**
     * Returns the configured poll interval.
     * @return poll interval
     */
    public Duration getPollInterval() {
        return Duration.ofMillis(pollIntervalMillis);
    }

    @Override
    public void close() {
        ScheduledExecutorService executor;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            executor = scheduler;
        }

        registrations.forEach(Registration::deactivate);
        registrations.clear();

        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("[CACHET] Polling file watcher stopped");
        }
    }

    private void ensureStarted() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cachet-file-poller");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::scheduledPoll, pollIntervalMillis, pollIntervalMillis,
                TimeUnit.MILLISECONDS);
        log.info("[CACHET] Polling file watcher started - interval={}ms", pollIntervalMillis);
    }

    private void scheduledPoll() {
        try {
            poll();
        } catch (Exception e) {
            log.error("[CACHET] Error polling watched files", e);
        }
    }

    private final class Registration implements WatchHandle {
        private final Path file;
        private final FileFingerprint baseline;
        private final Runnable onChange;
        private final AtomicBoolean active = new AtomicBoolean(true);

        Registration(Path file, FileFingerprint baseline, Runnable onChange) {
            this.file = file;
            this.baseline = baseline;
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
                registrations.remove(this);
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

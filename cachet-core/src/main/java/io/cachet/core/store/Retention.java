package io.cachet.core.store;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rule that decides when a cache entry stops being live.
 *
 * <p>An entry carries exactly one retention: an {@link AbsoluteExpiry} instant, or a
 * {@link FileDependency} on a watched file.</p>
 *
 * @since 1.0.0
 */
public interface Retention {

    /**
     * Returns whether an entry with this retention is still live.
     * @param now the current instant
     * @return true if the entry may be returned to callers
     */
    boolean isLive(Instant now);

    /**
     * Returns the instant at which the entry expires, if the retention is time based.
     * @return the deadline, or empty when the entry never expires by time
     */
    Optional<Instant> deadline();

    /**
     * Entry is invalid at or after {@code expiresAt}.
     */
    record AbsoluteExpiry(Instant expiresAt) implements Retention {

        public AbsoluteExpiry {
            Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        }

        @Override
        public boolean isLive(Instant now) {
            return now.isBefore(expiresAt);
        }

        @Override
        public Optional<Instant> deadline() {
            return Optional.of(expiresAt);
        }
    }

    /**
     * Entry is invalid once its file has changed. The switch is one-way.
     */
    final class FileDependency implements Retention {

        private final Path file;
        private final AtomicBoolean invalidated = new AtomicBoolean(false);

        public FileDependency(Path file) {
            this.file = Objects.requireNonNull(file, "file must not be null");
        }

        public Path file() {
            return file;
        }

        /**
         * Marks the dependency as changed.
         * @return true on the first call only
         */
        public boolean invalidate() {
            return invalidated.compareAndSet(false, true);
        }

        public boolean isInvalidated() {
            return invalidated.get();
        }

        @Override
        public boolean isLive(Instant now) {
            return !invalidated.get();
        }

        @Override
        public Optional<Instant> deadline() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "FileDependency[file=" + file + ", invalidated=" + invalidated.get() + "]";
        }
    }
}

package io.cachet.core.cache;

import java.nio.file.Path;

/**
 * Thrown when a file-dependent entry is stored against a file that does not exist.
 *
 * @since 1.0.0
 */
public class DependencyFileNotFoundException extends CacheException {

    private final Path file;

    public DependencyFileNotFoundException(Path file) {
        super("Dependency file not found: " + file);
        this.file = file;
    }

    /**
     * Returns the path that was checked.
     * @return the missing file
     */
    public Path getFile() {
        return file;
    }
}

package io.cachet.core.watch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;

/**
 * Observable state of a file, compared between polls to detect changes.
 *
 * @param exists whether the file exists
 * @param readable whether the file can be read
 * @param lastModified last modification time, or null when unknown
 * @param size size in bytes, or -1 when unknown
 *
 * @since 1.0.0
 */
public record FileFingerprint(boolean exists, boolean readable, FileTime lastModified, long size) {

    /** Fingerprint of a missing file */
    public static final FileFingerprint MISSING = new FileFingerprint(false, false, null, -1);

    /**
     * Reads the current fingerprint of a file.
     *
     * @param file the file
     * @return its fingerprint; attribute read failures yield an unreadable fingerprint
     */
    public static FileFingerprint of(Path file) {
        if (!Files.exists(file)) {
            return MISSING;
        }
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            return new FileFingerprint(true, Files.isReadable(file), attributes.lastModifiedTime(), attributes.size());
        } catch (IOException e) {
            return new FileFingerprint(true, false, null, -1);
        }
    }
}

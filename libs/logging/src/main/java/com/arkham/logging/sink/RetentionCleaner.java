package com.arkham.logging.sink;

import com.arkham.logging.Diagnostics;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes rotated log files older than a retention window.
 * <p>
 * Candidates are the regular files in the active file's directory whose name starts with the
 * active file's name (e.g. {@code app.log.1}, {@code app.log.7}); the active file itself is never
 * touched. Sweeps run at most once per {@link #CLEANUP_INTERVAL} through {@link #cleanupIfDue()}.
 * Without a retention window nothing is ever deleted.
 */
public final class RetentionCleaner {

    /** Minimum time between two throttled sweeps. */
    public static final Duration CLEANUP_INTERVAL = Duration.ofHours(1);

    private final Path activeFile;
    private final Duration retention;
    private final Clock clock;
    private final Diagnostics diagnostics;
    private Instant lastCleanup;

    /**
     * @param activeFile  path of the file being written
     * @param retention   maximum age of rotated files, or null to keep them forever
     * @param clock       time source
     * @param diagnostics destination for deletion failures
     */
    public RetentionCleaner(Path activeFile, Duration retention, Clock clock, Diagnostics diagnostics) {
        if (activeFile == null) {
            throw new IllegalArgumentException("activeFile must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (diagnostics == null) {
            throw new IllegalArgumentException("diagnostics must not be null");
        }
        this.activeFile = activeFile.toAbsolutePath().normalize();
        this.retention = retention;
        this.clock = clock;
        this.diagnostics = diagnostics;
    }

    public boolean isEnabled() {
        return retention != null && !retention.isZero() && !retention.isNegative();
    }

    /**
     * Sweeps when retention is enabled and the last sweep is at least an hour old.
     *
     * @return number of files deleted
     */
    public synchronized int cleanupIfDue() {
        if (!isEnabled()) {
            return 0;
        }
        Instant now = clock.instant();
        if (lastCleanup != null && now.isBefore(lastCleanup.plus(CLEANUP_INTERVAL))) {
            return 0;
        }
        return cleanup();
    }

    /**
     * Sweeps immediately, ignoring the throttle.
     *
     * @return number of files deleted
     */
    public synchronized int cleanup() {
        if (!isEnabled()) {
            return 0;
        }
        Instant now = clock.instant();
        lastCleanup = now;
        Path directory = activeFile.getParent();
        if (directory == null || !Files.isDirectory(directory)) {
            return 0;
        }
        Instant cutoff = now.minus(retention);
        String baseName = activeFile.getFileName().toString();
        int deleted = 0;
        DirectoryStream.Filter<Path> sameBase = path -> path.getFileName().toString().startsWith(baseName);
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, sameBase)) {
            for (Path file : files) {
                if (isExpired(file, cutoff) && delete(file)) {
                    deleted++;
                }
            }
        } catch (IOException e) {
            diagnostics.report("Failed to scan " + directory + " for expired log files", e);
        }
        return deleted;
    }

    private boolean isExpired(Path file, Instant cutoff) {
        if (file.toAbsolutePath().normalize().equals(activeFile) || !Files.isRegularFile(file)) {
            return false;
        }
        try {
            return Files.getLastModifiedTime(file).toInstant().isBefore(cutoff);
        } catch (IOException e) {
            diagnostics.report("Failed to read modification time of " + file, e);
            return false;
        }
    }

    private boolean delete(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            diagnostics.report("Failed to delete expired log file " + file, e);
            return false;
        }
    }
}

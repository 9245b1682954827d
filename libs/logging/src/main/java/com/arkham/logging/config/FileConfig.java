package com.arkham.logging.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Optional;

/**
 * File sink settings, bound from {@code frame.logging.file} (and {@code error_file}).
 * <p>
 * Defaults: enabled, {@code logs/arkham.log}, DEBUG, 100 MB per file, 10 backups,
 * 30 days retention, queue of 1000 records, file opened eagerly.
 *
 * @param enabled       whether the sink is installed
 * @param path          active log file path
 * @param level         minimum level written to the file
 * @param maxBytes      size that triggers a rollover
 * @param backupCount   number of rotated files kept (capped at 20 by the rolling policy)
 * @param retentionDays age after which rotated files are deleted; zero or negative keeps them forever
 * @param queueSize     capacity of the async sink's queue
 * @param delay         open the file on the first record instead of at start-up
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("path") String path,
        @JsonProperty("level") String level,
        @JsonProperty("max_bytes") Long maxBytes,
        @JsonProperty("backup_count") Integer backupCount,
        @JsonProperty("retention_days") Integer retentionDays,
        @JsonProperty("queue_size") Integer queueSize,
        @JsonProperty("delay") Boolean delay
) {

    public static final String DEFAULT_PATH = "logs/arkham.log";
    public static final String DEFAULT_ERROR_PATH = "logs/errors.log";
    public static final long DEFAULT_MAX_BYTES = 100_000_000L;
    public static final int DEFAULT_BACKUP_COUNT = 10;
    public static final int DEFAULT_RETENTION_DAYS = 30;
    public static final int DEFAULT_QUEUE_SIZE = 1000;

    public FileConfig {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (path == null || path.isBlank()) {
            path = DEFAULT_PATH;
        }
        if (level == null || level.isBlank()) {
            level = "DEBUG";
        }
        if (maxBytes == null || maxBytes <= 0) {
            maxBytes = DEFAULT_MAX_BYTES;
        }
        if (backupCount == null || backupCount < 0) {
            backupCount = DEFAULT_BACKUP_COUNT;
        }
        if (retentionDays == null) {
            retentionDays = DEFAULT_RETENTION_DAYS;
        }
        if (queueSize == null || queueSize <= 0) {
            queueSize = DEFAULT_QUEUE_SIZE;
        }
        if (delay == null) {
            delay = Boolean.FALSE;
        }
    }

    /**
     * Returns the default main file settings.
     */
    public static FileConfig defaults() {
        return new FileConfig(null, null, null, null, null, null, null, null);
    }

    /**
     * Returns the default settings for the error-only file.
     */
    public static FileConfig errorFileDefaults() {
        return new FileConfig(true, DEFAULT_ERROR_PATH, "ERROR", null, null, null, null, null);
    }

    /**
     * Returns default settings writing to {@code path}.
     */
    public static FileConfig atPath(String path) {
        return new FileConfig(true, path, null, null, null, null, null, null);
    }

    /**
     * Returns a disabled file sink configuration.
     */
    public static FileConfig disabled() {
        return new FileConfig(false, null, null, null, null, null, null, null);
    }

    /**
     * Returns the retention window, or empty when rotated files are kept forever.
     */
    public Optional<Duration> retention() {
        return retentionDays > 0 ? Optional.of(Duration.ofDays(retentionDays)) : Optional.empty();
    }
}

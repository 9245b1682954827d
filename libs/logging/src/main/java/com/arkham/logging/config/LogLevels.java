package com.arkham.logging.config;

import ch.qos.logback.classic.Level;

import java.util.Locale;

/**
 * Maps configured level names onto Logback levels.
 * <p>
 * Accepts Logback's names plus the aliases common in other stacks:
 * {@code WARNING} → WARN, {@code CRITICAL}/{@code FATAL} → ERROR.
 */
public final class LogLevels {

    private LogLevels() {
        // utility class
    }

    /**
     * Parses a level name, returning {@code fallback} for null or unknown names.
     */
    public static Level parse(String name, Level fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "WARNING" -> Level.WARN;
            case "CRITICAL", "FATAL" -> Level.ERROR;
            default -> Level.toLevel(normalized, fallback);
        };
    }
}

package com.arkham.logging.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Rendering used by the console sink.
 */
public enum ConsoleFormat {

    /** {@code timestamp LEVEL [logger] message}. */
    STANDARD,

    /** Same layout as the file sinks: one JSON object per line. */
    JSON,

    /** {@link #STANDARD} with the level highlighted by ANSI colours. */
    COLORED;

    /**
     * Parses a configuration value; unknown or empty values fall back to {@link #STANDARD}.
     */
    @JsonCreator
    public static ConsoleFormat fromValue(String value) {
        if (value == null || value.isBlank()) {
            return STANDARD;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> JSON;
            case "colored", "coloured", "color" -> COLORED;
            default -> STANDARD;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.arkham.logging.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Console sink settings, bound from {@code frame.logging.console}.
 *
 * @param enabled whether the console sink is installed (default true)
 * @param level   minimum level written to the console (default INFO)
 * @param format  rendering of console lines (default standard)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConsoleConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("level") String level,
        @JsonProperty("format") ConsoleFormat format
) {

    public ConsoleConfig {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (level == null || level.isBlank()) {
            level = "INFO";
        }
        if (format == null) {
            format = ConsoleFormat.STANDARD;
        }
    }

    /**
     * Returns the default console settings.
     */
    public static ConsoleConfig defaults() {
        return new ConsoleConfig(null, null, null);
    }

    /**
     * Returns a disabled console sink configuration.
     */
    public static ConsoleConfig disabled() {
        return new ConsoleConfig(false, null, null);
    }
}

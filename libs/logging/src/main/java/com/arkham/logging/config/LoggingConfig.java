package com.arkham.logging.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Complete logging configuration, bound from the {@code frame.logging} section.
 * <p>
 * Every section falls back to its defaults when absent. {@code errorFile} stays null unless
 * configured: the error-only sink is opt-in.
 *
 * @param console     console sink settings
 * @param file        main file sink settings
 * @param errorFile   error-only file sink settings, or null when not configured
 * @param wideEvents  wide-event and sampling settings
 * @param globalLevel level of the root logger (default INFO)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoggingConfig(
        @JsonProperty("console") ConsoleConfig console,
        @JsonProperty("file") FileConfig file,
        @JsonProperty("error_file") FileConfig errorFile,
        @JsonProperty("wide_events") WideEventConfig wideEvents,
        @JsonProperty("global_level") String globalLevel
) {

    public LoggingConfig {
        if (console == null) {
            console = ConsoleConfig.defaults();
        }
        if (file == null) {
            file = FileConfig.defaults();
        }
        if (wideEvents == null) {
            wideEvents = WideEventConfig.defaults();
        }
        if (globalLevel == null || globalLevel.isBlank()) {
            globalLevel = "INFO";
        }
    }

    /**
     * Returns the built-in defaults.
     */
    public static LoggingConfig defaults() {
        return new LoggingConfig(null, null, null, null, null);
    }

    public LoggingConfig withConsole(ConsoleConfig console) {
        return new LoggingConfig(console, file, errorFile, wideEvents, globalLevel);
    }

    public LoggingConfig withFile(FileConfig file) {
        return new LoggingConfig(console, file, errorFile, wideEvents, globalLevel);
    }

    public LoggingConfig withErrorFile(FileConfig errorFile) {
        return new LoggingConfig(console, file, errorFile, wideEvents, globalLevel);
    }

    public LoggingConfig withWideEvents(WideEventConfig wideEvents) {
        return new LoggingConfig(console, file, errorFile, wideEvents, globalLevel);
    }

    public LoggingConfig withGlobalLevel(String globalLevel) {
        return new LoggingConfig(console, file, errorFile, wideEvents, globalLevel);
    }
}

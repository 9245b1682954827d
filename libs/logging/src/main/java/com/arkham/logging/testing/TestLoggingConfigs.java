package com.arkham.logging.testing;

import com.arkham.logging.config.ConsoleConfig;
import com.arkham.logging.config.FileConfig;
import com.arkham.logging.config.LoggingConfig;
import com.arkham.logging.config.WideEventConfig;

import java.nio.file.Path;

/**
 * Test factory for {@link LoggingConfig} instances that keep tests off the console and
 * out of the working directory.
 */
public final class TestLoggingConfigs {

    private TestLoggingConfigs() {
        // Utility class
    }

    /**
     * Console and files disabled; wide events keep everything.
     */
    public static LoggingConfig silent() {
        return LoggingConfig.defaults()
                .withConsole(ConsoleConfig.disabled())
                .withFile(FileConfig.disabled());
    }

    /**
     * Console disabled, main file sink at {@code logFile} with DEBUG threshold, eager open.
     */
    public static LoggingConfig fileOnly(Path logFile) {
        return silent().withFile(FileConfig.atPath(logFile.toString())).withGlobalLevel("DEBUG");
    }

    /**
     * {@link #fileOnly(Path)} plus an error-only file at {@code errorFile}.
     */
    public static LoggingConfig withErrorFile(Path logFile, Path errorFile) {
        return fileOnly(logFile).withErrorFile(
                new FileConfig(true, errorFile.toString(), "ERROR", null, null, null, null, null));
    }

    /**
     * Wide-event settings with no forcing rules, so only the random draw decides.
     */
    public static WideEventConfig randomSampling(double rate, boolean tailSampling) {
        return new WideEventConfig(true, rate, tailSampling, false, false, null, null, null);
    }
}

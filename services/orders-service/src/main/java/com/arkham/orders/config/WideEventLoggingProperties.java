package com.arkham.orders.config;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Logging pipeline settings bound from {@code arkham.logging.*}.
 *
 * <p>The pipeline itself is configured by the YAML file named here (section {@code
 * frame.logging}) and by {@code ARKHAM_LOG_*} environment variables; Spring only tells it where
 * the file is.
 *
 * @param configFile path of the logging YAML file; a blank value means defaults plus environment.
 * @param shutdownHook also register a JVM shutdown hook, for runs where the context may not close.
 */
@ConfigurationProperties(prefix = "arkham.logging")
public record WideEventLoggingProperties(String configFile, boolean shutdownHook) {

    /** Returns the configured file, or null when none is set. */
    public Path configPath() {
        return configFile == null || configFile.isBlank() ? null : Path.of(configFile);
    }
}

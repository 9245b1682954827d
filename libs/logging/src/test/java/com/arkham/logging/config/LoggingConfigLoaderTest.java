package com.arkham.logging.config;

import com.arkham.logging.Diagnostics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LoggingConfigLoader}: YAML binding, environment overrides and fallback to
 * defaults on invalid input.
 */
@DisplayName("LoggingConfigLoader")
class LoggingConfigLoaderTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream err;
    private LoggingConfigLoader loader;

    @BeforeEach
    void setUp() {
        err = new ByteArrayOutputStream();
        loader = new LoggingConfigLoader(new Diagnostics(new PrintStream(err, true, StandardCharsets.UTF_8)));
    }

    private Path yaml(String content) throws IOException {
        Path file = tempDir.resolve("arkham.yaml");
        Files.writeString(file, content);
        return file;
    }

    private String diagnostics() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("File binding")
    class FileBinding {

        @Test
        @DisplayName("should return defaults for a missing file without reporting")
        void shouldUseDefaultsForMissingFile() {
            LoggingConfig config = loader.load(tempDir.resolve("absent.yaml"), Map.of());

            assertThat(config).isEqualTo(LoggingConfig.defaults());
            assertThat(diagnostics()).isEmpty();
        }

        @Test
        @DisplayName("should bind the frame.logging section")
        void shouldBindSection() throws IOException {
            Path file = yaml("""
                    frame:
                      logging:
                        global_level: DEBUG
                        console:
                          enabled: false
                          format: json
                        file:
                          path: /var/log/orders.log
                          max_bytes: 2048
                          backup_count: 3
                          retention_days: 7
                        wide_events:
                          sampling_rate: 0.25
                          tail_sampling: false
                          slow_threshold_ms: 500
                          always_sample_users: [u-1, u-2]
                    other:
                      ignored: true
                    """);

            LoggingConfig config = loader.load(file, Map.of());

            assertThat(config.globalLevel()).isEqualTo("DEBUG");
            assertThat(config.console().enabled()).isFalse();
            assertThat(config.console().format()).isEqualTo(ConsoleFormat.JSON);
            assertThat(config.file().path()).isEqualTo("/var/log/orders.log");
            assertThat(config.file().maxBytes()).isEqualTo(2048L);
            assertThat(config.file().backupCount()).isEqualTo(3);
            assertThat(config.file().retentionDays()).isEqualTo(7);
            assertThat(config.file().level()).isEqualTo("DEBUG");
            assertThat(config.wideEvents().samplingRate()).isEqualTo(0.25);
            assertThat(config.wideEvents().tailSampling()).isFalse();
            assertThat(config.wideEvents().slowThresholdMs()).isEqualTo(500);
            assertThat(config.wideEvents().alwaysSampleUsers()).containsExactly("u-1", "u-2");
            assertThat(config.wideEvents().alwaysSampleErrors()).isTrue();
            assertThat(config.errorFile()).isNull();
        }

        @Test
        @DisplayName("should fill error_file path and level when the section is present")
        void shouldDefaultErrorFile() throws IOException {
            Path file = yaml("""
                    frame:
                      logging:
                        error_file:
                          enabled: true
                    """);

            FileConfig errorFile = loader.load(file, Map.of()).errorFile();

            assertThat(errorFile).isNotNull();
            assertThat(errorFile.path()).isEqualTo(FileConfig.DEFAULT_ERROR_PATH);
            assertThat(errorFile.level()).isEqualTo("ERROR");
        }

        @Test
        @DisplayName("should report and ignore a file with invalid values")
        void shouldIgnoreInvalidFile() throws IOException {
            Path file = yaml("""
                    frame:
                      logging:
                        wide_events:
                          sampling_rate: 7.5
                    """);

            LoggingConfig config = loader.load(file, Map.of("ARKHAM_LOG_LEVEL", "WARN"));

            assertThat(config.wideEvents().samplingRate()).isEqualTo(1.0);
            assertThat(config.globalLevel()).isEqualTo("WARN");
            assertThat(diagnostics()).contains("Invalid logging configuration");
        }

        @Test
        @DisplayName("should report and ignore malformed YAML")
        void shouldIgnoreMalformedYaml() throws IOException {
            Path file = yaml("frame: [unclosed");

            LoggingConfig config = loader.load(file, Map.of());

            assertThat(config).isEqualTo(LoggingConfig.defaults());
            assertThat(diagnostics()).contains("Failed to read logging configuration");
        }
    }

    @Nested
    @DisplayName("Environment overrides")
    class Overrides {

        @Test
        @DisplayName("should let overrides win over the file")
        void shouldOverrideFile() throws IOException {
            Path file = yaml("""
                    frame:
                      logging:
                        file:
                          path: from-file.log
                          backup_count: 3
                    """);

            LoggingConfig config = loader.load(file, Map.of(
                    "ARKHAM_LOG_FILE_PATH", "from-env.log",
                    "ARKHAM_LOG_WIDE_EVENTS_SAMPLING_RATE", "0.1",
                    "ARKHAM_LOG_FILE_QUEUE_SIZE", "64"));

            assertThat(config.file().path()).isEqualTo("from-env.log");
            assertThat(config.file().backupCount()).isEqualTo(3);
            assertThat(config.file().queueSize()).isEqualTo(64);
            assertThat(config.wideEvents().samplingRate()).isEqualTo(0.1);
        }

        @Test
        @DisplayName("should apply the global level to the console unless given separately")
        void shouldApplyGlobalLevelToConsole() {
            LoggingConfig both = loader.load(null, Map.of("ARKHAM_LOG_LEVEL", "DEBUG"));
            LoggingConfig separate = loader.load(null, Map.of(
                    "ARKHAM_LOG_LEVEL", "DEBUG",
                    "ARKHAM_LOG_CONSOLE_LEVEL", "ERROR"));

            assertThat(both.globalLevel()).isEqualTo("DEBUG");
            assertThat(both.console().level()).isEqualTo("DEBUG");
            assertThat(separate.console().level()).isEqualTo("ERROR");
        }

        @Test
        @DisplayName("should parse boolean spellings")
        void shouldParseBooleans() {
            assertThat(loader.load(null, Map.of("ARKHAM_LOG_CONSOLE_ENABLED", "yes")).console().enabled()).isTrue();
            assertThat(loader.load(null, Map.of("ARKHAM_LOG_CONSOLE_ENABLED", "ON")).console().enabled()).isTrue();
            assertThat(loader.load(null, Map.of("ARKHAM_LOG_CONSOLE_ENABLED", "0")).console().enabled()).isFalse();
            assertThat(loader.load(null, Map.of("ARKHAM_LOG_FILE_ENABLED", "")).file().enabled()).isFalse();
        }

        @Test
        @DisplayName("should skip an unparsable number and keep the rest")
        void shouldSkipInvalidNumber() {
            LoggingConfig config = loader.load(null, Map.of(
                    "ARKHAM_LOG_FILE_BACKUP_COUNT", "many",
                    "ARKHAM_LOG_FILE_PATH", "kept.log"));

            assertThat(config.file().backupCount()).isEqualTo(FileConfig.DEFAULT_BACKUP_COUNT);
            assertThat(config.file().path()).isEqualTo("kept.log");
            assertThat(diagnostics()).contains("ARKHAM_LOG_FILE_BACKUP_COUNT");
        }

        @Test
        @DisplayName("should create the error file section from overrides")
        void shouldEnableErrorFileFromOverrides() {
            FileConfig errorFile = loader.load(null, Map.of("ARKHAM_LOG_ERROR_FILE_ENABLED", "true")).errorFile();

            assertThat(errorFile).isNotNull();
            assertThat(errorFile.enabled()).isTrue();
            assertThat(errorFile.path()).isEqualTo(FileConfig.DEFAULT_ERROR_PATH);
        }

        @Test
        @DisplayName("should fall back to defaults when overrides are invalid too")
        void shouldFallBackToDefaults() {
            LoggingConfig config = loader.load(null, Map.of("ARKHAM_LOG_WIDE_EVENTS_SAMPLING_RATE", "-2"));

            assertThat(config).isEqualTo(LoggingConfig.defaults());
            assertThat(diagnostics()).contains("using defaults");
        }
    }
}

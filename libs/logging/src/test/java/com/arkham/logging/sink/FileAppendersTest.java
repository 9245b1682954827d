package com.arkham.logging.sink;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.rolling.RollingFileAppender;
import com.arkham.logging.Diagnostics;
import com.arkham.logging.config.FileConfig;
import com.arkham.logging.metrics.PipelineMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileAppenders} and {@link RetentionRollingPolicy} against real files.
 */
@DisplayName("FileAppenders")
class FileAppendersTest {

    @TempDir
    Path dir;

    private LoggerContext context;
    private MutableClock clock;
    private Diagnostics diagnostics;
    private RollingFileAppender<ILoggingEvent> rotating;
    private AsyncFileAppender async;

    @BeforeEach
    void setUp() {
        context = new LoggerContext();
        clock = new MutableClock(Instant.now());
        diagnostics = new Diagnostics(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        if (async != null) {
            async.stop();
        }
        if (rotating != null) {
            rotating.stop();
        }
        context.stop();
    }

    private FileConfig config(Path file, int backups, int retentionDays) {
        return new FileConfig(true, file.toString(), "DEBUG", 1024L, backups, retentionDays, 16, false);
    }

    private ILoggingEvent event(Level level, String message) {
        LoggingEvent event = new LoggingEvent(FileAppendersTest.class.getName(),
                context.getLogger("orders"), level, message, null, null);
        event.setMDCPropertyMap(Map.of());
        event.setCallerData(new StackTraceElement[0]);
        return event;
    }

    @Test
    @DisplayName("should write JSON lines and shift backups on rollover")
    void shouldRollOver() throws IOException {
        Path file = dir.resolve("app.log");
        rotating = FileAppenders.rotating(context, "file-writer", config(file, 2, 30), clock, diagnostics);
        rotating.start();

        rotating.doAppend(event(Level.INFO, "generation-1"));
        rotating.rollover();
        rotating.doAppend(event(Level.INFO, "generation-2"));
        rotating.rollover();
        rotating.doAppend(event(Level.INFO, "generation-3"));
        rotating.rollover();

        assertThat(dir.resolve("app.log.1")).content().contains("generation-3");
        assertThat(dir.resolve("app.log.2")).content().contains("generation-2");
        assertThat(dir.resolve("app.log.3")).doesNotExist();
        assertThat(file).exists();
    }

    @Test
    @DisplayName("should cap the backup window")
    void shouldCapBackupWindow() {
        rotating = FileAppenders.rotating(context, "file-writer", config(dir.resolve("a.log"), 50, 30), clock, diagnostics);

        RetentionRollingPolicy policy = (RetentionRollingPolicy) rotating.getRollingPolicy();

        assertThat(policy.getMinIndex()).isEqualTo(1);
        assertThat(policy.getMaxIndex()).isEqualTo(FileAppenders.MAX_BACKUP_COUNT);
    }

    @Test
    @DisplayName("should delete expired backups when built and after a due rollover")
    void shouldApplyRetention() throws IOException {
        Path file = dir.resolve("app.log");
        Path stale = dir.resolve("app.log.5");
        Files.writeString(stale, "stale");
        Files.setLastModifiedTime(stale, FileTime.from(clock.instant().minus(Duration.ofDays(3))));

        rotating = FileAppenders.rotating(context, "file-writer", config(file, 5, 1), clock, diagnostics);
        assertThat(stale).doesNotExist();

        rotating.start();
        rotating.doAppend(event(Level.INFO, "current"));
        Path aged = dir.resolve("app.log.1");
        Files.writeString(aged, "aged");
        Files.setLastModifiedTime(aged, FileTime.from(clock.instant().minus(Duration.ofDays(2))));
        clock.advance(Duration.ofHours(2));

        rotating.rollover();

        assertThat(dir.resolve("app.log.2")).doesNotExist();
        assertThat(dir.resolve("app.log.1")).content().contains("current");
    }

    @Test
    @DisplayName("should filter by threshold in the async front")
    void shouldFilterByThreshold() throws IOException {
        Path file = dir.resolve("errors.log");
        async = FileAppenders.async(context, "error_file", config(file, 2, 30), Level.ERROR, clock, diagnostics,
                PipelineMetrics.standalone("files"));
        async.start();

        async.doAppend(event(Level.INFO, "routine"));
        async.doAppend(event(Level.ERROR, "broken"));
        async.stop();

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(1);
        assertThat(lines.get(0)).contains("\"message\":\"broken\"").contains("\"level\":\"ERROR\"");
        assertThat(async.getQueueSize()).isEqualTo(16);
    }
}

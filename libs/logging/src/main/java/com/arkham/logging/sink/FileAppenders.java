package com.arkham.logging.sink;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Layout;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeBasedTriggeringPolicy;
import ch.qos.logback.core.util.FileSize;
import com.arkham.logging.Diagnostics;
import com.arkham.logging.config.FileConfig;
import com.arkham.logging.format.JsonLineLayout;
import com.arkham.logging.metrics.PipelineMetrics;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Builds the file sinks: rotating-with-retention appenders and their async fronts.
 * <p>
 * Returned appenders are configured but not started; the caller starts them and decides on
 * fallbacks when a start fails.
 */
public final class FileAppenders {

    /** Largest window Logback's fixed-window policy accepts. */
    public static final int MAX_BACKUP_COUNT = 20;

    private FileAppenders() {
        // utility class
    }

    /**
     * Creates a size-rotated JSON-lines appender for {@code config.path()} with retention.
     */
    public static RollingFileAppender<ILoggingEvent> rotating(LoggerContext context, String name,
                                                              FileConfig config, Clock clock,
                                                              Diagnostics diagnostics) {
        RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName(name);
        appender.setFile(config.path());
        appender.setAppend(true);
        appender.setImmediateFlush(true);

        RetentionCleaner cleaner = new RetentionCleaner(
                Path.of(config.path()), config.retention().orElse(null), clock, diagnostics);

        RetentionRollingPolicy rollingPolicy = new RetentionRollingPolicy();
        rollingPolicy.setContext(context);
        rollingPolicy.setParent(appender);
        rollingPolicy.setFileNamePattern(config.path() + ".%i");
        rollingPolicy.setMinIndex(1);
        rollingPolicy.setMaxIndex(Math.min(Math.max(config.backupCount(), 1), MAX_BACKUP_COUNT));
        rollingPolicy.setCleaner(cleaner);
        rollingPolicy.start();

        SizeBasedTriggeringPolicy<ILoggingEvent> triggeringPolicy = new SizeBasedTriggeringPolicy<>();
        triggeringPolicy.setContext(context);
        triggeringPolicy.setMaxFileSize(new FileSize(config.maxBytes()));
        triggeringPolicy.start();

        appender.setRollingPolicy(rollingPolicy);
        appender.setTriggeringPolicy(triggeringPolicy);
        appender.setEncoder(encoder(context, jsonLayout(context)));

        cleaner.cleanup();
        return appender;
    }

    /**
     * Creates an async front over a rotating appender, passing events at {@code threshold} or above.
     */
    public static AsyncFileAppender async(LoggerContext context, String name, FileConfig config,
                                          Level threshold, Clock clock, Diagnostics diagnostics,
                                          PipelineMetrics metrics) {
        AsyncFileAppender appender = new AsyncFileAppender(rotating(context, name + "-writer", config, clock, diagnostics));
        appender.setContext(context);
        appender.setName(name);
        appender.setQueueSize(config.queueSize());
        appender.setLazyStart(config.delay());
        appender.setDiagnostics(diagnostics);
        appender.setMetrics(metrics);
        appender.addFilter(threshold(context, threshold));
        return appender;
    }

    /**
     * Creates a filter passing events at {@code level} or above.
     */
    public static ThresholdFilter threshold(LoggerContext context, Level level) {
        ThresholdFilter filter = new ThresholdFilter();
        filter.setContext(context);
        filter.setLevel(level.toString());
        filter.start();
        return filter;
    }

    public static LayoutWrappingEncoder<ILoggingEvent> encoder(LoggerContext context, Layout<ILoggingEvent> layout) {
        LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
        encoder.setContext(context);
        encoder.setLayout(layout);
        encoder.setCharset(StandardCharsets.UTF_8);
        encoder.start();
        return encoder;
    }

    private static JsonLineLayout jsonLayout(LoggerContext context) {
        JsonLineLayout layout = new JsonLineLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }
}

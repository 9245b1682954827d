package com.arkham.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.Layout;
import com.arkham.logging.config.ConsoleConfig;
import com.arkham.logging.config.ConsoleFormat;
import com.arkham.logging.config.FileConfig;
import com.arkham.logging.config.LogLevels;
import com.arkham.logging.config.LoggingConfig;
import com.arkham.logging.event.LoggingWideEventEmitter;
import com.arkham.logging.event.WideEventBuilder;
import com.arkham.logging.event.WideEvents;
import com.arkham.logging.format.ConsoleLayout;
import com.arkham.logging.format.JsonLineLayout;
import com.arkham.logging.metrics.PipelineMetrics;
import com.arkham.logging.operation.ErrorReporting;
import com.arkham.logging.operation.OperationLogger;
import com.arkham.logging.operation.ServiceCallLogging;
import com.arkham.logging.sampling.SamplingStrategy;
import com.arkham.logging.sanitize.DataSanitizer;
import com.arkham.logging.sink.AsyncFileAppender;
import com.arkham.logging.sink.FileAppenders;
import com.arkham.logging.tracing.TracingContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;

/**
 * Owns one complete logging pipeline: sinks, sampler, sanitizer and the wide-event factory.
 * <p>
 * The manager builds a private Logback {@link LoggerContext}, so loggers obtained from
 * {@link #getLogger(String)} write only to this manager's sinks and several managers can live
 * in one JVM. Sinks are installed in this order:
 * <ol>
 *   <li>{@value #CONSOLE_SINK}, when enabled</li>
 *   <li>{@value #FILE_SINK}: an {@link AsyncFileAppender}; when it cannot start, its rotating
 *       appender is used directly, and when that cannot start either the sink is omitted</li>
 *   <li>{@value #ERROR_FILE_SINK}: same construction, ERROR and above only, when configured</li>
 * </ol>
 * A failing sink never aborts construction; it is reported on the process error stream.
 * <p>
 * One manager is created by the application's composition root and handed to whatever needs
 * loggers or events. {@link #shutdown()} (also run by {@link #close()} and by the optional
 * shutdown hook) stops every sink once.
 */
public final class LoggingManager implements AutoCloseable {

    public static final String CONSOLE_SINK = "console";
    public static final String FILE_SINK = "file";
    public static final String ERROR_FILE_SINK = "error_file";

    /** Bound on {@link #flush()} per sink. */
    public static final Duration FLUSH_TIMEOUT = Duration.ofSeconds(5);

    private static final AtomicInteger INSTANCES = new AtomicInteger();

    private final LoggingConfig config;
    private final LoggerContext context;
    private final Logger rootLogger;
    private final TracingContext tracing;
    private final DataSanitizer sanitizer;
    private final SamplingStrategy sampler;
    private final PipelineMetrics metrics;
    private final Diagnostics diagnostics;
    private final WideEvents wideEvents;
    private final OperationLogger operations;
    private final ErrorReporting errorReporting;
    private final ServiceCallLogging serviceCalls;
    private final List<Appender<ILoggingEvent>> sinks = new ArrayList<>();
    private final AtomicBoolean shutDown = new AtomicBoolean();
    private Thread shutdownHook;

    /**
     * Creates a manager with default collaborators.
     */
    public LoggingManager(LoggingConfig config) {
        this(builder(config));
    }

    private LoggingManager(Builder builder) {
        this.config = builder.config;
        this.tracing = builder.tracing;
        this.sanitizer = builder.sanitizer;
        this.diagnostics = builder.diagnostics;

        String name = "arkham-logging-" + INSTANCES.incrementAndGet();
        this.metrics = new PipelineMetrics(builder.meterRegistry, name);
        this.context = new LoggerContext();
        context.setName(name);
        // share the SLF4J MDC so trace ids set through TracingContext reach these sinks
        context.setMDCAdapter(MDC.getMDCAdapter());
        context.getFrameworkPackages().add("com.arkham.logging.event");
        context.getFrameworkPackages().add("com.arkham.logging.operation");
        context.start();

        this.rootLogger = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(LogLevels.parse(config.globalLevel(), Level.INFO));

        installConsole(config.console());
        if (config.file().enabled()) {
            installFileSink(FILE_SINK, config.file(), LogLevels.parse(config.file().level(), Level.DEBUG), builder);
        }
        FileConfig errorFile = config.errorFile();
        if (errorFile != null && errorFile.enabled()) {
            installFileSink(ERROR_FILE_SINK, errorFile, LogLevels.parse(errorFile.level(), Level.ERROR), builder);
        }

        this.sampler = new SamplingStrategy(config.wideEvents(), builder.random);
        this.wideEvents = WideEvents.builder()
                .sampler(sampler)
                .sanitizer(sanitizer)
                .emitter(new LoggingWideEventEmitter(context.getLogger(WideEvents.LOGGER_NAME)))
                .tracing(tracing)
                .metrics(metrics)
                .diagnostics(diagnostics)
                .clock(builder.clock)
                .build();
        this.operations = new OperationLogger(wideEvents, context.getLogger(OperationLogger.class.getName()));
        this.errorReporting = new ErrorReporting(tracing);
        this.serviceCalls = new ServiceCallLogging(wideEvents);
    }

    public static Builder builder(LoggingConfig config) {
        return new Builder(config);
    }

    /**
     * Returns a logger whose records flow to this manager's sinks.
     */
    public org.slf4j.Logger getLogger(String name) {
        return context.getLogger(name);
    }

    public org.slf4j.Logger getLogger(Class<?> type) {
        return context.getLogger(type);
    }

    /**
     * Opens a wide event under the ambient trace id.
     */
    public WideEventBuilder createEvent(String service) {
        return wideEvents.open(service);
    }

    /**
     * Opens a wide event; {@code traceId} wins over the ambient one when given.
     */
    public WideEventBuilder createEvent(String service, String traceId) {
        return wideEvents.open(service, traceId);
    }

    /**
     * Returns the names of the installed sinks, in installation order.
     */
    public synchronized List<String> sinkNames() {
        List<String> names = new ArrayList<>(sinks.size());
        for (Appender<ILoggingEvent> sink : sinks) {
            names.add(sink.getName());
        }
        return names;
    }

    /**
     * Waits, bounded per sink, until queued records are written.
     */
    public synchronized void flush() {
        for (Appender<ILoggingEvent> sink : sinks) {
            if (sink instanceof AsyncFileAppender async && !async.flush(FLUSH_TIMEOUT)) {
                diagnostics.report("Sink '" + sink.getName() + "' did not flush within " + FLUSH_TIMEOUT);
            }
        }
    }

    /**
     * Installs a JVM shutdown hook that calls {@link #shutdown()}. Repeated calls install one hook.
     */
    public synchronized void registerShutdownHook() {
        if (shutdownHook == null && !shutDown.get()) {
            shutdownHook = new Thread(this::shutdown, "arkham-logging-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
    }

    /**
     * Stops every sink once, draining async queues within their bounded timeouts. Failures are
     * reported and do not prevent the remaining sinks from stopping.
     */
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            for (Appender<ILoggingEvent> sink : sinks) {
                try {
                    rootLogger.detachAppender(sink);
                    sink.stop();
                } catch (RuntimeException e) {
                    diagnostics.report("Failed to stop sink '" + sink.getName() + "'", e);
                }
            }
            sinks.clear();
            context.stop();
            removeShutdownHook();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isShutDown() {
        return shutDown.get();
    }

    public LoggingConfig config() {
        return config;
    }

    public TracingContext tracing() {
        return tracing;
    }

    public DataSanitizer sanitizer() {
        return sanitizer;
    }

    public SamplingStrategy sampler() {
        return sampler;
    }

    public WideEvents wideEvents() {
        return wideEvents;
    }

    public OperationLogger operations() {
        return operations;
    }

    public ErrorReporting errorReporting() {
        return errorReporting;
    }

    public ServiceCallLogging serviceCalls() {
        return serviceCalls;
    }

    public PipelineMetrics metrics() {
        return metrics;
    }

    private void installConsole(ConsoleConfig console) {
        if (!console.enabled()) {
            return;
        }
        try {
            ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
            appender.setContext(context);
            appender.setName(CONSOLE_SINK);
            appender.setEncoder(FileAppenders.encoder(context, consoleLayout(console.format())));
            appender.addFilter(FileAppenders.threshold(context, LogLevels.parse(console.level(), Level.INFO)));
            appender.start();
            attach(appender);
        } catch (RuntimeException e) {
            diagnostics.report("Console sink could not be created", e);
        }
    }

    private Layout<ILoggingEvent> consoleLayout(ConsoleFormat format) {
        Layout<ILoggingEvent> layout = format == ConsoleFormat.JSON
                ? new JsonLineLayout()
                : new ConsoleLayout(format == ConsoleFormat.COLORED);
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private void installFileSink(String name, FileConfig file, Level threshold, Builder builder) {
        try {
            AsyncFileAppender async = FileAppenders.async(context, name, file, threshold, builder.clock, diagnostics, metrics);
            async.setThreadFactory(builder.writerThreads);
            async.start();
            if (async.isStarted()) {
                attach(async);
                return;
            }
            // the async front failed on its own; the file may still be writable directly
            Appender<ILoggingEvent> rotating = async.getDelegate();
            if (!async.isDelegateFailed() && !rotating.isStarted()) {
                rotating.start();
            }
            if (rotating.isStarted()) {
                diagnostics.report("Async sink '" + name + "' unavailable, writing " + file.path() + " synchronously");
                rotating.addFilter(FileAppenders.threshold(context, threshold));
                attach(rotating);
                return;
            }
            diagnostics.report("File sink '" + name + "' disabled: " + file.path() + " could not be opened");
        } catch (RuntimeException e) {
            diagnostics.report("File sink '" + name + "' could not be created", e);
        }
    }

    private synchronized void attach(Appender<ILoggingEvent> appender) {
        rootLogger.addAppender(appender);
        sinks.add(appender);
    }

    private void removeShutdownHook() {
        if (shutdownHook == null || Thread.currentThread() == shutdownHook) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook runs and finds the manager stopped
            diagnostics.report("Shutdown hook left in place, JVM is exiting", e);
        }
    }

    /**
     * Builder for {@link LoggingManager}. Every collaborator except the configuration is optional.
     */
    public static final class Builder {

        private final LoggingConfig config;
        private TracingContext tracing = new TracingContext();
        private DataSanitizer sanitizer = DataSanitizer.defaults();
        private MeterRegistry meterRegistry = new SimpleMeterRegistry();
        private Diagnostics diagnostics = Diagnostics.stderr();
        private Clock clock = Clock.systemUTC();
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();
        private ThreadFactory writerThreads;

        private Builder(LoggingConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config must not be null");
            }
            this.config = config;
        }

        public Builder tracing(TracingContext tracing) {
            this.tracing = tracing;
            return this;
        }

        public Builder sanitizer(DataSanitizer sanitizer) {
            this.sanitizer = sanitizer;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder diagnostics(Diagnostics diagnostics) {
            this.diagnostics = diagnostics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Random source for sampling draws, values in {@code [0, 1)}. */
        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        /** Factory for the file sinks' writer threads; {@code null} keeps the default daemon threads. */
        public Builder writerThreads(ThreadFactory writerThreads) {
            this.writerThreads = writerThreads;
            return this;
        }

        public LoggingManager build() {
            if (tracing == null || sanitizer == null || meterRegistry == null
                    || diagnostics == null || clock == null || random == null) {
                throw new IllegalArgumentException("collaborators must not be null");
            }
            return new LoggingManager(this);
        }
    }
}

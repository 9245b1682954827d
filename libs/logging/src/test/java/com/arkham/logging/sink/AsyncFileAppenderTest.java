package com.arkham.logging.sink;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.AppenderBase;
import com.arkham.logging.Diagnostics;
import com.arkham.logging.metrics.PipelineMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AsyncFileAppender}: queue order, backpressure, flush, lazy start and the
 * stop lifecycle.
 */
@DisplayName("AsyncFileAppender")
class AsyncFileAppenderTest {

    private LoggerContext context;
    private RecordingAppender delegate;
    private AsyncFileAppender appender;
    private ByteArrayOutputStream err;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        context = new LoggerContext();
        delegate = new RecordingAppender();
        delegate.setContext(context);
        delegate.setName("recording");
        err = new ByteArrayOutputStream();
        metrics = PipelineMetrics.standalone("async-test");
        appender = new AsyncFileAppender(delegate);
        appender.setContext(context);
        appender.setName("file");
        appender.setDiagnostics(new Diagnostics(new PrintStream(err, true, StandardCharsets.UTF_8)));
        appender.setMetrics(metrics);
    }

    @AfterEach
    void tearDown() {
        delegate.release();
        appender.stop();
    }

    private ILoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent(AsyncFileAppenderTest.class.getName(),
                context.getLogger("orders"), Level.INFO, message, null, null);
        event.setMDCPropertyMap(Map.of());
        return event;
    }

    @Nested
    @DisplayName("Writing")
    class Writing {

        @Test
        @DisplayName("should write records in enqueue order and drain on stop")
        void shouldPreserveOrder() {
            appender.start();
            List<String> expected = IntStream.range(0, 200).mapToObj(i -> "R" + i).collect(Collectors.toList());

            expected.forEach(message -> appender.doAppend(event(message)));
            appender.stop();

            assertThat(delegate.messages()).containsExactlyElementsOf(expected);
            assertThat(appender.getState()).isEqualTo(AsyncFileAppender.State.STOPPED);
            assertThat(delegate.isStarted()).isFalse();
        }

        @Test
        @DisplayName("should flush everything queued before the call")
        void shouldFlush() {
            appender.start();
            for (int i = 0; i < 10; i++) {
                appender.doAppend(event("R" + i));
            }

            assertThat(appender.flush(Duration.ofSeconds(5))).isTrue();
            assertThat(delegate.messages()).hasSize(10);
        }

        @Test
        @DisplayName("should ignore records after stop")
        void shouldIgnoreAfterStop() {
            appender.start();
            appender.stop();

            appender.doAppend(event("late"));

            assertThat(delegate.messages()).isEmpty();
            assertThat(appender.flush(Duration.ofMillis(100))).isFalse();
        }

        @Test
        @DisplayName("should leave nothing queued when stop races with producers")
        void shouldNotStrandRecordsOnStop() throws InterruptedException {
            appender.setQueueSize(10_000);
            appender.start();
            AtomicBoolean running = new AtomicBoolean(true);
            CountDownLatch producing = new CountDownLatch(4);
            List<Thread> producers = IntStream.range(0, 4).mapToObj(p -> new Thread(() -> {
                producing.countDown();
                for (int i = 0; running.get(); i++) {
                    appender.doAppend(event("P" + p + "-" + i));
                }
            })).collect(Collectors.toList());
            producers.forEach(Thread::start);

            assertThat(producing.await(5, TimeUnit.SECONDS)).isTrue();
            appender.stop();
            running.set(false);
            for (Thread producer : producers) {
                producer.join(5_000);
            }

            assertThat(appender.getState()).isEqualTo(AsyncFileAppender.State.STOPPED);
            assertThat(appender.getPendingCount()).isZero();
            assertThat(delegate.messages()).doesNotHaveDuplicates();
        }
    }

    @Nested
    @DisplayName("Backpressure")
    class Backpressure {

        @Test
        @DisplayName("should drop and count records when the queue is full without blocking")
        void shouldDropWhenFull() throws Exception {
            delegate.blockWrites();
            appender.setQueueSize(1);
            appender.start();

            appender.doAppend(event("first"));
            assertThat(delegate.awaitWriteStarted()).isTrue();

            long started = System.nanoTime();
            for (int i = 0; i < 5; i++) {
                appender.doAppend(event("burst-" + i));
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertThat(elapsedMs).isLessThan(1000);
            assertThat(appender.getDroppedCount()).isEqualTo(4);
            assertThat(metrics.count(PipelineMetrics.RECORDS_DROPPED, PipelineMetrics.TAG_SINK, "file")).isEqualTo(4.0);
            assertThat(err.toString(StandardCharsets.UTF_8)).contains("Log queue full for sink 'file'");

            delegate.release();
            appender.stop();

            assertThat(delegate.messages()).containsExactly("first", "burst-0");
        }

        @Test
        @DisplayName("should reject a non-positive queue size")
        void shouldRejectInvalidQueueSize() {
            org.assertj.core.api.Assertions.assertThatThrownBy(() -> appender.setQueueSize(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Delegate lifecycle")
    class DelegateLifecycle {

        @Test
        @DisplayName("should start the delegate eagerly by default")
        void shouldStartEagerly() {
            appender.start();

            assertThat(delegate.isStarted()).isTrue();
            assertThat(appender.getState()).isEqualTo(AsyncFileAppender.State.RUNNING);
        }

        @Test
        @DisplayName("should open the delegate on the first record when lazy")
        void shouldStartLazily() {
            appender.setLazyStart(true);
            appender.start();

            assertThat(delegate.isStarted()).isFalse();

            appender.doAppend(event("first"));
            appender.flush(Duration.ofSeconds(5));

            assertThat(delegate.isStarted()).isTrue();
            assertThat(delegate.messages()).containsExactly("first");
        }

        @Test
        @DisplayName("should stay stopped when the delegate cannot start")
        void shouldNotStartWithBrokenDelegate() {
            delegate.refuseStart();

            appender.start();

            assertThat(appender.isStarted()).isFalse();
            assertThat(err.toString(StandardCharsets.UTF_8)).contains("could not open its file");
        }

        @Test
        @DisplayName("should stay stopped with a usable delegate when the writer thread cannot start")
        void shouldReportWriterThreadFailure() {
            appender.setThreadFactory(task -> {
                throw new IllegalStateException("no threads left");
            });

            appender.start();

            assertThat(appender.isStarted()).isFalse();
            assertThat(appender.isDelegateFailed()).isFalse();
            assertThat(delegate.isStarted()).isTrue();
            assertThat(err.toString(StandardCharsets.UTF_8)).contains("could not start its writer thread");
        }

        @Test
        @DisplayName("should count records the delegate fails to write")
        void shouldCountWriteFailures() {
            appender.start();
            delegate.stopOnNextWrite();

            appender.doAppend(event("doomed"));
            appender.flush(Duration.ofSeconds(5));

            assertThat(metrics.count(PipelineMetrics.WRITE_FAILURES, PipelineMetrics.TAG_SINK, "file")).isEqualTo(1.0);
            assertThat(err.toString(StandardCharsets.UTF_8)).contains("file stopped accepting writes");
        }
    }

    /**
     * Delegate that records messages and can block, refuse to start or stop itself.
     */
    private static final class RecordingAppender extends AppenderBase<ILoggingEvent> {

        private final List<String> messages = new CopyOnWriteArrayList<>();
        private final CountDownLatch writeStarted = new CountDownLatch(1);
        private final CountDownLatch gate = new CountDownLatch(1);
        private volatile boolean blocking;
        private volatile boolean refuseStart;
        private volatile boolean stopOnNextWrite;

        @Override
        public void start() {
            if (!refuseStart) {
                super.start();
            }
        }

        @Override
        protected void append(ILoggingEvent event) {
            writeStarted.countDown();
            if (blocking) {
                try {
                    gate.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (stopOnNextWrite) {
                stopOnNextWrite = false;
                stop();
                return;
            }
            messages.add(event.getFormattedMessage());
        }

        List<String> messages() {
            return List.copyOf(messages);
        }

        void blockWrites() {
            blocking = true;
        }

        boolean awaitWriteStarted() throws InterruptedException {
            return writeStarted.await(5, TimeUnit.SECONDS);
        }

        void release() {
            gate.countDown();
        }

        void refuseStart() {
            refuseStart = true;
        }

        void stopOnNextWrite() {
            stopOnNextWrite = true;
        }
    }
}

package com.arkham.logging.sink;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import com.arkham.logging.Diagnostics;
import com.arkham.logging.metrics.PipelineMetrics;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Non-blocking front for a file appender: producers enqueue, one worker thread writes.
 * <p>
 * {@link #append} never blocks. When the bounded queue is full the record is dropped, counted
 * and reported on the process error stream. The delegate (normally a rolling file appender) is
 * touched only by the worker, so all writes to the file are single-threaded and keep queue
 * order. With {@link #setLazyStart(boolean) lazy start} the delegate, and therefore the file,
 * is opened when the first record arrives.
 * <p>
 * Lifecycle: {@link State#STOPPED} → {@link State#RUNNING} → {@link State#DRAINING} →
 * {@link State#STOPPED}. {@link #stop()} refuses new records, waits a bounded time for the
 * queue to drain, then sends a stop sentinel and joins the worker with a timeout. The worker
 * stops the delegate on exit, which flushes and closes the file. Closing and enqueueing are
 * mutually exclusive, so no record can land behind the sentinel.
 * <p>
 * When the writer thread cannot be created the appender stays stopped and leaves a healthy
 * delegate started, so the owner can write through it directly.
 */
public class AsyncFileAppender extends UnsynchronizedAppenderBase<ILoggingEvent> {

    /** Lifecycle of the appender. */
    public enum State {
        STOPPED,
        RUNNING,
        DRAINING
    }

    public static final int DEFAULT_QUEUE_SIZE = 1000;
    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_JOIN_TIMEOUT = Duration.ofSeconds(5);

    private static final long POLL_INTERVAL_MS = 100;
    private static final ILoggingEvent STOP = new LoggingEvent();

    private final Appender<ILoggingEvent> delegate;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong dropped = new AtomicLong();
    private final ReadWriteLock admission = new ReentrantReadWriteLock();

    private int queueSize = DEFAULT_QUEUE_SIZE;
    private boolean lazyStart;
    private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;
    private Duration joinTimeout = DEFAULT_JOIN_TIMEOUT;
    private Diagnostics diagnostics = Diagnostics.stderr();
    private PipelineMetrics metrics;
    private ThreadFactory threadFactory;

    private BlockingQueue<ILoggingEvent> queue;
    private Thread worker;
    private volatile State state = State.STOPPED;
    private boolean delegateFailed;

    public AsyncFileAppender(Appender<ILoggingEvent> delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        this.delegate = delegate;
    }

    @Override
    public void start() {
        if (isStarted()) {
            return;
        }
        if (!lazyStart && !startDelegate()) {
            diagnostics.report("Async sink '" + getName() + "' could not open its file");
            addError("Delegate appender [" + delegate.getName() + "] failed to start");
            return;
        }
        queue = new ArrayBlockingQueue<>(queueSize);
        closed.set(false);
        state = State.RUNNING;
        try {
            worker = newWorker();
            worker.start();
        } catch (RuntimeException e) {
            state = State.STOPPED;
            worker = null;
            queue = null;
            diagnostics.report("Async sink '" + getName() + "' could not start its writer thread", e);
            addError("Writer thread for [" + getName() + "] failed to start", e);
            return;
        }
        super.start();
    }

    @Override
    protected void append(ILoggingEvent event) {
        if (closed.get()) {
            return;
        }
        // materialize thread-bound data before the event crosses threads
        event.prepareForDeferredProcessing();
        event.getCallerData();
        boolean accepted;
        admission.readLock().lock();
        try {
            if (closed.get()) {
                return;
            }
            accepted = queue.offer(event);
        } finally {
            admission.readLock().unlock();
        }
        if (!accepted) {
            dropped.incrementAndGet();
            if (metrics != null) {
                metrics.recordDropped(getName());
            }
            diagnostics.report("Log queue full for sink '" + getName() + "' (capacity " + queueSize
                    + "), dropping record from " + event.getLoggerName());
        }
    }

    /**
     * Waits until every record queued before this call has been written.
     *
     * @return true when the writes completed within {@code timeout}
     */
    public boolean flush(Duration timeout) {
        if (state != State.RUNNING) {
            return false;
        }
        FlushRequest request = new FlushRequest();
        try {
            long timeoutMs = timeout.toMillis();
            return queue.offer(request, timeoutMs, TimeUnit.MILLISECONDS)
                    && request.done.await(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void stop() {
        boolean closing;
        admission.writeLock().lock();
        try {
            closing = isStarted() && closed.compareAndSet(false, true);
        } finally {
            admission.writeLock().unlock();
        }
        if (!closing) {
            return;
        }
        state = State.DRAINING;
        if (!awaitDrain()) {
            diagnostics.report("Async sink '" + getName() + "' stopped with " + queue.size() + " records unwritten");
        }
        try {
            if (!queue.offer(STOP, joinTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                worker.interrupt();
            }
            worker.join(joinTimeout.toMillis());
            if (worker.isAlive()) {
                diagnostics.report("Async sink '" + getName() + "' writer did not stop within " + joinTimeout);
                worker.interrupt();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.interrupt();
        }
        state = State.STOPPED;
        super.stop();
    }

    public State getState() {
        return state;
    }

    /**
     * Returns how many records were dropped because the queue was full.
     */
    public long getDroppedCount() {
        return dropped.get();
    }

    public Appender<ILoggingEvent> getDelegate() {
        return delegate;
    }

    /**
     * Returns true once the delegate has refused to start; it is not retried.
     */
    public boolean isDelegateFailed() {
        return delegateFailed;
    }

    /**
     * Returns how many records are queued and not yet written.
     */
    public int getPendingCount() {
        BlockingQueue<ILoggingEvent> current = queue;
        return current == null ? 0 : current.size();
    }

    public int getQueueSize() {
        return queueSize;
    }

    public void setQueueSize(int queueSize) {
        if (queueSize <= 0) {
            throw new IllegalArgumentException("queueSize must be positive");
        }
        this.queueSize = queueSize;
    }

    public boolean isLazyStart() {
        return lazyStart;
    }

    public void setLazyStart(boolean lazyStart) {
        this.lazyStart = lazyStart;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public void setJoinTimeout(Duration joinTimeout) {
        this.joinTimeout = joinTimeout;
    }

    public void setDiagnostics(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public void setMetrics(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Sets the factory for the writer thread; by default a daemon thread named
     * {@code arkham-log-writer-<name>} is created.
     */
    public void setThreadFactory(ThreadFactory threadFactory) {
        this.threadFactory = threadFactory;
    }

    private Thread newWorker() {
        if (threadFactory == null) {
            Thread thread = new Thread(this::drainLoop, "arkham-log-writer-" + getName());
            thread.setDaemon(true);
            return thread;
        }
        Thread thread = threadFactory.newThread(this::drainLoop);
        if (thread == null) {
            throw new IllegalStateException("thread factory returned no thread");
        }
        return thread;
    }

    private void drainLoop() {
        try {
            while (true) {
                ILoggingEvent event = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (event == null) {
                    continue;
                }
                if (event == STOP) {
                    break;
                }
                if (event instanceof FlushRequest request) {
                    request.done.countDown();
                    continue;
                }
                write(event);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (delegate.isStarted()) {
                delegate.stop();
            }
        }
    }

    private void write(ILoggingEvent event) {
        if (!delegate.isStarted() && !startDelegate()) {
            recordWriteFailure("file could not be opened", null);
            return;
        }
        try {
            delegate.doAppend(event);
            if (!delegate.isStarted()) {
                recordWriteFailure("file stopped accepting writes", null);
            }
        } catch (RuntimeException e) {
            recordWriteFailure("record could not be written", e);
        }
    }

    private boolean startDelegate() {
        if (delegateFailed) {
            return false;
        }
        delegate.start();
        if (!delegate.isStarted()) {
            delegateFailed = true;
        }
        return !delegateFailed;
    }

    private void recordWriteFailure(String reason, RuntimeException cause) {
        if (metrics != null) {
            metrics.recordWriteFailure(getName());
        }
        diagnostics.report("Async sink '" + getName() + "': " + reason, cause);
    }

    private boolean awaitDrain() {
        long deadline = System.nanoTime() + drainTimeout.toNanos();
        while (!queue.isEmpty()) {
            if (System.nanoTime() >= deadline || !worker.isAlive()) {
                return queue.isEmpty();
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return queue.isEmpty();
            }
        }
        return true;
    }

    private static final class FlushRequest extends LoggingEvent {
        private final CountDownLatch done = new CountDownLatch(1);
    }
}

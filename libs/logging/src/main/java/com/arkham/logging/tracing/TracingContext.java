package com.arkham.logging.tracing;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Holds the current trace id with an SLF4J MDC bridge.
 * <p>
 * Storage is two-tier:
 * <ol>
 *   <li>a thread-confined slot, which is what concurrent request handling relies on, and</li>
 *   <li>a shared fallback, seen by any thread that has no id of its own (single-threaded
 *       tools and batch jobs that set the id once at start-up).</li>
 * </ol>
 * {@link #set(String)} and {@link #clear()} update both tiers; {@link #get()} prefers the
 * thread slot. The id is also mirrored into the MDC under {@value #MDC_TRACE_ID} so every log
 * line written on this thread carries it.
 * <p>
 * The current trace id belongs to a logical task, not to a pool thread. A thread pool does not
 * inherit it: hand work over with {@link #wrap(Runnable)} or {@link #wrap(Callable)}, which
 * capture the caller's id and install it around the task.
 * <p>
 * One instance is created by the application's composition root and shared with everything
 * that opens wide events.
 */
public final class TracingContext {

    /** MDC key for the trace id. */
    public static final String MDC_TRACE_ID = "trace_id";

    /** Prefix of generated trace ids. */
    public static final String TRACE_ID_PREFIX = "trace_";

    private final ThreadLocal<String> current = new ThreadLocal<>();
    private volatile String fallback;

    /**
     * Returns the current trace id: this thread's value, else the shared fallback.
     */
    public Optional<String> get() {
        String local = current.get();
        if (local != null) {
            return Optional.of(local);
        }
        return Optional.ofNullable(fallback);
    }

    /**
     * Sets the current trace id on both tiers. A null or blank id clears them.
     *
     * @param traceId the trace id, or null
     */
    public void set(String traceId) {
        if (traceId == null || traceId.isBlank()) {
            clear();
            return;
        }
        current.set(traceId);
        fallback = traceId;
        MDC.put(MDC_TRACE_ID, traceId);
    }

    /**
     * Clears the trace id on both tiers and removes the MDC key for this thread.
     */
    public void clear() {
        current.remove();
        fallback = null;
        MDC.remove(MDC_TRACE_ID);
    }

    /**
     * Generates a new trace id ({@code trace_} + 12 lowercase hex characters) and makes it current.
     *
     * @return the generated id
     */
    public String generate() {
        String traceId = newTraceId();
        set(traceId);
        return traceId;
    }

    /**
     * Creates a trace id without touching the current context.
     */
    public static String newTraceId() {
        return TRACE_ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    /**
     * Reads a trace id from incoming headers. Header names match case-insensitively.
     * {@value TraceHeaders#TRACE_ID} wins; otherwise the second field of
     * {@value TraceHeaders#TRACEPARENT} is used.
     *
     * @param headers request headers (null is treated as empty)
     * @return the trace id, if either header carries one
     */
    public Optional<String> extractFromHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> lowerCased = new LinkedHashMap<>();
        headers.forEach((name, value) -> {
            if (name != null && value != null) {
                lowerCased.putIfAbsent(name.toLowerCase(Locale.ROOT), value);
            }
        });

        String direct = lowerCased.get(TraceHeaders.TRACE_ID.toLowerCase(Locale.ROOT));
        if (direct != null && !direct.isBlank()) {
            return Optional.of(direct.trim());
        }

        String traceparent = lowerCased.get(TraceHeaders.TRACEPARENT);
        if (traceparent != null) {
            String[] parts = traceparent.trim().split("-");
            if (parts.length >= 2 && !parts[1].isBlank()) {
                return Optional.of(parts[1]);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns a copy of {@code headers} with the current trace id written to both
     * {@value TraceHeaders#TRACE_ID} and a synthesized {@value TraceHeaders#TRACEPARENT}
     * (the trace id also stands in for the parent id). Without a current trace id the copy
     * is returned unchanged.
     *
     * @param headers existing outgoing headers (may be null)
     * @return a new header map
     */
    public Map<String, String> propagateToHeaders(Map<String, String> headers) {
        Map<String, String> result = headers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(headers);
        get().ifPresent(traceId -> {
            result.put(TraceHeaders.TRACE_ID, traceId);
            result.put(TraceHeaders.TRACEPARENT, String.join("-",
                    TraceHeaders.TRACEPARENT_VERSION, traceId, traceId, TraceHeaders.TRACEPARENT_FLAGS));
        });
        return result;
    }

    /**
     * Same as {@link #propagateToHeaders(Map)} starting from no headers.
     */
    public Map<String, String> propagateToHeaders() {
        return propagateToHeaders(null);
    }

    /**
     * Runs {@code runnable} with {@code traceId} current on this thread, then restores the
     * previous thread value (or removes it). The shared fallback is not touched.
     *
     * @param traceId  trace id for the duration of the runnable
     * @param runnable the work to execute
     */
    public void runWithTraceId(String traceId, Runnable runnable) {
        String previous = current.get();
        try {
            setThreadLocal(traceId);
            runnable.run();
        } finally {
            setThreadLocal(previous);
        }
    }

    /**
     * Callable variant of {@link #runWithTraceId(String, Runnable)}.
     */
    public <T> T callWithTraceId(String traceId, Callable<T> callable) throws Exception {
        String previous = current.get();
        try {
            setThreadLocal(traceId);
            return callable.call();
        } finally {
            setThreadLocal(previous);
        }
    }

    /**
     * Captures the caller's current trace id and returns a runnable that installs it on
     * whichever thread eventually runs the task.
     */
    public Runnable wrap(Runnable task) {
        String captured = get().orElse(null);
        return () -> runWithTraceId(captured, task);
    }

    /**
     * Captures the caller's current trace id for a callable handed to another thread.
     */
    public <T> Callable<T> wrap(Callable<T> task) {
        String captured = get().orElse(null);
        return () -> callWithTraceId(captured, task);
    }

    private void setThreadLocal(String traceId) {
        if (traceId == null) {
            current.remove();
            MDC.remove(MDC_TRACE_ID);
        } else {
            current.set(traceId);
            MDC.put(MDC_TRACE_ID, traceId);
        }
    }
}

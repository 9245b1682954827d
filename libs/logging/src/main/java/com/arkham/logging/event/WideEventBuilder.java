package com.arkham.logging.event;

import com.arkham.logging.sanitize.DataSanitizer;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Accumulates the context of one operation and finalizes it into a {@link WideEvent}.
 * <p>
 * Every payload is sanitized before it is stored. Repeated calls to {@link #user},
 * {@link #input} and {@link #output} merge into the existing section. The first call to
 * {@link #success()} or one of the {@code error} methods finalizes and emits the event; any
 * later terminal call returns that same event without emitting again.
 * <p>
 * Methods are synchronized so dependencies can be recorded from parallel sub-calls.
 */
public final class WideEventBuilder {

    private final WideEvents owner;
    private final DataSanitizer sanitizer;
    private final String service;
    private final String traceId;
    private final String operationId;
    private final Instant timestamp;
    private final long startNanos;
    private final Boolean headDraw;

    private final Map<String, Object> user = new LinkedHashMap<>();
    private final Map<String, Object> input = new LinkedHashMap<>();
    private final Map<String, Object> output = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> dependencies = new LinkedHashMap<>();
    private final Map<String, Object> extra = new LinkedHashMap<>();
    private Integer statusCode;
    private String projectId;
    private WideEvent finished;

    WideEventBuilder(WideEvents owner, String service, String traceId, Instant timestamp,
                     long startNanos, Boolean headDraw) {
        this.owner = owner;
        this.sanitizer = owner.sanitizer();
        this.service = service;
        this.traceId = traceId;
        this.operationId = newOperationId();
        this.timestamp = timestamp;
        this.startNanos = startNanos;
        this.headDraw = headDraw;
    }

    static String newOperationId() {
        return "op_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public synchronized WideEventBuilder user(Map<String, ?> fields) {
        user.putAll(sanitizer.sanitizeFields(fields));
        return this;
    }

    public synchronized WideEventBuilder user(String key, Object value) {
        user.putAll(sanitizeEntry(key, value));
        return this;
    }

    public synchronized WideEventBuilder input(Map<String, ?> fields) {
        input.putAll(sanitizer.sanitizeFields(fields));
        return this;
    }

    public synchronized WideEventBuilder input(String key, Object value) {
        input.putAll(sanitizeEntry(key, value));
        return this;
    }

    public synchronized WideEventBuilder output(Map<String, ?> fields) {
        output.putAll(sanitizer.sanitizeFields(fields));
        return this;
    }

    public synchronized WideEventBuilder output(String key, Object value) {
        output.putAll(sanitizeEntry(key, value));
        return this;
    }

    /**
     * Records the timing of a named sub-call. A second call for the same name replaces the first.
     */
    public synchronized WideEventBuilder dependency(String name, long durationMs, Map<String, ?> metadata) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("duration_ms", durationMs);
        sanitizer.sanitizeFields(metadata).forEach(entry::putIfAbsent);
        dependencies.put(name, entry);
        return this;
    }

    public WideEventBuilder dependency(String name, long durationMs) {
        return dependency(name, durationMs, null);
    }

    public synchronized WideEventBuilder context(String key, Object value) {
        extra.putAll(sanitizeEntry(key, value));
        return this;
    }

    public synchronized WideEventBuilder context(Map<String, ?> fields) {
        extra.putAll(sanitizer.sanitizeFields(fields));
        return this;
    }

    public synchronized WideEventBuilder statusCode(int code) {
        this.statusCode = code;
        return this;
    }

    /**
     * Sets the project explicitly; otherwise a {@code project_id} context entry is used.
     */
    public synchronized WideEventBuilder projectId(String projectId) {
        this.projectId = projectId;
        return this;
    }

    /**
     * Finalizes the operation as successful and emits it if sampled.
     */
    public synchronized WideEvent success() {
        if (finished == null) {
            finish(Outcome.SUCCESS, null);
        }
        return finished;
    }

    public WideEvent error(String code, String message) {
        return error(code, message, null, null);
    }

    public WideEvent error(String code, String message, Throwable exception) {
        return error(code, message, exception, null);
    }

    /**
     * Finalizes the operation as failed and emits it if sampled.
     *
     * @param code      short error code
     * @param message   human-readable message, sanitized before storage
     * @param exception the failure, or null
     * @param traceback pre-rendered traceback; rendered from {@code exception} when null
     */
    public synchronized WideEvent error(String code, String message, Throwable exception, String traceback) {
        if (finished == null) {
            String safeCode = code == null || code.isBlank() ? "UNKNOWN_ERROR" : code;
            String safeMessage = message == null ? "" : sanitizer.sanitizeText(message);
            finish(Outcome.ERROR, ErrorDetails.of(safeCode, safeMessage, exception, traceback));
        }
        return finished;
    }

    public String service() {
        return service;
    }

    public String traceId() {
        return traceId;
    }

    public String operationId() {
        return operationId;
    }

    public synchronized boolean isFinished() {
        return finished != null;
    }

    private void finish(Outcome outcome, ErrorDetails error) {
        long durationMs = Math.max(0L, (owner.nowNanos() - startNanos) / 1_000_000L);
        finished = new WideEvent(
                operationId,
                traceId,
                timestamp,
                durationMs,
                service,
                outcome,
                statusCode,
                resolveProjectId(),
                user,
                input,
                output,
                dependencies,
                error,
                extra);
        owner.complete(finished, headDraw);
    }

    private String resolveProjectId() {
        if (projectId != null) {
            return projectId;
        }
        Object fromContext = extra.get("project_id");
        return fromContext == null ? null : String.valueOf(fromContext);
    }

    private Map<String, Object> sanitizeEntry(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        return sanitizer.sanitizeFields(Collections.singletonMap(key, value));
    }
}

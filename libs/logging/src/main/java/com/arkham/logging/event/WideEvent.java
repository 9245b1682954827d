package com.arkham.logging.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One immutable record describing a complete operation.
 * <p>
 * The error section is present exactly when the outcome is {@link Outcome#ERROR}; the compact
 * constructor rejects any other combination. Map sections are copied and exposed
 * read-only; empty sections are kept as empty maps and omitted by {@link #toMap()}.
 *
 * @param operationId  unique id of this event ({@code op_} + 12 hex characters)
 * @param traceId      id shared by every event of one logical request
 * @param timestamp    when the operation was opened
 * @param durationMs   elapsed milliseconds between open and finalization, never negative
 * @param service      operation name, e.g. {@code orders.create}
 * @param outcome      success or error
 * @param statusCode   protocol status code, or null
 * @param projectId    project the operation belongs to, or null
 * @param user         sanitized actor context
 * @param input        sanitized input summary
 * @param output       sanitized output summary
 * @param dependencies sub-call timings keyed by dependency name
 * @param error        failure details, present iff the outcome is error
 * @param extra        sanitized free-form context
 */
public record WideEvent(
        String operationId,
        String traceId,
        Instant timestamp,
        long durationMs,
        String service,
        Outcome outcome,
        Integer statusCode,
        String projectId,
        Map<String, Object> user,
        Map<String, Object> input,
        Map<String, Object> output,
        Map<String, Map<String, Object>> dependencies,
        ErrorDetails error,
        Map<String, Object> extra
) {

    public WideEvent {
        if (operationId == null || operationId.isBlank()) {
            throw new IllegalArgumentException("operationId must not be null or blank");
        }
        if (traceId == null || traceId.isBlank()) {
            throw new IllegalArgumentException("traceId must not be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must not be negative");
        }
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("service must not be null or blank");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        if ((outcome == Outcome.ERROR) != (error != null)) {
            throw new IllegalArgumentException("error must be present if and only if outcome is error");
        }
        user = readOnly(user);
        input = readOnly(input);
        output = readOnly(output);
        dependencies = dependencies == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(dependencies));
        extra = readOnly(extra);
    }

    public boolean isError() {
        return outcome == Outcome.ERROR;
    }

    /**
     * Returns the serialized shape. Core keys come first; empty sections are omitted and
     * free-form context keys never replace a core key.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("timestamp", timestamp.toString());
        map.put("operation_id", operationId);
        map.put("trace_id", traceId);
        map.put("service", service);
        map.put("duration_ms", durationMs);
        map.put("outcome", outcome.value());
        if (statusCode != null) {
            map.put("status_code", statusCode);
        }
        if (error != null) {
            map.put("error", error.toMap());
        }
        if (!user.isEmpty()) {
            map.put("user", user);
        }
        if (!input.isEmpty()) {
            map.put("input", input);
        }
        if (!output.isEmpty()) {
            map.put("output", output);
        }
        if (!dependencies.isEmpty()) {
            map.put("dependencies", dependencies);
        }
        if (projectId != null) {
            map.put("project_id", projectId);
        }
        extra.forEach(map::putIfAbsent);
        return map;
    }

    private static Map<String, Object> readOnly(Map<String, Object> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}

package com.arkham.logging.operation;

import com.arkham.logging.event.WideEvent;
import com.arkham.logging.event.WideEventBuilder;
import com.arkham.logging.tracing.TracingContext;
import org.slf4j.Logger;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error messages and log lines that carry the trace id and business context, so a failure can
 * be found by {@code trace_id} or by ids such as {@code job_id}.
 */
public final class ErrorReporting {

    /** Context pairs rendered into a message. */
    public static final int MAX_CONTEXT_ITEMS = 8;

    private static final int MAX_VALUE_LENGTH = 64;
    private static final int TRUNCATED_LENGTH = 61;

    private final TracingContext tracing;

    public ErrorReporting(TracingContext tracing) {
        if (tracing == null) {
            throw new IllegalArgumentException("tracing must not be null");
        }
        this.tracing = tracing;
    }

    /**
     * Formats {@code message (k=v ... trace_id=...): exception message}.
     * <p>
     * At most {@value #MAX_CONTEXT_ITEMS} pairs are rendered (the trace id counts as one, after
     * the caller's pairs); string values longer than 64 characters are cut to 61 plus
     * {@code ...}. The exception suffix is omitted when its message is empty.
     */
    public String formatErrorMessage(String message, Throwable exception, Map<String, ?> context) {
        Map<String, Object> items = withTraceId(context);
        StringBuilder result = new StringBuilder(message == null ? "" : message);
        if (!items.isEmpty()) {
            result.append(" (");
            Iterator<Map.Entry<String, Object>> entries = items.entrySet().iterator();
            for (int i = 0; i < MAX_CONTEXT_ITEMS && entries.hasNext(); i++) {
                Map.Entry<String, Object> entry = entries.next();
                if (i > 0) {
                    result.append(' ');
                }
                result.append(entry.getKey()).append('=').append(render(entry.getValue()));
            }
            result.append(')');
        }
        if (exception != null && exception.getMessage() != null && !exception.getMessage().isEmpty()) {
            result.append(": ").append(exception.getMessage());
        }
        return result.toString();
    }

    /**
     * Logs at ERROR with the formatted message, the exception (when given) and the context plus
     * trace id as key/value pairs.
     */
    public void logErrorWithContext(Logger logger, String message, Throwable exception, Map<String, ?> context) {
        LoggingEventBuilder builder = logger.atError();
        for (Map.Entry<String, Object> entry : withTraceId(context).entrySet()) {
            builder = builder.addKeyValue(entry.getKey(), entry.getValue());
        }
        if (exception != null) {
            builder = builder.setCause(exception);
        }
        builder.log(formatErrorMessage(message, exception, context));
    }

    /**
     * Finalizes {@code event} as an error with the exception's type and stack trace.
     *
     * @return the finished event, or null when {@code event} is null
     */
    public static WideEvent emitWideError(WideEventBuilder event, String code, String message, Throwable exception) {
        if (event == null) {
            return null;
        }
        return event.error(code, message, exception);
    }

    private Map<String, Object> withTraceId(Map<String, ?> context) {
        Map<String, Object> items = new LinkedHashMap<>();
        if (context != null) {
            items.putAll(context);
        }
        tracing.get().ifPresent(traceId -> items.put("trace_id", traceId));
        return items;
    }

    private static String render(Object value) {
        if (value instanceof String text && text.length() > MAX_VALUE_LENGTH) {
            return text.substring(0, TRUNCATED_LENGTH) + "...";
        }
        return String.valueOf(value);
    }
}

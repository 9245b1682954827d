package com.arkham.logging.event;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure description attached to an error-outcome {@link WideEvent}.
 *
 * @param code      short machine-readable code (required)
 * @param message   human-readable message (never null)
 * @param type      exception type name, or null when no exception was given
 * @param traceback rendered stack trace, or null
 */
public record ErrorDetails(String code, String message, String type, String traceback) {

    public ErrorDetails {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code must not be null or blank");
        }
        if (message == null) {
            message = "";
        }
    }

    /**
     * Builds error details from an optional exception. When {@code traceback} is null and an
     * exception is present, its stack trace is rendered.
     */
    public static ErrorDetails of(String code, String message, Throwable exception, String traceback) {
        if (exception == null) {
            return new ErrorDetails(code, message, null, traceback);
        }
        String rendered = traceback != null ? traceback : render(exception);
        return new ErrorDetails(code, message, exception.getClass().getSimpleName(), rendered);
    }

    /**
     * Renders a throwable's stack trace, causes included.
     */
    public static String render(Throwable exception) {
        StringWriter writer = new StringWriter();
        exception.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("code", code);
        map.put("message", message);
        if (type != null) {
            map.put("type", type);
        }
        if (traceback != null) {
            map.put("traceback", traceback);
        }
        return map;
    }
}

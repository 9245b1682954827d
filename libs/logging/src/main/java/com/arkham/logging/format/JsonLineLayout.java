package com.arkham.logging.format;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.event.KeyValuePair;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders each logging event as one JSON object followed by a newline.
 * <p>
 * Fixed keys: {@code timestamp} (ISO-8601 UTC), {@code level}, {@code logger}, {@code message},
 * {@code module}, {@code function}, {@code line}, {@code thread}, and {@code exception}
 * ({@code type}, {@code message}, {@code traceback}) when a throwable is attached. Structured
 * key/value pairs follow as additional top-level keys, then MDC entries for keys no pair set;
 * none of them can replace a fixed key. ANSI escape sequences are removed from every string.
 */
public class JsonLineLayout extends LayoutBase<ILoggingEvent> {

    /** Keys owned by the layout. */
    public static final Set<String> RESERVED_KEYS = Set.of(
            "timestamp", "level", "logger", "message", "module", "function", "line", "thread", "exception");

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    @Override
    public String doLayout(ILoggingEvent event) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("timestamp", Instant.ofEpochMilli(event.getTimeStamp()).toString());
        line.put("level", event.getLevel().toString());
        line.put("logger", event.getLoggerName());
        line.put("message", AnsiCodes.strip(event.getFormattedMessage()));
        putCaller(line, event);
        line.put("thread", event.getThreadName());

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            line.put("exception", exception(throwable));
        }

        List<KeyValuePair> pairs = event.getKeyValuePairs();
        if (pairs != null) {
            for (KeyValuePair pair : pairs) {
                putExtra(line, pair.key, pair.value);
            }
        }
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null) {
            mdc.forEach((key, value) -> putExtra(line, key, value));
        }
        return serialize(line) + CoreConstants.LINE_SEPARATOR;
    }

    @Override
    public String getContentType() {
        return "application/x-ndjson";
    }

    private static void putCaller(Map<String, Object> line, ILoggingEvent event) {
        StackTraceElement[] callerData = event.getCallerData();
        if (callerData != null && callerData.length > 0) {
            StackTraceElement caller = callerData[0];
            line.put("module", caller.getClassName());
            line.put("function", caller.getMethodName());
            line.put("line", caller.getLineNumber());
        } else {
            line.put("module", null);
            line.put("function", null);
            line.put("line", null);
        }
    }

    private static Map<String, Object> exception(IThrowableProxy throwable) {
        Map<String, Object> exception = new LinkedHashMap<>();
        String className = throwable.getClassName();
        exception.put("type", className.substring(className.lastIndexOf('.') + 1));
        exception.put("message", AnsiCodes.strip(throwable.getMessage()));
        exception.put("traceback", AnsiCodes.strip(ThrowableProxyUtil.asString(throwable)));
        return exception;
    }

    private static void putExtra(Map<String, Object> line, String key, Object value) {
        if (key == null || RESERVED_KEYS.contains(key)) {
            return;
        }
        line.putIfAbsent(key, AnsiCodes.stripDeep(value));
    }

    private String serialize(Map<String, Object> line) {
        try {
            return MAPPER.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            Map<String, Object> fallback = new LinkedHashMap<>();
            line.forEach((key, value) -> fallback.put(key, value == null || value instanceof Number
                    ? value : String.valueOf(value)));
            try {
                return MAPPER.writeValueAsString(fallback);
            } catch (JsonProcessingException again) {
                addError("Failed to serialize log line", again);
                return "{\"message\":\"unserializable log line\"}";
            }
        }
    }
}

package com.arkham.logging.operation;

import com.arkham.logging.event.WideEventBuilder;
import com.arkham.logging.event.WideEvents;
import org.slf4j.Logger;

import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs a unit of work inside a wide event.
 * <p>
 * The event is opened with the explicit trace id or the ambient one, and the sanitized context
 * is attached both as input and as context entries. The body receives the builder to add
 * output, dependencies or status. A normal return completes the event with {@code success()}.
 * An exception completes it with {@code error()} (code = exception simple name), is logged as
 * {@code Operation failed: <service>} and is rethrown unchanged. A body that finalizes the
 * event itself keeps its own outcome.
 */
public final class OperationLogger {

    /**
     * Work executed inside an operation.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    public interface OperationBody<T> {
        T execute(WideEventBuilder event) throws Exception;
    }

    private final WideEvents events;
    private final Logger failureLogger;

    /**
     * @param events        opens and emits the wide events
     * @param failureLogger receives the {@code Operation failed} lines
     */
    public OperationLogger(WideEvents events, Logger failureLogger) {
        if (events == null) {
            throw new IllegalArgumentException("events must not be null");
        }
        if (failureLogger == null) {
            throw new IllegalArgumentException("failureLogger must not be null");
        }
        this.events = events;
        this.failureLogger = failureLogger;
    }

    /**
     * Runs {@code body} as operation {@code service} under the ambient trace id.
     *
     * @throws Exception whatever the body throws
     */
    public <T> T call(String service, Map<String, ?> context, OperationBody<T> body) throws Exception {
        return call(service, null, context, body);
    }

    /**
     * Runs {@code body} as operation {@code service}.
     *
     * @param service operation name
     * @param traceId explicit trace id, or null for the ambient one
     * @param context context attached as input and context entries (may be null)
     * @param body    the work
     * @return the body's result
     * @throws Exception whatever the body throws
     */
    public <T> T call(String service, String traceId, Map<String, ?> context, OperationBody<T> body)
            throws Exception {
        WideEventBuilder event = events.open(service, traceId);
        Map<String, Object> sanitized = events.sanitizer().sanitizeFields(context);
        event.input(sanitized);
        event.context(sanitized);
        try {
            T result = body.execute(event);
            event.success();
            return result;
        } catch (Throwable t) {
            // errors are recorded too; the rethrow keeps the body's declared types
            event.error(t.getClass().getSimpleName(), t.getMessage() == null ? "" : t.getMessage(), t);
            failureLogger.atError()
                    .setCause(t)
                    .addKeyValue("context", sanitized)
                    .addKeyValue("trace_id", event.traceId())
                    .log("Operation failed: {}", service);
            throw t;
        }
    }

    /**
     * Unchecked variant of {@link #call(String, Map, OperationBody)} for bodies that throw only
     * runtime exceptions.
     */
    public <T> T supply(String service, Map<String, ?> context, Function<WideEventBuilder, T> body) {
        try {
            return call(service, null, context, body::apply);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected checked exception in operation " + service, e);
        }
    }

    /**
     * Void variant of {@link #supply(String, Map, Function)}.
     */
    public void run(String service, Map<String, ?> context, Consumer<WideEventBuilder> body) {
        supply(service, context, event -> {
            body.accept(event);
            return null;
        });
    }

    public WideEvents events() {
        return events;
    }
}

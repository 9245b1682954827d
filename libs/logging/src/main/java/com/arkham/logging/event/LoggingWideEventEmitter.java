package com.arkham.logging.event;

import org.slf4j.Logger;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.Map;

/**
 * Writes kept wide events to an SLF4J logger as structured key/value pairs.
 * <p>
 * Successful operations are logged at INFO, failed ones at ERROR so that an error-only sink
 * receives them. The message is a short human summary; the JSON layout lifts every pair to a
 * top-level key of the line. The line's own {@code timestamp} is the emission time, so the
 * event's creation time is written as {@value #EVENT_TIMESTAMP_KEY}.
 */
public final class LoggingWideEventEmitter implements WideEventEmitter {

    /** Key carrying {@link WideEvent#timestamp()} on the emitted record. */
    public static final String EVENT_TIMESTAMP_KEY = "event_timestamp";

    private final Logger logger;

    public LoggingWideEventEmitter(Logger logger) {
        if (logger == null) {
            throw new IllegalArgumentException("logger must not be null");
        }
        this.logger = logger;
    }

    @Override
    public void emit(WideEvent event) {
        LoggingEventBuilder builder = event.isError() ? logger.atError() : logger.atInfo();
        for (Map.Entry<String, Object> entry : event.toMap().entrySet()) {
            String key = "timestamp".equals(entry.getKey()) ? EVENT_TIMESTAMP_KEY : entry.getKey();
            builder = builder.addKeyValue(key, entry.getValue());
        }
        builder.log("{} {} in {}ms", event.service(), event.outcome().value(), event.durationMs());
    }
}

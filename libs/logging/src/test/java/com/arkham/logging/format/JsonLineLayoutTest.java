package com.arkham.logging.format;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.event.KeyValuePair;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JsonLineLayout}: fixed keys, caller data, exceptions, extra keys and ANSI
 * stripping.
 */
@DisplayName("JsonLineLayout")
class JsonLineLayoutTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LoggerContext context;
    private JsonLineLayout layout;

    @BeforeEach
    void setUp() {
        context = new LoggerContext();
        layout = new JsonLineLayout();
        layout.setContext(context);
        layout.start();
    }

    private LoggingEvent event(Level level, String message, Throwable throwable) {
        LoggingEvent event = new LoggingEvent(JsonLineLayoutTest.class.getName(),
                context.getLogger("orders.api"), level, message, throwable, null);
        event.setMDCPropertyMap(Map.of());
        event.setCallerData(new StackTraceElement[]{
                new StackTraceElement("com.example.OrderController", "create", "OrderController.java", 42)});
        return event;
    }

    private Map<String, Object> parse(String line) throws Exception {
        return MAPPER.readValue(line, new TypeReference<>() {
        });
    }

    @Test
    @DisplayName("should render one JSON object per line with the fixed keys")
    void shouldRenderFixedKeys() throws Exception {
        String line = layout.doLayout(event(Level.INFO, "order created", null));

        assertThat(line).endsWith(System.lineSeparator());
        assertThat(line.trim()).doesNotContain("\n");
        Map<String, Object> json = parse(line);
        assertThat(json)
                .containsEntry("level", "INFO")
                .containsEntry("logger", "orders.api")
                .containsEntry("message", "order created")
                .containsEntry("module", "com.example.OrderController")
                .containsEntry("function", "create")
                .containsEntry("line", 42)
                .containsKeys("timestamp", "thread")
                .doesNotContainKey("exception");
        assertThat((String) json.get("timestamp")).endsWith("Z");
    }

    @Test
    @DisplayName("should describe an attached exception")
    @SuppressWarnings("unchecked")
    void shouldDescribeException() throws Exception {
        Map<String, Object> json = parse(layout.doLayout(
                event(Level.ERROR, "failed", new IllegalStateException("stock missing"))));

        Map<String, Object> exception = (Map<String, Object>) json.get("exception");
        assertThat(exception)
                .containsEntry("type", "IllegalStateException")
                .containsEntry("message", "stock missing");
        assertThat((String) exception.get("traceback")).contains("java.lang.IllegalStateException: stock missing");
    }

    @Test
    @DisplayName("should let a key/value pair win over the same MDC key")
    void shouldPreferPairsOverMdc() throws Exception {
        LoggingEvent event = new LoggingEvent(JsonLineLayoutTest.class.getName(),
                context.getLogger("arkham.wide_event"), Level.INFO, "wide event", null, null);
        event.setMDCPropertyMap(Map.of("trace_id", "trace_ambient000", "request_path", "/api/v1/orders"));
        event.addKeyValuePair(new KeyValuePair("trace_id", "trace_explicit111"));

        Map<String, Object> json = parse(layout.doLayout(event));

        assertThat(json)
                .containsEntry("trace_id", "trace_explicit111")
                .containsEntry("request_path", "/api/v1/orders");
    }

    @Test
    @DisplayName("should merge MDC and key/value pairs without replacing fixed keys")
    void shouldMergeExtras() throws Exception {
        LoggingEvent event = new LoggingEvent(JsonLineLayoutTest.class.getName(),
                context.getLogger("orders.api"), Level.INFO, "with extras", null, null);
        event.setMDCPropertyMap(Map.of("trace_id", "trace_abc", "level", "spoofed"));
        event.addKeyValuePair(new KeyValuePair("order_id", 42));
        event.addKeyValuePair(new KeyValuePair("message", "spoofed"));
        event.addKeyValuePair(new KeyValuePair("input", Map.of("sku", "A-1")));

        Map<String, Object> json = parse(layout.doLayout(event));

        assertThat(json)
                .containsEntry("trace_id", "trace_abc")
                .containsEntry("order_id", 42)
                .containsEntry("input", Map.of("sku", "A-1"))
                .containsEntry("level", "INFO")
                .containsEntry("message", "with extras");
    }

    @Test
    @DisplayName("should strip ANSI escape sequences")
    void shouldStripAnsi() throws Exception {
        LoggingEvent event = event(Level.WARN, AnsiCodes.RED + "red alert" + AnsiCodes.RESET, null);
        event.addKeyValuePair(new KeyValuePair("note", AnsiCodes.GREEN + "ok" + AnsiCodes.RESET));

        String line = layout.doLayout(event);

        assertThat(line).doesNotContain("\u001B");
        assertThat(parse(line)).containsEntry("message", "red alert").containsEntry("note", "ok");
    }

    @Test
    @DisplayName("should fall back to text for values Jackson cannot serialize")
    void shouldFallBackForUnserializableValues() throws Exception {
        Object selfReferencing = new Object() {
            public Object getSelf() {
                return this;
            }

            @Override
            public String toString() {
                return "opaque";
            }
        };
        LoggingEvent event = event(Level.INFO, "odd value", null);
        event.addKeyValuePair(new KeyValuePair("thing", selfReferencing));

        assertThat(parse(layout.doLayout(event))).containsEntry("thing", "opaque");
    }

    @Test
    @DisplayName("should emit null caller fields when caller data is missing")
    void shouldHandleMissingCallerData() throws Exception {
        LoggingEvent event = new LoggingEvent(JsonLineLayoutTest.class.getName(),
                context.getLogger("orders.api"), Level.INFO, "no caller", null, null);
        event.setMDCPropertyMap(Map.of());
        event.setCallerData(new StackTraceElement[0]);

        Map<String, Object> json = parse(layout.doLayout(event));

        assertThat(json).containsEntry("module", null).containsEntry("line", null);
        assertThat(layout.getContentType()).isEqualTo("application/x-ndjson");
    }
}

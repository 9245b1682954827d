package com.arkham.logging.format;

import ch.qos.logback.classic.Level;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * ANSI colour codes for console output, and stripping of escape sequences for structured output.
 */
public final class AnsiCodes {

    public static final String RESET = "\u001B[0m";
    public static final String RED = "\u001B[31m";
    public static final String GREEN = "\u001B[32m";
    public static final String YELLOW = "\u001B[33m";
    public static final String CYAN = "\u001B[36m";
    public static final String BOLD_RED = "\u001B[1;31m";

    private static final Pattern ESCAPE = Pattern.compile("\u001B\\[[0-9;?]*[A-Za-z]");

    private AnsiCodes() {
        // utility class
    }

    /**
     * Returns the colour used for a level.
     */
    public static String colorFor(Level level) {
        if (level == null) {
            return RESET;
        }
        return switch (level.toInt()) {
            case Level.ERROR_INT -> BOLD_RED;
            case Level.WARN_INT -> YELLOW;
            case Level.INFO_INT -> GREEN;
            case Level.DEBUG_INT, Level.TRACE_INT -> CYAN;
            default -> RESET;
        };
    }

    /**
     * Removes every ANSI escape sequence from {@code text}.
     */
    public static String strip(String text) {
        if (text == null || text.indexOf('\u001B') < 0) {
            return text;
        }
        return ESCAPE.matcher(text).replaceAll("");
    }

    /**
     * Strips escape sequences from every string inside a value, copying maps and collections.
     */
    public static Object stripDeep(Object value) {
        if (value instanceof String text) {
            return strip(text);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, val) -> copy.put(key instanceof String k ? strip(k) : key, stripDeep(val)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(stripDeep(element));
            }
            return copy;
        }
        return value;
    }
}

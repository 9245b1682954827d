package com.arkham.logging.sanitize;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts sensitive data from arbitrary nested values before they reach a log sink.
 * <p>
 * Two mechanisms run together:
 * <ul>
 *   <li><b>Key redaction</b>: a map entry whose key equals or contains one of the sensitive
 *       key fragments (case-insensitive) has its whole value replaced by the redaction token,
 *       unless the key is whitelisted.</li>
 *   <li><b>Value redaction</b>: every string is scanned with the built-in patterns (email,
 *       credit card, SSN, phone and optionally IPv4, in that order) followed by any custom
 *       patterns; every match is replaced by the redaction token.</li>
 * </ul>
 * The input is never mutated: maps, lists, sets and arrays are copied with the same shape.
 * Numbers, booleans, characters and {@code null} pass through unchanged; any other object is
 * converted with {@code toString()} and sanitized as text. Sanitizing never throws.
 * <p>
 * Descent stops at {@value #MAX_DEPTH} levels, and a container that appears again on its own
 * descent path is replaced by {@value #CIRCULAR_MARKER} instead of being followed.
 */
public final class DataSanitizer {

    /** Default replacement for redacted content. */
    public static final String DEFAULT_REDACTION = "***";

    /** Maximum nesting depth followed before a value is replaced by {@value #DEPTH_MARKER}. */
    public static final int MAX_DEPTH = 50;

    /** Replacement for values nested deeper than {@link #MAX_DEPTH}. */
    public static final String DEPTH_MARKER = "<max depth exceeded>";

    /** Replacement for a container that (directly or indirectly) contains itself. */
    public static final String CIRCULAR_MARKER = "<circular reference>";

    /** Key fragments treated as sensitive when no custom set is supplied. */
    public static final Set<String> DEFAULT_SENSITIVE_KEYS = Set.of(
            "password", "passwd", "secret", "token", "api_key", "apikey",
            "authorization", "credential", "private_key", "access_key",
            "session_id", "cookie", "ssn", "credit_card", "card_number", "cvv"
    );

    static final Pattern EMAIL =
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    static final Pattern CREDIT_CARD =
            Pattern.compile("\\b(?:\\d{4}[-\\s]?){3}\\d{4}\\b");
    static final Pattern SSN =
            Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b");
    static final Pattern PHONE =
            Pattern.compile("(?:\\+?1[-.\\s]?)?\\(?\\b\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b");
    static final Pattern IPV4 =
            Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");

    private final String redaction;
    private final Set<String> sensitiveKeys;
    private final Set<String> whitelistKeys;
    private final List<Pattern> valuePatterns;

    private DataSanitizer(Builder builder) {
        this.redaction = builder.redaction;
        this.sensitiveKeys = lowerCased(builder.sensitiveKeys);
        this.whitelistKeys = lowerCased(builder.whitelistKeys);

        List<Pattern> patterns = new ArrayList<>();
        if (builder.sanitizeEmails) {
            patterns.add(EMAIL);
        }
        patterns.add(CREDIT_CARD);
        patterns.add(SSN);
        patterns.add(PHONE);
        if (builder.sanitizeIps) {
            patterns.add(IPV4);
        }
        patterns.addAll(builder.customPatterns);
        this.valuePatterns = List.copyOf(patterns);
    }

    /**
     * Creates a sanitizer with the default token, key vocabulary and patterns
     * (emails redacted, IP addresses kept).
     */
    public static DataSanitizer defaults() {
        return builder().build();
    }

    /**
     * Starts a builder pre-populated with the defaults.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a sanitized copy of {@code value}.
     *
     * @param value any value, including {@code null}
     * @return a structurally identical copy with sensitive content replaced
     */
    public Object sanitize(Object value) {
        return sanitize(value, 0, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    /**
     * Sanitizes a map of fields, the most common call shape for event payloads.
     *
     * @param fields field map (null is treated as empty)
     * @return a new insertion-ordered map; never null
     */
    public Map<String, Object> sanitizeFields(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            return new LinkedHashMap<>();
        }
        Object sanitized = sanitize(fields);
        Map<String, Object> result = new LinkedHashMap<>();
        if (sanitized instanceof Map<?, ?> map) {
            map.forEach((key, val) -> result.put(String.valueOf(key), val));
        }
        return result;
    }

    /**
     * Sanitizes a single string with the value patterns.
     */
    public String sanitizeText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Pattern pattern : valuePatterns) {
            result = pattern.matcher(result).replaceAll(Matcher.quoteReplacement(redaction));
        }
        return result;
    }

    /**
     * Checks whether a map key should have its value redacted wholesale.
     *
     * @param key the key (null is never sensitive)
     * @return true when the key matches a sensitive fragment and is not whitelisted
     */
    public boolean isSensitiveKey(Object key) {
        if (key == null) {
            return false;
        }
        String normalized = String.valueOf(key).toLowerCase(Locale.ROOT);
        if (whitelistKeys.contains(normalized)) {
            return false;
        }
        for (String fragment : sensitiveKeys) {
            if (normalized.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the redaction token.
     */
    public String redaction() {
        return redaction;
    }

    private Object sanitize(Object value, int depth, Set<Object> path) {
        if (value == null || value instanceof Number || value instanceof Boolean
                || value instanceof Character) {
            return value;
        }
        if (value instanceof CharSequence text) {
            return sanitizeText(text.toString());
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?> || value.getClass().isArray()) {
            if (depth >= MAX_DEPTH) {
                return DEPTH_MARKER;
            }
            if (!path.add(value)) {
                return CIRCULAR_MARKER;
            }
            try {
                return sanitizeContainer(value, depth, path);
            } finally {
                path.remove(value);
            }
        }
        return sanitizeText(safeToString(value));
    }

    private Object sanitizeContainer(Object value, int depth, Set<Object> path) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Object key = entry.getKey();
                copy.put(key, isSensitiveKey(key) ? redaction : sanitize(entry.getValue(), depth + 1, path));
            }
            return copy;
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            for (Object element : set) {
                copy.add(sanitize(element, depth + 1, path));
            }
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(sanitize(element, depth + 1, path));
            }
            return copy;
        }
        if (value instanceof Object[] array) {
            Object[] copy = new Object[array.length];
            for (int i = 0; i < array.length; i++) {
                copy[i] = sanitize(array[i], depth + 1, path);
            }
            return copy;
        }
        // primitive arrays hold no text, copy them as a list of boxed values
        int length = Array.getLength(value);
        List<Object> copy = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            copy.add(Array.get(value, i));
        }
        return copy;
    }

    private static String safeToString(Object value) {
        try {
            return String.valueOf(value);
        } catch (RuntimeException e) {
            return "<unrepresentable " + value.getClass().getSimpleName() + ">";
        }
    }

    private static Set<String> lowerCased(Collection<String> values) {
        Set<String> result = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                result.add(value.toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Builder for {@link DataSanitizer}.
     */
    public static final class Builder {

        private String redaction = DEFAULT_REDACTION;
        private final Set<String> sensitiveKeys = new LinkedHashSet<>(DEFAULT_SENSITIVE_KEYS);
        private final Set<String> whitelistKeys = new LinkedHashSet<>();
        private final List<Pattern> customPatterns = new ArrayList<>();
        private boolean sanitizeEmails = true;
        private boolean sanitizeIps = false;

        private Builder() {
        }

        public Builder redaction(String redaction) {
            if (redaction == null || redaction.isEmpty()) {
                throw new IllegalArgumentException("redaction must not be null or empty");
            }
            this.redaction = redaction;
            return this;
        }

        /** Adds key fragments on top of the default vocabulary. */
        public Builder sensitiveKeys(Collection<String> keys) {
            this.sensitiveKeys.addAll(keys);
            return this;
        }

        /** Replaces the key vocabulary entirely. */
        public Builder onlySensitiveKeys(Collection<String> keys) {
            this.sensitiveKeys.clear();
            this.sensitiveKeys.addAll(keys);
            return this;
        }

        /** Keys (exact, case-insensitive) whose values are never redacted by key. */
        public Builder whitelistKeys(Collection<String> keys) {
            this.whitelistKeys.addAll(keys);
            return this;
        }

        public Builder customPattern(Pattern pattern) {
            if (pattern == null) {
                throw new IllegalArgumentException("pattern must not be null");
            }
            this.customPatterns.add(pattern);
            return this;
        }

        public Builder sanitizeEmails(boolean sanitizeEmails) {
            this.sanitizeEmails = sanitizeEmails;
            return this;
        }

        public Builder sanitizeIps(boolean sanitizeIps) {
            this.sanitizeIps = sanitizeIps;
            return this;
        }

        public DataSanitizer build() {
            return new DataSanitizer(this);
        }
    }
}

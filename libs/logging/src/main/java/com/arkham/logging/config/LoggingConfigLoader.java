package com.arkham.logging.config;

import com.arkham.logging.Diagnostics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads {@link LoggingConfig} from a YAML file and {@code ARKHAM_LOG_*} overrides.
 * <p>
 * The file's {@code frame.logging} section is read first, then overrides replace individual
 * fields, then built-in defaults fill whatever is still missing. A missing file is treated as
 * empty. A malformed or invalid file is reported to {@link Diagnostics} and ignored, so the
 * result is always usable.
 * <p>
 * {@code ARKHAM_LOG_LEVEL} sets the global level, and the console level too unless
 * {@code ARKHAM_LOG_CONSOLE_LEVEL} is given. Boolean overrides accept {@code true}, {@code 1},
 * {@code yes} and {@code on}; any other value means false.
 */
public final class LoggingConfigLoader {

    public static final String ENV_PREFIX = "ARKHAM_LOG_";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final List<EnvOverride> OVERRIDES = List.of(
            new EnvOverride("CONSOLE_ENABLED", "console", "enabled", Kind.BOOLEAN),
            new EnvOverride("CONSOLE_LEVEL", "console", "level", Kind.TEXT),
            new EnvOverride("CONSOLE_FORMAT", "console", "format", Kind.TEXT),
            new EnvOverride("FILE_ENABLED", "file", "enabled", Kind.BOOLEAN),
            new EnvOverride("FILE_PATH", "file", "path", Kind.TEXT),
            new EnvOverride("FILE_LEVEL", "file", "level", Kind.TEXT),
            new EnvOverride("FILE_MAX_BYTES", "file", "max_bytes", Kind.LONG),
            new EnvOverride("FILE_BACKUP_COUNT", "file", "backup_count", Kind.INTEGER),
            new EnvOverride("FILE_RETENTION_DAYS", "file", "retention_days", Kind.INTEGER),
            new EnvOverride("FILE_QUEUE_SIZE", "file", "queue_size", Kind.INTEGER),
            new EnvOverride("ERROR_FILE_ENABLED", "error_file", "enabled", Kind.BOOLEAN),
            new EnvOverride("ERROR_FILE_PATH", "error_file", "path", Kind.TEXT),
            new EnvOverride("ERROR_FILE_LEVEL", "error_file", "level", Kind.TEXT),
            new EnvOverride("WIDE_EVENTS_ENABLED", "wide_events", "enabled", Kind.BOOLEAN),
            new EnvOverride("WIDE_EVENTS_SAMPLING_RATE", "wide_events", "sampling_rate", Kind.DOUBLE),
            new EnvOverride("WIDE_EVENTS_TAIL_SAMPLING", "wide_events", "tail_sampling", Kind.BOOLEAN),
            new EnvOverride("WIDE_EVENTS_SLOW_THRESHOLD_MS", "wide_events", "slow_threshold_ms", Kind.INTEGER)
    );

    private final Diagnostics diagnostics;

    public LoggingConfigLoader() {
        this(Diagnostics.stderr());
    }

    public LoggingConfigLoader(Diagnostics diagnostics) {
        if (diagnostics == null) {
            throw new IllegalArgumentException("diagnostics must not be null");
        }
        this.diagnostics = diagnostics;
    }

    /**
     * Loads {@code file} (may be null) with overrides from the process environment.
     */
    public LoggingConfig load(Path file) {
        return load(file, System.getenv());
    }

    /**
     * Loads {@code file} (may be null) with overrides from {@code overrides}.
     *
     * @param file      YAML file containing a {@code frame.logging} section, or null
     * @param overrides environment-style key/value pairs; unrelated keys are ignored
     * @return the merged configuration, never null
     */
    public LoggingConfig load(Path file, Map<String, String> overrides) {
        ObjectNode fromFile = readFile(file);
        try {
            return convert(merge(fromFile, overrides));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            diagnostics.report("Invalid logging configuration in " + file + ", ignoring the file", e);
        }
        try {
            return convert(merge(YAML.createObjectNode(), overrides));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            diagnostics.report("Invalid " + ENV_PREFIX + "* overrides, using defaults", e);
            return LoggingConfig.defaults();
        }
    }

    private ObjectNode readFile(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return YAML.createObjectNode();
        }
        try {
            JsonNode root = YAML.readTree(file.toFile());
            JsonNode section = root == null ? null : root.path("frame").path("logging");
            if (section instanceof ObjectNode object) {
                return object.deepCopy();
            }
            return YAML.createObjectNode();
        } catch (IOException e) {
            diagnostics.report("Failed to read logging configuration " + file + ", using defaults", e);
            return YAML.createObjectNode();
        }
    }

    private ObjectNode merge(ObjectNode base, Map<String, String> overrides) {
        ObjectNode merged = base.deepCopy();
        if (overrides != null) {
            applyOverrides(merged, overrides);
        }
        JsonNode errorFile = merged.get("error_file");
        if (errorFile instanceof ObjectNode section) {
            if (!section.hasNonNull("path")) {
                section.put("path", FileConfig.DEFAULT_ERROR_PATH);
            }
            if (!section.hasNonNull("level")) {
                section.put("level", "ERROR");
            }
        }
        return merged;
    }

    private void applyOverrides(ObjectNode node, Map<String, String> overrides) {
        String level = overrides.get(ENV_PREFIX + "LEVEL");
        if (level != null && !level.isBlank()) {
            node.put("global_level", level.trim());
            String consoleLevel = overrides.get(ENV_PREFIX + "CONSOLE_LEVEL");
            if (consoleLevel == null || consoleLevel.isBlank()) {
                section(node, "console").put("level", level.trim());
            }
        }
        for (EnvOverride override : OVERRIDES) {
            String key = ENV_PREFIX + override.key();
            String raw = overrides.get(key);
            if (raw == null || (override.kind() != Kind.BOOLEAN && raw.isBlank())) {
                continue;
            }
            try {
                override.apply(section(node, override.section()), raw.trim());
            } catch (NumberFormatException e) {
                diagnostics.report("Ignoring invalid override " + key + "=" + raw, e);
            }
        }
    }

    private static ObjectNode section(ObjectNode node, String name) {
        JsonNode existing = node.get(name);
        if (existing instanceof ObjectNode object) {
            return object;
        }
        return node.putObject(name);
    }

    private static LoggingConfig convert(ObjectNode node) throws JsonProcessingException {
        return YAML.treeToValue(node, LoggingConfig.class);
    }

    static boolean parseBoolean(String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            default -> false;
        };
    }

    private enum Kind {
        TEXT,
        BOOLEAN,
        INTEGER,
        LONG,
        DOUBLE
    }

    private record EnvOverride(String key, String section, String field, Kind kind) {

        void apply(ObjectNode target, String raw) {
            switch (kind) {
                case TEXT -> target.put(field, raw);
                case BOOLEAN -> target.put(field, parseBoolean(raw));
                case INTEGER -> target.put(field, Integer.parseInt(raw));
                case LONG -> target.put(field, Long.parseLong(raw));
                case DOUBLE -> target.put(field, Double.parseDouble(raw));
                default -> throw new IllegalStateException("Unhandled override kind " + kind);
            }
        }
    }
}

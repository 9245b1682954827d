package com.arkham.logging;

import java.io.PrintStream;
import java.time.Instant;

/**
 * Best-effort reporter for faults inside the logging pipeline itself.
 * <p>
 * Sinks, the config loader and the manager must never route their own failures back through
 * the pipeline (a failing sink would recurse into itself), so they write a single line to the
 * process error stream instead. Reporting never throws.
 */
public final class Diagnostics {

    private static final Diagnostics STDERR = new Diagnostics(System.err);

    private final PrintStream stream;

    /**
     * Creates a reporter writing to the given stream.
     *
     * @param stream destination for diagnostic lines (must not be null)
     */
    public Diagnostics(PrintStream stream) {
        if (stream == null) {
            throw new IllegalArgumentException("stream must not be null");
        }
        this.stream = stream;
    }

    /**
     * Returns the shared reporter bound to {@code System.err}.
     */
    public static Diagnostics stderr() {
        return STDERR;
    }

    /**
     * Writes one diagnostic line.
     */
    public void report(String message) {
        report(message, null);
    }

    /**
     * Writes one diagnostic line, followed by the cause's type and message when present.
     */
    public void report(String message, Throwable cause) {
        try {
            StringBuilder line = new StringBuilder()
                    .append(Instant.now())
                    .append(" [arkham-logging] ")
                    .append(message);
            if (cause != null) {
                line.append(": ").append(cause.getClass().getName());
                if (cause.getMessage() != null) {
                    line.append(": ").append(cause.getMessage());
                }
            }
            stream.println(line);
            stream.flush();
        } catch (RuntimeException ignored) {
            // the error stream itself is gone; nowhere left to report
        }
    }
}
